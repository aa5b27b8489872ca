/**
 * Stream 领域 - 实时推送域
 *
 * <p>职责：长连接客户端登记、频道订阅、推送与连接令牌校验</p>
 *
 * <h3>核心概念</h3>
 * <ul>
 *   <li>ClientConnection - 运行时连接（不持久化）</li>
 *   <li>Channel - 订阅主题，决定频道广播的投递范围</li>
 *   <li>InsightDataEngine - 上游数据引擎（预测、告警）</li>
 * </ul>
 *
 * @author flowpulse
 * @since 2026-10-19
 */
package com.flowpulse.domain.stream;
