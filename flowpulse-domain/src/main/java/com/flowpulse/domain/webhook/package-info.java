/**
 * Webhook 领域 - 入站/外发网关域
 *
 * <p>职责：入站签名校验与平台载荷归一化，外发端点登记、触发匹配、重试与兜底</p>
 *
 * <h3>核心实体</h3>
 * <ul>
 *   <li>WebhookEndpoint - 外发端点（计数器随派发更新）</li>
 *   <li>WebhookDelivery - 投递记录（入站事件 / 外发派发）</li>
 * </ul>
 *
 * <h3>平台适配</h3>
 * <ul>
 *   <li>{@link com.flowpulse.domain.webhook.service.platform.IWebhookPayloadAdapter} - 每个平台一个实现</li>
 * </ul>
 *
 * @author flowpulse
 * @since 2026-10-19
 */
package com.flowpulse.domain.webhook;
