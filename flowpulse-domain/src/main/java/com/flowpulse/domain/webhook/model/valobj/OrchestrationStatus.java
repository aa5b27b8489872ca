package com.flowpulse.domain.webhook.model.valobj;

import com.flowpulse.types.enums.SystemHealthEnum;

/**
 * Webhook 编排整体状态。
 */
public record OrchestrationStatus(int activeEndpoints,
                                  int totalEndpoints,
                                  int queuedEvents,
                                  long processedEvents,
                                  long failedEvents,
                                  SystemHealthEnum systemHealth) {
}
