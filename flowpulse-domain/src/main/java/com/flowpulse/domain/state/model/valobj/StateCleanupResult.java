package com.flowpulse.domain.state.model.valobj;

import java.time.LocalDateTime;

/**
 * 保留期清理结果。
 */
public record StateCleanupResult(int deletedCount, LocalDateTime cutoffDate) {
}
