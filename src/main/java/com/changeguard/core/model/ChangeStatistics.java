package com.changeguard.core.model;

import java.util.Map;

/**
 * Read-only counts over the change registry.
 */
public record ChangeStatistics(
    long total,
    Map<ChangeStatus, Long> byStatus,
    Map<RiskCategory, Long> byCategory
) {

    public long count(ChangeStatus status) {
        return byStatus.getOrDefault(status, 0L);
    }
}
