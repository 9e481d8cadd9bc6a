package com.trade.journal.metrics;

import java.util.Map;

/**
 * 策略名称解析
 */
public final class StrategyNames {

    public static final String UNASSIGNED = "Unassigned";
    public static final String UNKNOWN = "Unknown";

    private StrategyNames() {}

    public static String resolve(Long strategyId, Map<Long, String> catalogue) {
        if (strategyId == null) {
            return UNASSIGNED;
        }
        return catalogue.getOrDefault(strategyId, UNKNOWN);
    }
}
