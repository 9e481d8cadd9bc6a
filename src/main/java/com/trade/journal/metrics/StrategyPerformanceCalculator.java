package com.trade.journal.metrics;

import com.trade.journal.matching.PairedTrade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 按策略汇总回合交易，按交易次数降序
 */
public class StrategyPerformanceCalculator {

    private static final Logger logger = LoggerFactory.getLogger(StrategyPerformanceCalculator.class);

    public List<StrategyPerformance> compute(List<PairedTrade> pairs, Map<Long, String> catalogue) {
        Map<Long, List<PairedTrade>> byStrategy = new LinkedHashMap<>();
        for (PairedTrade pair : pairs) {
            byStrategy.computeIfAbsent(pair.getStrategyId(), id -> new ArrayList<>()).add(pair);
        }

        List<StrategyPerformance> result = new ArrayList<>(byStrategy.size());
        byStrategy.forEach((strategyId, group) -> {
            BigDecimal volume = BigDecimal.ZERO;
            BigDecimal pnl = BigDecimal.ZERO;
            for (PairedTrade pair : group) {
                volume = volume.add(pair.getEntryValue());
                pnl = pnl.add(pair.getNetPnl());
            }
            result.add(new StrategyPerformance(strategyId, StrategyNames.resolve(strategyId, catalogue),
                    group.size(), volume, pnl));
        });
        result.sort(Comparator.comparingInt(StrategyPerformance::getTradeCount).reversed()
                .thenComparing(StrategyPerformance::getStrategyName));

        logger.debug("策略汇总: 策略数={}", result.size());
        return result;
    }
}
