package com.trade.journal.matching;

import com.trade.journal.core.Decimal;
import com.trade.journal.core.Execution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 持仓分组
 * 每个代码同一时刻只有一个活动分组：第一笔成交开仓，后续成交（无论方向）并入，
 * 净持仓回到0时分组结束，下一笔成交开启新分组
 */
public class PositionGrouper {

    private static final Logger logger = LoggerFactory.getLogger(PositionGrouper.class);

    /**
     * 开仓时间倒序，最新的分组在前
     */
    public static final Comparator<PositionGroup> NEWEST_FIRST =
            Comparator.comparing(PositionGroup::getEntryTimestamp)
                    .thenComparingLong(group -> group.getEntryExecution().getId())
                    .reversed();

    /**
     * @param executions 参与配对的全部成交
     * @param pairs      同一批成交的配对结果，用于汇总分组盈亏
     */
    public List<PositionGroup> group(List<Execution> executions, List<PairedTrade> pairs) {
        Map<Long, BigDecimal> pnlByExit = new HashMap<>();
        for (PairedTrade pair : pairs) {
            pnlByExit.merge(pair.getExitExecutionId(), pair.getNetPnl(), BigDecimal::add);
        }

        List<Execution> ordered = new ArrayList<>(executions);
        ordered.sort(LotMatcher.CHRONOLOGICAL);

        Map<String, Builder> active = new LinkedHashMap<>();
        List<PositionGroup> groups = new ArrayList<>();
        for (Execution execution : ordered) {
            Builder builder = active.computeIfAbsent(execution.getSymbol(), s -> new Builder());
            builder.add(execution, pnlByExit);
            if (Decimal.isDust(builder.netQuantity.abs())) {
                groups.add(builder.build());
                active.remove(execution.getSymbol());
            }
        }
        active.values().forEach(builder -> groups.add(builder.build()));

        groups.sort(NEWEST_FIRST);
        logger.debug("持仓分组完成: 成交={}, 分组={}, 未平={}", executions.size(), groups.size(), active.size());
        return groups;
    }

    /**
     * 回合交易按所在分组的开仓成交归属策略；开仓成交未归属时保留回合原有的策略
     */
    public List<PairedTrade> attributeStrategies(List<PairedTrade> pairs, List<PositionGroup> groups) {
        Map<Long, Long> strategyByExecution = new HashMap<>();
        for (PositionGroup group : groups) {
            Long strategyId = group.getEntryStrategyId();
            if (strategyId == null) {
                continue;
            }
            for (Execution execution : group.getExecutions()) {
                strategyByExecution.put(execution.getId(), strategyId);
            }
        }

        List<PairedTrade> attributed = new ArrayList<>(pairs.size());
        for (PairedTrade pair : pairs) {
            Long strategyId = strategyByExecution.get(pair.getEntryExecutionId());
            attributed.add(strategyId == null || strategyId.equals(pair.getStrategyId())
                    ? pair : pair.withStrategyId(strategyId));
        }
        return attributed;
    }

    private static final class Builder {
        private final List<Execution> executions = new ArrayList<>();
        private BigDecimal netQuantity = BigDecimal.ZERO;
        private BigDecimal pnl = BigDecimal.ZERO;

        private void add(Execution execution, Map<Long, BigDecimal> pnlByExit) {
            executions.add(execution);
            netQuantity = netQuantity.add(execution.getQuantity()
                    .multiply(BigDecimal.valueOf(execution.getSide().directionSign())));
            pnl = pnl.add(pnlByExit.getOrDefault(execution.getId(), BigDecimal.ZERO));
        }

        private PositionGroup build() {
            return new PositionGroup(executions.get(0), executions, pnl, netQuantity);
        }
    }
}
