package com.trade.journal.segment;

import com.trade.journal.core.OptionSymbols;
import com.trade.journal.matching.PairedTrade;
import com.trade.journal.metrics.StrategyNames;
import com.trade.journal.metrics.WinLossSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * 分组绩效分析
 * 时间维度按平仓时间（配置时区）分组
 */
public class SegmentationAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(SegmentationAnalyzer.class);

    private static final Comparator<SegmentStats> BY_PNL_DESC =
            Comparator.comparing(SegmentStats::getTotalPnl).reversed().thenComparing(SegmentStats::getKey);

    private final ZoneId zone;

    public SegmentationAnalyzer(ZoneId zone) {
        this.zone = zone;
    }

    public EvaluationMetrics analyze(List<PairedTrade> pairs, Map<Long, String> strategyCatalogue) {
        List<List<PairedTrade>> weekdays = buckets(7);
        List<List<PairedTrade>> daysOfMonth = buckets(31);
        List<List<PairedTrade>> hours = buckets(24);
        Map<String, List<PairedTrade>> bySymbol = new TreeMap<>();
        Map<Long, List<PairedTrade>> byStrategy = new LinkedHashMap<>();

        for (PairedTrade pair : pairs) {
            ZonedDateTime exit = pair.getExitTimestamp().atZone(zone);
            weekdays.get(exit.getDayOfWeek().getValue() - 1).add(pair);
            daysOfMonth.get(exit.getDayOfMonth() - 1).add(pair);
            hours.get(exit.getHour()).add(pair);
            bySymbol.computeIfAbsent(OptionSymbols.underlying(pair.getSymbol()), s -> new ArrayList<>()).add(pair);
            byStrategy.computeIfAbsent(pair.getStrategyId(), id -> new ArrayList<>()).add(pair);
        }

        List<SegmentStats> weekdayStats = new ArrayList<>(7);
        for (int i = 0; i < 7; i++) {
            String name = DayOfWeek.of(i + 1).getDisplayName(TextStyle.FULL, Locale.ENGLISH);
            weekdayStats.add(new SegmentStats(String.valueOf(i), name, null, WinLossSummary.of(weekdays.get(i))));
        }

        List<SegmentStats> dayStats = new ArrayList<>(31);
        for (int i = 0; i < 31; i++) {
            String day = String.valueOf(i + 1);
            dayStats.add(new SegmentStats(day, day, null, WinLossSummary.of(daysOfMonth.get(i))));
        }

        List<SegmentStats> hourStats = new ArrayList<>(24);
        for (int h = 0; h < 24; h++) {
            hourStats.add(new SegmentStats(String.valueOf(h), hourLabel(h), null, WinLossSummary.of(hours.get(h))));
        }

        List<SegmentStats> symbolStats = new ArrayList<>(bySymbol.size());
        bySymbol.forEach((symbol, group) ->
                symbolStats.add(new SegmentStats(symbol, symbol, null, WinLossSummary.of(group))));
        symbolStats.sort(BY_PNL_DESC);

        List<SegmentStats> strategyStats = new ArrayList<>(byStrategy.size());
        byStrategy.forEach((strategyId, group) -> strategyStats.add(new SegmentStats(
                strategyId == null ? "unassigned" : String.valueOf(strategyId),
                StrategyNames.resolve(strategyId, strategyCatalogue),
                strategyId,
                WinLossSummary.of(group))));
        strategyStats.sort(BY_PNL_DESC);

        logger.debug("分组分析完成: 回合={}, 标的={}, 策略={}", pairs.size(), symbolStats.size(), strategyStats.size());
        return new EvaluationMetrics(weekdayStats, dayStats, hourStats, symbolStats, strategyStats);
    }

    static String hourLabel(int hour) {
        return String.format("%02d:00-%02d:59", hour, hour);
    }

    private static List<List<PairedTrade>> buckets(int size) {
        List<List<PairedTrade>> buckets = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            buckets.add(new ArrayList<>());
        }
        return buckets;
    }
}
