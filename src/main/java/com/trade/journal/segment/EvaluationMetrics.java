package com.trade.journal.segment;

import java.util.Collections;
import java.util.List;

/**
 * 多维度分组绩效
 * 星期、日期、小时三个维度总是完整的（7 / 31 / 24 项），无交易的分组为零值
 */
public final class EvaluationMetrics {
    private final List<SegmentStats> weekdayPerformance;
    private final List<SegmentStats> dayOfMonthPerformance;
    private final List<SegmentStats> timeOfDayPerformance;
    private final List<SegmentStats> symbolPerformance;
    private final List<SegmentStats> strategyPerformance;

    public EvaluationMetrics(List<SegmentStats> weekdayPerformance, List<SegmentStats> dayOfMonthPerformance,
                             List<SegmentStats> timeOfDayPerformance, List<SegmentStats> symbolPerformance,
                             List<SegmentStats> strategyPerformance) {
        this.weekdayPerformance = Collections.unmodifiableList(weekdayPerformance);
        this.dayOfMonthPerformance = Collections.unmodifiableList(dayOfMonthPerformance);
        this.timeOfDayPerformance = Collections.unmodifiableList(timeOfDayPerformance);
        this.symbolPerformance = Collections.unmodifiableList(symbolPerformance);
        this.strategyPerformance = Collections.unmodifiableList(strategyPerformance);
    }

    public List<SegmentStats> getWeekdayPerformance() { return weekdayPerformance; }
    public List<SegmentStats> getDayOfMonthPerformance() { return dayOfMonthPerformance; }
    public List<SegmentStats> getTimeOfDayPerformance() { return timeOfDayPerformance; }
    public List<SegmentStats> getSymbolPerformance() { return symbolPerformance; }
    public List<SegmentStats> getStrategyPerformance() { return strategyPerformance; }
}
