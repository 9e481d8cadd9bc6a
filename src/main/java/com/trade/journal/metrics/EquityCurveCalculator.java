package com.trade.journal.metrics;

import com.trade.journal.core.Decimal;
import com.trade.journal.matching.PairedTrade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * 日资金曲线与回撤统计
 * 起始资金视为0，百分比相对当时峰值的绝对值计算
 */
public class EquityCurveCalculator {

    private static final Logger logger = LoggerFactory.getLogger(EquityCurveCalculator.class);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final ZoneId zone;

    public EquityCurveCalculator(ZoneId zone) {
        this.zone = zone;
    }

    public EquityCurve compute(List<PairedTrade> pairs) {
        List<DailyPnl> days = DailyPnlSeries.of(pairs, zone);
        if (days.isEmpty()) {
            return EquityCurve.empty();
        }

        List<EquityPoint> points = new ArrayList<>(days.size());
        BigDecimal cumulative = BigDecimal.ZERO;
        BigDecimal peak = BigDecimal.ZERO;
        LocalDate peakDate = days.get(0).getDate();

        BigDecimal maxDrawdown = BigDecimal.ZERO;
        BigDecimal maxDrawdownPct = BigDecimal.ZERO;
        LocalDate maxStart = null;
        LocalDate maxEnd = null;

        BigDecimal drawdownSum = BigDecimal.ZERO;
        int drawdownDays = 0;
        int run = 0;
        LocalDate runStart = null;
        int longestRun = 0;
        LocalDate longestStart = null;
        LocalDate longestEnd = null;

        BigDecimal trough = BigDecimal.ZERO;
        LocalDate troughDate = days.get(0).getDate();
        BigDecimal bestSurge = BigDecimal.ZERO;
        LocalDate surgeStart = null;
        LocalDate surgeEnd = null;

        for (DailyPnl day : days) {
            LocalDate date = day.getDate();
            cumulative = cumulative.add(day.getNetPnl());
            if (cumulative.compareTo(peak) > 0) {
                peak = cumulative;
                peakDate = date;
            }
            BigDecimal drawdown = peak.subtract(cumulative);
            BigDecimal drawdownPct = peak.signum() == 0 ? BigDecimal.ZERO
                    : Decimal.scalePercent(Decimal.divide(drawdown.multiply(HUNDRED), peak.abs()));

            if (drawdown.compareTo(maxDrawdown) > 0) {
                maxDrawdown = drawdown;
                maxDrawdownPct = drawdownPct;
                maxStart = peakDate;
                maxEnd = date;
            }

            if (drawdown.signum() > 0) {
                if (run == 0) {
                    runStart = date;
                }
                run++;
                drawdownSum = drawdownSum.add(drawdown);
                drawdownDays++;
                if (run > longestRun) {
                    longestRun = run;
                    longestStart = runStart;
                    longestEnd = date;
                }
            } else {
                run = 0;
            }

            if (cumulative.compareTo(trough) < 0) {
                trough = cumulative;
                troughDate = date;
            }
            BigDecimal surge = cumulative.subtract(trough);
            if (surge.compareTo(bestSurge) > 0) {
                bestSurge = surge;
                surgeStart = troughDate;
                surgeEnd = date;
            }

            points.add(new EquityPoint(date, day.getNetPnl(), cumulative, peak, drawdown, drawdownPct));
        }

        BigDecimal avgDrawdown = drawdownDays == 0 ? BigDecimal.ZERO
                : Decimal.divide(drawdownSum, BigDecimal.valueOf(drawdownDays));
        DrawdownMetrics drawdownMetrics = new DrawdownMetrics(maxDrawdown, maxDrawdownPct, maxStart, maxEnd,
                avgDrawdown, longestRun, longestStart, longestEnd);

        logger.debug("资金曲线: 交易日={}, 最后日期={}, {}", points.size(), points.get(points.size() - 1).getDate(), drawdownMetrics);
        return new EquityCurve(points, drawdownMetrics, surgeStart, surgeEnd, bestSurge);
    }
}
