package com.trade.journal.metrics;

import com.trade.journal.matching.PairedTrade;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 按平仓日期（配置时区）汇总每日净盈亏，日期升序
 */
final class DailyPnlSeries {

    private DailyPnlSeries() {}

    static List<DailyPnl> of(Collection<PairedTrade> pairs, ZoneId zone) {
        Map<LocalDate, BigDecimal> pnlByDate = new TreeMap<>();
        Map<LocalDate, Integer> countByDate = new TreeMap<>();
        for (PairedTrade pair : pairs) {
            LocalDate date = pair.getExitTimestamp().atZone(zone).toLocalDate();
            pnlByDate.merge(date, pair.getNetPnl(), BigDecimal::add);
            countByDate.merge(date, 1, Integer::sum);
        }
        List<DailyPnl> days = new ArrayList<>(pnlByDate.size());
        pnlByDate.forEach((date, pnl) -> days.add(new DailyPnl(date, pnl, countByDate.get(date))));
        return days;
    }
}
