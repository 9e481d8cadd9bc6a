package com.trade.journal.matching;

import java.util.Collections;
import java.util.List;

/**
 * 配对结果：区间内的回合交易 + 剩余未平仓持仓
 */
public final class MatchResult {

    private static final MatchResult EMPTY = new MatchResult(List.of(), List.of());

    private final List<PairedTrade> pairs;
    private final List<OpenLot> openLots;

    public MatchResult(List<PairedTrade> pairs, List<OpenLot> openLots) {
        this.pairs = Collections.unmodifiableList(pairs);
        this.openLots = Collections.unmodifiableList(openLots);
    }

    public static MatchResult empty() {
        return EMPTY;
    }

    public List<PairedTrade> getPairs() { return pairs; }
    public List<OpenLot> getOpenLots() { return openLots; }

    @Override
    public String toString() {
        return String.format("MatchResult{pairs=%d, openLots=%d}", pairs.size(), openLots.size());
    }
}
