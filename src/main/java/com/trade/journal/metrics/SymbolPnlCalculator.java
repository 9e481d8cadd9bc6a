package com.trade.journal.metrics;

import com.trade.journal.core.Decimal;
import com.trade.journal.core.OptionSymbols;
import com.trade.journal.core.Side;
import com.trade.journal.matching.OpenLot;
import com.trade.journal.matching.PairedTrade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 按标的（期权归入其标的代码）汇总盈亏，仅有未平仓持仓的标的也会列出
 */
public class SymbolPnlCalculator {

    private static final Logger logger = LoggerFactory.getLogger(SymbolPnlCalculator.class);

    public List<SymbolPnl> compute(List<PairedTrade> pairs, List<OpenLot> openLots) {
        Map<String, Accumulator> bySymbol = new TreeMap<>();

        for (PairedTrade pair : pairs) {
            Accumulator acc = bySymbol.computeIfAbsent(OptionSymbols.underlying(pair.getSymbol()), s -> new Accumulator());
            acc.closed++;
            acc.gross = acc.gross.add(pair.getGrossPnl());
            acc.net = acc.net.add(pair.getNetPnl());
            acc.fees = acc.fees.add(pair.getTotalFees());
            if (pair.isWin()) {
                acc.wins++;
            } else if (pair.isLoss()) {
                acc.losses++;
            }
        }

        for (OpenLot lot : openLots) {
            Accumulator acc = bySymbol.computeIfAbsent(OptionSymbols.underlying(lot.getSymbol()), s -> new Accumulator());
            if (lot.getSide() == Side.BUY) {
                acc.longQty = acc.longQty.add(lot.getRemainingQuantity());
            } else {
                acc.shortQty = acc.shortQty.add(lot.getRemainingQuantity());
            }
        }

        List<SymbolPnl> result = new ArrayList<>(bySymbol.size());
        bySymbol.forEach((symbol, acc) -> result.add(new SymbolPnl(
                symbol,
                acc.closed,
                acc.longQty.subtract(acc.shortQty).abs(),
                acc.gross,
                acc.net,
                acc.fees,
                acc.wins,
                acc.losses,
                Decimal.ratio(acc.wins, acc.wins + acc.losses)
        )));
        result.sort(Comparator.comparing(SymbolPnl::getTotalNetPnl).reversed());

        logger.debug("标的盈亏汇总: 标的数={}", result.size());
        return result;
    }

    private static final class Accumulator {
        private int closed;
        private int wins;
        private int losses;
        private BigDecimal gross = BigDecimal.ZERO;
        private BigDecimal net = BigDecimal.ZERO;
        private BigDecimal fees = BigDecimal.ZERO;
        private BigDecimal longQty = BigDecimal.ZERO;
        private BigDecimal shortQty = BigDecimal.ZERO;
    }
}
