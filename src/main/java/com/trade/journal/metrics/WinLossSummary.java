package com.trade.journal.metrics;

import com.trade.journal.core.Decimal;
import com.trade.journal.matching.PairedTrade;

import java.math.BigDecimal;
import java.util.Collection;

/**
 * 一组回合交易的盈亏汇总
 * 盈亏比、收益风险比：无盈利交易时为0，有盈利但无亏损时为 null（无上限）
 */
public final class WinLossSummary {
    private final int tradeCount;
    private final int winningTrades;
    private final int losingTrades;
    private final BigDecimal totalPnl;
    private final BigDecimal grossProfit;       // 盈利合计（正数）
    private final BigDecimal grossLoss;         // 亏损合计（绝对值）
    private final BigDecimal winRate;
    private final BigDecimal averageWin;
    private final BigDecimal averageLoss;       // 负数
    private final BigDecimal averagePnl;
    private final BigDecimal profitFactor;      // 可能为 null
    private final BigDecimal payoffRatio;       // 可能为 null

    private WinLossSummary(int tradeCount, int winningTrades, int losingTrades, BigDecimal totalPnl,
                           BigDecimal grossProfit, BigDecimal grossLoss) {
        this.tradeCount = tradeCount;
        this.winningTrades = winningTrades;
        this.losingTrades = losingTrades;
        this.totalPnl = totalPnl;
        this.grossProfit = grossProfit;
        this.grossLoss = grossLoss;
        this.winRate = Decimal.ratio(winningTrades, tradeCount);
        this.averageWin = winningTrades == 0 ? BigDecimal.ZERO
                : Decimal.divide(grossProfit, BigDecimal.valueOf(winningTrades));
        this.averageLoss = losingTrades == 0 ? BigDecimal.ZERO
                : Decimal.divide(grossLoss, BigDecimal.valueOf(losingTrades)).negate();
        this.averagePnl = tradeCount == 0 ? BigDecimal.ZERO
                : Decimal.divide(totalPnl, BigDecimal.valueOf(tradeCount));
        this.profitFactor = boundedRatio(grossProfit, grossLoss, winningTrades, losingTrades);
        this.payoffRatio = boundedRatio(averageWin, averageLoss.abs(), winningTrades, losingTrades);
    }

    public static WinLossSummary of(Collection<PairedTrade> pairs) {
        int wins = 0;
        int losses = 0;
        BigDecimal total = BigDecimal.ZERO;
        BigDecimal profit = BigDecimal.ZERO;
        BigDecimal loss = BigDecimal.ZERO;
        for (PairedTrade pair : pairs) {
            BigDecimal pnl = pair.getNetPnl();
            total = total.add(pnl);
            if (pair.isWin()) {
                wins++;
                profit = profit.add(pnl);
            } else if (pair.isLoss()) {
                losses++;
                loss = loss.add(pnl.abs());
            }
        }
        return new WinLossSummary(pairs.size(), wins, losses, total, profit, loss);
    }

    /**
     * 比值哨兵规则：无盈利为0；有盈利无亏损为 null；否则按4位小数计算
     */
    static BigDecimal boundedRatio(BigDecimal numerator, BigDecimal denominator, int wins, int losses) {
        if (wins == 0) {
            return Decimal.scaleRatio(BigDecimal.ZERO);
        }
        if (losses == 0) {
            return null;
        }
        return Decimal.divide(numerator, denominator, Decimal.RATIO_SCALE);
    }

    public int getTradeCount() { return tradeCount; }
    public int getWinningTrades() { return winningTrades; }
    public int getLosingTrades() { return losingTrades; }
    public BigDecimal getTotalPnl() { return totalPnl; }
    public BigDecimal getGrossProfit() { return grossProfit; }
    public BigDecimal getGrossLoss() { return grossLoss; }
    public BigDecimal getWinRate() { return winRate; }
    public BigDecimal getAverageWin() { return averageWin; }
    public BigDecimal getAverageLoss() { return averageLoss; }
    public BigDecimal getAveragePnl() { return averagePnl; }
    public BigDecimal getProfitFactor() { return profitFactor; }
    public BigDecimal getPayoffRatio() { return payoffRatio; }
}
