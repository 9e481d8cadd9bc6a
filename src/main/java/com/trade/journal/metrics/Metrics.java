package com.trade.journal.metrics;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * 组合绩效指标
 * 空数据时各项为0（日期为 null），不抛出异常
 */
public final class Metrics {
    private final int totalTrades;                         // 总回合数
    private final int winningTrades;                       // 盈利回合数
    private final int losingTrades;                        // 亏损回合数
    private final BigDecimal totalProfitLoss;              // 净盈亏合计
    private final BigDecimal winRate;                      // 胜率
    private final BigDecimal averageProfit;                // 平均盈利
    private final BigDecimal averageLoss;                  // 平均亏损（负数）
    private final BigDecimal largestWin;                   // 最大单笔盈利
    private final BigDecimal largestLoss;                  // 最大单笔亏损（负数）
    private final BigDecimal totalVolume;                  // 开仓成交额合计
    private final List<SymbolStats> tradesBySymbol;        // 按代码统计
    private final int consecutiveWins;                     // 最长连胜
    private final int consecutiveLosses;                   // 最长连亏
    private final int currentWinStreak;                    // 当前连胜
    private final int currentLossStreak;                   // 当前连亏
    private final BigDecimal strategyWinRate;              // 已归属策略回合的胜率
    private final int strategyWinningTrades;
    private final int strategyLosingTrades;
    private final BigDecimal strategyProfitLoss;
    private final int strategyConsecutiveWins;
    private final int strategyConsecutiveLosses;
    private final BigDecimal expectancy;                   // 期望值
    private final BigDecimal profitFactor;                 // 盈亏比，可能为 null
    private final BigDecimal averageTrade;                 // 平均每笔盈亏
    private final BigDecimal totalFees;                    // 手续费合计
    private final BigDecimal netProfit;                    // 净利润
    private final BigDecimal maxDrawdown;                  // 最大回撤（正数金额）
    private final BigDecimal sharpeRatio;                  // 日盈亏夏普比率（未年化）
    private final BigDecimal riskRewardRatio;              // 收益风险比，可能为 null
    private final BigDecimal tradesPerDay;                 // 日均回合数
    private final BigDecimal bestDay;                      // 最佳单日
    private final BigDecimal worstDay;                     // 最差单日
    private final LocalDate bestDayDate;
    private final LocalDate worstDayDate;
    private final BigDecimal averageHoldingTimeSeconds;    // 平均持仓秒数
    private final BigDecimal averageGainPct;               // 盈利回合平均价格变动%
    private final BigDecimal averageLossPct;               // 亏损回合平均价格变动%
    private final BigDecimal largestWinPct;
    private final BigDecimal largestLossPct;

    private Metrics(Builder b) {
        this.totalTrades = b.totalTrades;
        this.winningTrades = b.winningTrades;
        this.losingTrades = b.losingTrades;
        this.totalProfitLoss = b.totalProfitLoss;
        this.winRate = b.winRate;
        this.averageProfit = b.averageProfit;
        this.averageLoss = b.averageLoss;
        this.largestWin = b.largestWin;
        this.largestLoss = b.largestLoss;
        this.totalVolume = b.totalVolume;
        this.tradesBySymbol = b.tradesBySymbol;
        this.consecutiveWins = b.consecutiveWins;
        this.consecutiveLosses = b.consecutiveLosses;
        this.currentWinStreak = b.currentWinStreak;
        this.currentLossStreak = b.currentLossStreak;
        this.strategyWinRate = b.strategyWinRate;
        this.strategyWinningTrades = b.strategyWinningTrades;
        this.strategyLosingTrades = b.strategyLosingTrades;
        this.strategyProfitLoss = b.strategyProfitLoss;
        this.strategyConsecutiveWins = b.strategyConsecutiveWins;
        this.strategyConsecutiveLosses = b.strategyConsecutiveLosses;
        this.expectancy = b.expectancy;
        this.profitFactor = b.profitFactor;
        this.averageTrade = b.averageTrade;
        this.totalFees = b.totalFees;
        this.netProfit = b.netProfit;
        this.maxDrawdown = b.maxDrawdown;
        this.sharpeRatio = b.sharpeRatio;
        this.riskRewardRatio = b.riskRewardRatio;
        this.tradesPerDay = b.tradesPerDay;
        this.bestDay = b.bestDay;
        this.worstDay = b.worstDay;
        this.bestDayDate = b.bestDayDate;
        this.worstDayDate = b.worstDayDate;
        this.averageHoldingTimeSeconds = b.averageHoldingTimeSeconds;
        this.averageGainPct = b.averageGainPct;
        this.averageLossPct = b.averageLossPct;
        this.largestWinPct = b.largestWinPct;
        this.largestLossPct = b.largestLossPct;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 无交易时的零值指标
     */
    public static Metrics empty() {
        return builder().build();
    }

    public int getTotalTrades() { return totalTrades; }
    public int getWinningTrades() { return winningTrades; }
    public int getLosingTrades() { return losingTrades; }
    public BigDecimal getTotalProfitLoss() { return totalProfitLoss; }
    public BigDecimal getWinRate() { return winRate; }
    public BigDecimal getAverageProfit() { return averageProfit; }
    public BigDecimal getAverageLoss() { return averageLoss; }
    public BigDecimal getLargestWin() { return largestWin; }
    public BigDecimal getLargestLoss() { return largestLoss; }
    public BigDecimal getTotalVolume() { return totalVolume; }
    public List<SymbolStats> getTradesBySymbol() { return tradesBySymbol; }
    public int getConsecutiveWins() { return consecutiveWins; }
    public int getConsecutiveLosses() { return consecutiveLosses; }
    public int getCurrentWinStreak() { return currentWinStreak; }
    public int getCurrentLossStreak() { return currentLossStreak; }
    public BigDecimal getStrategyWinRate() { return strategyWinRate; }
    public int getStrategyWinningTrades() { return strategyWinningTrades; }
    public int getStrategyLosingTrades() { return strategyLosingTrades; }
    public BigDecimal getStrategyProfitLoss() { return strategyProfitLoss; }
    public int getStrategyConsecutiveWins() { return strategyConsecutiveWins; }
    public int getStrategyConsecutiveLosses() { return strategyConsecutiveLosses; }
    public BigDecimal getExpectancy() { return expectancy; }
    public BigDecimal getProfitFactor() { return profitFactor; }
    public BigDecimal getAverageTrade() { return averageTrade; }
    public BigDecimal getTotalFees() { return totalFees; }
    public BigDecimal getNetProfit() { return netProfit; }
    public BigDecimal getMaxDrawdown() { return maxDrawdown; }
    public BigDecimal getSharpeRatio() { return sharpeRatio; }
    public BigDecimal getRiskRewardRatio() { return riskRewardRatio; }
    public BigDecimal getTradesPerDay() { return tradesPerDay; }
    public BigDecimal getBestDay() { return bestDay; }
    public BigDecimal getWorstDay() { return worstDay; }
    public LocalDate getBestDayDate() { return bestDayDate; }
    public LocalDate getWorstDayDate() { return worstDayDate; }
    public BigDecimal getAverageHoldingTimeSeconds() { return averageHoldingTimeSeconds; }
    public BigDecimal getAverageGainPct() { return averageGainPct; }
    public BigDecimal getAverageLossPct() { return averageLossPct; }
    public BigDecimal getLargestWinPct() { return largestWinPct; }
    public BigDecimal getLargestLossPct() { return largestLossPct; }

    @Override
    public String toString() {
        return String.format(
                """
                ==================== 绩效指标 ====================
                总回合数:          %d
                盈利/亏损:         %d / %d
                胜率:              %s
                净利润:            %s
                盈亏比:            %s
                期望值:            %s
                最大回撤:          %s
                夏普比率:          %s
                最长连胜/连亏:     %d / %d
                ================================================
                """,
                totalTrades, winningTrades, losingTrades, winRate, netProfit,
                profitFactor == null ? "∞" : profitFactor, expectancy, maxDrawdown, sharpeRatio,
                consecutiveWins, consecutiveLosses
        );
    }

    /**
     * Builder 模式
     */
    public static class Builder {
        private int totalTrades = 0;
        private int winningTrades = 0;
        private int losingTrades = 0;
        private BigDecimal totalProfitLoss = BigDecimal.ZERO;
        private BigDecimal winRate = BigDecimal.ZERO;
        private BigDecimal averageProfit = BigDecimal.ZERO;
        private BigDecimal averageLoss = BigDecimal.ZERO;
        private BigDecimal largestWin = BigDecimal.ZERO;
        private BigDecimal largestLoss = BigDecimal.ZERO;
        private BigDecimal totalVolume = BigDecimal.ZERO;
        private List<SymbolStats> tradesBySymbol = List.of();
        private int consecutiveWins = 0;
        private int consecutiveLosses = 0;
        private int currentWinStreak = 0;
        private int currentLossStreak = 0;
        private BigDecimal strategyWinRate = BigDecimal.ZERO;
        private int strategyWinningTrades = 0;
        private int strategyLosingTrades = 0;
        private BigDecimal strategyProfitLoss = BigDecimal.ZERO;
        private int strategyConsecutiveWins = 0;
        private int strategyConsecutiveLosses = 0;
        private BigDecimal expectancy = BigDecimal.ZERO;
        private BigDecimal profitFactor = BigDecimal.ZERO;
        private BigDecimal averageTrade = BigDecimal.ZERO;
        private BigDecimal totalFees = BigDecimal.ZERO;
        private BigDecimal netProfit = BigDecimal.ZERO;
        private BigDecimal maxDrawdown = BigDecimal.ZERO;
        private BigDecimal sharpeRatio = BigDecimal.ZERO;
        private BigDecimal riskRewardRatio = BigDecimal.ZERO;
        private BigDecimal tradesPerDay = BigDecimal.ZERO;
        private BigDecimal bestDay = BigDecimal.ZERO;
        private BigDecimal worstDay = BigDecimal.ZERO;
        private LocalDate bestDayDate = null;
        private LocalDate worstDayDate = null;
        private BigDecimal averageHoldingTimeSeconds = BigDecimal.ZERO;
        private BigDecimal averageGainPct = BigDecimal.ZERO;
        private BigDecimal averageLossPct = BigDecimal.ZERO;
        private BigDecimal largestWinPct = BigDecimal.ZERO;
        private BigDecimal largestLossPct = BigDecimal.ZERO;

        public Builder totalTrades(int totalTrades) {
            this.totalTrades = totalTrades;
            return this;
        }

        public Builder winningTrades(int winningTrades) {
            this.winningTrades = winningTrades;
            return this;
        }

        public Builder losingTrades(int losingTrades) {
            this.losingTrades = losingTrades;
            return this;
        }

        public Builder totalProfitLoss(BigDecimal totalProfitLoss) {
            this.totalProfitLoss = totalProfitLoss;
            return this;
        }

        public Builder winRate(BigDecimal winRate) {
            this.winRate = winRate;
            return this;
        }

        public Builder averageProfit(BigDecimal averageProfit) {
            this.averageProfit = averageProfit;
            return this;
        }

        public Builder averageLoss(BigDecimal averageLoss) {
            this.averageLoss = averageLoss;
            return this;
        }

        public Builder largestWin(BigDecimal largestWin) {
            this.largestWin = largestWin;
            return this;
        }

        public Builder largestLoss(BigDecimal largestLoss) {
            this.largestLoss = largestLoss;
            return this;
        }

        public Builder totalVolume(BigDecimal totalVolume) {
            this.totalVolume = totalVolume;
            return this;
        }

        public Builder tradesBySymbol(List<SymbolStats> tradesBySymbol) {
            this.tradesBySymbol = tradesBySymbol;
            return this;
        }

        public Builder consecutiveWins(int consecutiveWins) {
            this.consecutiveWins = consecutiveWins;
            return this;
        }

        public Builder consecutiveLosses(int consecutiveLosses) {
            this.consecutiveLosses = consecutiveLosses;
            return this;
        }

        public Builder currentWinStreak(int currentWinStreak) {
            this.currentWinStreak = currentWinStreak;
            return this;
        }

        public Builder currentLossStreak(int currentLossStreak) {
            this.currentLossStreak = currentLossStreak;
            return this;
        }

        public Builder strategyWinRate(BigDecimal strategyWinRate) {
            this.strategyWinRate = strategyWinRate;
            return this;
        }

        public Builder strategyWinningTrades(int strategyWinningTrades) {
            this.strategyWinningTrades = strategyWinningTrades;
            return this;
        }

        public Builder strategyLosingTrades(int strategyLosingTrades) {
            this.strategyLosingTrades = strategyLosingTrades;
            return this;
        }

        public Builder strategyProfitLoss(BigDecimal strategyProfitLoss) {
            this.strategyProfitLoss = strategyProfitLoss;
            return this;
        }

        public Builder strategyConsecutiveWins(int strategyConsecutiveWins) {
            this.strategyConsecutiveWins = strategyConsecutiveWins;
            return this;
        }

        public Builder strategyConsecutiveLosses(int strategyConsecutiveLosses) {
            this.strategyConsecutiveLosses = strategyConsecutiveLosses;
            return this;
        }

        public Builder expectancy(BigDecimal expectancy) {
            this.expectancy = expectancy;
            return this;
        }

        public Builder profitFactor(BigDecimal profitFactor) {
            this.profitFactor = profitFactor;
            return this;
        }

        public Builder averageTrade(BigDecimal averageTrade) {
            this.averageTrade = averageTrade;
            return this;
        }

        public Builder totalFees(BigDecimal totalFees) {
            this.totalFees = totalFees;
            return this;
        }

        public Builder netProfit(BigDecimal netProfit) {
            this.netProfit = netProfit;
            return this;
        }

        public Builder maxDrawdown(BigDecimal maxDrawdown) {
            this.maxDrawdown = maxDrawdown;
            return this;
        }

        public Builder sharpeRatio(BigDecimal sharpeRatio) {
            this.sharpeRatio = sharpeRatio;
            return this;
        }

        public Builder riskRewardRatio(BigDecimal riskRewardRatio) {
            this.riskRewardRatio = riskRewardRatio;
            return this;
        }

        public Builder tradesPerDay(BigDecimal tradesPerDay) {
            this.tradesPerDay = tradesPerDay;
            return this;
        }

        public Builder bestDay(BigDecimal bestDay) {
            this.bestDay = bestDay;
            return this;
        }

        public Builder worstDay(BigDecimal worstDay) {
            this.worstDay = worstDay;
            return this;
        }

        public Builder bestDayDate(LocalDate bestDayDate) {
            this.bestDayDate = bestDayDate;
            return this;
        }

        public Builder worstDayDate(LocalDate worstDayDate) {
            this.worstDayDate = worstDayDate;
            return this;
        }

        public Builder averageHoldingTimeSeconds(BigDecimal averageHoldingTimeSeconds) {
            this.averageHoldingTimeSeconds = averageHoldingTimeSeconds;
            return this;
        }

        public Builder averageGainPct(BigDecimal averageGainPct) {
            this.averageGainPct = averageGainPct;
            return this;
        }

        public Builder averageLossPct(BigDecimal averageLossPct) {
            this.averageLossPct = averageLossPct;
            return this;
        }

        public Builder largestWinPct(BigDecimal largestWinPct) {
            this.largestWinPct = largestWinPct;
            return this;
        }

        public Builder largestLossPct(BigDecimal largestLossPct) {
            this.largestLossPct = largestLossPct;
            return this;
        }

        public Metrics build() {
            return new Metrics(this);
        }
    }
}
