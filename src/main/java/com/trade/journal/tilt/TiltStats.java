package com.trade.journal.tilt;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;

/**
 * 情绪化交易（上头）指标
 */
public final class TiltStats {

    public static final String CATEGORY_CALM = "Calm & Disciplined";
    public static final String CATEGORY_MODERATE = "Moderate Tilt Risk";
    public static final String CATEGORY_SEVERE = "High Tilt / Severe Tilt";
    public static final String CATEGORY_INSUFFICIENT = "Insufficient Data";

    private final int tradeCount;
    private final BigDecimal baselineWinRate;
    private final BigDecimal winRateAfterLoss;
    private final BigDecimal winRateAfterWin;
    private final BigDecimal winRateAfter2Losses;
    private final BigDecimal avgLossNormally;       // 全部亏损的均值（负数）
    private final BigDecimal avgLossAfterLoss;      // 亏损之后再亏损的均值（负数）
    private final BigDecimal probLossAfterLoss;
    private final BigDecimal tiltScore;             // 0-10
    private final String tiltCategory;
    private final Integer recommendedStreak;        // 建议停手的连亏笔数，可能为 null
    private final List<StreakStats> streakStats;
    private final List<String> coachingLines;

    public TiltStats(int tradeCount, BigDecimal baselineWinRate, BigDecimal winRateAfterLoss,
                     BigDecimal winRateAfterWin, BigDecimal winRateAfter2Losses,
                     BigDecimal avgLossNormally, BigDecimal avgLossAfterLoss, BigDecimal probLossAfterLoss,
                     BigDecimal tiltScore, String tiltCategory, Integer recommendedStreak,
                     List<StreakStats> streakStats, List<String> coachingLines) {
        this.tradeCount = tradeCount;
        this.baselineWinRate = baselineWinRate;
        this.winRateAfterLoss = winRateAfterLoss;
        this.winRateAfterWin = winRateAfterWin;
        this.winRateAfter2Losses = winRateAfter2Losses;
        this.avgLossNormally = avgLossNormally;
        this.avgLossAfterLoss = avgLossAfterLoss;
        this.probLossAfterLoss = probLossAfterLoss;
        this.tiltScore = tiltScore;
        this.tiltCategory = tiltCategory;
        this.recommendedStreak = recommendedStreak;
        this.streakStats = Collections.unmodifiableList(streakStats);
        this.coachingLines = Collections.unmodifiableList(coachingLines);
    }

    public int getTradeCount() { return tradeCount; }
    public BigDecimal getBaselineWinRate() { return baselineWinRate; }
    public BigDecimal getWinRateAfterLoss() { return winRateAfterLoss; }
    public BigDecimal getWinRateAfterWin() { return winRateAfterWin; }
    public BigDecimal getWinRateAfter2Losses() { return winRateAfter2Losses; }
    public BigDecimal getAvgLossNormally() { return avgLossNormally; }
    public BigDecimal getAvgLossAfterLoss() { return avgLossAfterLoss; }
    public BigDecimal getProbLossAfterLoss() { return probLossAfterLoss; }
    public BigDecimal getTiltScore() { return tiltScore; }
    public String getTiltCategory() { return tiltCategory; }
    public Integer getRecommendedStreak() { return recommendedStreak; }
    public List<StreakStats> getStreakStats() { return streakStats; }
    public List<String> getCoachingLines() { return coachingLines; }

    @Override
    public String toString() {
        return String.format("TiltStats{trades=%d, score=%s, category=%s, recommended=%s}",
                tradeCount, tiltScore, tiltCategory, recommendedStreak);
    }
}
