package com.trade.journal.metrics;

import com.trade.journal.matching.PairedTrade;

import java.util.List;

/**
 * 连胜/连亏统计
 * 净盈亏为0的回合既不延续也不中断连续记录
 */
final class Streaks {
    final int longestWins;
    final int longestLosses;
    final int currentWins;
    final int currentLosses;

    private Streaks(int longestWins, int longestLosses, int currentWins, int currentLosses) {
        this.longestWins = longestWins;
        this.longestLosses = longestLosses;
        this.currentWins = currentWins;
        this.currentLosses = currentLosses;
    }

    /**
     * @param chronological 按平仓时间排序的回合
     */
    static Streaks of(List<PairedTrade> chronological) {
        int longestWins = 0;
        int longestLosses = 0;
        int wins = 0;
        int losses = 0;
        for (PairedTrade pair : chronological) {
            if (pair.isWin()) {
                wins++;
                losses = 0;
                longestWins = Math.max(longestWins, wins);
            } else if (pair.isLoss()) {
                losses++;
                wins = 0;
                longestLosses = Math.max(longestLosses, losses);
            }
        }
        return new Streaks(longestWins, longestLosses, wins, losses);
    }
}
