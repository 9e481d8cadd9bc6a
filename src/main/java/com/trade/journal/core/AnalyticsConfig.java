package com.trade.journal.core;

import java.math.BigDecimal;
import java.time.ZoneId;

/**
 * 分析引擎配置
 * 从配置文件加载或通过 Builder 创建
 */
public class AnalyticsConfig {

    private final ZoneId zone;
    private final PairingMethod defaultPairingMethod;
    private final BigDecimal optionMultiplier;
    private final boolean strategyRespectsDateFilter;
    private final int histogramBins;
    private final int defaultConcentrationPercent;
    private final int tiltMaxStreak;
    private final int tiltMinSample;
    private final int tiltMinTrades;
    private final BigDecimal tiltWinDropThreshold;
    private final int recentTradesDefaultLimit;
    private final String storeFile;

    private AnalyticsConfig(Builder b) {
        this.zone = b.zone;
        this.defaultPairingMethod = b.defaultPairingMethod;
        this.optionMultiplier = b.optionMultiplier;
        this.strategyRespectsDateFilter = b.strategyRespectsDateFilter;
        this.histogramBins = b.histogramBins;
        this.defaultConcentrationPercent = b.defaultConcentrationPercent;
        this.tiltMaxStreak = b.tiltMaxStreak;
        this.tiltMinSample = b.tiltMinSample;
        this.tiltMinTrades = b.tiltMinTrades;
        this.tiltWinDropThreshold = b.tiltWinDropThreshold;
        this.recentTradesDefaultLimit = b.recentTradesDefaultLimit;
        this.storeFile = b.storeFile;
    }

    /**
     * 从配置文件加载
     */
    public static AnalyticsConfig fromProperties() {
        ConfigManager config = ConfigManager.getInstance();

        return AnalyticsConfig.builder()
            .zone(ZoneId.of(config.getProperty("journal.zone", "UTC")))
            .defaultPairingMethod(PairingMethod.parse(config.getProperty("pairing.default.method", "FIFO")))
            .optionMultiplier(config.getBigDecimalProperty("pairing.options.multiplier", BigDecimal.valueOf(100)))
            .strategyRespectsDateFilter(config.getBooleanProperty("metrics.strategy.respect-date-filter", false))
            .histogramBins(config.getIntProperty("distribution.histogram.bins", 20))
            .defaultConcentrationPercent(config.getIntProperty("distribution.concentration.default", 10))
            .tiltMaxStreak(config.getIntProperty("tilt.max.streak", 4))
            .tiltMinSample(config.getIntProperty("tilt.min.sample", 10))
            .tiltMinTrades(config.getIntProperty("tilt.min.trades", 10))
            .tiltWinDropThreshold(config.getBigDecimalProperty("tilt.win.drop.threshold", new BigDecimal("0.15")))
            .recentTradesDefaultLimit(config.getIntProperty("recent.trades.default.limit", 5))
            .storeFile(config.getProperty("store.file", null))
            .build();
    }

    /**
     * 默认配置（不读取配置文件）
     */
    public static AnalyticsConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public ZoneId getZone() { return zone; }
    public PairingMethod getDefaultPairingMethod() { return defaultPairingMethod; }
    public BigDecimal getOptionMultiplier() { return optionMultiplier; }
    public boolean isStrategyRespectsDateFilter() { return strategyRespectsDateFilter; }
    public int getHistogramBins() { return histogramBins; }
    public int getDefaultConcentrationPercent() { return defaultConcentrationPercent; }
    public int getTiltMaxStreak() { return tiltMaxStreak; }
    public int getTiltMinSample() { return tiltMinSample; }
    public int getTiltMinTrades() { return tiltMinTrades; }
    public BigDecimal getTiltWinDropThreshold() { return tiltWinDropThreshold; }
    public int getRecentTradesDefaultLimit() { return recentTradesDefaultLimit; }
    public String getStoreFile() { return storeFile; }

    /**
     * Builder 模式
     */
    public static class Builder {
        private ZoneId zone = ZoneId.of("UTC");
        private PairingMethod defaultPairingMethod = PairingMethod.FIFO;
        private BigDecimal optionMultiplier = BigDecimal.valueOf(100);
        private boolean strategyRespectsDateFilter = false;
        private int histogramBins = 20;
        private int defaultConcentrationPercent = 10;
        private int tiltMaxStreak = 4;
        private int tiltMinSample = 10;
        private int tiltMinTrades = 10;
        private BigDecimal tiltWinDropThreshold = new BigDecimal("0.15");
        private int recentTradesDefaultLimit = 5;
        private String storeFile;

        public Builder zone(ZoneId zone) {
            this.zone = zone;
            return this;
        }

        public Builder defaultPairingMethod(PairingMethod defaultPairingMethod) {
            this.defaultPairingMethod = defaultPairingMethod;
            return this;
        }

        public Builder optionMultiplier(BigDecimal optionMultiplier) {
            this.optionMultiplier = optionMultiplier;
            return this;
        }

        public Builder strategyRespectsDateFilter(boolean strategyRespectsDateFilter) {
            this.strategyRespectsDateFilter = strategyRespectsDateFilter;
            return this;
        }

        public Builder histogramBins(int histogramBins) {
            this.histogramBins = histogramBins;
            return this;
        }

        public Builder defaultConcentrationPercent(int defaultConcentrationPercent) {
            this.defaultConcentrationPercent = defaultConcentrationPercent;
            return this;
        }

        public Builder tiltMaxStreak(int tiltMaxStreak) {
            this.tiltMaxStreak = tiltMaxStreak;
            return this;
        }

        public Builder tiltMinSample(int tiltMinSample) {
            this.tiltMinSample = tiltMinSample;
            return this;
        }

        public Builder tiltMinTrades(int tiltMinTrades) {
            this.tiltMinTrades = tiltMinTrades;
            return this;
        }

        public Builder tiltWinDropThreshold(BigDecimal tiltWinDropThreshold) {
            this.tiltWinDropThreshold = tiltWinDropThreshold;
            return this;
        }

        public Builder recentTradesDefaultLimit(int recentTradesDefaultLimit) {
            this.recentTradesDefaultLimit = recentTradesDefaultLimit;
            return this;
        }

        public Builder storeFile(String storeFile) {
            this.storeFile = storeFile;
            return this;
        }

        public AnalyticsConfig build() {
            if (histogramBins < 1) {
                throw new IllegalArgumentException("直方图分箱数必须大于0: " + histogramBins);
            }
            if (tiltMaxStreak < 1) {
                throw new IllegalArgumentException("最大连亏统计长度必须大于0: " + tiltMaxStreak);
            }
            return new AnalyticsConfig(this);
        }
    }

    @Override
    public String toString() {
        return "AnalyticsConfig{" +
            "zone=" + zone +
            ", defaultPairingMethod=" + defaultPairingMethod +
            ", optionMultiplier=" + optionMultiplier +
            ", strategyRespectsDateFilter=" + strategyRespectsDateFilter +
            ", histogramBins=" + histogramBins +
            ", tiltMaxStreak=" + tiltMaxStreak +
            ", tiltMinSample=" + tiltMinSample +
            ", tiltMinTrades=" + tiltMinTrades +
            ", tiltWinDropThreshold=" + tiltWinDropThreshold +
            ", storeFile=" + storeFile +
            '}';
    }
}
