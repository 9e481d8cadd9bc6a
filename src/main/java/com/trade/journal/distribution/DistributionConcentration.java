package com.trade.journal.distribution;

import java.util.Collections;
import java.util.List;

/**
 * 盈亏分布直方图 + 集中度
 */
public final class DistributionConcentration {
    private final List<HistogramBin> histogram;
    private final ConcentrationStats concentration;

    public DistributionConcentration(List<HistogramBin> histogram, ConcentrationStats concentration) {
        this.histogram = Collections.unmodifiableList(histogram);
        this.concentration = concentration;
    }

    public List<HistogramBin> getHistogram() { return histogram; }
    public ConcentrationStats getConcentration() { return concentration; }
}
