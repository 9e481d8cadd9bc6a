package com.trade.journal.service;

import com.trade.journal.core.AnalyticsConfig;
import com.trade.journal.core.DateRange;
import com.trade.journal.core.Execution;
import com.trade.journal.core.PairingMethod;
import com.trade.journal.distribution.DistributionAnalyzer;
import com.trade.journal.distribution.DistributionConcentration;
import com.trade.journal.matching.LotMatcher;
import com.trade.journal.matching.MatchResult;
import com.trade.journal.matching.OpenLot;
import com.trade.journal.matching.PairedTrade;
import com.trade.journal.matching.PositionGroup;
import com.trade.journal.matching.PositionGrouper;
import com.trade.journal.metrics.EquityCurve;
import com.trade.journal.metrics.EquityCurveCalculator;
import com.trade.journal.metrics.Metrics;
import com.trade.journal.metrics.MetricsAggregator;
import com.trade.journal.metrics.StrategyNames;
import com.trade.journal.metrics.StrategyPerformance;
import com.trade.journal.metrics.StrategyPerformanceCalculator;
import com.trade.journal.metrics.SymbolPnl;
import com.trade.journal.metrics.SymbolPnlCalculator;
import com.trade.journal.segment.EvaluationMetrics;
import com.trade.journal.segment.SegmentationAnalyzer;
import com.trade.journal.store.ImportResult;
import com.trade.journal.store.TradeCsvImporter;
import com.trade.journal.store.TradeSnapshot;
import com.trade.journal.store.TradeStore;
import com.trade.journal.tilt.TiltAnalyzer;
import com.trade.journal.tilt.TiltStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 交易日志分析服务
 * 每个请求读取一次存储快照，在快照上完成配对和全部统计；请求之间不共享可变状态
 * 只有已成交（FILLED）的记录参与配对；回合按所在持仓分组的开仓成交归属策略
 *
 * 日期参数：ISO 日期（开始取当天零点，结束包含当天）或 ISO 时间戳，null 表示不限；
 * 配对方法：FIFO / LIFO（大小写不敏感），null 使用配置的默认值
 */
public class JournalAnalyticsService {

    private static final Logger logger = LoggerFactory.getLogger(JournalAnalyticsService.class);

    private final TradeStore store;
    private final AnalyticsConfig config;
    private final LotMatcher matcher;
    private final MetricsAggregator metricsAggregator;
    private final SymbolPnlCalculator symbolPnlCalculator;
    private final StrategyPerformanceCalculator strategyPerformanceCalculator;
    private final EquityCurveCalculator equityCurveCalculator;
    private final SegmentationAnalyzer segmentationAnalyzer;
    private final DistributionAnalyzer distributionAnalyzer;
    private final TiltAnalyzer tiltAnalyzer;
    private final PositionGrouper positionGrouper;
    private final TradeCsvImporter csvImporter;

    public JournalAnalyticsService(TradeStore store, AnalyticsConfig config) {
        this.store = Objects.requireNonNull(store, "store");
        this.config = Objects.requireNonNull(config, "config");
        this.matcher = new LotMatcher(config.getOptionMultiplier());
        this.metricsAggregator = new MetricsAggregator(config.getZone());
        this.symbolPnlCalculator = new SymbolPnlCalculator();
        this.strategyPerformanceCalculator = new StrategyPerformanceCalculator();
        this.equityCurveCalculator = new EquityCurveCalculator(config.getZone());
        this.segmentationAnalyzer = new SegmentationAnalyzer(config.getZone());
        this.distributionAnalyzer = new DistributionAnalyzer(config.getHistogramBins());
        this.tiltAnalyzer = new TiltAnalyzer(config);
        this.positionGrouper = new PositionGrouper();
        this.csvImporter = new TradeCsvImporter(store, config.getZone());
    }

    // ==================== 统计 ====================

    public Metrics computeMetrics(String pairingMethod, String startDate, String endDate)
            throws InvalidRequestException {
        Request request = prepare("computeMetrics", pairingMethod, startDate, endDate);
        List<PairedTrade> strategyPairs = config.isStrategyRespectsDateFilter()
                ? request.pairs : request.allPairs;
        return metricsAggregator.compute(request.pairs, strategyPairs);
    }

    public List<SymbolPnl> computeSymbolPnl(String pairingMethod, String startDate, String endDate)
            throws InvalidRequestException {
        Request request = prepare("computeSymbolPnl", pairingMethod, startDate, endDate);
        return symbolPnlCalculator.compute(request.pairs, request.match.getOpenLots());
    }

    /**
     * 使用默认配对方法
     */
    public List<StrategyPerformance> computeStrategyPerformance(String startDate, String endDate)
            throws InvalidRequestException {
        return computeStrategyPerformance(null, startDate, endDate);
    }

    public List<StrategyPerformance> computeStrategyPerformance(String pairingMethod, String startDate, String endDate)
            throws InvalidRequestException {
        Request request = prepare("computeStrategyPerformance", pairingMethod, startDate, endDate);
        return strategyPerformanceCalculator.compute(request.pairs, request.snapshot.getStrategies());
    }

    /**
     * 最近平仓的回合，平仓时间倒序
     *
     * @param limit 条数，null 使用配置默认值
     */
    public List<RecentTrade> computeRecentTrades(Integer limit, String pairingMethod, String startDate, String endDate)
            throws InvalidRequestException {
        int actualLimit = limit == null ? config.getRecentTradesDefaultLimit() : limit;
        if (actualLimit <= 0) {
            throw reject(new InvalidRequestException(InvalidRequestException.ErrorCode.INVALID_LIMIT,
                    "条数必须大于0: " + limit));
        }
        Request request = prepare("computeRecentTrades", pairingMethod, startDate, endDate);

        List<PairedTrade> ordered = new ArrayList<>(request.pairs);
        ordered.sort(MetricsAggregator.BY_EXIT.reversed());
        List<RecentTrade> recent = new ArrayList<>(Math.min(actualLimit, ordered.size()));
        for (PairedTrade pair : ordered.subList(0, Math.min(actualLimit, ordered.size()))) {
            String strategyName = pair.getStrategyId() == null ? null
                    : StrategyNames.resolve(pair.getStrategyId(), request.snapshot.getStrategies());
            recent.add(new RecentTrade(pair.getSymbol(), pair.getEntryTimestamp(), pair.getExitTimestamp(),
                    pair.getQuantity(), pair.getEntryPrice(), pair.getExitPrice(), pair.getNetPnl(), strategyName));
        }
        return recent;
    }

    public EvaluationMetrics computeEvaluationMetrics(String pairingMethod, String startDate, String endDate)
            throws InvalidRequestException {
        Request request = prepare("computeEvaluationMetrics", pairingMethod, startDate, endDate);
        return segmentationAnalyzer.analyze(request.pairs, request.snapshot.getStrategies());
    }

    /**
     * @param concentrationPercent 头部比例（5-30），null 使用配置默认值
     */
    public DistributionConcentration computeDistributionConcentration(String pairingMethod, String startDate,
                                                                      String endDate, Integer concentrationPercent)
            throws InvalidRequestException {
        int percent = concentrationPercent == null ? config.getDefaultConcentrationPercent() : concentrationPercent;
        if (percent < DistributionAnalyzer.MIN_CONCENTRATION_PERCENT
                || percent > DistributionAnalyzer.MAX_CONCENTRATION_PERCENT) {
            throw reject(new InvalidRequestException(InvalidRequestException.ErrorCode.CONCENTRATION_OUT_OF_RANGE,
                    "集中度比例必须在 [5, 30] 之间: " + concentrationPercent));
        }
        Request request = prepare("computeDistributionConcentration", pairingMethod, startDate, endDate);
        return distributionAnalyzer.analyze(request.pairs, percent);
    }

    public TiltStats computeTiltMetric(String pairingMethod, String startDate, String endDate)
            throws InvalidRequestException {
        Request request = prepare("computeTiltMetric", pairingMethod, startDate, endDate);
        return tiltAnalyzer.analyze(request.pairs);
    }

    /**
     * 指定策略的回合交易，平仓时间升序
     *
     * @param strategyId null 表示未归属策略的回合
     */
    public List<PairedTrade> getPairedTradesByStrategy(Long strategyId, String pairingMethod,
                                                       String startDate, String endDate)
            throws InvalidRequestException {
        Request request = prepare("getPairedTradesByStrategy", pairingMethod, startDate, endDate);
        List<PairedTrade> result = new ArrayList<>();
        for (PairedTrade pair : request.pairs) {
            if (Objects.equals(pair.getStrategyId(), strategyId)) {
                result.add(pair);
            }
        }
        result.sort(MetricsAggregator.BY_EXIT);
        return result;
    }

    public EquityCurve computeEquityCurve(String pairingMethod, String startDate, String endDate)
            throws InvalidRequestException {
        Request request = prepare("computeEquityCurve", pairingMethod, startDate, endDate);
        return equityCurveCalculator.compute(request.pairs);
    }

    /**
     * 当前未平仓持仓（不受日期过滤影响）
     */
    public List<OpenLot> getOpenPositions(String pairingMethod) throws InvalidRequestException {
        Request request = prepare("getOpenPositions", pairingMethod, null, null);
        List<OpenLot> lots = new ArrayList<>(request.match.getOpenLots());
        lots.sort(Comparator.comparing(OpenLot::getSymbol).thenComparing(OpenLot::getTimestamp));
        return lots;
    }

    /**
     * 持仓分组，开仓时间倒序；日期区间按开仓时间过滤，组内成交和盈亏始终完整
     */
    public List<PositionGroup> getPositionGroups(String pairingMethod, String startDate, String endDate)
            throws InvalidRequestException {
        Request request = prepare("getPositionGroups", pairingMethod, startDate, endDate);
        List<PositionGroup> result = new ArrayList<>();
        for (PositionGroup group : request.groups) {
            if (request.range.contains(group.getEntryTimestamp())) {
                result.add(group);
            }
        }
        return result;
    }

    // ==================== 数据维护 ====================

    public ImportResult importTradesCsv(String csvText) throws InvalidRequestException {
        try {
            return csvImporter.importCsv(csvText);
        } catch (IllegalArgumentException e) {
            throw reject(new InvalidRequestException(InvalidRequestException.ErrorCode.INVALID_CSV,
                    e.getMessage(), e));
        }
    }

    /**
     * @return 删除的成交数量
     */
    public int clearAllTrades() {
        return store.clearAll();
    }

    public void saveStrategy(long strategyId, String name) {
        store.saveStrategy(strategyId, name);
    }

    public void assignStrategy(long executionId, Long strategyId) {
        store.assignStrategy(executionId, strategyId);
    }

    // ==================== 内部 ====================

    private Request prepare(String operation, String pairingMethod, String startDate, String endDate)
            throws InvalidRequestException {
        PairingMethod method = parseMethod(pairingMethod);
        DateRange range = parseRange(startDate, endDate);
        logger.debug("{}: method={}, range={}", operation, method, range);

        TradeSnapshot snapshot = store.snapshot();
        List<Execution> filled = new ArrayList<>(snapshot.getExecutions().size());
        for (Execution execution : snapshot.getExecutions()) {
            if (execution.isFilled()) {
                filled.add(execution);
            }
        }
        MatchResult match = matcher.match(filled, method);
        List<PositionGroup> groups = positionGrouper.group(filled, match.getPairs());
        List<PairedTrade> allPairs = positionGrouper.attributeStrategies(match.getPairs(), groups);

        List<PairedTrade> pairs;
        if (range.isUnbounded()) {
            pairs = allPairs;
        } else {
            pairs = new ArrayList<>();
            for (PairedTrade pair : allPairs) {
                if (range.contains(pair.getExitTimestamp())) {
                    pairs.add(pair);
                }
            }
        }
        return new Request(snapshot, range, match, groups, allPairs, pairs);
    }

    private PairingMethod parseMethod(String pairingMethod) throws InvalidRequestException {
        if (pairingMethod == null) {
            return config.getDefaultPairingMethod();
        }
        try {
            return PairingMethod.parse(pairingMethod);
        } catch (IllegalArgumentException e) {
            throw reject(new InvalidRequestException(InvalidRequestException.ErrorCode.UNKNOWN_PAIRING_METHOD,
                    e.getMessage(), e));
        }
    }

    private DateRange parseRange(String startDate, String endDate) throws InvalidRequestException {
        Instant start = parseDate(startDate, true);
        Instant end = parseDate(endDate, false);
        if (start != null && end != null && start.isAfter(end)) {
            throw reject(new InvalidRequestException(InvalidRequestException.ErrorCode.INVALID_DATE_RANGE,
                    "开始日期晚于结束日期: " + startDate + " > " + endDate));
        }
        return DateRange.of(start, end);
    }

    private Instant parseDate(String text, boolean start) throws InvalidRequestException {
        try {
            return start ? DateRange.parseStart(text, config.getZone()) : DateRange.parseEnd(text, config.getZone());
        } catch (DateTimeParseException e) {
            throw reject(new InvalidRequestException(InvalidRequestException.ErrorCode.INVALID_DATE,
                    "无效的日期: " + text, e));
        }
    }

    private static InvalidRequestException reject(InvalidRequestException e) {
        logger.warn("请求被拒绝 [{}]: {}", e.getErrorCode(), e.getMessage());
        return e;
    }

    /**
     * 一次请求的快照与配对结果
     */
    private static final class Request {
        private final TradeSnapshot snapshot;
        private final DateRange range;
        private final MatchResult match;
        private final List<PositionGroup> groups;
        private final List<PairedTrade> allPairs;   // 全部回合，已按持仓分组归属策略
        private final List<PairedTrade> pairs;      // 平仓时间在区间内的回合

        private Request(TradeSnapshot snapshot, DateRange range, MatchResult match, List<PositionGroup> groups,
                        List<PairedTrade> allPairs, List<PairedTrade> pairs) {
            this.snapshot = snapshot;
            this.range = range;
            this.match = match;
            this.groups = groups;
            this.allPairs = allPairs;
            this.pairs = pairs;
        }
    }
}
