package com.trade.journal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.journal.core.AnalyticsConfig;
import com.trade.journal.core.JsonMappers;
import com.trade.journal.service.InvalidRequestException;
import com.trade.journal.service.JournalAnalyticsService;
import com.trade.journal.store.FileTradeStore;
import com.trade.journal.store.ImportResult;
import com.trade.journal.store.InMemoryTradeStore;
import com.trade.journal.store.TradeStore;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 交易日志分析命令行入口
 *
 * 用法: JournalMain &lt;csv文件&gt; [报告] [--method FIFO|LIFO] [--from 日期] [--to 日期]
 */
public class JournalMain {

    private static final String[] REPORTS = {
            "metrics", "symbols", "strategies", "recent", "evaluation",
            "distribution", "tilt", "equity", "open", "positions", "all"
    };

    public static void main(String[] args) {
        if (args.length == 0) {
            printUsage();
            return;
        }

        String csvFile = args[0];
        String report = "metrics";
        String method = null;
        String from = null;
        String to = null;
        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--method" -> method = requireValue(args, ++i);
                case "--from" -> from = requireValue(args, ++i);
                case "--to" -> to = requireValue(args, ++i);
                default -> report = args[i];
            }
        }

        try {
            AnalyticsConfig config = AnalyticsConfig.fromProperties();
            TradeStore store = createStore(config);
            JournalAnalyticsService service = new JournalAnalyticsService(store, config);

            String csv = Files.readString(Paths.get(csvFile), StandardCharsets.UTF_8);
            ImportResult imported = service.importTradesCsv(csv);
            System.err.println("导入完成: " + imported);
            imported.getErrors().forEach(error -> System.err.println("  " + error));

            ObjectMapper mapper = JsonMappers.create();
            System.out.println(mapper.writeValueAsString(runReport(service, report, method, from, to)));

        } catch (InvalidRequestException e) {
            System.err.println("请求无效 [" + e.getErrorCode() + "]: " + e.getMessage());
            System.exit(2);
        } catch (IOException e) {
            System.err.println("读取失败: " + e.getMessage());
            System.exit(1);
        }
    }

    private static Object runReport(JournalAnalyticsService service, String report,
                                    String method, String from, String to) throws InvalidRequestException {
        return switch (report) {
            case "metrics" -> service.computeMetrics(method, from, to);
            case "symbols" -> service.computeSymbolPnl(method, from, to);
            case "strategies" -> service.computeStrategyPerformance(method, from, to);
            case "recent" -> service.computeRecentTrades(null, method, from, to);
            case "evaluation" -> service.computeEvaluationMetrics(method, from, to);
            case "distribution" -> service.computeDistributionConcentration(method, from, to, null);
            case "tilt" -> service.computeTiltMetric(method, from, to);
            case "equity" -> service.computeEquityCurve(method, from, to);
            case "open" -> service.getOpenPositions(method);
            case "positions" -> service.getPositionGroups(method, from, to);
            case "all" -> {
                Map<String, Object> all = new LinkedHashMap<>();
                for (String name : REPORTS) {
                    if (!"all".equals(name)) {
                        all.put(name, runReport(service, name, method, from, to));
                    }
                }
                yield all;
            }
            default -> throw new IllegalArgumentException("未知报告: " + report + "，可选: " + String.join(", ", REPORTS));
        };
    }

    private static TradeStore createStore(AnalyticsConfig config) {
        String storeFile = config.getStoreFile();
        if (storeFile == null || storeFile.isBlank()) {
            return new InMemoryTradeStore();
        }
        Path path = Paths.get(storeFile);
        System.err.println("使用成交存储文件: " + path.toAbsolutePath());
        return new FileTradeStore(path);
    }

    private static String requireValue(String[] args, int index) {
        if (index >= args.length) {
            throw new IllegalArgumentException("参数缺少取值: " + args[index - 1]);
        }
        return args[index];
    }

    private static void printUsage() {
        System.out.println("""
            ================================================
               交易日志分析
            ================================================
            用法: JournalMain <csv文件> [报告] [--method FIFO|LIFO] [--from 日期] [--to 日期]

            报告: metrics（默认）, symbols, strategies, recent, evaluation,
                  distribution, tilt, equity, open, positions, all
            日期: 2024-03-01 或 2024-03-01T14:30:00Z
            """);
    }
}
