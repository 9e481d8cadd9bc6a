package com.trade.journal.store;

import com.trade.journal.core.Execution;
import com.trade.journal.core.Side;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * CSV 成交导入
 * 支持两种格式，按表头自动识别：
 * <ul>
 *   <li>标准格式：symbol,side,quantity,price,timestamp[,order_type,status,fees,notes]</li>
 *   <li>Webull 导出：Name,Symbol,Side,Status,Filled,Total Qty,Price,Avg Price,Time-in-Force,Placed Time,Filled Time[,手续费列]</li>
 * </ul>
 * 校验失败的行记入错误列表并跳过，其余行一次性写入存储
 */
public class TradeCsvImporter {

    private static final Logger logger = LoggerFactory.getLogger(TradeCsvImporter.class);

    private static final String[] STANDARD_REQUIRED = {"symbol", "side", "quantity", "price", "timestamp"};
    private static final String[] WEBULL_REQUIRED = {"Symbol", "Side", "Status", "Filled"};
    private static final String[] WEBULL_FEE_COLUMNS = {"Commission", "Fees", "Fee", "Total Fees"};

    private static final DateTimeFormatter WEBULL_TIME = DateTimeFormatter.ofPattern("MM/dd/yyyy HH:mm:ss");
    private static final DateTimeFormatter LOCAL_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final TradeStore store;
    private final ZoneId zone;

    public TradeCsvImporter(TradeStore store, ZoneId zone) {
        this.store = store;
        this.zone = zone;
    }

    /**
     * 导入 CSV 文本
     *
     * @throws IllegalArgumentException 内容为空或缺少必需列
     */
    public ImportResult importCsv(String csvText) {
        if (csvText == null || csvText.isBlank()) {
            throw new IllegalArgumentException("CSV 内容为空");
        }

        String[] lines = csvText.split("\\r?\\n", -1);
        int headerIndex = 0;
        while (headerIndex < lines.length && lines[headerIndex].isBlank()) {
            headerIndex++;
        }
        List<String> headers = splitLine(stripBom(lines[headerIndex]));
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            columns.put(headers.get(i).trim(), i);
        }

        boolean webull = columns.containsKey("Filled")
                || columns.containsKey("Placed Time")
                || columns.containsKey("Filled Time");
        if (!webull) {
            columns = lowerCaseKeys(columns);
        }
        requireColumns(columns, webull ? WEBULL_REQUIRED : STANDARD_REQUIRED);
        if (webull && !columns.containsKey("Price") && !columns.containsKey("Avg Price")) {
            throw new IllegalArgumentException("CSV 缺少必需列: Price 或 Avg Price");
        }
        if (webull && !columns.containsKey("Filled Time") && !columns.containsKey("Placed Time")) {
            throw new IllegalArgumentException("CSV 缺少必需列: Filled Time 或 Placed Time");
        }

        List<Execution> candidates = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        int skipped = 0;

        for (int i = headerIndex + 1; i < lines.length; i++) {
            if (lines[i].isBlank()) {
                continue;
            }
            int lineNumber = i + 1;
            Row row = new Row(splitLine(lines[i]), columns);
            try {
                Execution execution = webull ? parseWebull(row) : parseStandard(row);
                if (execution == null) {
                    skipped++;
                } else {
                    candidates.add(execution);
                }
            } catch (IllegalArgumentException | DateTimeParseException e) {
                errors.add("line " + lineNumber + ": " + e.getMessage());
            }
        }

        List<Execution> added = store.addExecutions(candidates);
        skipped += candidates.size() - added.size();

        logger.info("CSV 导入完成: 格式={}, 新增={}, 跳过={}, 错误={}",
                webull ? "Webull" : "标准", added.size(), skipped, errors.size());
        return new ImportResult(added.size(), skipped, errors);
    }

    private Execution parseStandard(Row row) {
        return Execution.builder()
                .symbol(requireText(row.get("symbol"), "交易代码为空"))
                .side(Side.parse(row.get("side")))
                .quantity(parseNumber(row.get("quantity"), "数量"))
                .price(parseNumber(row.get("price"), "价格"))
                .timestamp(parseTimestamp(requireText(row.get("timestamp"), "成交时间为空")))
                .orderType(orDefault(row.get("order_type"), "MARKET"))
                .status(orDefault(row.get("status"), Execution.STATUS_FILLED))
                .fees(row.get("fees").isBlank() ? BigDecimal.ZERO : parseNumber(row.get("fees"), "手续费"))
                .notes(emptyToNull(row.get("notes")))
                .build();
    }

    /**
     * 已撤单、未成交或价格为0的行返回 null
     */
    private Execution parseWebull(Row row) {
        String status = row.get("Status");
        BigDecimal filled = parseNumber(orDefault(row.get("Filled"), "0"), "成交数量");
        if (status.toLowerCase(Locale.ROOT).startsWith("cancel") || filled.signum() == 0) {
            return null;
        }

        BigDecimal price = null;
        if (!row.get("Avg Price").isBlank()) {
            price = tryParsePrice(row.get("Avg Price"));
        }
        if (price == null) {
            price = tryParsePrice(row.get("Price"));
        }
        if (price == null) {
            throw new IllegalArgumentException("无效价格: " + row.get("Price"));
        }
        if (price.signum() == 0) {
            return null;
        }

        String time = row.get("Filled Time").isBlank() ? row.get("Placed Time") : row.get("Filled Time");

        return Execution.builder()
                .symbol(requireText(row.get("Symbol"), "交易代码为空"))
                .side(Side.parse(row.get("Side")))
                .quantity(filled)
                .price(price)
                .timestamp(parseWebullTime(time))
                .orderType(orDefault(row.get("Time-in-Force"), "DAY"))
                .status(status)
                .fees(parseWebullFees(row))
                .notes(emptyToNull(row.get("Name")))
                .build();
    }

    /**
     * 形如 "12/18/2025 13:25:11 EST"，时区缩写忽略，按配置时区解释
     */
    private Instant parseWebullTime(String text) {
        String value = requireText(text, "成交时间为空");
        String[] parts = value.split("\\s+");
        if (parts.length < 2) {
            throw new IllegalArgumentException("无效的成交时间: " + value);
        }
        try {
            return LocalDateTime.parse(parts[0] + " " + parts[1], WEBULL_TIME).atZone(zone).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("无效的成交时间: " + value, e);
        }
    }

    private BigDecimal parseWebullFees(Row row) {
        for (String column : WEBULL_FEE_COLUMNS) {
            String value = row.get(column);
            if (value.isBlank()) {
                continue;
            }
            try {
                return new BigDecimal(value.replace("$", "").replace(",", "").trim()).abs();
            } catch (NumberFormatException e) {
                logger.debug("忽略无法解析的手续费 {}={}", column, value);
            }
        }
        return BigDecimal.ZERO;
    }

    /**
     * 支持 ISO 时间戳（带时区或偏移）和本地时间（按配置时区解释）
     */
    private Instant parseTimestamp(String value) {
        List<Function<String, Instant>> parsers = List.of(
                Instant::parse,
                text -> OffsetDateTime.parse(text).toInstant(),
                text -> LocalDateTime.parse(text).atZone(zone).toInstant(),
                text -> LocalDateTime.parse(text, LOCAL_TIME).atZone(zone).toInstant()
        );
        DateTimeParseException lastError = null;
        for (Function<String, Instant> parser : parsers) {
            try {
                return parser.apply(value);
            } catch (DateTimeParseException e) {
                lastError = e;
            }
        }
        throw new IllegalArgumentException("无效的成交时间: " + value, lastError);
    }

    private static BigDecimal tryParsePrice(String value) {
        String cleaned = value.trim();
        while (cleaned.startsWith("@")) {
            cleaned = cleaned.substring(1).trim();
        }
        if (cleaned.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(cleaned.replace("$", "").replace(",", ""));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static BigDecimal parseNumber(String value, String field) {
        String cleaned = value.trim();
        if (cleaned.isEmpty()) {
            throw new IllegalArgumentException(field + "为空");
        }
        try {
            return new BigDecimal(cleaned.replace(",", ""));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("无效的" + field + ": " + value, e);
        }
    }

    private static String requireText(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(message);
        }
        return value.trim();
    }

    private static String orDefault(String value, String defaultValue) {
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    private static String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static void requireColumns(Map<String, Integer> columns, String[] required) {
        for (String column : required) {
            if (!columns.containsKey(column)) {
                throw new IllegalArgumentException("CSV 缺少必需列: " + column);
            }
        }
    }

    private static Map<String, Integer> lowerCaseKeys(Map<String, Integer> columns) {
        Map<String, Integer> lowered = new HashMap<>();
        columns.forEach((k, v) -> lowered.put(k.toLowerCase(Locale.ROOT), v));
        return lowered;
    }

    private static String stripBom(String line) {
        return line.startsWith("\uFEFF") ? line.substring(1) : line;
    }

    /**
     * 按逗号拆分一行，支持双引号包裹的字段（"" 表示引号本身）
     */
    static List<String> splitLine(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        current.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                fields.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        fields.add(current.toString());
        return fields;
    }

    /**
     * 按列名取值，缺失列返回空串
     */
    private static final class Row {
        private final List<String> fields;
        private final Map<String, Integer> columns;

        private Row(List<String> fields, Map<String, Integer> columns) {
            this.fields = fields;
            this.columns = columns;
        }

        String get(String column) {
            Integer index = columns.get(column);
            if (index == null || index >= fields.size()) {
                return "";
            }
            return fields.get(index).trim();
        }
    }
}
