package com.trade.journal.core;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * 闭区间时间范围 [start, end]，任一端为 null 表示不限
 */
public final class DateRange {

    private static final DateRange UNBOUNDED = new DateRange(null, null);

    private final Instant start;
    private final Instant end;

    private DateRange(Instant start, Instant end) {
        this.start = start;
        this.end = end;
    }

    public static DateRange of(Instant start, Instant end) {
        if (start != null && end != null && start.isAfter(end)) {
            throw new IllegalArgumentException("开始时间晚于结束时间: " + start + " > " + end);
        }
        if (start == null && end == null) {
            return UNBOUNDED;
        }
        return new DateRange(start, end);
    }

    public static DateRange unbounded() {
        return UNBOUNDED;
    }

    /**
     * 解析开始时间：日期取当天零点，时间戳原样使用
     *
     * @throws DateTimeParseException 格式无效
     */
    public static Instant parseStart(String text, ZoneId zone) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String value = text.trim();
        if (isDateOnly(value)) {
            return LocalDate.parse(value).atStartOfDay(zone).toInstant();
        }
        return Instant.parse(value);
    }

    /**
     * 解析结束时间：日期取当天最后一刻（含当天），时间戳原样使用
     *
     * @throws DateTimeParseException 格式无效
     */
    public static Instant parseEnd(String text, ZoneId zone) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String value = text.trim();
        if (isDateOnly(value)) {
            return LocalDate.parse(value).plusDays(1).atStartOfDay(zone).toInstant().minusNanos(1);
        }
        return Instant.parse(value);
    }

    private static boolean isDateOnly(String value) {
        return value.length() == 10 && value.indexOf('T') < 0;
    }

    public boolean contains(Instant timestamp) {
        if (start != null && timestamp.isBefore(start)) {
            return false;
        }
        return end == null || !timestamp.isAfter(end);
    }

    public boolean isUnbounded() {
        return start == null && end == null;
    }

    public Instant getStart() { return start; }
    public Instant getEnd() { return end; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DateRange)) return false;
        DateRange that = (DateRange) o;
        return Objects.equals(start, that.start) && Objects.equals(end, that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return String.format("[%s, %s]", start == null ? "-∞" : start, end == null ? "+∞" : end);
    }
}
