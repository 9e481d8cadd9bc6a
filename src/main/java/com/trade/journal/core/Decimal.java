package com.trade.journal.core;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * BigDecimal 工具类
 * 所有金额、价格、数量计算必须使用此类，禁止 double
 */
public final class Decimal {

    private Decimal() {}

    /**
     * 默认精度：价格与均值保留8位小数
     */
    public static final int PRICE_SCALE = 8;

    /**
     * 比率精度：胜率、盈亏比等保留4位小数
     */
    public static final int RATIO_SCALE = 4;

    /**
     * 百分比精度：保留2位小数
     */
    private static final int PERCENT_SCALE = 2;

    /**
     * 数量尾差阈值，低于此值视为已耗尽
     */
    public static final BigDecimal DUST = new BigDecimal("0.0001");

    /**
     * 比率格式化（4位小数）
     */
    public static BigDecimal scaleRatio(BigDecimal value) {
        return value.setScale(RATIO_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * 百分比格式化（2位小数）
     */
    public static BigDecimal scalePercent(BigDecimal value) {
        return value.setScale(PERCENT_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * 安全除法，避免除零
     */
    public static BigDecimal divide(BigDecimal dividend, BigDecimal divisor) {
        return divide(dividend, divisor, PRICE_SCALE);
    }

    /**
     * 指定精度的安全除法，除数为零时返回0
     */
    public static BigDecimal divide(BigDecimal dividend, BigDecimal divisor, int scale) {
        if (divisor.compareTo(BigDecimal.ZERO) == 0) {
            return BigDecimal.ZERO.setScale(scale);
        }
        return dividend.divide(divisor, scale, RoundingMode.HALF_UP);
    }

    /**
     * 计数比率，如胜率 = 盈利次数 / 总次数
     */
    public static BigDecimal ratio(long numerator, long denominator) {
        return divide(BigDecimal.valueOf(numerator), BigDecimal.valueOf(denominator), RATIO_SCALE);
    }

    /**
     * 均值，空集合返回0
     */
    public static BigDecimal mean(Collection<BigDecimal> values) {
        if (values.isEmpty()) {
            return BigDecimal.ZERO;
        }
        return divide(sum(values), BigDecimal.valueOf(values.size()));
    }

    public static BigDecimal sum(Collection<BigDecimal> values) {
        return values.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * 标准差
     *
     * @param sample true 使用样本方差（n-1），false 使用总体方差（n）
     */
    public static BigDecimal stdDev(Collection<BigDecimal> values, boolean sample) {
        int n = values.size();
        int denominator = sample ? n - 1 : n;
        if (denominator <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal avg = mean(values);
        BigDecimal variance = BigDecimal.ZERO;
        for (BigDecimal value : values) {
            BigDecimal diff = value.subtract(avg);
            variance = variance.add(diff.multiply(diff));
        }
        variance = variance.divide(BigDecimal.valueOf(denominator), PRICE_SCALE, RoundingMode.HALF_UP);
        return variance.sqrt(MathContext.DECIMAL64).setScale(PRICE_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * 限定在 [min, max] 区间
     */
    public static BigDecimal clamp(BigDecimal value, BigDecimal min, BigDecimal max) {
        return value.max(min).min(max);
    }

    /**
     * 判断数量是否已低于尾差阈值
     */
    public static boolean isDust(BigDecimal quantity) {
        return quantity.compareTo(DUST) < 0;
    }
}
