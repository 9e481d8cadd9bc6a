package com.trade.journal.core;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Decimal 工具类单元测试
 */
class DecimalTest {

    @Test
    void testScaleRatio() {
        BigDecimal scaled = Decimal.scaleRatio(new BigDecimal("0.123456"));

        // 比率保留4位小数
        assertEquals(4, scaled.scale());
        assertEquals(new BigDecimal("0.1235"), scaled);
    }

    @Test
    void testScalePercent() {
        BigDecimal scaled = Decimal.scalePercent(new BigDecimal("12.3456"));
        assertEquals(new BigDecimal("12.35"), scaled);
    }

    @Test
    void testDivide_ByZero() {
        BigDecimal result = Decimal.divide(new BigDecimal("100"), BigDecimal.ZERO);

        // 除零返回0
        assertEquals(0, BigDecimal.ZERO.compareTo(result));
    }

    @Test
    void testDivide_WithScale() {
        BigDecimal result = Decimal.divide(new BigDecimal("500"), new BigDecimal("200"), Decimal.RATIO_SCALE);
        assertEquals(new BigDecimal("2.5000"), result);
    }

    @Test
    void testRatio() {
        assertEquals(new BigDecimal("0.6667"), Decimal.ratio(2, 3));
        assertEquals(0, BigDecimal.ZERO.compareTo(Decimal.ratio(5, 0)));
    }

    @Test
    void testMeanAndSum() {
        List<BigDecimal> values = List.of(new BigDecimal("10"), new BigDecimal("20"), new BigDecimal("30"));

        assertEquals(0, new BigDecimal("60").compareTo(Decimal.sum(values)));
        assertEquals(0, new BigDecimal("20").compareTo(Decimal.mean(values)));
        assertEquals(0, BigDecimal.ZERO.compareTo(Decimal.mean(List.of())));
    }

    @Test
    void testStdDev_SampleAndPopulation() {
        List<BigDecimal> values = List.of(new BigDecimal("2"), new BigDecimal("4"), new BigDecimal("4"),
                new BigDecimal("4"), new BigDecimal("5"), new BigDecimal("5"), new BigDecimal("7"), new BigDecimal("9"));

        // 总体标准差为2
        assertEquals(0, new BigDecimal("2").compareTo(Decimal.stdDev(values, false)));

        // 样本标准差 sqrt(32/7) ≈ 2.13808994
        BigDecimal sample = Decimal.stdDev(values, true);
        assertTrue(sample.compareTo(new BigDecimal("2.1380")) > 0);
        assertTrue(sample.compareTo(new BigDecimal("2.1381")) < 0);
    }

    @Test
    void testStdDev_TooFewValues() {
        assertEquals(0, BigDecimal.ZERO.compareTo(Decimal.stdDev(List.of(BigDecimal.ONE), true)));
    }

    @Test
    void testClamp() {
        assertEquals(0, new BigDecimal("100").compareTo(
                Decimal.clamp(new BigDecimal("150"), BigDecimal.ZERO, new BigDecimal("100"))));
        assertEquals(0, BigDecimal.ZERO.compareTo(
                Decimal.clamp(new BigDecimal("-3"), BigDecimal.ZERO, new BigDecimal("100"))));
    }

    @Test
    void testIsDust() {
        assertTrue(Decimal.isDust(new BigDecimal("0.00005")));
        assertFalse(Decimal.isDust(Decimal.DUST));
    }
}
