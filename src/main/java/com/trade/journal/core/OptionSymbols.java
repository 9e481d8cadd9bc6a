package com.trade.journal.core;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 期权代码识别
 * 形如 SPY251218C00679000：标的 + 到期日(YYMMDD) + C/P + 行权价
 */
public final class OptionSymbols {

    private static final Pattern EXPIRY_DIGITS = Pattern.compile("\\d{6}");

    private OptionSymbols() {}

    public static boolean isOption(String symbol) {
        if (symbol == null || symbol.length() < 10) {
            return false;
        }
        String upper = symbol.toUpperCase(Locale.ROOT);
        if (upper.indexOf('C') < 0 && upper.indexOf('P') < 0) {
            return false;
        }
        return EXPIRY_DIGITS.matcher(upper).find() || upper.length() > 15;
    }

    /**
     * 标的代码：第一个数字之前的部分；非期权原样返回
     */
    public static String underlying(String symbol) {
        if (!isOption(symbol)) {
            return symbol;
        }
        for (int i = 0; i < symbol.length(); i++) {
            if (Character.isDigit(symbol.charAt(i))) {
                return i == 0 ? symbol : symbol.substring(0, i);
            }
        }
        return symbol;
    }

    /**
     * 合约乘数：期权使用配置值，其余为1
     */
    public static BigDecimal multiplier(String symbol, BigDecimal optionMultiplier) {
        return isOption(symbol) ? optionMultiplier : BigDecimal.ONE;
    }
}
