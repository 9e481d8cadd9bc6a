package com.trade.journal.core;

import java.util.Locale;

/**
 * 配对方法
 * FIFO：优先消耗最早的反向持仓；LIFO：优先消耗最新的反向持仓
 */
public enum PairingMethod {
    FIFO,
    LIFO;

    /**
     * 解析配对方法，大小写不敏感
     *
     * @throws IllegalArgumentException 无法识别的配对方法（不做静默回退）
     */
    public static PairingMethod parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("配对方法为空");
        }
        try {
            return PairingMethod.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("无效的配对方法: " + value + "，仅支持 FIFO / LIFO", e);
        }
    }
}
