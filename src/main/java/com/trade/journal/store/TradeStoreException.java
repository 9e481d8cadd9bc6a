package com.trade.journal.store;

/**
 * 存储读写失败
 */
public class TradeStoreException extends RuntimeException {

    public TradeStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
