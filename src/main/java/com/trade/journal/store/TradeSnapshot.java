package com.trade.journal.store;

import com.trade.journal.core.Execution;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 成交存储的不可变快照
 * 一次请求只读取一个快照，不会看到导入到一半的数据
 */
public final class TradeSnapshot {
    private final long version;
    private final List<Execution> executions;
    private final Map<Long, String> strategies;

    public TradeSnapshot(long version, List<Execution> executions, Map<Long, String> strategies) {
        this.version = version;
        this.executions = Collections.unmodifiableList(executions);
        this.strategies = Collections.unmodifiableMap(strategies);
    }

    public long getVersion() { return version; }
    public List<Execution> getExecutions() { return executions; }
    public Map<Long, String> getStrategies() { return strategies; }

    public boolean isEmpty() {
        return executions.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("TradeSnapshot{version=%d, executions=%d, strategies=%d}",
                version, executions.size(), strategies.size());
    }
}
