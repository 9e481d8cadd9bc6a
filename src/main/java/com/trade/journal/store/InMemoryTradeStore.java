package com.trade.journal.store;

import com.trade.journal.core.Execution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 内存成交存储
 * 读写锁保护：快照在读锁下复制，写操作持有写锁并递增版本号
 *
 * 写操作先构造新状态并交给 {@link #persist(TradeSnapshot)}，成功后才替换当前状态；
 * 持久化失败时内存保持原样
 */
public class InMemoryTradeStore implements TradeStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryTradeStore.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private List<Execution> executions = new ArrayList<>();
    private Map<Long, String> strategies = new LinkedHashMap<>();
    private Set<String> duplicateKeys = new HashSet<>();
    private long nextId = 1;
    private long version = 0;

    @Override
    public TradeSnapshot snapshot() {
        lock.readLock().lock();
        try {
            return new TradeSnapshot(version, new ArrayList<>(executions), new LinkedHashMap<>(strategies));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Execution> addExecutions(List<Execution> candidates) {
        lock.writeLock().lock();
        try {
            List<Execution> updated = new ArrayList<>(executions);
            Set<String> updatedKeys = new HashSet<>(duplicateKeys);
            long id = nextId;
            List<Execution> added = new ArrayList<>();
            for (Execution candidate : candidates) {
                if (!updatedKeys.add(candidate.getDuplicateKey())) {
                    logger.debug("跳过重复成交: {}", candidate);
                    continue;
                }
                Execution stored = candidate.withId(id++);
                updated.add(stored);
                added.add(stored);
            }
            if (!added.isEmpty()) {
                commit(updated, strategies, updatedKeys, id);
            }
            logger.info("导入成交: 新增={}, 重复跳过={}, version={}",
                    added.size(), candidates.size() - added.size(), version);
            return added;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int clearAll() {
        lock.writeLock().lock();
        try {
            int removed = executions.size();
            commit(new ArrayList<>(), strategies, new HashSet<>(), nextId);
            logger.info("已清空全部成交: 删除={}, version={}", removed, version);
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void saveStrategy(long strategyId, String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("策略名称为空: " + strategyId);
        }
        lock.writeLock().lock();
        try {
            Map<Long, String> updated = new LinkedHashMap<>(strategies);
            updated.put(strategyId, name.trim());
            commit(executions, updated, duplicateKeys, nextId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Execution assignStrategy(long executionId, Long strategyId) {
        lock.writeLock().lock();
        try {
            for (int i = 0; i < executions.size(); i++) {
                Execution current = executions.get(i);
                if (current.getId() == executionId) {
                    Execution reassigned = current.withStrategyId(strategyId);
                    List<Execution> updated = new ArrayList<>(executions);
                    updated.set(i, reassigned);
                    commit(updated, strategies, duplicateKeys, nextId);
                    logger.info("成交 #{} 归属策略 {}", executionId, strategyId);
                    return reassigned;
                }
            }
            throw new IllegalArgumentException("成交不存在: " + executionId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 写锁内调用，参数为即将生效的新状态；抛出异常则本次写操作不生效
     */
    protected void persist(TradeSnapshot candidate) {
    }

    /**
     * 用已持久化的数据恢复状态
     */
    protected void restore(List<Execution> restoredExecutions, Map<Long, String> restoredStrategies, long restoredVersion) {
        lock.writeLock().lock();
        try {
            executions = new ArrayList<>(restoredExecutions);
            strategies = new LinkedHashMap<>(restoredStrategies);
            duplicateKeys = new HashSet<>();
            for (Execution execution : restoredExecutions) {
                duplicateKeys.add(execution.getDuplicateKey());
            }
            nextId = restoredExecutions.stream().mapToLong(Execution::getId).max().orElse(0) + 1;
            version = restoredVersion;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void commit(List<Execution> newExecutions, Map<Long, String> newStrategies,
                        Set<String> newKeys, long newNextId) {
        long newVersion = version + 1;
        persist(new TradeSnapshot(newVersion, newExecutions, newStrategies));
        executions = newExecutions;
        strategies = newStrategies;
        duplicateKeys = newKeys;
        nextId = newNextId;
        version = newVersion;
    }
}
