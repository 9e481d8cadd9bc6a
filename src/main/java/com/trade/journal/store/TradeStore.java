package com.trade.journal.store;

import com.trade.journal.core.Execution;

import java.util.List;

/**
 * 成交存储接口
 * 读操作返回快照；写操作（导入、清空、策略变更）互斥执行
 */
public interface TradeStore {

    /**
     * 获取当前快照
     */
    TradeSnapshot snapshot();

    /**
     * 批量新增成交，原子执行
     * 与已有成交（或本批次之前的行）重复的记录被跳过，ID 由存储分配
     *
     * @return 实际新增的成交
     */
    List<Execution> addExecutions(List<Execution> executions);

    /**
     * 删除全部成交
     *
     * @return 删除的数量
     */
    int clearAll();

    /**
     * 新增或重命名策略
     */
    void saveStrategy(long strategyId, String name);

    /**
     * 将成交归属到策略（null 表示取消归属）
     *
     * @throws IllegalArgumentException 成交不存在
     */
    Execution assignStrategy(long executionId, Long strategyId);
}
