package com.trade.journal.matching;

import com.trade.journal.core.DateRange;
import com.trade.journal.core.Execution;
import com.trade.journal.core.OptionSymbols;
import com.trade.journal.core.PairingMethod;
import com.trade.journal.core.Side;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 成交配对器
 * 按代码分别维护多头、空头未平仓队列，按时间顺序处理成交：
 * 与反向队列配对（FIFO 取队首，LIFO 取队尾），剩余数量进入同向队列
 *
 * 无状态，可在多个请求间共享
 */
public class LotMatcher {

    private static final Logger logger = LoggerFactory.getLogger(LotMatcher.class);

    static final Comparator<Execution> CHRONOLOGICAL =
            Comparator.comparing(Execution::getTimestamp).thenComparingLong(Execution::getId);

    private final BigDecimal optionMultiplier;

    public LotMatcher(BigDecimal optionMultiplier) {
        this.optionMultiplier = optionMultiplier;
    }

    public MatchResult match(List<Execution> executions, PairingMethod method) {
        return match(executions, method, DateRange.unbounded());
    }

    /**
     * 执行配对
     *
     * @param executions 全部成交（任意代码、任意顺序）
     * @param method     配对方法
     * @param exitRange  按平仓时间过滤回合交易；开仓时间不受限制
     */
    public MatchResult match(List<Execution> executions, PairingMethod method, DateRange exitRange) {
        if (executions.isEmpty()) {
            return MatchResult.empty();
        }

        List<Execution> ordered = new ArrayList<>(executions);
        ordered.sort(CHRONOLOGICAL);

        Map<String, Book> books = new LinkedHashMap<>();
        List<PairedTrade> pairs = new ArrayList<>();

        for (Execution execution : ordered) {
            Book book = books.computeIfAbsent(execution.getSymbol(), s -> new Book());
            Deque<Lot> opposing = execution.getSide() == Side.BUY ? book.shorts : book.longs;
            Lot incoming = new Lot(execution);

            while (!incoming.isExhausted() && !opposing.isEmpty()) {
                Lot resting = method == PairingMethod.FIFO ? opposing.peekFirst() : opposing.peekLast();
                BigDecimal matched = incoming.getRemainingQuantity().min(resting.getRemainingQuantity());

                BigDecimal entryFee = resting.consume(matched);
                BigDecimal exitFee = incoming.consume(matched);
                PairedTrade pair = buildPair(resting.getExecution(), execution, matched, entryFee, exitFee);
                if (exitRange.contains(pair.getExitTimestamp())) {
                    pairs.add(pair);
                }

                if (resting.isExhausted()) {
                    if (method == PairingMethod.FIFO) {
                        opposing.pollFirst();
                    } else {
                        opposing.pollLast();
                    }
                }
            }

            if (!incoming.isExhausted()) {
                Deque<Lot> same = execution.getSide() == Side.BUY ? book.longs : book.shorts;
                same.addLast(incoming);
            }
        }

        List<OpenLot> openLots = new ArrayList<>();
        for (Book book : books.values()) {
            book.longs.forEach(lot -> openLots.add(lot.toOpenLot()));
            book.shorts.forEach(lot -> openLots.add(lot.toOpenLot()));
        }

        logger.debug("配对完成: method={}, 成交={}, 回合={}, 未平仓={}, 区间={}",
                method, executions.size(), pairs.size(), openLots.size(), exitRange);
        return new MatchResult(pairs, openLots);
    }

    private PairedTrade buildPair(Execution entry, Execution exit, BigDecimal quantity,
                                  BigDecimal entryFee, BigDecimal exitFee) {
        Long strategyId = entry.getStrategyId() != null ? entry.getStrategyId() : exit.getStrategyId();
        return new PairedTrade(
                entry.getSymbol(),
                entry.getSide(),
                entry.getId(),
                exit.getId(),
                quantity,
                entry.getPrice(),
                exit.getPrice(),
                entry.getTimestamp(),
                exit.getTimestamp(),
                entryFee,
                exitFee,
                OptionSymbols.multiplier(entry.getSymbol(), optionMultiplier),
                strategyId
        );
    }

    /**
     * 单个代码的未平仓队列
     */
    private static final class Book {
        private final Deque<Lot> longs = new ArrayDeque<>();
        private final Deque<Lot> shorts = new ArrayDeque<>();
    }
}
