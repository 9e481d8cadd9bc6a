package com.trade.journal.store;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.journal.core.Execution;
import com.trade.journal.core.JsonMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON 文件持久化的成交存储
 * 每次写操作生效前整体落盘（先写临时文件再替换），落盘失败则写操作不生效
 */
public class FileTradeStore extends InMemoryTradeStore {

    private static final Logger logger = LoggerFactory.getLogger(FileTradeStore.class);

    private final Path file;
    private final ObjectMapper objectMapper;

    public FileTradeStore(Path file) {
        this.file = file;
        this.objectMapper = JsonMappers.create();

        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new TradeStoreException("无法创建数据目录: " + file, e);
        }

        if (Files.exists(file)) {
            load();
        }
    }

    private void load() {
        try {
            StoredJournal stored = objectMapper.readValue(file.toFile(), StoredJournal.class);
            restore(stored.executions, stored.strategies, stored.version);
            logger.info("已加载成交存储: {} (成交={}, 策略={})",
                    file, stored.executions.size(), stored.strategies.size());
        } catch (IOException e) {
            throw new TradeStoreException("读取成交存储失败: " + file, e);
        }
    }

    @Override
    protected void persist(TradeSnapshot candidate) {
        StoredJournal stored = new StoredJournal(candidate.getVersion(),
                candidate.getExecutions(), candidate.getStrategies());
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), stored);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new TradeStoreException("保存成交存储失败: " + file, e);
        }
    }

    public Path getFile() {
        return file;
    }

    /**
     * 落盘格式
     */
    static final class StoredJournal {
        @JsonProperty
        final long version;
        @JsonProperty
        final List<Execution> executions;
        @JsonProperty
        final Map<Long, String> strategies;

        @JsonCreator
        StoredJournal(@JsonProperty("version") long version,
                      @JsonProperty("executions") List<Execution> executions,
                      @JsonProperty("strategies") Map<Long, String> strategies) {
            this.version = version;
            this.executions = executions == null ? List.of() : executions;
            this.strategies = strategies == null ? new LinkedHashMap<>() : strategies;
        }
    }
}
