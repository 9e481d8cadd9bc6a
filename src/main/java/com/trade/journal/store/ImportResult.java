package com.trade.journal.store;

import java.util.Collections;
import java.util.List;

/**
 * CSV 导入结果
 */
public final class ImportResult {
    private final int imported;             // 新增成交数
    private final int skipped;              // 跳过数（重复、已撤单、未成交）
    private final List<String> errors;      // 校验失败的行，格式 "line N: 原因"

    public ImportResult(int imported, int skipped, List<String> errors) {
        this.imported = imported;
        this.skipped = skipped;
        this.errors = Collections.unmodifiableList(errors);
    }

    public int getImported() { return imported; }
    public int getSkipped() { return skipped; }
    public List<String> getErrors() { return errors; }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("ImportResult{imported=%d, skipped=%d, errors=%d}", imported, skipped, errors.size());
    }
}
