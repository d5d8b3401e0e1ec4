package com.threatflow.assembler.parse;

import com.threatflow.assembler.model.ParsedRecord;

import java.util.Collections;
import java.util.List;

/**
 * Records completed by one {@link IncrementalStreamParser} call plus the buffer state left behind.
 */
public final class ParseResult {
    public final List<ParsedRecord> records;
    public final boolean hasMore;
    public final int bufferSize;

    ParseResult(List<ParsedRecord> records, int bufferSize) {
        this.records = Collections.unmodifiableList(records);
        this.bufferSize = bufferSize;
        this.hasMore = bufferSize > 0;
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
