package com.entity.reconciliation.source;

import com.entity.reconciliation.core.model.SourceRecord;

import java.util.List;

/**
 * Outcome of reading a source extract.
 *
 * @param records parsed records, in input order
 * @param errors  lines that could not be parsed
 */
public record ReadResult(List<SourceRecord> records, List<ReadError> errors) {

    public ReadResult {
        records = records != null ? List.copyOf(records) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * @param lineNumber the line number in the input (1-based, 0 for stream-level errors)
     * @param message    the error message
     */
    public record ReadError(long lineNumber, String message) {}

    @Override
    public String toString() {
        return "ReadResult{records=" + records.size() + ", errors=" + errors.size() + '}';
    }
}
