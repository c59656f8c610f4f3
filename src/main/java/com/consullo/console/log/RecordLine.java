package com.consullo.console.log;

/**
 * Result of a line or position lookup in a {@link Log}.
 *
 * @param index record index
 * @param record the record
 * @param offset 0-based line (or character) offset within the record
 * @since 1.0
 */
public record RecordLine(int index, LogRecord record, int offset) {
}
