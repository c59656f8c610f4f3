package com.consullo.console.log;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * Ordered transcript records kept in lockstep with two {@link Partition}s.
 *
 * <p>{@code linenos} holds each record's row count ({@link LogRecord#numLines()}) and
 * {@code positions} holds each record's text length. Every mutation validates its arguments before
 * touching any container, so the three always change together.
 *
 * <p>Not thread-safe: the transcript is owned by the foreground thread.
 *
 * @since 1.0
 */
public final class Log {

  private final List<LogRecord> records = new ArrayList<>();
  private final Partition linenos = new Partition();
  private final Partition positions = new Partition();

  public int size() {
    return this.records.size();
  }

  public boolean isEmpty() {
    return this.records.isEmpty();
  }

  public LogRecord get(final int index) {
    return this.records.get(normalize(index));
  }

  /**
   * Returns the last record.
   *
   * @return last record
   * @throws IndexOutOfBoundsException if the log is empty
   */
  public LogRecord last() {
    return get(-1);
  }

  public void append(final LogRecord record) {
    Validate.notNull(record, "record must not be null");
    this.records.add(record);
    this.linenos.append(record.numLines());
    this.positions.append(record.text().length());
    checkInSync();
  }

  public void insert(final int index, final LogRecord record) {
    Validate.notNull(record, "record must not be null");
    final int i = normalize(index);
    this.records.add(i, record);
    this.linenos.insert(i, record.numLines());
    this.positions.insert(i, record.text().length());
    checkInSync();
  }

  /**
   * Replaces record {@code index}.
   *
   * @param index record index (negative counts from the end)
   * @param record replacement
   * @return the replaced record
   */
  public LogRecord set(final int index, final LogRecord record) {
    Validate.notNull(record, "record must not be null");
    final int i = normalize(index);
    final LogRecord previous = this.records.set(i, record);
    this.linenos.set(i, record.numLines());
    this.positions.set(i, record.text().length());
    checkInSync();
    return previous;
  }

  public LogRecord delete(final int index) {
    final int i = normalize(index);
    final LogRecord removed = this.records.remove(i);
    this.linenos.delete(i);
    this.positions.delete(i);
    checkInSync();
    return removed;
  }

  /**
   * Locates the record whose prompt spans rendered line {@code line}.
   *
   * @param line 0-based rendered line number
   * @return record, its index and the line offset within its prompt
   * @throws IndexOutOfBoundsException if no record spans the line
   */
  public RecordLine findRecordForLine(final int line) {
    if (line < 0 || line >= this.linenos.total()) {
      throw new IndexOutOfBoundsException(
          "line " + line + " out of range in log of " + this.linenos.total() + " lines");
    }
    final int index = this.linenos.chunkAt(line);
    return new RecordLine(index, this.records.get(index), line - this.linenos.first(index));
  }

  /**
   * Locates the record whose text contains character position {@code pos}.
   *
   * @param pos absolute character position in {@code [0, totalLength()]}
   * @return record, its index and the character offset within its text
   */
  public RecordLine findRecordAtPosition(final int pos) {
    final int index = this.positions.chunkAt(pos);
    return new RecordLine(index, this.records.get(index), pos - this.positions.first(index));
  }

  public Offsets linenos() {
    return this.linenos;
  }

  public Offsets positions() {
    return this.positions;
  }

  public int totalLines() {
    return this.linenos.total();
  }

  public int totalLength() {
    return this.positions.total();
  }

  public List<LogRecord> records() {
    return Collections.unmodifiableList(this.records);
  }

  private int normalize(final int index) {
    final int size = this.records.size();
    if (index < -size || index >= size) {
      throw new IndexOutOfBoundsException(
          "index " + index + " out of range in log of size " + size);
    }
    return index < 0 ? index + size : index;
  }

  private void checkInSync() {
    Validate.validState(
        this.records.size() == this.linenos.length() && this.records.size() == this.positions.length(),
        "log desynchronized: %d records, %d line chunks, %d position chunks",
        this.records.size(), this.linenos.length(), this.positions.length());
  }
}
