package com.consullo.console.transcript;

import com.consullo.console.log.Domain;
import com.consullo.console.log.Log;
import com.consullo.console.log.LogRecord;
import com.consullo.console.log.Offsets;
import com.consullo.console.log.RecordLine;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transcript document with an editable tail.
 *
 * <p>The document text is exactly the concatenation of the record texts held by the {@link Log},
 * so record {@code i} starts at {@code positions().first(i)}. Everything before {@code promptPos}
 * is finalized history. While an input record is open it is always the last record, it spans
 * {@code [promptPos, promptEnd]}, and it is the only text that edits may touch: selections are
 * clamped into that range before every edit.
 *
 * <p>Records always start on a fresh row. Before a record is placed after one whose text does not
 * end with a line break, that record is replaced with a newline-terminated copy (its row count is
 * unchanged).
 *
 * <p>Not thread-safe: owned by the foreground thread.
 *
 * @since 1.0
 */
public final class Transcript {

  private static final Logger LOGGER = LoggerFactory.getLogger(Transcript.class);

  private final Log log = new Log();
  private final StringBuilder document = new StringBuilder();
  private final List<TranscriptListener> listeners = new CopyOnWriteArrayList<>();
  private final String tab;
  private final String continuationPrompt;

  private int promptPos;
  private int inputIndex = -1;
  private String inputPrompt = "";
  private int anchor;
  private int position;

  /**
   * Creates an empty transcript.
   *
   * @param tabWidth spaces per indentation block
   * @param continuationPrompt prompt shown on every input line after the first
   */
  public Transcript(final int tabWidth, final String continuationPrompt) {
    Validate.isTrue(tabWidth > 0, "tabWidth must be positive");
    Validate.notNull(continuationPrompt, "continuationPrompt must not be null");
    Validate.isTrue(continuationPrompt.indexOf('\n') < 0, "continuationPrompt must be a single line");
    this.tab = StringUtils.repeat(' ', tabWidth);
    this.continuationPrompt = continuationPrompt;
  }

  public void addListener(final TranscriptListener listener) {
    Validate.notNull(listener, "listener must not be null");
    this.listeners.add(listener);
  }

  public void removeListener(final TranscriptListener listener) {
    this.listeners.remove(listener);
  }

  // ---------------------------------------------------------------------------------------------
  // history

  /**
   * Adds a finalized record. With no open input the record goes to the end and {@code promptPos}
   * moves past it; with an open input it is inserted right before the input record, made
   * newline-terminated, and the editable region shifts along.
   *
   * @param domain record domain
   * @param prompt prompt text, one line break per row
   * @param text record content
   * @return index of the new record
   */
  public int append(final Domain domain, final String prompt, final String text) {
    LogRecord record = new LogRecord(domain, prompt, text);

    if (this.inputIndex < 0) {
      terminateRecordBefore(this.log.size());
      final int index = this.log.size();
      this.log.append(record);
      this.document.append(text);
      this.promptPos = this.document.length();
      this.anchor = this.promptPos;
      this.position = this.promptPos;
      fireAdded(index, record);
      return index;
    }

    if (!text.endsWith("\n")) {
      record = record.withText(text + "\n");
    }
    terminateRecordBefore(this.inputIndex);
    final int index = this.inputIndex;
    final int at = this.log.positions().first(index);
    this.log.insert(index, record);
    this.document.insert(at, record.text());
    this.inputIndex++;
    shiftEditableRegion(record.text().length());
    fireAdded(index, record);
    return index;
  }

  /**
   * Deletes every finalized record, keeping the open input if there is one.
   *
   * @return number of records removed
   */
  public int clearHistory() {
    final int count = this.inputIndex >= 0 ? this.inputIndex : this.log.size();
    if (count == 0) {
      return 0;
    }
    final int cut = count < this.log.size() ? this.log.positions().first(count) : this.document.length();
    for (int i = 0; i < count; i++) {
      this.log.delete(0);
    }
    this.document.delete(0, cut);
    if (this.inputIndex >= 0) {
      this.inputIndex -= count;
    }
    shiftEditableRegion(-cut);
    LOGGER.debug("Cleared {} records ({} chars)", count, cut);
    for (TranscriptListener listener : this.listeners) {
      listener.onRecordsRemoved(0, count);
    }
    return count;
  }

  // ---------------------------------------------------------------------------------------------
  // editable region

  /**
   * Opens an empty editable input record at the end of the transcript.
   *
   * @param prompt first-line prompt, e.g. {@code "IN [0]: "}
   */
  public void openInput(final String prompt) {
    Validate.notNull(prompt, "prompt must not be null");
    Validate.isTrue(prompt.indexOf('\n') < 0, "prompt must be a single line");
    Validate.validState(this.inputIndex < 0, "an input record is already open");
    this.inputPrompt = prompt;
    this.inputIndex = append(Domain.INPUT, prompt + "\n", "");
  }

  /**
   * Changes the first-line prompt of the open input record, keeping its text.
   *
   * @param prompt new first-line prompt
   */
  public void setInputPrompt(final String prompt) {
    Validate.notNull(prompt, "prompt must not be null");
    Validate.isTrue(prompt.indexOf('\n') < 0, "prompt must be a single line");
    requireInput();
    this.inputPrompt = prompt;
    syncInputRecord();
  }

  /**
   * Finalizes the open input record; its text, plus a terminating line break, becomes history.
   *
   * @return the submitted input text
   */
  public String closeInput() {
    requireInput();
    final String text = inputBuffer();
    // the input's last row is never terminated while editing
    final LogRecord closed = this.log.get(this.inputIndex).withText(text + "\n");
    this.log.set(this.inputIndex, closed);
    this.document.append('\n');
    for (TranscriptListener listener : this.listeners) {
      listener.onRecordChanged(this.inputIndex, closed);
    }
    this.inputIndex = -1;
    this.promptPos = this.document.length();
    this.anchor = this.promptPos;
    this.position = this.promptPos;
    return text;
  }

  public boolean isInputOpen() {
    return this.inputIndex >= 0;
  }

  public String inputBuffer() {
    return this.document.substring(this.promptPos);
  }

  public void clearInputBuffer() {
    requireInput();
    this.anchor = this.promptPos;
    this.position = this.document.length();
    deleteSelection();
    syncInputRecord();
  }

  /**
   * Replaces the selection (or inserts at the cursor) with {@code text}. The selection is clamped
   * into the editable region first.
   *
   * @param text text to insert
   */
  public void insertInputText(final String text) {
    Validate.notNull(text, "text must not be null");
    requireInput();
    clampSelection();
    deleteSelection();
    this.document.insert(this.position, text);
    this.position += text.length();
    this.anchor = this.position;
    syncInputRecord();
  }

  /**
   * Removes the selected input text, if any.
   *
   * @return true if text was removed
   */
  public boolean removeSelectedInput() {
    requireInput();
    clampSelection();
    if (!deleteSelection()) {
      return false;
    }
    syncInputRecord();
    return true;
  }

  /**
   * Deletes backwards: the selection if there is one, else a whole indentation block when the
   * cursor sits on a block boundary after one, else a single character.
   *
   * @return true if text was removed
   */
  public boolean backspace() {
    requireInput();
    clampSelection();
    if (this.anchor == this.position && cursorOffset() >= 1) {
      final String left = lineUntilCursor();
      final boolean onTabStop = left.length() % this.tab.length() == 0 && left.endsWith(this.tab);
      this.anchor = this.position - (onTabStop ? this.tab.length() : 1);
    }
    if (!deleteSelection()) {
      return false;
    }
    syncInputRecord();
    return true;
  }

  /**
   * Deletes forwards, mirroring {@link #backspace()}.
   *
   * @return true if text was removed
   */
  public boolean deleteForward() {
    requireInput();
    clampSelection();
    if (this.anchor == this.position && this.position < this.document.length()) {
      final String left = lineUntilCursor();
      final String right = lineAfterCursor();
      final boolean onTabStop = left.length() % this.tab.length() == 0 && right.startsWith(this.tab);
      this.anchor = this.position + (onTabStop ? this.tab.length() : 1);
    }
    if (!deleteSelection()) {
      return false;
    }
    syncInputRecord();
    return true;
  }

  /**
   * Indents the selected lines, or pads the cursor to the next tab stop when nothing is selected.
   */
  public void insertTab() {
    requireInput();
    clampSelection();
    if (this.anchor != this.position) {
      indentSelection(true);
      return;
    }
    final int width = this.tab.length();
    insertInputText(this.tab.substring(0, width - lineUntilCursor().length() % width));
  }

  /**
   * Indents or outdents every line touched by the selection by exactly one block. Relative
   * indentation inside a line is preserved; lines are not snapped to tab stops. The selection
   * keeps covering the same text.
   *
   * @param indent true to indent, false to outdent
   */
  public void indentSelection(final boolean indent) {
    requireInput();
    clampSelection();
    final String buffer = inputBuffer();
    final boolean forward = this.anchor <= this.position;
    int pos0 = Math.min(this.anchor, this.position) - this.promptPos;
    int pos1 = Math.max(this.anchor, this.position) - this.promptPos;
    final int line0 = StringUtils.countMatches(buffer.substring(0, pos0), '\n');
    final int line1 = StringUtils.countMatches(buffer.substring(0, pos1), '\n');

    final String[] lines = buffer.split("\n", -1);
    for (int i = line0; i <= line1; i++) {
      final String line = lines[i];
      if (indent) {
        lines[i] = this.tab + line;
      } else {
        final int cut = Math.min(this.tab.length(), line.length());
        lines[i] = StringUtils.stripStart(line.substring(0, cut), null) + line.substring(cut);
      }
      final int delta = lines[i].length() - line.length();
      if (i == line0) {
        pos0 += delta;
      }
      pos1 += delta;
    }

    // an outdent can pull an endpoint left of its own line start
    pos0 = Math.max(pos0, lineStart(lines, line0));
    pos1 = Math.max(pos1, Math.max(pos0, lineStart(lines, line1)));

    this.document.replace(this.promptPos, this.document.length(), String.join("\n", lines));
    final int start = this.promptPos + pos0;
    final int end = this.promptPos + pos1;
    this.anchor = forward ? start : end;
    this.position = forward ? end : start;
    syncInputRecord();
  }

  /**
   * Sets the selection, clamping both ends into the editable region.
   *
   * @param newAnchor anchor position
   * @param newPosition cursor position
   */
  public void setSelection(final int newAnchor, final int newPosition) {
    this.anchor = newAnchor;
    this.position = newPosition;
    clampSelection();
  }

  /**
   * Moves the cursor, optionally extending the selection, clamped into the editable region.
   *
   * @param newPosition target position
   * @param keepAnchor true to extend the selection
   */
  public void moveCursor(final int newPosition, final boolean keepAnchor) {
    this.position = newPosition;
    if (!keepAnchor) {
      this.anchor = newPosition;
    }
    clampSelection();
  }

  public Selection selection() {
    return new Selection(this.anchor, this.position);
  }

  public int cursorOffset() {
    return this.position - this.promptPos;
  }

  public int promptPos() {
    return this.promptPos;
  }

  public int promptEnd() {
    return this.document.length();
  }

  // ---------------------------------------------------------------------------------------------
  // queries

  public String text() {
    return this.document.toString();
  }

  public int size() {
    return this.log.size();
  }

  public LogRecord record(final int index) {
    return this.log.get(index);
  }

  public Optional<LogRecord> lastRecord() {
    return this.log.isEmpty() ? Optional.empty() : Optional.of(this.log.last());
  }

  /**
   * Returns the last record before the open input, or the last record when no input is open.
   *
   * @return last finalized record, if any
   */
  public Optional<LogRecord> lastFinalizedRecord() {
    final int count = this.inputIndex >= 0 ? this.inputIndex : this.log.size();
    return count == 0 ? Optional.empty() : Optional.of(this.log.get(count - 1));
  }

  public List<LogRecord> records() {
    return this.log.records();
  }

  public Offsets linenos() {
    return this.log.linenos();
  }

  public Offsets positions() {
    return this.log.positions();
  }

  public RecordLine findRecordForLine(final int line) {
    return this.log.findRecordForLine(line);
  }

  /**
   * Returns the prompt text rendered next to row {@code line}.
   *
   * @param line 0-based row
   * @return prompt text for that row
   */
  public String promptText(final int line) {
    final RecordLine found = this.log.findRecordForLine(line);
    return found.record().promptLine(found.offset());
  }

  // ---------------------------------------------------------------------------------------------

  private void requireInput() {
    Validate.validState(this.inputIndex >= 0, "no input record is open");
  }

  private void clampSelection() {
    final int end = this.document.length();
    this.anchor = Math.max(Math.min(this.anchor, end), this.promptPos);
    this.position = Math.max(Math.min(this.position, end), this.promptPos);
  }

  private boolean deleteSelection() {
    final int start = Math.min(this.anchor, this.position);
    final int end = Math.max(this.anchor, this.position);
    if (start == end) {
      return false;
    }
    this.document.delete(start, end);
    this.anchor = start;
    this.position = start;
    return true;
  }

  private void syncInputRecord() {
    final String text = inputBuffer();
    final StringBuilder prompt = new StringBuilder(this.inputPrompt).append('\n');
    final int continuations = StringUtils.countMatches(text, '\n');
    for (int i = 0; i < continuations; i++) {
      prompt.append(this.continuationPrompt).append('\n');
    }
    final LogRecord updated = new LogRecord(Domain.INPUT, prompt.toString(), text);
    this.log.set(this.inputIndex, updated);
    for (TranscriptListener listener : this.listeners) {
      listener.onRecordChanged(this.inputIndex, updated);
    }
  }

  private void terminateRecordBefore(final int index) {
    if (index == 0) {
      return;
    }
    final int previous = index - 1;
    final LogRecord record = this.log.get(previous);
    if (record.text().endsWith("\n")) {
      return;
    }
    final int end = this.log.positions().first(previous) + record.text().length();
    final LogRecord terminated = record.withText(record.text() + "\n");
    this.log.set(previous, terminated);
    this.document.insert(end, '\n');
    if (this.inputIndex >= 0) {
      shiftEditableRegion(1);
    }
    for (TranscriptListener listener : this.listeners) {
      listener.onRecordChanged(previous, terminated);
    }
  }

  private void shiftEditableRegion(final int delta) {
    this.promptPos += delta;
    this.anchor += delta;
    this.position += delta;
  }

  private void fireAdded(final int index, final LogRecord record) {
    for (TranscriptListener listener : this.listeners) {
      listener.onRecordAdded(index, record);
    }
  }

  private String lineUntilCursor() {
    final String before = this.document.substring(this.promptPos, this.position);
    return before.substring(before.lastIndexOf('\n') + 1);
  }

  private String lineAfterCursor() {
    final String after = this.document.substring(this.position);
    final int lineBreak = after.indexOf('\n');
    return lineBreak < 0 ? after : after.substring(0, lineBreak);
  }

  private static int lineStart(final String[] lines, final int line) {
    int offset = 0;
    for (int i = 0; i < line; i++) {
      offset += lines[i].length() + 1;
    }
    return offset;
  }
}
