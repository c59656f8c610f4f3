package com.consullo.console.log;

import org.apache.commons.lang3.Validate;

/**
 * One domain-tagged unit of transcript content.
 *
 * <p>The prompt is the text rendered next to the record's rows; it carries one line break per row
 * the record occupies.
 *
 * @param domain record domain
 * @param prompt prompt text, may span several lines
 * @param text record content
 * @since 1.0
 */
public record LogRecord(Domain domain, String prompt, String text) {

  public LogRecord {
    Validate.notNull(domain, "domain must not be null");
    Validate.notNull(prompt, "prompt must not be null");
    Validate.notNull(text, "text must not be null");
  }

  /**
   * Returns the number of line breaks in the prompt, i.e. the rows this record claims.
   *
   * @return prompt line count
   */
  public int numLines() {
    int count = 0;
    for (int i = 0; i < this.prompt.length(); i++) {
      if (this.prompt.charAt(i) == '\n') {
        count++;
      }
    }
    return count;
  }

  public LogRecord withText(final String newText) {
    return new LogRecord(this.domain, this.prompt, newText);
  }

  /**
   * Returns prompt line {@code offset}, without its line break.
   *
   * @param offset 0-based line offset within the prompt
   * @return prompt line text
   */
  public String promptLine(final int offset) {
    final String[] lines = this.prompt.split("\n", -1);
    Validate.validIndex(lines, offset, "prompt line %d out of range", offset);
    return lines[offset];
  }
}
