package com.consullo.console.transcript;

/**
 * Cursor selection in absolute document positions.
 *
 * @param anchor fixed end of the selection
 * @param position moving end of the selection, where the cursor is
 * @since 1.0
 */
public record Selection(int anchor, int position) {

  public static Selection caret(final int position) {
    return new Selection(position, position);
  }

  public int start() {
    return Math.min(this.anchor, this.position);
  }

  public int end() {
    return Math.max(this.anchor, this.position);
  }

  public boolean isEmpty() {
    return this.anchor == this.position;
  }
}
