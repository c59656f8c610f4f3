package com.consullo.console.log;

import java.util.Arrays;
import org.apache.commons.lang3.Validate;

/**
 * Offset-indexed sequence of chunk sizes.
 *
 * <p>Stores cumulative offsets {@code locs} of length {@code n + 1} with {@code locs[0] == 0}; chunk
 * {@code i} spans {@code [locs[i], locs[i + 1])}. Offsets are non-decreasing at all times.
 *
 * <p>Mutations rewrite the suffix of the offset array after the mutation point. Chunk counts track
 * transcript records, not characters, so this stays cheap in practice.
 *
 * @since 1.0
 */
public final class Partition implements Offsets {

  private static final int INITIAL_CAPACITY = 16;

  private int[] locs;
  private int chunks;

  public Partition() {
    this.locs = new int[INITIAL_CAPACITY];
    this.chunks = 0;
  }

  @Override
  public int length() {
    return this.chunks;
  }

  @Override
  public int get(final int index) {
    final int i = checkIndex(index);
    return this.locs[i + 1] - this.locs[i];
  }

  /**
   * Resizes chunk {@code index}, shifting every later offset by the size difference.
   *
   * @param index chunk index (negative counts from the end)
   * @param size new chunk size
   */
  public void set(final int index, final int size) {
    checkSize(size);
    final int i = checkIndex(index);
    shift(i + 1, size - (this.locs[i + 1] - this.locs[i]));
  }

  /**
   * Removes chunk {@code index}, shifting every later offset down by its size.
   *
   * @param index chunk index (negative counts from the end)
   */
  public void delete(final int index) {
    final int i = checkIndex(index);
    final int size = this.locs[i + 1] - this.locs[i];
    System.arraycopy(this.locs, i + 2, this.locs, i + 1, this.chunks - i - 1);
    this.chunks--;
    shift(i + 1, -size);
  }

  /**
   * Inserts a chunk of {@code size} immediately before chunk {@code index}.
   *
   * @param index index of an existing chunk (negative counts from the end)
   * @param size size of the new chunk
   */
  public void insert(final int index, final int size) {
    checkSize(size);
    final int i = checkIndex(index);
    ensureCapacity(this.chunks + 2);
    System.arraycopy(this.locs, i, this.locs, i + 1, this.chunks + 1 - i);
    this.chunks++;
    shift(i + 1, size);
  }

  /**
   * Appends a chunk of {@code size} at the end.
   *
   * @param size chunk size
   */
  public void append(final int size) {
    checkSize(size);
    ensureCapacity(this.chunks + 2);
    this.locs[this.chunks + 1] = this.locs[this.chunks] + size;
    this.chunks++;
  }

  @Override
  public int findLoc(final int pos) {
    int lo = 0;
    int hi = this.chunks + 1;
    while (lo < hi) {
      final int mid = (lo + hi) >>> 1;
      if (this.locs[mid] < pos) {
        lo = mid + 1;
      } else {
        hi = mid;
      }
    }
    return lo;
  }

  @Override
  public int chunkAt(final int pos) {
    if (this.chunks == 0) {
      throw new IndexOutOfBoundsException("position " + pos + " out of range in empty partition");
    }
    if (pos < 0 || pos > total()) {
      throw new IndexOutOfBoundsException(
          "position " + pos + " out of range in partition of total size " + total());
    }
    // bisect-right, then step back to the chunk whose start is <= pos
    int lo = 0;
    int hi = this.chunks + 1;
    while (lo < hi) {
      final int mid = (lo + hi) >>> 1;
      if (this.locs[mid] <= pos) {
        lo = mid + 1;
      } else {
        hi = mid;
      }
    }
    return Math.min(lo - 1, this.chunks - 1);
  }

  @Override
  public int first(final int index) {
    return this.locs[checkIndex(index)];
  }

  @Override
  public int last(final int index) {
    return this.locs[checkIndex(index) + 1] - 1;
  }

  @Override
  public int total() {
    return this.locs[this.chunks];
  }

  /**
   * Returns a copy of the cumulative offsets, {@code length() + 1} entries.
   *
   * @return offsets copy
   */
  public int[] offsets() {
    return Arrays.copyOf(this.locs, this.chunks + 1);
  }

  @Override
  public String toString() {
    return "Partition" + Arrays.toString(offsets());
  }

  private int checkIndex(final int index) {
    if (index < -this.chunks || index >= this.chunks) {
      throw new IndexOutOfBoundsException(
          "index " + index + " out of range in partition of size " + this.chunks);
    }
    return index < 0 ? index + this.chunks : index;
  }

  private static void checkSize(final int size) {
    Validate.isTrue(size >= 0, "chunk size must not be negative: %d", size);
  }

  private void shift(final int start, final int delta) {
    if (delta == 0) {
      return;
    }
    for (int i = start; i <= this.chunks; i++) {
      this.locs[i] += delta;
    }
  }

  private void ensureCapacity(final int required) {
    if (required > this.locs.length) {
      this.locs = Arrays.copyOf(this.locs, Math.max(required, this.locs.length * 2));
    }
  }
}
