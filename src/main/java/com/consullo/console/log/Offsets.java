package com.consullo.console.log;

/**
 * Read-only view over a {@link Partition}.
 *
 * <p>Rendering collaborators receive this view so they can map rows and character positions back to
 * transcript records without being able to mutate the underlying offsets.
 *
 * @since 1.0
 */
public interface Offsets {

  /**
   * Returns the number of chunks.
   *
   * @return chunk count
   */
  int length();

  /**
   * Returns the size of chunk {@code index}. Negative indices count from the end.
   *
   * @param index chunk index
   * @return chunk size
   * @throws IndexOutOfBoundsException if the index is out of range
   */
  int get(int index);

  /**
   * Returns the leftmost chunk index whose start offset is at or past {@code pos}.
   *
   * <p>The result may equal {@link #length()}. Callers that need the chunk containing a position
   * should use {@link #chunkAt(int)}.
   *
   * @param pos absolute position
   * @return bisect-left index over the start offsets
   */
  int findLoc(int pos);

  /**
   * Returns the chunk that contains {@code pos}: the last chunk whose start is at or before
   * {@code pos}, clamped to the last chunk.
   *
   * @param pos absolute position in {@code [0, total()]}
   * @return chunk index
   * @throws IndexOutOfBoundsException if the partition is empty or {@code pos} is outside the range
   */
  int chunkAt(int pos);

  /**
   * Returns the start offset of chunk {@code index}.
   *
   * @param index chunk index
   * @return start offset
   */
  int first(int index);

  /**
   * Returns the inclusive end offset of chunk {@code index}.
   *
   * @param index chunk index
   * @return inclusive end offset ({@code first(index) - 1} for an empty chunk)
   */
  int last(int index);

  /**
   * Returns the sum of all chunk sizes.
   *
   * @return total size
   */
  int total();
}
