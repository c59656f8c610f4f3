package com.consullo.console.log;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Partition}.
 *
 * @since 1.0
 */
public class PartitionTest {

  @Test
  @DisplayName("Should track cumulative offsets across appends")
  void append_Sizes_OffsetsAreCumulative() {
    final Partition p = partitionOf(3, 0, 5);

    assertThat(p.length()).isEqualTo(3);
    assertThat(p.offsets()).containsExactly(0, 3, 3, 8);
    assertThat(p.get(0)).isEqualTo(3);
    assertThat(p.get(1)).isZero();
    assertThat(p.get(-1)).isEqualTo(5);
    assertThat(p.first(2)).isEqualTo(3);
    assertThat(p.last(2)).isEqualTo(7);
    assertThat(p.total()).isEqualTo(8);
  }

  @Test
  @DisplayName("Should shift later offsets when a chunk is resized")
  void set_GrowAndShrink_ShiftsSuffix() {
    final Partition p = partitionOf(2, 2, 2);

    p.set(1, 5);
    assertThat(p.offsets()).containsExactly(0, 2, 7, 9);

    p.set(-3, 0);
    assertThat(p.offsets()).containsExactly(0, 0, 5, 7);
  }

  @Test
  @DisplayName("Should insert before an existing chunk and restore offsets on delete")
  void insertThenDelete_SameIndex_RestoresOffsets() {
    final Partition p = partitionOf(1, 4, 2);
    final int[] before = p.offsets();

    p.insert(1, 6);
    assertThat(p.offsets()).containsExactly(0, 1, 7, 11, 13);
    assertThat(p.get(1)).isEqualTo(6);

    p.delete(1);
    assertThat(p.offsets()).containsExactly(before);
  }

  @Test
  @DisplayName("Should remove the chunk at the given index")
  void delete_FirstAndLast_RemovesChunk() {
    final Partition p = partitionOf(1, 2, 3, 4);

    p.delete(0);
    assertThat(p.offsets()).containsExactly(0, 2, 5, 9);

    p.delete(-1);
    assertThat(p.offsets()).containsExactly(0, 2, 5);
    assertThat(p.length()).isEqualTo(2);
  }

  @Test
  @DisplayName("Should keep bisect-left semantics for findLoc")
  void findLoc_Positions_BisectLeft() {
    final Partition p = partitionOf(1, 1, 0);

    assertThat(p.findLoc(0)).isZero();
    assertThat(p.findLoc(1)).isEqualTo(1);
    assertThat(p.findLoc(2)).isEqualTo(2);
    assertThat(p.findLoc(3)).isEqualTo(4);
  }

  @Test
  @DisplayName("Should find a chunk containing or ending at every position")
  void chunkAt_RandomHistories_PositionWithinChunkBounds() {
    final Random random = new Random(42);
    for (int round = 0; round < 200; round++) {
      final Partition p = new Partition();
      final int n = 1 + random.nextInt(8);
      for (int i = 0; i < n; i++) {
        p.append(random.nextInt(4));
      }
      for (int pos = 0; pos <= p.total(); pos++) {
        final int i = p.chunkAt(pos);
        assertThat(i).isBetween(0, p.length() - 1);
        assertThat(p.first(i)).isLessThanOrEqualTo(pos);
        assertThat(pos).isLessThanOrEqualTo(p.last(i) + 1);
      }
    }
  }

  @Test
  @DisplayName("Should agree with a naive model after random edits")
  void mutations_RandomSequence_MatchModel() {
    final Random random = new Random(7);
    final Partition p = new Partition();
    final List<Integer> model = new ArrayList<>();

    for (int step = 0; step < 500; step++) {
      final int op = random.nextInt(4);
      final int size = random.nextInt(10);
      if (op == 0 || model.isEmpty()) {
        p.append(size);
        model.add(size);
      } else if (op == 1) {
        final int i = random.nextInt(model.size());
        p.insert(i, size);
        model.add(i, size);
      } else if (op == 2) {
        final int i = random.nextInt(model.size());
        p.set(i, size);
        model.set(i, size);
      } else {
        final int i = random.nextInt(model.size());
        p.delete(i);
        model.remove(i);
      }

      assertThat(p.length()).isEqualTo(model.size());
      int sum = 0;
      for (int i = 0; i < model.size(); i++) {
        assertThat(p.first(i)).isEqualTo(sum);
        sum += model.get(i);
      }
      assertThat(p.total()).isEqualTo(sum);
    }
  }

  @Test
  @DisplayName("Should reject out of range indices and negative sizes")
  void mutations_InvalidArguments_Throw() {
    final Partition p = partitionOf(1, 2);

    assertThatThrownBy(() -> p.get(2)).isInstanceOf(IndexOutOfBoundsException.class)
        .hasMessageContaining("out of range");
    assertThatThrownBy(() -> p.get(-3)).isInstanceOf(IndexOutOfBoundsException.class);
    assertThatThrownBy(() -> p.insert(2, 1)).isInstanceOf(IndexOutOfBoundsException.class);
    assertThatThrownBy(() -> p.append(-1)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> p.chunkAt(4)).isInstanceOf(IndexOutOfBoundsException.class);
    assertThatThrownBy(() -> new Partition().chunkAt(0)).isInstanceOf(IndexOutOfBoundsException.class);
  }

  @Test
  @DisplayName("Should grow past its initial capacity")
  void append_ManyChunks_GrowsStorage() {
    final Partition p = new Partition();
    for (int i = 0; i < 100; i++) {
      p.append(1);
    }
    p.insert(50, 10);

    assertThat(p.length()).isEqualTo(101);
    assertThat(p.total()).isEqualTo(110);
    assertThat(p.first(51)).isEqualTo(60);
  }

  private static Partition partitionOf(final int... sizes) {
    final Partition p = new Partition();
    for (int size : sizes) {
      p.append(size);
    }
    return p;
  }
}
