package com.purchasingpower.codegraph.embedding;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;

@DisplayName("Sparse Vector Codec Tests")
class SparseVectorCodecTest {

    @Test
    @DisplayName("Should keep only non-zero entries as index/value pairs")
    void compressesNonZeroEntries() {
        List<List<Number>> pairs = SparseVectorCodec.compress(new double[]{0, 0.5, 0, 0, 0.25});

        assertThat(pairs).containsExactly(List.of(1, 0.5), List.of(4, 0.25));
        assertArrayEquals(new double[]{0, 0.5, 0, 0, 0.25}, SparseVectorCodec.decompress(pairs, 5));
    }

    @Test
    @DisplayName("A zero vector compresses to nothing and restores to zeros")
    void zeroVector() {
        assertThat(SparseVectorCodec.compress(new double[3])).isEmpty();
        assertArrayEquals(new double[3], SparseVectorCodec.decompress(List.of(), 3));
        assertArrayEquals(new double[3], SparseVectorCodec.decompress(null, 3));
    }

    @Test
    @DisplayName("Out-of-range indexes are rejected")
    void rejectsOutOfRange() {
        assertThatThrownBy(() -> SparseVectorCodec.decompress(List.of(List.of(7, 1.0)), 3))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("out of range");
    }
}
