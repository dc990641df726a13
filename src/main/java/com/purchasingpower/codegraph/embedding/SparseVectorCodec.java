package com.purchasingpower.codegraph.embedding;

import com.google.common.base.Preconditions;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts dense embeddings to {@code [index, value]} pairs of their non-zero
 * entries and back. Used only at the persistence boundary.
 */
public final class SparseVectorCodec {

    private SparseVectorCodec() {
    }

    public static List<List<Number>> compress(double[] dense) {
        List<List<Number>> pairs = new ArrayList<>();
        for (int i = 0; i < dense.length; i++) {
            if (dense[i] != 0) {
                pairs.add(List.of(i, dense[i]));
            }
        }
        return pairs;
    }

    /**
     * Restores a zero-initialized vector of {@code size} and scatters the pairs back in.
     *
     * @throws IllegalArgumentException if a pair is malformed or its index is out of range
     */
    public static double[] decompress(List<List<Number>> pairs, int size) {
        double[] dense = new double[size];
        if (pairs == null) {
            return dense;
        }
        for (List<Number> pair : pairs) {
            Preconditions.checkArgument(pair != null && pair.size() == 2, "Malformed sparse entry: %s", pair);
            int index = pair.get(0).intValue();
            Preconditions.checkArgument(index >= 0 && index < size, "Sparse index %s out of range [0, %s)", index, size);
            dense[index] = pair.get(1).doubleValue();
        }
        return dense;
    }
}
