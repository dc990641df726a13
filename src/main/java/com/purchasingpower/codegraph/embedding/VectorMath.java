package com.purchasingpower.codegraph.embedding;

/**
 * Dense vector helpers for TF-IDF embeddings.
 */
public final class VectorMath {

    private VectorMath() {
    }

    /**
     * Cosine of the angle between two vectors. Returns 0 when the lengths
     * differ or either vector has zero magnitude.
     */
    public static double cosineSimilarity(double[] a, double[] b) {
        if (a.length != b.length) {
            return 0;
        }
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        double magnitude = Math.sqrt(normA) * Math.sqrt(normB);
        return magnitude == 0 ? 0 : dot / magnitude;
    }

    /**
     * Scales the vector to unit length in place. A zero vector stays zero.
     */
    public static double[] normalize(double[] vector) {
        double sum = 0;
        for (double value : vector) {
            sum += value * value;
        }
        double magnitude = Math.sqrt(sum);
        if (magnitude > 0) {
            for (int i = 0; i < vector.length; i++) {
                vector[i] /= magnitude;
            }
        }
        return vector;
    }
}
