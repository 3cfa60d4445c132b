package com.memoryvault.infrastructure.voice;

import java.nio.ByteBuffer;

/**
 * Vector helpers for speaker embeddings.
 */
public final class Embeddings {

    private Embeddings() {
    }

    /**
     * Cosine similarity clamped to {@code [0, 1]}. Zero vectors score 0.
     *
     * @throws IllegalArgumentException if the lengths differ
     */
    public static double cosine(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                "Embedding dimensions differ: " + a.length + " vs " + b.length);
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        double similarity = dot / Math.sqrt(normA * normB);
        return Math.max(0.0, Math.min(1.0, similarity));
    }

    /**
     * Element-wise mean. A single vector is returned as an exact copy.
     */
    public static double[] average(double[][] vectors) {
        if (vectors.length == 0) {
            throw new IllegalArgumentException("At least one embedding is required");
        }
        if (vectors.length == 1) {
            return vectors[0].clone();
        }
        int dimensions = vectors[0].length;
        double[] centroid = new double[dimensions];
        for (double[] vector : vectors) {
            if (vector.length != dimensions) {
                throw new IllegalArgumentException("Embedding dimensions differ");
            }
            for (int i = 0; i < dimensions; i++) {
                centroid[i] += vector[i];
            }
        }
        for (int i = 0; i < dimensions; i++) {
            centroid[i] /= vectors.length;
        }
        return centroid;
    }

    public static byte[] toBytes(double[] vector) {
        ByteBuffer buffer = ByteBuffer.allocate(vector.length * Double.BYTES);
        for (double value : vector) {
            buffer.putDouble(value);
        }
        return buffer.array();
    }

    public static double[] fromBytes(byte[] bytes) {
        if (bytes.length % Double.BYTES != 0) {
            throw new IllegalArgumentException("Embedding byte length is not a multiple of " + Double.BYTES);
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        double[] vector = new double[bytes.length / Double.BYTES];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = buffer.getDouble();
        }
        return vector;
    }
}
