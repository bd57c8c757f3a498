package com.jreinhal.tieredrag.util;

import java.util.List;

public final class VectorMath {

    private VectorMath() {
    }

    /**
     * Cosine similarity; 0.0 for empty, mismatched or zero-norm vectors.
     */
    public static double cosine(float[] a, float[] b) {
        if (a == null || b == null || a.length == 0 || a.length != b.length) {
            return 0.0;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * (double) b[i];
            normA += (double) a[i] * (double) a[i];
            normB += (double) b[i] * (double) b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    public static double norm(List<Double> vector) {
        double sum = 0.0;
        for (Double value : vector) {
            sum += value * value;
        }
        return Math.sqrt(sum);
    }

    public static List<Double> toList(float[] vector) {
        Double[] boxed = new Double[vector.length];
        for (int i = 0; i < vector.length; i++) {
            boxed[i] = (double) vector[i];
        }
        return List.of(boxed);
    }

    public static float[] toArray(List<Double> vector) {
        if (vector == null) {
            return new float[0];
        }
        float[] result = new float[vector.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = vector.get(i).floatValue();
        }
        return result;
    }
}
