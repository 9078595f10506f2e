package io.research.vectors.index;

/**
 * Cosine similarity helpers. Accumulates in double precision.
 */
public final class VectorMath {

    private VectorMath() {
    }

    public static double dot(float[] a, float[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            sum += (double) a[i] * b[i];
        }
        return sum;
    }

    public static double norm(float[] v) {
        return Math.sqrt(dot(v, v));
    }

    /**
     * Cosine similarity in [-1, 1]; 0 when either vector has zero length.
     */
    public static double cosine(float[] a, float[] b) {
        return cosine(a, norm(a), b, norm(b));
    }

    static double cosine(float[] a, double normA, float[] b, double normB) {
        if (normA == 0 || normB == 0) return 0;
        double cosine = dot(a, b) / (normA * normB);
        return Math.max(-1.0, Math.min(1.0, cosine));
    }
}
