package io.research.vectors;

/**
 * Maps a raw cosine similarity in [-1, 1] to a result score in [0, 1].
 */
public enum ScoreMapping {

    /** Negative similarity counts as 0. */
    CLAMPED_COSINE {
        @Override
        public double toScore(double cosine) {
            return clamp(cosine);
        }
    },

    /** Linear shift of the whole cosine range: {@code (cos + 1) / 2}. */
    SHIFTED_COSINE {
        @Override
        public double toScore(double cosine) {
            return clamp((cosine + 1.0) / 2.0);
        }
    };

    public abstract double toScore(double cosine);

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
