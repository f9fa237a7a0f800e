package dev.extractioneval.scorer;

/** Individual metric value assigned by a scorer. */
public record Score(
        /** Name of the metric being scored. */
        String name,
        /**
         * Numeric representation of how well the extraction performed.
         *
         * <p>Must be between 0.0 (inclusive) and 1.0 (inclusive)
         */
        double value) {
    public Score {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException(
                    "score must be between 0 and 1: %s : %s".formatted(name, value));
        }
    }
}
