package courier.retry;

/**
 * How the redelivery delay grows with the attempt number.
 */
public enum BackoffStrategy {
    /** {@code baseDelay * (attempt + 1)}. */
    FIXED,
    /** {@code baseDelay * 2^attempt}. */
    EXPONENTIAL;

    /**
     * Computes the uncapped delay multiplier for a zero-based attempt, saturating at
     * {@link Long#MAX_VALUE} instead of overflowing.
     *
     * @param attempt zero-based attempt that just failed
     * @return the multiplier applied to the base delay
     */
    long multiplier(int attempt) {
        if (attempt < 0) {
            return 0L;
        }
        if (this == FIXED) {
            return attempt + 1L;
        }
        return attempt >= 62 ? Long.MAX_VALUE : 1L << attempt;
    }
}
