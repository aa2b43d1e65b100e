package app.lexrecall.core.review.algorithm;

/**
 * What a failed review (adjusted quality below 3) does to the ease factor.
 * <p>
 * {@link #KEEP} is the default: the streak and interval reset, the ease factor stays where it was.
 * {@link #DECREASE} follows classical SM-2 and feeds the failing quality through the ease formula too,
 * still floored at 1.3.
 */
public enum FailureEasePolicy {
    KEEP,
    DECREASE;

    public static final FailureEasePolicy DEFAULT = KEEP;
}
