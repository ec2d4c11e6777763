package com.verity.dataquality.runtime.operators;

/**
 * A {@link CharSequence} view that fails once more than a fixed number of
 * characters have been read from it.
 *
 * <p>{@link java.util.regex.Matcher} reads its input exclusively through
 * {@link #charAt(int)}, so the read count is a faithful proxy for matching
 * work, and a backtracking pattern is interrupted deterministically instead
 * of running unbounded.
 */
final class BoundedCharSequence implements CharSequence {

    private final CharSequence delegate;
    private final Budget budget;

    BoundedCharSequence(CharSequence delegate, long maxReads) {
        this(delegate, new Budget(maxReads));
    }

    private BoundedCharSequence(CharSequence delegate, Budget budget) {
        this.delegate = delegate;
        this.budget = budget;
    }

    @Override
    public char charAt(int index) {
        if (++budget.reads > budget.limit) {
            throw new StepLimitExceededException(budget.limit);
        }
        return delegate.charAt(index);
    }

    @Override
    public int length() {
        return delegate.length();
    }

    @Override
    public CharSequence subSequence(int start, int end) {
        return new BoundedCharSequence(delegate.subSequence(start, end), budget);
    }

    @Override
    public String toString() {
        return delegate.toString();
    }

    private static final class Budget {
        private final long limit;
        private long reads;

        Budget(long limit) {
            this.limit = limit;
        }
    }

    /**
     * Raised from inside the regex engine when the read budget is spent.
     */
    static final class StepLimitExceededException extends RuntimeException {
        StepLimitExceededException(long limit) {
            super("Regex evaluation exceeded " + limit + " steps", null, false, false);
        }
    }
}
