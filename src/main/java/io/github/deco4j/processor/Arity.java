package io.github.deco4j.processor;

/**
 * Argument-count rule for a marker.
 *
 * @param min minimum number of arguments
 * @param max maximum number of arguments, {@link Integer#MAX_VALUE} when unbounded
 */
public record Arity(int min, int max) {

    private static final Arity ANY = new Arity(0, Integer.MAX_VALUE);

    public Arity {
        if (min < 0 || max < min) {
            throw new IllegalArgumentException("Invalid arity bounds: [" + min + ", " + max + "]");
        }
    }

    public static Arity exactly(int count) {
        return new Arity(count, count);
    }

    public static Arity atLeast(int count) {
        return new Arity(count, Integer.MAX_VALUE);
    }

    public static Arity any() {
        return ANY;
    }

    public boolean accepts(int count) {
        return count >= min && count <= max;
    }

    /**
     * Returns a human-readable form such as {@code exactly 2} or {@code at least 1}.
     */
    public String describe() {
        if (min == max) {
            return "exactly " + min;
        }
        if (max == Integer.MAX_VALUE) {
            return "at least " + min;
        }
        return "between " + min + " and " + max;
    }
}
