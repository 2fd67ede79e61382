package org.safepay.domain.value;

import org.safepay.lang.Option;

import static org.safepay.lang.Option.none;
import static org.safepay.lang.Option.some;

/// Optional lower and upper limits for the length of a validated text value.
///
/// @param min Minimal length, inclusive
/// @param max Maximal length, inclusive
public record LengthBounds(Option<Integer> min, Option<Integer> max) {
    private static final LengthBounds UNBOUNDED = new LengthBounds(none(), none());

    public static LengthBounds unbounded() {
        return UNBOUNDED;
    }

    public static LengthBounds atLeast(int min) {
        return new LengthBounds(some(min), none());
    }

    public static LengthBounds atMost(int max) {
        return new LengthBounds(none(), some(max));
    }

    public static LengthBounds between(int min, int max) {
        return new LengthBounds(some(min), some(max));
    }

    public boolean fitsMin(int length) {
        return min.fold(() -> true, limit -> length >= limit);
    }

    public boolean fitsMax(int length) {
        return max.fold(() -> true, limit -> length <= limit);
    }

    @Override
    public String toString() {
        return "LengthBounds[" + min.map(String::valueOf).or("-") + ".." + max.map(String::valueOf).or("-") + "]";
    }
}
