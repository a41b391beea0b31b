package io.github.cyfko.surveylogic.core.model;

/**
 * Survey waves a state applies to. Both bounds are optional and inclusive.
 *
 * @param applyFrom first wave the state applies to, or {@code null} if unbounded
 * @param applyTo   last wave the state applies to, or {@code null} if unbounded
 * @author Frank KOSSI
 * @since 1.0
 */
public record VersionRange(Integer applyFrom, Integer applyTo) {

    public VersionRange {
        if (applyFrom != null && applyTo != null && applyFrom > applyTo) {
            throw new IllegalArgumentException(
                    String.format("applyFrom (%d) must not be after applyTo (%d)", applyFrom, applyTo));
        }
    }

    public static VersionRange from(int applyFrom) {
        return new VersionRange(applyFrom, null);
    }

    public static VersionRange between(int applyFrom, int applyTo) {
        return new VersionRange(applyFrom, applyTo);
    }

    /**
     * Tells whether the given wave falls within this range.
     *
     * @param wave the survey wave number
     * @return {@code true} if both present bounds admit the wave
     */
    public boolean contains(int wave) {
        return (applyFrom == null || wave >= applyFrom) && (applyTo == null || wave <= applyTo);
    }
}
