package se.alipsa.refbridge;

/**
 * Constraints on generated input values for a function.
 *
 * @param allowNaN
 *          whether NaN may be generated
 * @param allowInfinity
 *          whether positive or negative infinity may be generated
 */
public record DataSpec(boolean allowNaN, boolean allowInfinity) {
}
