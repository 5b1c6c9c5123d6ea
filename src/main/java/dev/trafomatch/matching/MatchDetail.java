package dev.trafomatch.matching;

import dev.trafomatch.design.AttributeValue;
import org.jspecify.annotations.Nullable;

/**
 * Per-attribute explanation of a score.
 *
 * @param attribute the attribute name
 * @param queryValue the value asked for
 * @param designValue the design's value, null when the design does not record it
 * @param score the comparator score in [0, 1]
 */
public record MatchDetail(
    String attribute,
    AttributeValue queryValue,
    @Nullable AttributeValue designValue,
    double score) {}
