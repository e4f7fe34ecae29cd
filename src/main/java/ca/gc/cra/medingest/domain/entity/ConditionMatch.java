package ca.gc.cra.medingest.domain.entity;

/**
 * Term matched for a condition category with up to 100 characters of surrounding text.
 *
 * @param term matched term, lower-case
 * @param context text window around the match
 * @since 0.1.0
 */
public record ConditionMatch(String term, String context) {}
