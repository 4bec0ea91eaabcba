package pl.marcinmilkowski.graph_matcher.pattern;

import java.util.Locale;

/**
 * Token attribute kinds a pattern can constrain.
 */
public enum FieldNames {
    /** Surface form */
    WORD,
    /** Normalized form */
    LEMMA,
    /** Coarse (universal) POS tag */
    TAG,
    /** Fine (language specific) POS tag */
    FINE_TAG,
    /** Named entity class */
    ENTITY;

    /**
     * Parse a field name case-insensitively ("tag", "fine_tag", ...).
     *
     * @throws InvalidPatternShapeException if the name is unknown
     */
    public static FieldNames fromString(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidPatternShapeException("Missing field name");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidPatternShapeException("Unknown field name: " + name, e);
        }
    }
}
