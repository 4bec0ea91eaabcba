package pl.marcinmilkowski.graph_matcher.pattern;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Attribute constraint on a single token: the token's {@code field} must match
 * one of the accepted values. Values use the wildcard syntax ({@code *}, {@code ?}).
 */
public record Field(FieldNames field, Set<String> value) {

    public Field {
        if (field == null) {
            throw new InvalidPatternShapeException("Field constraint without a field name");
        }
        if (value == null || value.isEmpty()) {
            throw new InvalidPatternShapeException("Field constraint on " + field + " accepts no values");
        }
        value = Collections.unmodifiableSet(new LinkedHashSet<>(value));
    }

    public static Field of(FieldNames field, String... values) {
        return new Field(field, new LinkedHashSet<>(Arrays.asList(values)));
    }

    public static Field of(FieldNames field, Collection<String> values) {
        return new Field(field, new LinkedHashSet<>(values));
    }
}
