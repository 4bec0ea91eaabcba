package pl.marcinmilkowski.graph_matcher.query;

import pl.marcinmilkowski.graph_matcher.pattern.FieldNames;
import pl.marcinmilkowski.graph_matcher.sentence.SentenceGraph;

import java.util.regex.Pattern;

/**
 * Predicate that matches tokens whose value for one attribute kind matches a
 * wildcard pattern. {@code *} matches any string, {@code ?} any single char;
 * everything else is literal and case-sensitive.
 */
public class ValuePredicate implements TokenPredicate {
    private final FieldNames field;
    private final String pattern;
    private final Pattern regex;

    public ValuePredicate(FieldNames field, String pattern) {
        this.field = field;
        this.pattern = pattern;
        this.regex = Pattern.compile(wildcardToRegex(pattern));
    }

    @Override
    public boolean test(SentenceGraph sentence, int position) {
        if (pattern.equals("*")) {
            return true;
        }
        for (String value : sentence.values(position, field)) {
            if (regex.matcher(value).matches()) {
                return true;
            }
        }
        return false;
    }

    static String wildcardToRegex(String pattern) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == '*') {
                sb.append(".*");
            } else if (c == '?') {
                sb.append(".");
            } else if (".^$|()[]{}\\+".indexOf(c) >= 0) {
                sb.append('\\').append(c);  // Escape regex special chars
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return field + "(" + pattern + ")";
    }
}
