package pl.marcinmilkowski.graph_matcher.query;

import pl.marcinmilkowski.graph_matcher.pattern.Field;
import pl.marcinmilkowski.graph_matcher.sentence.SentenceGraph;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Token matcher that compiles each field into an {@link OrPredicate} of
 * {@link ValuePredicate}s and conjoins the fields with an {@link AndPredicate}.
 *
 * <p>Compiled predicates are cached per field list, so the matcher can be shared
 * between threads.</p>
 */
public class PredicateTokenMatcher implements TokenMatcher {

    private final Map<List<Field>, TokenPredicate> compiled = new ConcurrentHashMap<>();

    @Override
    public List<TokenSpan> match(List<Field> fields, SentenceGraph sentence) {
        TokenPredicate predicate = compiled.computeIfAbsent(List.copyOf(fields), PredicateTokenMatcher::compile);
        List<TokenSpan> spans = new ArrayList<>();
        for (int position = 0; position < sentence.size(); position++) {
            if (predicate.test(sentence, position)) {
                spans.add(TokenSpan.single(position));
            }
        }
        return spans;
    }

    static TokenPredicate compile(List<Field> fields) {
        List<TokenPredicate> andPreds = new ArrayList<>();
        for (Field field : fields) {
            List<TokenPredicate> orPreds = new ArrayList<>();
            for (String value : field.value()) {
                orPreds.add(new ValuePredicate(field.field(), value));
            }
            andPreds.add(new OrPredicate(orPreds));
        }
        return new AndPredicate(andPreds);
    }
}
