package pl.marcinmilkowski.graph_matcher.sentence;

import pl.marcinmilkowski.graph_matcher.pattern.FieldNames;

/**
 * One token of a sentence with its CoNLL-U columns.
 *
 * @param position 0-based position (CoNLL-U id minus one)
 * @param head     CoNLL-U head id (1-based), 0 for the root
 */
public record SentenceToken(
    int position,
    String word,
    String lemma,
    String upos,
    String xpos,
    String feats,
    int head,
    String deprel,
    String misc
) {
    private static final String EMPTY = "_";
    private static final String ENTITY_KEY = "NE=";

    public SentenceToken {
        word = word != null ? word : EMPTY;
        lemma = lemma != null ? lemma : EMPTY;
        upos = upos != null ? upos : EMPTY;
        xpos = xpos != null ? xpos : upos;
        feats = feats != null ? feats : EMPTY;
        deprel = deprel != null ? deprel : EMPTY;
        misc = misc != null ? misc : EMPTY;
    }

    /**
     * Token without dependency information; edges are added separately.
     */
    public static SentenceToken of(int position, String word, String lemma, String upos) {
        return new SentenceToken(position, word, lemma, upos, upos, EMPTY, 0, EMPTY, EMPTY);
    }

    /**
     * Entity class from the MISC column ({@code NE=ORG}), or null.
     */
    public String entity() {
        if (EMPTY.equals(misc)) {
            return null;
        }
        for (String item : misc.split("\\|")) {
            if (item.startsWith(ENTITY_KEY)) {
                return item.substring(ENTITY_KEY.length());
            }
        }
        return null;
    }

    /**
     * Value of the given attribute kind, or null if the token has none.
     */
    public String value(FieldNames field) {
        switch (field) {
            case WORD: return word;
            case LEMMA: return lemma;
            case TAG: return upos;
            case FINE_TAG: return xpos;
            case ENTITY: return entity();
            default: throw new IllegalArgumentException("Unsupported field: " + field);
        }
    }

    public boolean isRoot() {
        return head == 0;
    }

    @Override
    public String toString() {
        return String.format("Token(%d: %s/%s)", position, word, upos);
    }
}
