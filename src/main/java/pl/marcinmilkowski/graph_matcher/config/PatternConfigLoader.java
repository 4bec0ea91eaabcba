package pl.marcinmilkowski.graph_matcher.config;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.graph_matcher.pattern.Distance;
import pl.marcinmilkowski.graph_matcher.pattern.Edge;
import pl.marcinmilkowski.graph_matcher.pattern.ExactDistance;
import pl.marcinmilkowski.graph_matcher.pattern.Field;
import pl.marcinmilkowski.graph_matcher.pattern.FieldNames;
import pl.marcinmilkowski.graph_matcher.pattern.Full;
import pl.marcinmilkowski.graph_matcher.pattern.HasLabelFromList;
import pl.marcinmilkowski.graph_matcher.pattern.HasNoLabel;
import pl.marcinmilkowski.graph_matcher.pattern.InvalidPatternShapeException;
import pl.marcinmilkowski.graph_matcher.pattern.Label;
import pl.marcinmilkowski.graph_matcher.pattern.NamedConstraint;
import pl.marcinmilkowski.graph_matcher.pattern.Token;
import pl.marcinmilkowski.graph_matcher.pattern.TokenPair;
import pl.marcinmilkowski.graph_matcher.pattern.TokenTriplet;
import pl.marcinmilkowski.graph_matcher.pattern.TokenTuple;
import pl.marcinmilkowski.graph_matcher.pattern.UptoDistance;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Loads named structural patterns from JSON.
 *
 * Expected JSON structure:
 * {
 *   "version": "1.0",
 *   "patterns": [
 *     {
 *       "name": "nsubj_verb",
 *       "tokens": [
 *         {"id": "v", "spec": [{"field": "tag", "value": ["VERB"]}]},
 *         {"id": "s", "optional": false, "capture": true,
 *          "outgoing_edges": [{"has_no": ["punct"]}]}
 *       ],
 *       "edges": [{"child": "s", "parent": "v", "has": ["nsubj"]}],
 *       "distances": [{"token1": "s", "token2": "v", "up_to": 3}],
 *       "concats": [{"tokens": ["a", "b"], "phrases": ["New_York"]}]
 *     },
 *     ...
 *   ]
 * }
 *
 * Missing top-level keys and duplicate names are {@link IllegalArgumentException}s;
 * a malformed pattern body is an {@link InvalidPatternShapeException}.
 */
public class PatternConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(PatternConfigLoader.class);

    private final String version;
    private final String source;
    private final List<NamedConstraint> patterns;
    private final Map<String, NamedConstraint> patternsByName;

    /**
     * Load pattern configuration from the specified path.
     *
     * @param configPath Path to the patterns JSON file
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the file is invalid
     */
    public PatternConfigLoader(Path configPath) throws IOException {
        this(readFile(configPath), configPath.toString());
    }

    private PatternConfigLoader(String content, String source) {
        this.source = source;

        JSONObject root;
        try {
            root = JSON.parseObject(content);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Pattern config is not valid JSON: " + source, e);
        }
        if (root == null) {
            throw new IllegalArgumentException("Empty pattern config: " + source);
        }

        // Validate version
        String parsedVersion = root.getString("version");
        if (parsedVersion == null || parsedVersion.isBlank()) {
            throw new IllegalArgumentException("Missing 'version' field in pattern config");
        }
        this.version = parsedVersion;

        JSONArray patternsArray = root.getJSONArray("patterns");
        if (patternsArray == null || patternsArray.isEmpty()) {
            throw new IllegalArgumentException("Missing or empty 'patterns' array in pattern config");
        }

        List<NamedConstraint> loaded = new ArrayList<>();
        Map<String, NamedConstraint> loadedByName = new LinkedHashMap<>();
        for (int i = 0; i < patternsArray.size(); i++) {
            JSONObject patternObj = patternsArray.getJSONObject(i);
            if (patternObj == null) {
                throw new IllegalArgumentException("Invalid pattern at index " + i);
            }
            String name = patternObj.getString("name");
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Missing 'name' field for pattern at index " + i);
            }
            if (loadedByName.containsKey(name)) {
                throw new IllegalArgumentException("Duplicate pattern name: " + name);
            }

            NamedConstraint pattern;
            try {
                pattern = new NamedConstraint(name, parsePattern(patternObj));
            } catch (InvalidPatternShapeException e) {
                throw new InvalidPatternShapeException("Pattern '" + name + "': " + e.getMessage(), e);
            }
            loaded.add(pattern);
            loadedByName.put(name, pattern);
        }
        this.patterns = Collections.unmodifiableList(loaded);
        this.patternsByName = Collections.unmodifiableMap(loadedByName);

        logger.info("Loaded pattern config version {}: {} patterns from {}", version, patterns.size(), source);
    }

    /**
     * Load pattern configuration from a classpath resource.
     */
    public static PatternConfigLoader fromResource(String resource) {
        try (InputStream in = PatternConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Pattern config resource not found: " + resource);
            }
            return new PatternConfigLoader(new String(in.readAllBytes(), StandardCharsets.UTF_8),
                "classpath:" + resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read pattern config resource: " + resource, e);
        }
    }

    private static String readFile(Path configPath) throws IOException {
        if (!Files.exists(configPath)) {
            throw new IOException("Pattern config file not found: " + configPath);
        }
        return Files.readString(configPath);
    }

    private static Full parsePattern(JSONObject patternObj) {
        Full.Builder builder = Full.builder();

        JSONArray tokens = patternObj.getJSONArray("tokens");
        if (tokens == null || tokens.isEmpty()) {
            throw new InvalidPatternShapeException("pattern declares no tokens");
        }
        for (int i = 0; i < tokens.size(); i++) {
            builder.token(parseToken(tokens.getJSONObject(i)));
        }

        for (JSONObject edgeObj : objects(patternObj, "edges")) {
            builder.edge(new Edge(edgeObj.getString("child"), edgeObj.getString("parent"), parseLabel(edgeObj)));
        }
        for (JSONObject distanceObj : objects(patternObj, "distances")) {
            builder.distance(parseDistance(distanceObj));
        }
        for (JSONObject concatObj : objects(patternObj, "concats")) {
            builder.concat(parseConcat(concatObj));
        }
        return builder.build();
    }

    private static Token parseToken(JSONObject tokenObj) {
        if (tokenObj == null) {
            throw new InvalidPatternShapeException("token constraint must be an object");
        }
        Token.Builder builder = Token.builder(tokenObj.getString("id"))
            .capture(tokenObj.getBooleanValue("capture", true))
            .optional(tokenObj.getBooleanValue("optional", false));

        for (JSONObject fieldObj : objects(tokenObj, "spec")) {
            FieldNames field = FieldNames.fromString(fieldObj.getString("field"));
            builder.field(Field.of(field, strings(fieldObj, "value")));
        }
        for (JSONObject labelObj : objects(tokenObj, "incoming_edges")) {
            builder.incoming(parseLabel(labelObj));
        }
        for (JSONObject labelObj : objects(tokenObj, "outgoing_edges")) {
            builder.outgoing(parseLabel(labelObj));
        }
        return builder.build();
    }

    private static Label parseLabel(JSONObject obj) {
        boolean has = obj.containsKey("has");
        boolean hasNo = obj.containsKey("has_no");
        if (has == hasNo) {
            throw new InvalidPatternShapeException("label constraint needs exactly one of 'has' or 'has_no': " + obj);
        }
        return has
            ? new HasLabelFromList(strings(obj, "has"))
            : new HasNoLabel(strings(obj, "has_no"));
    }

    private static Distance parseDistance(JSONObject obj) {
        String token1 = obj.getString("token1");
        String token2 = obj.getString("token2");
        boolean exact = obj.containsKey("exact");
        boolean upTo = obj.containsKey("up_to");
        if (exact == upTo) {
            throw new InvalidPatternShapeException("distance constraint needs exactly one of 'exact' or 'up_to': " + obj);
        }
        return exact
            ? new ExactDistance(token1, token2, obj.getIntValue("exact"))
            : new UptoDistance(token1, token2, obj.getIntValue("up_to"));
    }

    private static TokenTuple parseConcat(JSONObject obj) {
        List<String> ids = new ArrayList<>(strings(obj, "tokens"));
        Set<String> phrases = strings(obj, "phrases");
        switch (ids.size()) {
            case 2:
                return new TokenPair(ids.get(0), ids.get(1), phrases);
            case 3:
                return new TokenTriplet(ids.get(0), ids.get(1), ids.get(2), phrases);
            default:
                throw new InvalidPatternShapeException("phrase constraint must name 2 or 3 tokens, found " + ids);
        }
    }

    private static List<JSONObject> objects(JSONObject parent, String key) {
        JSONArray array = parent.getJSONArray(key);
        if (array == null) {
            return List.of();
        }
        List<JSONObject> result = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            Object item = array.get(i);
            if (!(item instanceof JSONObject)) {
                throw new InvalidPatternShapeException("'" + key + "' entry " + i + " must be an object");
            }
            result.add((JSONObject) item);
        }
        return result;
    }

    private static Set<String> strings(JSONObject parent, String key) {
        JSONArray array = parent.getJSONArray(key);
        if (array == null || array.isEmpty()) {
            throw new InvalidPatternShapeException("missing or empty '" + key + "' in " + parent);
        }
        Set<String> values = new LinkedHashSet<>();
        for (int i = 0; i < array.size(); i++) {
            values.add(array.getString(i));
        }
        return values;
    }

    /**
     * Get all configured patterns, in file order.
     */
    public List<NamedConstraint> getPatterns() {
        return patterns;
    }

    /**
     * Get a pattern by name.
     */
    public Optional<NamedConstraint> getPattern(String name) {
        return Optional.ofNullable(patternsByName.get(name));
    }

    /**
     * Get the configuration version.
     */
    public String getVersion() {
        return version;
    }

    /**
     * Where the configuration was loaded from (a file path or {@code classpath:} resource).
     */
    public String getSource() {
        return source;
    }

    /**
     * Export the loaded config as a JSONObject in the same structure it was read from.
     */
    public JSONObject toJson() {
        JSONObject root = new JSONObject();
        root.put("version", version);

        JSONArray patternsArray = new JSONArray();
        for (NamedConstraint pattern : patterns) {
            patternsArray.add(patternToJson(pattern));
        }
        root.put("patterns", patternsArray);
        return root;
    }

    private static JSONObject patternToJson(NamedConstraint pattern) {
        Full constraint = pattern.constraint();
        JSONObject obj = new JSONObject();
        obj.put("name", pattern.name());

        JSONArray tokens = new JSONArray();
        for (Token token : constraint.tokens()) {
            JSONObject tokenObj = new JSONObject();
            tokenObj.put("id", token.id());
            tokenObj.put("capture", token.capture());
            tokenObj.put("optional", token.optional());
            JSONArray spec = new JSONArray();
            for (Field field : token.spec()) {
                JSONObject fieldObj = new JSONObject();
                fieldObj.put("field", field.field().name());
                fieldObj.put("value", new JSONArray(field.value()));
                spec.add(fieldObj);
            }
            tokenObj.put("spec", spec);
            tokenObj.put("incoming_edges", labelsToJson(token.incomingEdges()));
            tokenObj.put("outgoing_edges", labelsToJson(token.outgoingEdges()));
            tokens.add(tokenObj);
        }
        obj.put("tokens", tokens);

        JSONArray edges = new JSONArray();
        for (Edge edge : constraint.edges()) {
            JSONObject edgeObj = labelToJson(edge.label());
            edgeObj.put("child", edge.child());
            edgeObj.put("parent", edge.parent());
            edges.add(edgeObj);
        }
        obj.put("edges", edges);

        JSONArray distances = new JSONArray();
        for (Distance distance : constraint.distances()) {
            JSONObject distanceObj = new JSONObject();
            distanceObj.put("token1", distance.token1());
            distanceObj.put("token2", distance.token2());
            distanceObj.put(distance instanceof ExactDistance ? "exact" : "up_to", distance.distance());
            distances.add(distanceObj);
        }
        obj.put("distances", distances);

        JSONArray concats = new JSONArray();
        for (TokenTuple concat : constraint.concats()) {
            JSONObject concatObj = new JSONObject();
            concatObj.put("tokens", new JSONArray(concat.tokens()));
            concatObj.put("phrases", new JSONArray(concat.tupleSet()));
            concats.add(concatObj);
        }
        obj.put("concats", concats);
        return obj;
    }

    private static JSONArray labelsToJson(List<Label> labels) {
        JSONArray array = new JSONArray();
        for (Label label : labels) {
            array.add(labelToJson(label));
        }
        return array;
    }

    private static JSONObject labelToJson(Label label) {
        JSONObject obj = new JSONObject();
        obj.put(label instanceof HasLabelFromList ? "has" : "has_no", new JSONArray(label.labels()));
        return obj;
    }
}
