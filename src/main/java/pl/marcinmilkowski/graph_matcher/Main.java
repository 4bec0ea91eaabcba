package pl.marcinmilkowski.graph_matcher;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.graph_matcher.config.PatternConfigLoader;
import pl.marcinmilkowski.graph_matcher.conllu.ConlluReader;
import pl.marcinmilkowski.graph_matcher.matcher.BatchMatcher;
import pl.marcinmilkowski.graph_matcher.matcher.Matcher;
import pl.marcinmilkowski.graph_matcher.matcher.MatchingResult;
import pl.marcinmilkowski.graph_matcher.matcher.SentenceMatches;
import pl.marcinmilkowski.graph_matcher.pattern.NamedConstraint;
import pl.marcinmilkowski.graph_matcher.sentence.DependencySentence;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Main entry point for the dependency graph matcher.
 *
 * Commands:
 *   match --patterns patterns.json --input corpus.conllu [--threads 4] [--pattern name]
 *   validate --patterns patterns.json
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        if (args.length == 0) {
            showUsage();
            return;
        }

        try {
            String command = args[0].toLowerCase();

            switch (command) {
                case "match":
                    handleMatchCommand(args);
                    break;
                case "validate":
                    handleValidateCommand(args);
                    break;
                case "help":
                    showUsage();
                    break;
                default:
                    logger.error("Unknown command: " + command);
                    showUsage();
            }
        } catch (Exception e) {
            logger.error("Application error", e);
            System.err.println("Error: " + e.getMessage());
            System.err.println("Use 'help' command for usage information.");
        }
    }

    private static void showUsage() {
        System.out.println("Usage: java -jar graph-matcher.jar <command> [options]");
        System.out.println();
        System.out.println("Commands:");
        System.out.println("  match --patterns <file.json> --input <file.conllu>");
        System.out.println("      Match patterns against every sentence, one JSON line per match");
        System.out.println("      Options:");
        System.out.println("        --threads <n>    Worker threads (default: available processors)");
        System.out.println("        --pattern <name> Only match the named pattern");
        System.out.println();
        System.out.println("  validate --patterns <file.json>");
        System.out.println("      Load and compile the patterns");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  java -jar graph-matcher.jar match \\");
        System.out.println("    --patterns patterns.json --input corpus.conllu --threads 4");
    }

    private static void handleMatchCommand(String[] args) throws IOException {
        String patternsPath = null;
        String inputPath = null;
        String patternName = null;
        Integer threads = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--patterns":
                case "-p":
                    patternsPath = args[++i];
                    break;
                case "--input":
                case "-i":
                    inputPath = args[++i];
                    break;
                case "--pattern":
                    patternName = args[++i];
                    break;
                case "--threads":
                    threads = Integer.parseInt(args[++i]);
                    break;
                default:
                    System.err.println("Unknown option: " + args[i]);
            }
        }

        if (patternsPath == null || inputPath == null) {
            System.err.println("Error: --patterns and --input are required");
            return;
        }

        PatternConfigLoader config = new PatternConfigLoader(Paths.get(patternsPath));
        List<NamedConstraint> patterns = config.getPatterns();
        if (patternName != null) {
            String name = patternName;
            patterns = List.of(config.getPattern(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown pattern: " + name)));
        }

        List<DependencySentence> sentences = new ConlluReader().read(Paths.get(inputPath));
        BatchMatcher batch = new BatchMatcher(new Matcher(patterns));
        if (threads != null) {
            batch.setThreads(threads);
        }

        long total = 0;
        for (SentenceMatches sentenceMatches : batch.matchAll(sentences)) {
            DependencySentence sentence = sentences.get(sentenceMatches.sentenceIndex());
            for (Map.Entry<String, List<MatchingResult>> entry : sentenceMatches.matches().entrySet()) {
                for (MatchingResult result : entry.getValue()) {
                    System.out.println(toJson(sentence, entry.getKey(), result).toJSONString());
                    total++;
                }
            }
        }
        logger.info("Found {} matches in {} sentences", total, sentences.size());
    }

    private static void handleValidateCommand(String[] args) throws IOException {
        String patternsPath = null;
        for (int i = 1; i < args.length; i++) {
            if ("--patterns".equals(args[i]) || "-p".equals(args[i])) {
                patternsPath = args[++i];
            } else {
                System.err.println("Unknown option: " + args[i]);
            }
        }
        if (patternsPath == null) {
            System.err.println("Error: --patterns is required");
            return;
        }

        PatternConfigLoader config = new PatternConfigLoader(Paths.get(patternsPath));
        Matcher matcher = new Matcher(config.getPatterns());
        System.out.println("OK: " + matcher.names().size() + " patterns (version " + config.getVersion() + ")");
    }

    static JSONObject toJson(DependencySentence sentence, String patternName, MatchingResult result) {
        JSONObject obj = new JSONObject();
        obj.put("sentence", sentence.getSentenceId());
        obj.put("pattern", patternName);

        JSONObject tokens = new JSONObject();
        for (Map.Entry<String, Integer> entry : result.getTokens().entrySet()) {
            JSONObject token = new JSONObject();
            token.put("position", entry.getValue());
            token.put("word", sentence.text(entry.getValue()));
            tokens.put(entry.getKey(), token);
        }
        obj.put("tokens", tokens);

        JSONArray edges = new JSONArray();
        for (Map.Entry<MatchingResult.IndexPair, Set<String>> entry : result.getEdges().entrySet()) {
            JSONObject edge = new JSONObject();
            edge.put("child", entry.getKey().child());
            edge.put("parent", entry.getKey().parent());
            edge.put("labels", new JSONArray(new TreeSet<>(entry.getValue())));
            edges.add(edge);
        }
        obj.put("edges", edges);
        return obj;
    }
}
