package pl.marcinmilkowski.graph_matcher.matcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.graph_matcher.sentence.SentenceGraph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Runs a {@link Matcher} over many sentences on a fixed thread pool.
 * Sentences are independent, so each one is a separate task; results come back
 * in input order.
 *
 * Usage:
 * <pre>
 *   BatchMatcher batch = new BatchMatcher(matcher);
 *   batch.setThreads(4);
 *   List&lt;SentenceMatches&gt; results = batch.matchAll(sentences);
 * </pre>
 */
public class BatchMatcher {

    private static final Logger logger = LoggerFactory.getLogger(BatchMatcher.class);

    private final Matcher matcher;

    // Configuration
    private int threads = Runtime.getRuntime().availableProcessors();
    private int progressEvery = 10_000;

    public BatchMatcher(Matcher matcher) {
        this.matcher = matcher;
    }

    public void setThreads(int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be positive: " + threads);
        }
        this.threads = threads;
    }

    public void setProgressEvery(int progressEvery) {
        if (progressEvery < 1) {
            throw new IllegalArgumentException("progressEvery must be positive: " + progressEvery);
        }
        this.progressEvery = progressEvery;
    }

    /**
     * Match every pattern against every sentence and drain the results.
     *
     * @throws IllegalStateException if a task fails or the calling thread is interrupted
     */
    public List<SentenceMatches> matchAll(List<? extends SentenceGraph> sentences) {
        long startTime = System.currentTimeMillis();
        AtomicInteger processed = new AtomicInteger();
        AtomicInteger withMatches = new AtomicInteger();

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<SentenceMatches>> futures = new ArrayList<>(sentences.size());
            for (int i = 0; i < sentences.size(); i++) {
                int index = i;
                SentenceGraph sentence = sentences.get(i);
                futures.add(executor.submit(() -> {
                    SentenceMatches result = matchOne(index, sentence);
                    if (result.total() > 0) {
                        withMatches.incrementAndGet();
                    }
                    int count = processed.incrementAndGet();
                    if (count % progressEvery == 0) {
                        logger.info("Progress: {}/{} sentences matched, {} with matches",
                            count, sentences.size(), withMatches.get());
                    }
                    return result;
                }));
            }

            List<SentenceMatches> results = new ArrayList<>(futures.size());
            for (Future<SentenceMatches> future : futures) {
                results.add(future.get());
            }

            long elapsed = System.currentTimeMillis() - startTime;
            logger.info("Completed: {} sentences, {} with matches in {} ms",
                sentences.size(), withMatches.get(), elapsed);
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while matching sentences", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Matching task failed", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Match every pattern against a single sentence on the calling thread.
     */
    public SentenceMatches matchOne(int index, SentenceGraph sentence) {
        Match match = matcher.apply(sentence);
        Map<String, List<MatchingResult>> byName = new LinkedHashMap<>();
        for (String name : match.names()) {
            byName.put(name, match.matchesFor(name).collect(Collectors.toList()));
        }
        return new SentenceMatches(index, byName);
    }
}
