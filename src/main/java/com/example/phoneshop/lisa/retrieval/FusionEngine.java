package com.example.phoneshop.lisa.retrieval;

import com.example.phoneshop.lisa.cache.CacheKeyUtils;
import com.example.phoneshop.lisa.cache.ResultCache;
import com.example.phoneshop.lisa.model.RankedResult;
import com.example.phoneshop.lisa.model.ResultSource;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Weighted-vote fusion of the lexical and vector rankings. A source adds its weight to a product
 * at most once, however many of that product's passages it returned; the result holds one entry
 * per product, carrying the first passage seen for it.
 */
@Slf4j
public class FusionEngine {

    private static final double WEIGHT_TOLERANCE = 1e-6;

    private final PassageRetriever lexical;
    private final PassageRetriever vector;
    private final ResultCache cache;
    private final double lexicalWeight;
    private final double vectorWeight;
    private final Duration cacheTtl;

    public FusionEngine(PassageRetriever lexical,
                        PassageRetriever vector,
                        ResultCache cache,
                        double lexicalWeight,
                        double vectorWeight,
                        Duration cacheTtl) {
        if (lexicalWeight < 0 || vectorWeight < 0
                || Math.abs(lexicalWeight + vectorWeight - 1.0) > WEIGHT_TOLERANCE) {
            throw new IllegalArgumentException(
                    "fusion weights must be non-negative and sum to 1, got " + lexicalWeight + "/" + vectorWeight);
        }
        this.lexical = lexical;
        this.vector = vector;
        this.cache = cache;
        this.lexicalWeight = lexicalWeight;
        this.vectorWeight = vectorWeight;
        this.cacheTtl = cacheTtl;
    }

    public Mono<List<RankedResult>> fuse(String query, int topK) {
        String key = CacheKeyUtils.fusionKey(query, topK);
        return cache.get(key)
                .doOnNext(hit -> log.debug("fusion cache hit key={} size={}", key, hit.size()))
                .switchIfEmpty(Mono.defer(() -> Mono.zip(lexical.search(query, topK), vector.search(query, topK))
                        .map(both -> merge(both.getT1(), both.getT2(), topK))
                        .flatMap(fused -> cache.put(key, fused, cacheTtl).thenReturn(fused))));
    }

    List<RankedResult> merge(List<RankedResult> lexicalResults, List<RankedResult> vectorResults, int topK) {
        Map<String, RankedResult> firstSeen = new LinkedHashMap<>();
        Map<String, Double> scores = new LinkedHashMap<>();
        accumulate(lexicalResults, lexicalWeight, firstSeen, scores);
        accumulate(vectorResults, vectorWeight, firstSeen, scores);

        List<RankedResult> fused = new ArrayList<>(firstSeen.size());
        for (Map.Entry<String, RankedResult> e : firstSeen.entrySet()) {
            fused.add(e.getValue().rescored(scores.get(e.getKey()), ResultSource.FUSED));
        }
        fused.sort((a, b) -> Double.compare(b.score(), a.score()));
        return fused.size() > topK ? List.copyOf(fused.subList(0, Math.max(0, topK))) : fused;
    }

    private static void accumulate(List<RankedResult> results, double weight,
                                   Map<String, RankedResult> firstSeen, Map<String, Double> scores) {
        if (results == null) {
            return;
        }
        Set<String> counted = new HashSet<>();
        for (RankedResult r : results) {
            String product = r.passage().productKey();
            firstSeen.putIfAbsent(product, r);
            if (counted.add(product)) {
                scores.merge(product, weight, Double::sum);
            }
        }
    }
}
