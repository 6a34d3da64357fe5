package com.example.phoneshop.lisa.retrieval;

import com.example.phoneshop.lisa.cache.CacheKeyUtils;
import com.example.phoneshop.lisa.cache.ResultCache;
import com.example.phoneshop.lisa.model.RankedResult;
import com.example.phoneshop.lisa.model.ResultSource;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.scoring.ScoringModel;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rescores fused candidates with a cross-encoder and keeps the best passage per product.
 * Inference runs on the parallel scheduler in a single batched call.
 */
@Slf4j
public class CrossEncoderReranker {

    private final ScoringModel scoringModel;
    private final ResultCache cache;
    private final RerankPolicy policy;
    private final double threshold;
    private final int maxContentChars;
    private final Duration cacheTtl;

    public CrossEncoderReranker(ScoringModel scoringModel,
                                ResultCache cache,
                                RerankPolicy policy,
                                double threshold,
                                int maxContentChars,
                                Duration cacheTtl) {
        this.scoringModel = scoringModel;
        this.cache = cache;
        this.policy = policy;
        this.threshold = threshold;
        this.maxContentChars = maxContentChars;
        this.cacheTtl = cacheTtl;
    }

    public Mono<List<RankedResult>> rerank(String query, List<RankedResult> candidates, int topK) {
        if (candidates == null || candidates.isEmpty()) {
            return Mono.just(List.of());
        }
        String key = CacheKeyUtils.rerankKey(query, topK);
        return cache.get(key)
                .doOnNext(hit -> log.debug("rerank cache hit key={} size={}", key, hit.size()))
                .switchIfEmpty(Mono.defer(() -> score(query, candidates)
                        .map(scores -> select(candidates, scores, topK))
                        .flatMap(ranked -> cache.put(key, ranked, cacheTtl).thenReturn(ranked))));
    }

    private Mono<List<Double>> score(String query, List<RankedResult> candidates) {
        return Mono.fromCallable(() -> {
                    List<TextSegment> segments = new ArrayList<>(candidates.size());
                    for (RankedResult c : candidates) {
                        segments.add(TextSegment.from(truncate(c.passage().content(), c.passage().id())));
                    }
                    long start = System.nanoTime();
                    Response<List<Double>> response = scoringModel.scoreAll(segments, query);
                    log.debug("scored {} pairs in {} ms", segments.size(), (System.nanoTime() - start) / 1_000_000);
                    List<Double> scores = response.content();
                    if (scores == null || scores.size() != candidates.size()) {
                        throw new IllegalStateException("scoring model returned "
                                + (scores == null ? 0 : scores.size()) + " scores for " + candidates.size() + " pairs");
                    }
                    return scores;
                })
                .subscribeOn(Schedulers.parallel());
    }

    List<RankedResult> select(List<RankedResult> candidates, List<Double> scores, int topK) {
        if (policy == RerankPolicy.TOP_K && topK <= 0) {
            return List.of();
        }
        // product -> index of its best candidate; strict > keeps the earlier passage on ties
        Map<String, Integer> bestIndex = new LinkedHashMap<>();
        for (int i = 0; i < candidates.size(); i++) {
            String product = candidates.get(i).passage().productKey();
            Integer current = bestIndex.get(product);
            if (current == null || scores.get(i) > scores.get(current)) {
                bestIndex.put(product, i);
            }
        }

        List<Integer> order = new ArrayList<>(bestIndex.values());
        order.sort(Comparator.<Integer>comparingDouble(scores::get).reversed()
                .thenComparingInt(Integer::intValue));

        List<RankedResult> out = new ArrayList<>();
        for (int idx : order) {
            double s = scores.get(idx);
            if (policy == RerankPolicy.THRESHOLD && !(s > threshold)) {
                continue;
            }
            out.add(candidates.get(idx).rescored(s, ResultSource.RERANKED));
            if (policy == RerankPolicy.TOP_K && out.size() >= topK) {
                break;
            }
        }
        return out;
    }

    private String truncate(String content, String fallback) {
        String text = (content == null || content.isBlank()) ? fallback : content;
        return text.length() > maxContentChars ? text.substring(0, maxContentChars) : text;
    }
}
