package com.example.phoneshop.lisa.retrieval;

import com.example.phoneshop.lisa.model.RankedResult;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Fusion followed by optional reranking. Fusion always asks for {@code candidateTopK}
 * products; the reranker (or a plain cut when it is skipped) narrows them to the final count.
 */
@Slf4j
public class RetrievalService {

    private final FusionEngine fusionEngine;
    private final CrossEncoderReranker reranker;
    private final RerankGate gate;
    private final List<String> gateKeywords;
    private final int candidateTopK;
    private final int topK;

    /**
     * @param reranker may be null, in which case fused results are returned as they are
     */
    public RetrievalService(FusionEngine fusionEngine,
                            CrossEncoderReranker reranker,
                            RerankGate gate,
                            List<String> gateKeywords,
                            int candidateTopK,
                            int topK) {
        this.fusionEngine = fusionEngine;
        this.reranker = reranker;
        this.gate = gate;
        this.gateKeywords = gateKeywords == null ? List.of() : List.copyOf(gateKeywords);
        this.candidateTopK = Math.max(candidateTopK, topK);
        this.topK = topK;
    }

    public Mono<List<RankedResult>> retrieve(String query) {
        return retrieve(query, topK);
    }

    public Mono<List<RankedResult>> retrieve(String query, int k) {
        return fusionEngine.fuse(query, Math.max(candidateTopK, k))
                .flatMap(fused -> {
                    if (reranker != null && gate.admits(query, gateKeywords)) {
                        return reranker.rerank(query, fused, k);
                    }
                    return Mono.just(fused.size() > k ? List.copyOf(fused.subList(0, k)) : fused);
                })
                .doOnNext(results -> log.debug("retrieved {} products for '{}'", results.size(), query));
    }
}
