package com.example.phoneshop.lisa.retrieval;

import com.example.phoneshop.lisa.model.RankedResult;
import com.example.phoneshop.lisa.model.ResultSource;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * A ranking source over the catalog. The two variants are {@link LexicalIndex} and
 * {@link VectorIndex}; which one a result came from is reported by {@link #kind()}.
 */
public interface PassageRetriever {

    ResultSource kind();

    /** Up to {@code k} results, best first. */
    Mono<List<RankedResult>> search(String query, int k);
}
