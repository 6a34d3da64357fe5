package com.example.phoneshop.lisa.retrieval;

import com.example.phoneshop.lisa.generation.RetryPolicy;
import com.example.phoneshop.lisa.model.Passage;
import com.example.phoneshop.lisa.model.PassageMetadata;
import com.example.phoneshop.lisa.model.RankedResult;
import com.example.phoneshop.lisa.model.ResultSource;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Nearest-neighbour search through a LangChain4j embedding store. The store is populated
 * elsewhere; {@link #seed(List)} exists for development and the empty-catalog case.
 */
@Slf4j
public class VectorIndex implements PassageRetriever {

    /** Metadata key holding the passage id inside the store. */
    public static final String PASSAGE_ID = "passage_id";

    private final EmbeddingStore<TextSegment> store;
    private final EmbeddingModel embeddingModel;
    private final Duration timeout;
    private final RetryPolicy retryPolicy;

    public VectorIndex(EmbeddingStore<TextSegment> store,
                       EmbeddingModel embeddingModel,
                       Duration timeout,
                       RetryPolicy retryPolicy) {
        this.store = store;
        this.embeddingModel = embeddingModel;
        this.timeout = timeout;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public ResultSource kind() {
        return ResultSource.VECTOR;
    }

    @Override
    public Mono<List<RankedResult>> search(String query, int k) {
        if (k <= 0 || query == null || query.isBlank()) {
            return Mono.just(List.of());
        }
        Mono<List<RankedResult>> call = Mono.fromCallable(() -> query(query, k))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(timeout);
        return retryPolicy.applyTo(call, "vector search");
    }

    /** Embeds and stores the passages. Blocking; call at startup only. */
    public void seed(List<Passage> passages) {
        if (passages == null || passages.isEmpty()) {
            return;
        }
        List<TextSegment> segments = new ArrayList<>(passages.size());
        for (Passage p : passages) {
            segments.add(toSegment(p));
        }
        List<Embedding> embeddings = embeddingModel.embedAll(segments).content();
        store.addAll(embeddings, segments);
        log.info("vector index seeded with {} passages", segments.size());
    }

    private List<RankedResult> query(String query, int k) {
        Embedding q = embeddingModel.embed(query).content();
        EmbeddingSearchRequest request = EmbeddingSearchRequest.builder()
                .queryEmbedding(q)
                .maxResults(k)
                .build();
        List<EmbeddingMatch<TextSegment>> matches = store.search(request).matches();
        List<RankedResult> out = new ArrayList<>(matches.size());
        for (EmbeddingMatch<TextSegment> m : matches) {
            TextSegment segment = m.embedded();
            if (segment == null) {
                continue;
            }
            Double score = m.score();
            out.add(new RankedResult(toPassage(m.embeddingId(), segment),
                    score == null ? 0.0 : score, ResultSource.VECTOR));
        }
        return out;
    }

    static Passage toPassage(String embeddingId, TextSegment segment) {
        Map<String, Object> raw = segment.metadata().toMap();
        Object storedId = raw.get(PASSAGE_ID);
        String id = storedId == null ? embeddingId : String.valueOf(storedId);
        return new Passage(id, segment.text(), PassageMetadata.fromMap(raw));
    }

    static TextSegment toSegment(Passage p) {
        Map<String, Object> meta = new HashMap<>(p.metadata().toMap());
        meta.put(PASSAGE_ID, p.id());
        String text = p.content().isBlank() ? p.id() : p.content();
        return TextSegment.from(text, Metadata.from(meta));
    }
}
