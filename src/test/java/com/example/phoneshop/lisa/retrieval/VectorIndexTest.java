package com.example.phoneshop.lisa.retrieval;

import static com.example.phoneshop.lisa.support.Passages.passage;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.phoneshop.lisa.generation.RetryPolicy;
import com.example.phoneshop.lisa.model.RankedResult;
import com.example.phoneshop.lisa.model.ResultSource;
import com.example.phoneshop.lisa.support.KeywordEmbeddingModel;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingSearchResult;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

class VectorIndexTest {

  private final KeywordEmbeddingModel embeddingModel = new KeywordEmbeddingModel("iphone", "galaxy", "xiaomi");

  @Test
  void seededPassagesComeBackWithIdAndMetadata() {
    VectorIndex index = new VectorIndex(new InMemoryEmbeddingStore<>(), embeddingModel,
        Duration.ofSeconds(5), RetryPolicy.none());
    index.seed(List.of(
        passage("p1", "iphone-16", "iPhone 16 chip A18"),
        passage("p2", "galaxy-s24", "Galaxy S24 Ultra bút S Pen"),
        passage("p3", "xiaomi-14", "Xiaomi 14 Leica")));

    List<RankedResult> results = index.search("galaxy có bút không", 2).block();

    assertThat(results).hasSize(2);
    RankedResult top = results.get(0);
    assertThat(top.passage().id()).isEqualTo("p2");
    assertThat(top.passage().productKey()).isEqualTo("galaxy-s24");
    assertThat(top.passage().metadata().url()).isEqualTo("https://shop.example/galaxy-s24");
    assertThat(top.source()).isEqualTo(ResultSource.VECTOR);
    assertThat(top.score()).isGreaterThan(results.get(1).score());
  }

  @Test
  void blankQueryDoesNotTouchTheStore() {
    @SuppressWarnings("unchecked")
    EmbeddingStore<TextSegment> store = mock(EmbeddingStore.class);
    VectorIndex index = new VectorIndex(store, embeddingModel, Duration.ofSeconds(5), RetryPolicy.none());

    StepVerifier.create(index.search("  ", 3))
        .expectNext(List.of())
        .verifyComplete();
    verify(store, times(0)).search(any());
  }

  @Test
  void transientStoreFailureIsRetried() {
    @SuppressWarnings("unchecked")
    EmbeddingStore<TextSegment> store = mock(EmbeddingStore.class);
    when(store.search(any(EmbeddingSearchRequest.class)))
        .thenThrow(new RuntimeException("503 unavailable"))
        .thenReturn(new EmbeddingSearchResult<>(List.of()));
    VectorIndex index = new VectorIndex(store, embeddingModel, Duration.ofSeconds(5),
        RetryPolicy.transientFailures(3, Duration.ofMillis(1)));

    StepVerifier.create(index.search("iphone", 3))
        .expectNext(List.of())
        .verifyComplete();
    verify(store, times(2)).search(any(EmbeddingSearchRequest.class));
  }
}
