package com.example.phoneshop.lisa.retrieval;

import static com.example.phoneshop.lisa.support.Passages.ranked;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.phoneshop.lisa.cache.InMemoryResultCache;
import com.example.phoneshop.lisa.model.RankedResult;
import com.example.phoneshop.lisa.model.ResultSource;
import com.example.phoneshop.lisa.support.MutableClock;
import com.example.phoneshop.lisa.support.StubRetriever;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.scoring.ScoringModel;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class RetrievalServiceTest {

  private final InMemoryResultCache cache =
      new InMemoryResultCache(100, new MutableClock(Instant.parse("2024-05-01T00:00:00Z")));
  private final StubRetriever lexical = new StubRetriever(ResultSource.LEXICAL, List.of(
      ranked("a1", "A", 3.0, ResultSource.LEXICAL),
      ranked("b1", "B", 2.0, ResultSource.LEXICAL),
      ranked("c1", "C", 1.0, ResultSource.LEXICAL)));
  private final StubRetriever vector = new StubRetriever(ResultSource.VECTOR, List.of());
  private final FusionEngine fusion = new FusionEngine(lexical, vector, cache, 0.5, 0.5, Duration.ofHours(1));

  @Test
  void withoutRerankerFusedListIsCutToTopK() {
    RetrievalService service = new RetrievalService(fusion, null, RerankGate.ALWAYS, List.of(), 10, 2);

    List<RankedResult> out = service.retrieve("q").block();

    assertThat(out).extracting(r -> r.passage().productKey()).containsExactly("A", "B");
  }

  @Test
  void keywordGateSkipsRerankingForPlainQueries() {
    ScoringModel scoring = mock(ScoringModel.class);
    CrossEncoderReranker reranker =
        new CrossEncoderReranker(scoring, cache, RerankPolicy.TOP_K, 5.0, 2048, Duration.ofHours(1));
    RetrievalService service = new RetrievalService(fusion, reranker, RerankGate.KEYWORDS,
        List.of("so sánh", "nên mua"), 10, 3);

    service.retrieve("giá iphone").block();

    verify(scoring, never()).scoreAll(anyList(), anyString());
  }

  @Test
  void keywordGateReranksMatchingQueries() {
    ScoringModel scoring = mock(ScoringModel.class);
    when(scoring.scoreAll(anyList(), anyString())).thenReturn(Response.from(List.of(1.0, 9.0, 5.0)));
    CrossEncoderReranker reranker =
        new CrossEncoderReranker(scoring, cache, RerankPolicy.TOP_K, 5.0, 2048, Duration.ofHours(1));
    RetrievalService service = new RetrievalService(fusion, reranker, RerankGate.KEYWORDS,
        List.of("so sánh", "nên mua"), 10, 2);

    List<RankedResult> out = service.retrieve("Nên mua máy nào").block();

    assertThat(out).extracting(r -> r.passage().productKey()).containsExactly("B", "C");
  }
}
