package com.example.phoneshop.lisa.retrieval;

import static com.example.phoneshop.lisa.support.Passages.passage;
import static com.example.phoneshop.lisa.support.Passages.ranked;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.phoneshop.lisa.cache.InMemoryResultCache;
import com.example.phoneshop.lisa.model.RankedResult;
import com.example.phoneshop.lisa.model.ResultSource;
import com.example.phoneshop.lisa.support.MutableClock;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.scoring.ScoringModel;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class CrossEncoderRerankerTest {

  private ScoringModel scoringModel;
  private InMemoryResultCache cache;

  private final List<RankedResult> candidates = List.of(
      ranked("a1", "A", 1.0, ResultSource.FUSED),
      ranked("b1", "B", 1.0, ResultSource.FUSED),
      ranked("a2", "A", 0.5, ResultSource.FUSED),
      ranked("c1", "C", 0.5, ResultSource.FUSED));

  @BeforeEach
  void setUp() {
    scoringModel = mock(ScoringModel.class);
    cache = new InMemoryResultCache(100, new MutableClock(Instant.parse("2024-05-01T00:00:00Z")));
  }

  private CrossEncoderReranker reranker(RerankPolicy policy) {
    return new CrossEncoderReranker(scoringModel, cache, policy, 5.0, 2048, Duration.ofHours(24));
  }

  @Test
  void keepsBestPassagePerProductOrderedByScore() {
    when(scoringModel.scoreAll(anyList(), anyString()))
        .thenReturn(Response.from(List.of(2.0, 4.0, 7.0, 1.0)));

    List<RankedResult> out = reranker(RerankPolicy.TOP_K).rerank("q", candidates, 3).block();

    assertThat(out).extracting(r -> r.passage().id()).containsExactly("a2", "b1", "c1");
    assertThat(out).extracting(RankedResult::score).containsExactly(7.0, 4.0, 1.0);
    assertThat(out).allMatch(r -> r.source() == ResultSource.RERANKED);
  }

  @Test
  void topKLimitsProducts() {
    when(scoringModel.scoreAll(anyList(), anyString()))
        .thenReturn(Response.from(List.of(2.0, 4.0, 7.0, 1.0)));

    List<RankedResult> out = reranker(RerankPolicy.TOP_K).rerank("q", candidates, 1).block();

    assertThat(out).extracting(r -> r.passage().productKey()).containsExactly("A");
  }

  @Test
  void equalScoresKeepFusionOrder() {
    when(scoringModel.scoreAll(anyList(), anyString()))
        .thenReturn(Response.from(List.of(3.0, 3.0, 3.0, 3.0)));

    List<RankedResult> out = reranker(RerankPolicy.TOP_K).rerank("q", candidates, 3).block();

    assertThat(out).extracting(r -> r.passage().id()).containsExactly("a1", "b1", "c1");
  }

  @Test
  void thresholdPolicyKeepsProductsAboveThreshold() {
    when(scoringModel.scoreAll(anyList(), anyString()))
        .thenReturn(Response.from(List.of(6.0, 5.0, 9.0, 5.5)));

    List<RankedResult> out = reranker(RerankPolicy.THRESHOLD).rerank("q", candidates, 1).block();

    assertThat(out).extracting(r -> r.passage().id()).containsExactly("a2", "c1");
  }

  @Test
  void emptyCandidatesNeverCallTheModel() {
    assertThat(reranker(RerankPolicy.TOP_K).rerank("q", List.of(), 3).block()).isEmpty();
    verify(scoringModel, never()).scoreAll(anyList(), anyString());
  }

  @Test
  void secondCallIsServedFromCache() {
    when(scoringModel.scoreAll(anyList(), anyString()))
        .thenReturn(Response.from(List.of(2.0, 4.0, 7.0, 1.0)));
    CrossEncoderReranker reranker = reranker(RerankPolicy.TOP_K);

    List<RankedResult> first = reranker.rerank("q", candidates, 3).block();
    List<RankedResult> second = reranker.rerank("q", candidates, 3).block();

    assertThat(second).isEqualTo(first);
    verify(scoringModel, times(1)).scoreAll(anyList(), anyString());
  }

  @Test
  @SuppressWarnings("unchecked")
  void longContentIsTruncatedBeforeScoring() {
    RankedResult longOne = new RankedResult(passage("l1", "L", "x".repeat(5000)), 1.0, ResultSource.FUSED);
    when(scoringModel.scoreAll(anyList(), anyString())).thenReturn(Response.from(List.of(1.0)));

    new CrossEncoderReranker(scoringModel, cache, RerankPolicy.TOP_K, 5.0, 100, Duration.ofHours(1))
        .rerank("q", List.of(longOne), 3).block();

    ArgumentCaptor<List<TextSegment>> segments = ArgumentCaptor.forClass(List.class);
    verify(scoringModel).scoreAll(segments.capture(), anyString());
    assertThat(segments.getValue().get(0).text()).hasSize(100);
  }
}
