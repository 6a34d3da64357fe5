package com.example.phoneshop.lisa.tools;

import static com.example.phoneshop.lisa.support.Passages.ranked;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.phoneshop.lisa.model.ResultSource;
import com.example.phoneshop.lisa.retrieval.RetrievalService;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class ProductSearchToolTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final RetrievalService retrieval = mock(RetrievalService.class);
  private final ProductSearchTool tool = new ProductSearchTool(retrieval);

  @Test
  void formatsRetrievedPassages() {
    when(retrieval.retrieve(anyString()))
        .thenReturn(Mono.just(List.of(ranked("i1", "iphone-16", 1.0, ResultSource.RERANKED))));

    StepVerifier.create(tool.definition().invoke(objectMapper.createObjectNode().put("query", "giá iPhone 16")))
        .expectNext("Source: Title iphone-16\nURL: https://shop.example/iphone-16\nPrice: 1000\nContent: content of i1")
        .verifyComplete();
  }

  @Test
  void emptyResultIsExplained() {
    when(retrieval.retrieve(anyString())).thenReturn(Mono.just(List.of()));

    StepVerifier.create(tool.run(objectMapper.createObjectNode().put("query", "nokia")))
        .expectNext(ProductSearchTool.NOTHING_FOUND)
        .verifyComplete();
  }
}
