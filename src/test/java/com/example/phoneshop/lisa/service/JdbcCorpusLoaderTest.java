package com.example.phoneshop.lisa.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.phoneshop.lisa.model.Passage;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

class JdbcCorpusLoaderTest {

  private final NamedParameterJdbcTemplate jdbc = mock(NamedParameterJdbcTemplate.class);
  private final JdbcCorpusLoader loader = new JdbcCorpusLoader(jdbc, new ObjectMapper(), "production");

  @Test
  void prefersStoredPassageIdAndStringifiesNumbers() {
    Passage p = loader.toPassage("emb-1", "Galaxy S24",
        "{\"passage_id\":\"g1\",\"product_id\":\"galaxy-s24\",\"price\":21990000}");

    assertThat(p.id()).isEqualTo("g1");
    assertThat(p.productKey()).isEqualTo("galaxy-s24");
    assertThat(p.metadata().price()).isEqualTo("21990000");
  }

  @Test
  void fallsBackToEmbeddingIdWhenMetadataIsMissingOrBroken() {
    assertThat(loader.toPassage("emb-2", "text", null).id()).isEqualTo("emb-2");
    assertThat(loader.toPassage("emb-3", "text", "{not json").productKey()).isEqualTo("emb-3");
  }

  @Test
  @SuppressWarnings("unchecked")
  void databaseFailureAbortsTheLoad() {
    when(jdbc.query(anyString(), any(SqlParameterSource.class), any(RowMapper.class)))
        .thenThrow(new DataAccessResourceFailureException("connection refused"));

    assertThatThrownBy(loader::load)
        .isInstanceOf(CorpusLoadException.class)
        .hasMessageContaining("production");
  }

  @Test
  void rejectsUnsafeTableNames() {
    assertThatThrownBy(() -> new JdbcCorpusLoader(jdbc, new ObjectMapper(), "x; drop table y"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
