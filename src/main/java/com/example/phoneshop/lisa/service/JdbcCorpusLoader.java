package com.example.phoneshop.lisa.service;

import com.example.phoneshop.lisa.model.Passage;
import com.example.phoneshop.lisa.model.PassageMetadata;
import com.example.phoneshop.lisa.retrieval.VectorIndex;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads passages straight from the table behind the pgvector embedding store
 * ({@code embedding_id, text, metadata}), so that the lexical index covers exactly what the
 * vector index can return.
 */
@Slf4j
public class JdbcCorpusLoader implements CorpusLoader {

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final String table;

    public JdbcCorpusLoader(NamedParameterJdbcTemplate jdbcTemplate, ObjectMapper objectMapper, String table) {
        if (table == null || !TABLE_NAME.matcher(table).matches()) {
            throw new IllegalArgumentException("invalid table name: " + table);
        }
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.table = table;
    }

    @Override
    public List<Passage> load() {
        String sql = "SELECT embedding_id::text AS embedding_id, text, metadata::text AS metadata FROM " + table;
        try {
            List<Passage> passages = jdbcTemplate.query(sql, new MapSqlParameterSource(),
                    (rs, rowNum) -> toPassage(rs.getString("embedding_id"), rs.getString("text"), rs.getString("metadata")));
            log.info("loaded {} passages from table {}", passages.size(), table);
            return passages;
        } catch (DataAccessException e) {
            throw new CorpusLoadException("cannot read corpus from table " + table, e);
        }
    }

    Passage toPassage(String embeddingId, String text, String metadataJson) {
        Map<String, Object> meta = Map.of();
        if (metadataJson != null && !metadataJson.isBlank()) {
            try {
                meta = objectMapper.readValue(metadataJson, new TypeReference<Map<String, Object>>() {});
            } catch (JsonProcessingException e) {
                log.warn("ignoring unreadable metadata for {}: {}", embeddingId, e.getOriginalMessage());
            }
        }
        Object storedId = meta.get(VectorIndex.PASSAGE_ID);
        String id = storedId == null ? embeddingId : String.valueOf(storedId);
        return new Passage(id, text, PassageMetadata.fromMap(meta));
    }
}
