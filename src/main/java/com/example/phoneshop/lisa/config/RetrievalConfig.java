package com.example.phoneshop.lisa.config;

import com.example.phoneshop.lisa.cache.ResultCache;
import com.example.phoneshop.lisa.generation.RetryPolicy;
import com.example.phoneshop.lisa.retrieval.CrossEncoderReranker;
import com.example.phoneshop.lisa.retrieval.FusionEngine;
import com.example.phoneshop.lisa.retrieval.LexicalIndex;
import com.example.phoneshop.lisa.retrieval.RetrievalService;
import com.example.phoneshop.lisa.retrieval.VectorIndex;
import com.example.phoneshop.lisa.service.CorpusLoader;
import com.example.phoneshop.lisa.service.JdbcCorpusLoader;
import com.example.phoneshop.lisa.service.JsonCorpusLoader;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.scoring.ScoringModel;
import dev.langchain4j.model.scoring.onnx.OnnxScoringModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import dev.langchain4j.store.embedding.pgvector.PgVectorEmbeddingStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

/**
 * Catalog, indexes, fusion and reranking. The corpus is read once while the context starts; a
 * failure there stops startup.
 */
@Slf4j
@Configuration
public class RetrievalConfig {

    @Bean
    public EmbeddingStore<TextSegment> embeddingStore(LisaProperties props) {
        LisaProperties.Vector v = props.getVector();
        if (v.getStore() == LisaProperties.Vector.Store.PGVECTOR) {
            LisaProperties.Pgvector p = v.getPgvector();
            log.info("vector store: pgvector {}:{}/{} table {}", p.getHost(), p.getPort(), p.getDatabase(), p.getTable());
            return PgVectorEmbeddingStore.builder()
                    .host(p.getHost())
                    .port(p.getPort())
                    .database(p.getDatabase())
                    .user(p.getUser())
                    .password(p.getPassword())
                    .table(p.getTable())
                    .dimension(p.getDimension())
                    .createTable(false)
                    .dropTableFirst(false)
                    .build();
        }
        log.info("vector store: in-memory");
        return new InMemoryEmbeddingStore<>();
    }

    @Bean
    public CorpusLoader corpusLoader(LisaProperties props, ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        if (props.getCorpus().getSource() == LisaProperties.Corpus.Source.PGVECTOR) {
            LisaProperties.Pgvector p = props.getVector().getPgvector();
            DriverManagerDataSource dataSource = new DriverManagerDataSource(
                    "jdbc:postgresql://" + p.getHost() + ":" + p.getPort() + "/" + p.getDatabase(),
                    p.getUser(), p.getPassword());
            dataSource.setDriverClassName("org.postgresql.Driver");
            return new JdbcCorpusLoader(new NamedParameterJdbcTemplate(dataSource), objectMapper, p.getTable());
        }
        return new JsonCorpusLoader(resourceLoader, objectMapper, props.getCorpus().getLocation());
    }

    @Bean
    public LexicalIndex lexicalIndex(CorpusLoader corpusLoader) {
        return new LexicalIndex(corpusLoader.load());
    }

    @Bean
    public VectorIndex vectorIndex(EmbeddingStore<TextSegment> embeddingStore,
                                   EmbeddingModel embeddingModel,
                                   RetryPolicy generationRetryPolicy,
                                   LexicalIndex lexicalIndex,
                                   LisaProperties props) {
        VectorIndex index = new VectorIndex(embeddingStore, embeddingModel,
                props.getRetrieval().getSearchTimeout(), generationRetryPolicy);
        if (lexicalIndex.isSentinelOnly()) {
            log.warn("catalog is empty, seeding the vector store with the welcome passage");
            index.seed(lexicalIndex.passages());
        } else if (props.getVector().isSeedFromCorpus()) {
            index.seed(lexicalIndex.passages());
        }
        return index;
    }

    @Bean
    public FusionEngine fusionEngine(LexicalIndex lexicalIndex, VectorIndex vectorIndex,
                                     ResultCache resultCache, LisaProperties props) {
        LisaProperties.Retrieval r = props.getRetrieval();
        return new FusionEngine(lexicalIndex, vectorIndex, resultCache,
                r.getLexicalWeight(), r.getVectorWeight(), r.getCacheTtl());
    }

    @Bean
    @ConditionalOnProperty(name = "lisa.rerank.enabled", havingValue = "true")
    public ScoringModel scoringModel(LisaProperties props) {
        LisaProperties.Rerank r = props.getRerank();
        if (isBlank(r.getModelPath()) || isBlank(r.getTokenizerPath())) {
            throw new IllegalStateException(
                    "lisa.rerank.model-path and lisa.rerank.tokenizer-path are required when reranking is enabled");
        }
        log.info("cross-encoder: {}", r.getModelPath());
        return new OnnxScoringModel(r.getModelPath(), r.getTokenizerPath());
    }

    @Bean
    @ConditionalOnProperty(name = "lisa.rerank.enabled", havingValue = "true")
    public CrossEncoderReranker crossEncoderReranker(ScoringModel scoringModel, ResultCache resultCache,
                                                     LisaProperties props) {
        LisaProperties.Rerank r = props.getRerank();
        return new CrossEncoderReranker(scoringModel, resultCache, r.getPolicy(), r.getThreshold(),
                r.getMaxContentChars(), r.getCacheTtl());
    }

    @Bean
    public RetrievalService retrievalService(FusionEngine fusionEngine,
                                             ObjectProvider<CrossEncoderReranker> reranker,
                                             LisaProperties props) {
        CrossEncoderReranker active = reranker.getIfAvailable();
        if (active == null) {
            log.info("reranking disabled, fused results are used as they are");
        }
        LisaProperties.Retrieval r = props.getRetrieval();
        return new RetrievalService(fusionEngine, active, props.getRerank().getGate(),
                props.getRerank().getGateKeywords(), r.getCandidateTopK(), r.getTopK());
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
