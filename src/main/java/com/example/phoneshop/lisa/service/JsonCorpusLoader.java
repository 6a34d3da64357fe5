package com.example.phoneshop.lisa.service;

import com.example.phoneshop.lisa.model.Passage;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/** Reads a JSON array of passages from any Spring resource location. */
@Slf4j
public class JsonCorpusLoader implements CorpusLoader {

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final String location;

    public JsonCorpusLoader(ResourceLoader resourceLoader, ObjectMapper objectMapper, String location) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.location = location;
    }

    @Override
    public List<Passage> load() {
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            List<Passage> passages = objectMapper.readValue(in, new TypeReference<List<Passage>>() {});
            List<Passage> result = passages == null ? List.of() : passages;
            log.info("loaded {} passages from {}", result.size(), location);
            return result;
        } catch (IOException e) {
            throw new CorpusLoadException("cannot read corpus from " + location, e);
        }
    }
}
