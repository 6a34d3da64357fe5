package com.example.phoneshop.lisa.service;

import com.example.phoneshop.lisa.model.Passage;

import java.util.List;

/** Source of the full catalog, read once at startup to build the lexical index. */
public interface CorpusLoader {

    /**
     * @throws CorpusLoadException when the catalog cannot be read; startup is aborted
     */
    List<Passage> load();
}
