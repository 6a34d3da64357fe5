package com.example.phoneshop.lisa.retrieval;

import com.example.phoneshop.lisa.model.Passage;
import com.example.phoneshop.lisa.model.RankedResult;
import com.example.phoneshop.lisa.model.ResultSource;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * In-memory BM25 over title and content. Built once from the full corpus; immutable afterwards,
 * so searches need no locking.
 */
@Slf4j
public class LexicalIndex implements PassageRetriever {

    private static final double K1 = 1.5;
    private static final double B = 0.75;

    private final List<Passage> docs;
    private final List<Map<String, Integer>> termFreqs;
    private final int[] docLengths;
    private final Map<String, Integer> df = new HashMap<>();
    private final double avgDocLength;

    public LexicalIndex(List<Passage> corpus) {
        List<Passage> source = (corpus == null || corpus.isEmpty())
                ? List.of(SentinelPassage.welcome())
                : corpus;
        this.docs = List.copyOf(source);
        this.termFreqs = new ArrayList<>(docs.size());
        this.docLengths = new int[docs.size()];

        long total = 0;
        for (int i = 0; i < docs.size(); i++) {
            List<String> tokens = tokenize(indexText(docs.get(i)));
            Map<String, Integer> tf = new HashMap<>();
            for (String t : tokens) {
                tf.merge(t, 1, Integer::sum);
            }
            termFreqs.add(tf);
            docLengths[i] = tokens.size();
            total += tokens.size();
            for (String t : tf.keySet()) {
                df.merge(t, 1, Integer::sum);
            }
        }
        this.avgDocLength = docs.isEmpty() ? 1.0 : Math.max(1.0, (double) total / docs.size());
        log.info("lexical index built: {} passages, {} terms", docs.size(), df.size());
    }

    @Override
    public ResultSource kind() {
        return ResultSource.LEXICAL;
    }

    @Override
    public Mono<List<RankedResult>> search(String query, int k) {
        return Mono.fromCallable(() -> rank(query, k));
    }

    public int size() {
        return docs.size();
    }

    public List<Passage> passages() {
        return docs;
    }

    /** True when the catalog was empty and only the welcome passage is indexed. */
    public boolean isSentinelOnly() {
        return docs.size() == 1 && SentinelPassage.ID.equals(docs.get(0).id());
    }

    List<RankedResult> rank(String query, int k) {
        if (k <= 0 || query == null || query.isBlank()) {
            return List.of();
        }
        Set<String> terms = new HashSet<>(tokenize(query));
        int n = docs.size();
        List<RankedResult> scored = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            Map<String, Integer> tf = termFreqs.get(i);
            double score = 0.0;
            for (String t : terms) {
                Integer f = tf.get(t);
                if (f == null) {
                    continue;
                }
                int nq = df.getOrDefault(t, 0);
                double idf = Math.log(1.0 + (n - nq + 0.5) / (nq + 0.5));
                double denom = f + K1 * (1 - B + B * (docLengths[i] / avgDocLength));
                score += idf * (f * (K1 + 1)) / denom;
            }
            if (score > 0) {
                scored.add(new RankedResult(docs.get(i), score, ResultSource.LEXICAL));
            }
        }
        // List.sort is stable, so equal scores keep corpus order
        scored.sort((a, b) -> Double.compare(b.score(), a.score()));
        return scored.size() > k ? List.copyOf(scored.subList(0, k)) : scored;
    }

    static List<String> tokenize(String s) {
        if (s == null) {
            return Collections.emptyList();
        }
        // composed form, otherwise decomposed diacritics would split words
        String norm = Normalizer.normalize(s, Normalizer.Form.NFC).toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{Nd}\\s]", " ");
        List<String> out = new ArrayList<>();
        for (String p : norm.split("\\s+")) {
            if (!p.isEmpty()) {
                out.add(p);
            }
        }
        return out;
    }

    private static String indexText(Passage p) {
        String title = p.metadata().title();
        return title == null ? p.content() : title + " " + p.content();
    }
}
