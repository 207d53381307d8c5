package in.co.pricematch.services;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.store.embedding.CosineSimilarity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Bounded cache of sentence embeddings keyed by normalized product name, so each unique name
 * is sent to the embedding model once per engine. Safe for concurrent use.
 */
public class EmbeddingCache {

    private final EmbeddingModel model;
    private final Cache<String, Embedding> cache;

    public EmbeddingCache(EmbeddingModel model, int maximumSize) {
        this.model = model;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .build();
    }

    public Embedding embed(String text) {
        try {
            return cache.get(text, key -> {
                Response<Embedding> response = model.embed(key);
                if (response == null || response.content() == null) {
                    throw new ScoringException("Embedding model returned no vector for '" + key + "'");
                }
                return response.content();
            });
        } catch (ScoringException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ScoringException("Embedding model failed for '" + text + "'", e);
        }
    }

    /**
     * Cosine similarity of the embeddings of two texts.
     */
    public double cosine(String a, String b) {
        Embedding ea = embed(a);
        Embedding eb = embed(b);
        try {
            return CosineSimilarity.between(ea, eb);
        } catch (IllegalArgumentException e) {
            throw new ScoringException("Embeddings are not comparable: '" + a + "' vs '" + b + "'", e);
        }
    }

    /**
     * Embed every text not yet cached in a single batch call.
     *
     * @return number of texts sent to the model
     */
    public int warmUp(Collection<String> texts) {
        Set<String> missing = new LinkedHashSet<>();
        for (String text : texts) {
            if (text != null && !text.isBlank() && cache.getIfPresent(text) == null) {
                missing.add(text);
            }
        }
        if (missing.isEmpty()) {
            return 0;
        }

        List<String> ordered = new ArrayList<>(missing);
        List<TextSegment> segments = new ArrayList<>(ordered.size());
        for (String text : ordered) {
            segments.add(TextSegment.from(text));
        }
        Response<List<Embedding>> batch = model.embedAll(segments);
        List<Embedding> embeddings = batch == null ? null : batch.content();
        if (embeddings == null || embeddings.size() != ordered.size()) {
            // Fall back to lazy per-text embedding.
            LoggingService.warn("embedding_warmup_incomplete", LoggingService.data(
                    "requested", ordered.size(), "received", embeddings == null ? 0 : embeddings.size()));
            return 0;
        }
        for (int i = 0; i < ordered.size(); i++) {
            cache.put(ordered.get(i), embeddings.get(i));
        }
        return ordered.size();
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
