package in.co.pricematch.services;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deterministic in-memory embedding model for tests. Each word is hashed into one of a fixed
 * number of buckets, so identical texts get identical vectors and texts sharing words get a
 * positive cosine similarity.
 */
public class BagOfWordsEmbeddingModel implements EmbeddingModel {

    private static final int DIMENSION = 64;

    private final AtomicInteger embedCalls = new AtomicInteger();
    private final AtomicInteger embedAllCalls = new AtomicInteger();

    @Override
    public Response<Embedding> embed(String text) {
        embedCalls.incrementAndGet();
        return Response.from(vectorOf(text));
    }

    @Override
    public Response<Embedding> embed(TextSegment segment) {
        return embed(segment.text());
    }

    @Override
    public Response<List<Embedding>> embedAll(List<TextSegment> segments) {
        embedAllCalls.incrementAndGet();
        List<Embedding> embeddings = new ArrayList<>(segments.size());
        for (TextSegment segment : segments) {
            embeddings.add(vectorOf(segment.text()));
        }
        return Response.from(embeddings);
    }

    @Override
    public int dimension() {
        return DIMENSION;
    }

    public int getEmbedCalls() {
        return embedCalls.get();
    }

    public int getEmbedAllCalls() {
        return embedAllCalls.get();
    }

    private static Embedding vectorOf(String text) {
        float[] vector = new float[DIMENSION];
        // Bias bucket keeps every vector non-zero.
        vector[0] = 0.1f;
        for (String word : text.toLowerCase(Locale.ROOT).split("\\s+")) {
            if (!word.isEmpty()) {
                vector[1 + Math.floorMod(word.hashCode(), DIMENSION - 1)] += 1.0f;
            }
        }
        return Embedding.from(vector);
    }
}
