package com.memoryvault.infrastructure.voice;

/**
 * Turns a raw audio sample into a fixed-length speaker embedding.
 *
 * <p>Implementations must be deterministic for identical input and return
 * vectors of {@link #dimensions()} length. Similarity between embeddings is
 * computed by {@link Embeddings#cosine}.
 */
public interface EmbeddingExtractor {

    double[] extract(byte[] audio);

    int dimensions();

    /**
     * Version tag stored with every voiceprint this extractor produced.
     */
    String modelVersion();
}
