package com.memoryvault.infrastructure.voice;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Placeholder extractor: expands SHA-256 of the sample into a 512-value
 * vector centred on zero.
 *
 * <p>Identical samples score 1.0 against each other and unrelated samples
 * land near 0. It carries no speaker information and exists so the
 * authentication pipeline can run end to end until a real model is wired in.
 */
@Component
@Slf4j
public class DigestEmbeddingExtractor implements EmbeddingExtractor {

    static final int DIMENSIONS = 512;

    private static final String MODEL_VERSION = "digest-sha256-512-v1";

    @Override
    public double[] extract(byte[] audio) {
        if (audio == null || audio.length == 0) {
            throw new IllegalArgumentException("Audio sample must not be empty");
        }
        MessageDigest digest = sha256();
        double[] embedding = new double[DIMENSIONS];
        int filled = 0;
        int block = 0;
        while (filled < DIMENSIONS) {
            digest.update(audio);
            digest.update(ByteBuffer.allocate(Integer.BYTES).putInt(block++).array());
            for (byte b : digest.digest()) {
                if (filled == DIMENSIONS) {
                    break;
                }
                embedding[filled++] = ((b & 0xFF) - 127.5) / 127.5;
            }
        }
        if (log.isTraceEnabled()) {
            log.trace("Extracted {}-dim embedding from {} audio bytes", DIMENSIONS, audio.length);
        }
        return embedding;
    }

    @Override
    public int dimensions() {
        return DIMENSIONS;
    }

    @Override
    public String modelVersion() {
        return MODEL_VERSION;
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
