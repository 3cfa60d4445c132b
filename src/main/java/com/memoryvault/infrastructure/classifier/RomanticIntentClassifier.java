package com.memoryvault.infrastructure.classifier;

/**
 * Oracle deciding whether disclosure content expresses romantic intent.
 * Called once per disclosure, before the record is persisted.
 */
public interface RomanticIntentClassifier {

    boolean isRomantic(String content);
}
