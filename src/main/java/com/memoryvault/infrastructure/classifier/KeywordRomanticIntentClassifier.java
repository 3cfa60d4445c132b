package com.memoryvault.infrastructure.classifier;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Default classifier: whole-word, case-insensitive phrase matching.
 *
 * <p>Negations ("I don't love him") still count as
 * romantic; a language-model backed implementation can replace this bean.
 */
@Component
@Slf4j
public class KeywordRomanticIntentClassifier implements RomanticIntentClassifier {

    private static final List<String> PHRASES = List.of(
        "love",
        "in love",
        "crush",
        "feelings for",
        "attracted to",
        "romantic",
        "kiss",
        "date",
        "dating",
        "marry",
        "soulmate",
        "girlfriend",
        "boyfriend"
    );

    private static final Pattern ROMANTIC = Pattern.compile(
        "\\b(" + String.join("|", PHRASES.stream().map(Pattern::quote).toList()) + ")\\b",
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
    );

    @Override
    public boolean isRomantic(String content) {
        if (content == null || content.isBlank()) {
            return false;
        }
        boolean romantic = ROMANTIC.matcher(content.toLowerCase(Locale.ROOT)).find();
        if (log.isDebugEnabled()) {
            log.debug("Classified {} chars of disclosure content: romantic={}", content.length(), romantic);
        }
        return romantic;
    }
}
