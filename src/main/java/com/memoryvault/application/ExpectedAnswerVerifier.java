package com.memoryvault.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Default response check: normalized comparison against the expected answer.
 *
 * <p>Normalization lower-cases, strips accents and surrounding punctuation
 * and collapses whitespace. Temporal answers must parse as the same ISO date.
 * Relationship answers may be prefixed with "my".
 */
@Component
@Slf4j
public class ExpectedAnswerVerifier implements ChallengeResponseVerifier {

    @Override
    public boolean matches(IssuedChallenge challenge, String response) {
        if (response == null || response.isBlank()) {
            return false;
        }
        String expected = challenge.getExpectedAnswer();
        return switch (challenge.getType()) {
            case TEMPORAL -> sameDate(expected, response);
            case RELATIONSHIP -> normalize(response).replaceFirst("^my ", "").equals(normalize(expected));
            case CONTENT, IDENTITY -> normalize(response).equals(normalize(expected));
        };
    }

    private static boolean sameDate(String expected, String response) {
        try {
            return LocalDate.parse(expected).equals(LocalDate.parse(response.strip()));
        } catch (DateTimeParseException e) {
            log.debug("Temporal answer is not an ISO date: {}", e.getMessage());
            return false;
        }
    }

    static String normalize(String value) {
        String decomposed = Normalizer.normalize(value, Normalizer.Form.NFKD)
            .replaceAll("\\p{M}", "");
        return decomposed.toLowerCase(Locale.ROOT)
            .replaceAll("[^\\p{L}\\p{N}\\s'-]", " ")
            .replaceAll("\\s+", " ")
            .strip();
    }
}
