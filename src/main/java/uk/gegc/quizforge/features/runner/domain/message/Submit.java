package uk.gegc.quizforge.features.runner.domain.message;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Inbound submission carrying the answers known to the frontend.
 */
public record Submit(String sender, Map<String, Object> answers) implements ExerciseMessage {

    public Submit {
        answers = answers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(answers));
    }

    public static Submit of(String sender) {
        return new Submit(sender, Map.of());
    }
}
