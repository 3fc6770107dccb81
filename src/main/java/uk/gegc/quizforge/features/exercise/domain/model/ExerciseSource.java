package uk.gegc.quizforge.features.exercise.domain.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Content derived identity of an exercise definition.
 */
public final class ExerciseSource {

    private ExerciseSource() {
    }

    /**
     * Joins the inherited source fragments, base first, with a blank line.
     *
     * @return the combined source, or {@code null} if any fragment is unavailable
     */
    public static String combine(List<String> fragments) {
        if (fragments == null || fragments.isEmpty() || fragments.contains(null)) {
            return null;
        }
        return String.join("\n\n", fragments);
    }

    /**
     * SHA3-256 hex digest of the combined source, or {@code null} without source text.
     */
    public static String identifier(String source) {
        if (source == null) {
            return null;
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA3-256");
            return HexFormat.of().formatHex(digest.digest(source.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA3-256 algorithm unavailable", e);
        }
    }
}
