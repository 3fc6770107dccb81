package uk.gegc.quizforge.shared.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Global defaults handed to every exercise attempt.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "quizforge")
public class QuizForgeProperties {

    /**
     * Name recorded for attempts when the caller does not supply one.
     * Default: John Doe
     */
    @NotBlank
    private String userName = "John Doe";

    /**
     * Difficulty range used when an exercise does not declare its own.
     */
    @Valid
    private Difficulty difficulty = new Difficulty();

    /**
     * Number of decimals kept when total scores are sent to observers.
     * Default: 2
     */
    @Min(0)
    private int totalScoreDecimals = 2;

    /**
     * Engine values copied into the JSON summary written to the history log.
     */
    private List<String> summaryItems = new ArrayList<>(List.of(
            "parameters", "answers", "the_solution", "a_solution", "scores", "max_scores",
            "total_score", "max_total_score", "correct", "started_at", "submitted_at", "user_name"));

    private Persistence persistence = new Persistence();

    @Data
    public static class Difficulty {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double min = 0.0;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double max = 1.0;
    }

    @Data
    public static class Persistence {
        /**
         * When false, attempts are never written to the database.
         * Default: true
         */
        private boolean enabled = true;
    }
}
