package uk.gegc.quizforge.features.exercise.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import uk.gegc.quizforge.features.exercise.domain.hook.HintsResult;
import uk.gegc.quizforge.features.exercise.domain.hook.Hook;
import uk.gegc.quizforge.features.exercise.domain.hook.ScoreResult;
import uk.gegc.quizforge.features.exercise.domain.hook.SolutionResult;
import uk.gegc.quizforge.features.model.domain.model.ProblemModel;
import uk.gegc.quizforge.features.pool.domain.model.PoolItem;
import uk.gegc.quizforge.shared.exception.ExerciseConfigurationException;

import java.util.List;
import java.util.Map;

/**
 * Stateless template of one exercise.
 * <p>
 * Only the {@code problem} hook is mandatory; every other hook defaults to an empty
 * result (no parameters, empty preamble and feedback, no solutions, no hints,
 * automatic scoring). Settings are validated when the definition is built, so a
 * definition that exists is always correctly configured.
 * </p>
 */
@Getter
public final class ExerciseDefinition implements PoolItem {

    private final String name;
    private final ExerciseMetadata metadata;
    private final ExerciseSettings settings;

    private final Hook<Map<String, Object>> parameters;
    private final Hook<ProblemModel> problem;
    private final Hook<String> preamble;
    private final Hook<SolutionResult> theSolution;
    private final Hook<SolutionResult> aSolution;
    private final Hook<HintsResult> hints;
    private final Hook<ScoreResult> scores;
    private final Hook<String> feedback;

    /**
     * Source text of this definition and of the definitions it extends, base first.
     * A {@code null} fragment marks source text that is not available.
     */
    private final List<String> sourceFragments;

    @Builder(toBuilder = true)
    private ExerciseDefinition(String name,
                               ExerciseMetadata metadata,
                               ExerciseSettings settings,
                               Hook<Map<String, Object>> parameters,
                               Hook<ProblemModel> problem,
                               Hook<String> preamble,
                               Hook<SolutionResult> theSolution,
                               Hook<SolutionResult> aSolution,
                               Hook<HintsResult> hints,
                               Hook<ScoreResult> scores,
                               Hook<String> feedback,
                               @Singular List<String> sourceFragments) {
        if (name == null || name.isBlank()) {
            throw new ExerciseConfigurationException("An exercise needs a name.");
        }
        if (problem == null) {
            throw new ExerciseConfigurationException("Exercise '" + name + "' does not define a problem.");
        }
        this.name = name;
        this.metadata = metadata != null ? metadata : ExerciseMetadata.empty();
        this.settings = settings != null ? settings : ExerciseSettings.DEFAULT;
        this.parameters = parameters != null ? parameters : Hook.constant(Map.of());
        this.problem = problem;
        this.preamble = preamble != null ? preamble : Hook.constant("");
        this.theSolution = theSolution != null ? theSolution : Hook.constant(SolutionResult.none());
        this.aSolution = aSolution != null ? aSolution : Hook.constant(SolutionResult.none());
        this.hints = hints != null ? hints : Hook.constant(HintsResult.none());
        this.scores = scores != null ? scores : Hook.constant(ScoreResult.automatic());
        this.feedback = feedback != null ? feedback : Hook.constant("");
        this.sourceFragments = sourceFragments;
    }

    public ExerciseDefinition withSettings(ExerciseSettings settings) {
        return toBuilder().settings(settings).build();
    }

    public ExerciseDefinition withWeights(WeightSpec weights) {
        return withSettings(settings.withWeights(weights));
    }

    /**
     * Copy whose weights are multiplied by {@code factor}, used when a pool weights its items.
     */
    public ExerciseDefinition scaledBy(double factor) {
        return withWeights(settings.weights().scaledBy(factor));
    }

    /**
     * Extends this definition: the copy carries the given name and appends
     * {@code sourceText} to the inherited source.
     */
    public ExerciseDefinition.ExerciseDefinitionBuilder extend(String name, String sourceText) {
        return toBuilder().name(name).sourceFragment(sourceText);
    }

    /**
     * Title from the metadata, falling back to the definition name.
     */
    @Override
    public String label() {
        return metadata.title() != null ? metadata.title() : name;
    }

    @Override
    public String toString() {
        return "ExerciseDefinition{" + name + "}";
    }
}
