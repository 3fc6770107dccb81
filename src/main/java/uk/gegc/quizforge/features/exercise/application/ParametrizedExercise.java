package uk.gegc.quizforge.features.exercise.application;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import uk.gegc.quizforge.features.exercise.domain.hook.HintsResult;
import uk.gegc.quizforge.features.exercise.domain.hook.SolutionResult;
import uk.gegc.quizforge.features.exercise.domain.model.ExerciseDefinition;
import uk.gegc.quizforge.features.exercise.domain.model.ExerciseMetadata;
import uk.gegc.quizforge.features.exercise.domain.model.ExerciseSettings;
import uk.gegc.quizforge.features.exercise.domain.model.ExerciseSource;
import uk.gegc.quizforge.features.exercise.domain.model.GlobalParameters;
import uk.gegc.quizforge.features.model.domain.model.InputField;
import uk.gegc.quizforge.features.model.domain.model.ProblemModel;
import uk.gegc.quizforge.features.scoring.application.ScoreCalculator;
import uk.gegc.quizforge.features.scoring.application.ScoreWeights;
import uk.gegc.quizforge.features.scoring.domain.model.ScoreSheet;
import uk.gegc.quizforge.shared.exception.ExerciseConfigurationException;
import uk.gegc.quizforge.shared.exception.IllPosedExerciseException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.function.Function;

/**
 * One random instance of an exercise definition.
 * <p>
 * Every derived value is computed on first access and memoized for the lifetime of the
 * instance, so an attempt stays consistent even when the definition's hooks are not
 * deterministic. Dependency order: parameters, model, input fields, solutions, weights,
 * maximal scores, scores. Instances are not thread safe; one instance serves one attempt.
 * </p>
 */
@Slf4j
public class ParametrizedExercise {

    /**
     * Input fields whose name ends with this suffix take their solution from the
     * parameter of the same name without the suffix, unless a solution is given explicitly.
     */
    public static final String IMPLICIT_SOLUTION_SUFFIX = "_";

    @Getter
    private final ExerciseDefinition definition;
    @Getter
    private final GlobalParameters globalParameters;
    private final Double requestedDifficulty;
    private final Random random;
    private final MemoTable memo = new MemoTable();

    private Double difficulty;

    @Getter
    @Setter
    private Instant startedAt;
    @Getter
    @Setter
    private Instant submittedAt;

    public ParametrizedExercise(ExerciseDefinition definition) {
        this(definition, GlobalParameters.defaults(), null, new Random());
    }

    public ParametrizedExercise(ExerciseDefinition definition,
                                GlobalParameters globalParameters,
                                Double difficulty,
                                Random random) {
        ExerciseSettings.requireDifficulty("difficulty", difficulty);
        this.definition = Objects.requireNonNull(definition, "definition");
        this.globalParameters = globalParameters != null ? globalParameters : GlobalParameters.defaults();
        this.requestedDifficulty = difficulty;
        this.random = random != null ? random : new Random();
    }

    public String getName() {
        return definition.getName();
    }

    public String getUserName() {
        return globalParameters.userName();
    }

    public ExerciseMetadata metadata() {
        return definition.getMetadata();
    }

    public String source() {
        return memo.get(DerivedValue.SOURCE, () -> ExerciseSource.combine(definition.getSourceFragments()));
    }

    /**
     * Content hash of the definition's source, {@code null} if the source is unavailable.
     */
    public String id() {
        return memo.get(DerivedValue.ID, () -> ExerciseSource.identifier(source()));
    }

    /**
     * The difficulty the parameters were sampled with; triggers sampling.
     */
    public double difficulty() {
        parameters();
        return difficulty;
    }

    public Map<String, Object> parameters() {
        return memo.get(DerivedValue.PARAMETERS, () -> {
            double sampled;
            if (requestedDifficulty != null) {
                sampled = requestedDifficulty;
            } else {
                ExerciseSettings settings = definition.getSettings();
                double min = settings.minDifficulty() != null ? settings.minDifficulty() : globalParameters.minDifficulty();
                double max = settings.maxDifficulty() != null ? settings.maxDifficulty() : globalParameters.maxDifficulty();
                sampled = min + (max - min) * random.nextDouble();
            }
            difficulty = sampled;
            Map<String, Object> bag = globalParameters.asBag();
            bag.put(GlobalParameters.DIFFICULTY, sampled);
            Map<String, Object> sample = definition.getParameters().apply(bag);
            log.debug("Sampled parameters for {} at difficulty {}: {}", getName(), sampled, sample);
            Map<String, Object> copy = new LinkedHashMap<>();
            if (sample != null) {
                copy.putAll(sample);
            }
            return Collections.unmodifiableMap(copy);
        });
    }

    public ProblemModel model() {
        return memo.get(DerivedValue.MODEL, () -> {
            Map<String, Object> parameters = parameters();
            ProblemModel model = definition.getProblem().apply(parameters);
            if (model == null) {
                throw new IllPosedExerciseException("The problem method of '" + getName() + "' returned nothing.");
            }
            for (String outputField : model.outputFields()) {
                if (!parameters.containsKey(outputField)) {
                    throw new IllPosedExerciseException("No parameter for output field '" + outputField + "'.");
                }
            }
            return model;
        });
    }

    public String template() {
        return memo.get(DerivedValue.TEMPLATE, () -> model().render(parameters()));
    }

    public String preamble() {
        return memo.get(DerivedValue.PREAMBLE, () -> {
            String preamble = definition.getPreamble().apply(parameters());
            return preamble != null ? preamble : "";
        });
    }

    public Map<String, InputField> inputFields() {
        return model().inputFields();
    }

    public List<InputField> widgets() {
        return model().widgets();
    }

    /**
     * Explicit reference solutions merged with the implicit ones inferred from the
     * naming convention; explicit entries win.
     */
    public Map<String, Object> theSolution() {
        return memo.get(DerivedValue.THE_SOLUTION, () -> {
            Map<String, Object> parameters = parameters();
            Map<String, Object> explicit = asMapping(definition.getTheSolution().apply(parameters), "the solution");

            Map<String, Object> merged = new LinkedHashMap<>(explicit);
            for (String name : inputFields().keySet()) {
                if (name.endsWith(IMPLICIT_SOLUTION_SUFFIX) && !explicit.containsKey(name)) {
                    String parameter = name.substring(0, name.length() - IMPLICIT_SOLUTION_SUFFIX.length());
                    if (parameters.containsKey(parameter)) {
                        merged.put(name, parameters.get(parameter));
                    }
                }
            }
            merged.forEach((name, value) -> inputFields().get(name).setTheSolution(value));
            return collectFromFields(merged, InputField::getTheSolution);
        });
    }

    public Map<String, Object> aSolution() {
        return memo.get(DerivedValue.A_SOLUTION, () -> {
            Map<String, Object> solution = asMapping(definition.getASolution().apply(parameters()), "a solution");
            solution.forEach((name, value) -> inputFields().get(name).setASolution(value));
            return collectFromFields(solution, InputField::getASolution);
        });
    }

    /**
     * Per field, the reference solution if there is one, otherwise a solution.
     */
    public Map<String, Object> solution() {
        return memo.get(DerivedValue.SOLUTION, () -> {
            Map<String, Object> theSolution = theSolution();
            Map<String, Object> aSolution = aSolution();
            Map<String, Object> solution = new LinkedHashMap<>();
            inputFields().forEach((name, field) -> {
                if (theSolution.containsKey(name) || aSolution.containsKey(name)) {
                    solution.put(name, field.solution());
                }
            });
            return Collections.unmodifiableMap(solution);
        });
    }

    public HintsResult hints() {
        return memo.get(DerivedValue.HINTS, () -> {
            HintsResult hints = definition.getHints().apply(parameters());
            if (hints == null) {
                return HintsResult.none();
            }
            if (hints instanceof HintsResult.PerField perField) {
                if (perField.hints().isEmpty()) {
                    return HintsResult.none();
                }
                Map<String, List<String>> byField = new LinkedHashMap<>();
                inputFields().keySet().forEach(name -> byField.put(name, perField.hints().getOrDefault(name, List.of())));
                if (byField.size() == 1) {
                    return HintsResult.of(byField.values().iterator().next());
                }
                return HintsResult.perField(byField);
            }
            return hints;
        });
    }

    public Map<String, Object> trivialInput() {
        return memo.get(DerivedValue.TRIVIAL_INPUT, () -> {
            Map<String, Object> input = new LinkedHashMap<>();
            inputFields().forEach((name, field) -> input.put(name, field.getValueType().trivialValue()));
            return Collections.unmodifiableMap(input);
        });
    }

    public Map<String, Object> dummyInput() {
        return memo.get(DerivedValue.DUMMY_INPUT, () -> {
            Map<String, Object> input = new LinkedHashMap<>();
            inputFields().forEach((name, field) -> input.put(name, field.getValueType().dummyValue()));
            return Collections.unmodifiableMap(input);
        });
    }

    public Map<String, Double> scoreWeights() {
        return memo.get(DerivedValue.SCORE_WEIGHTS,
                () -> ScoreWeights.normalize(definition.getSettings().weights(), inputFields().keySet()));
    }

    public ScoreCalculator scoreCalculator() {
        return new ScoreCalculator(definition.getScores(), parameters(), inputFields(), solution(), dummyInput(),
                scoreWeights());
    }

    public Map<String, Double> maxScores() {
        return maxScoreSheet().perField();
    }

    public double maxTotalScore() {
        return maxScoreSheet().total();
    }

    /**
     * Current answers; {@code null} marks an unanswered field.
     */
    public Map<String, Object> answers() {
        return model().answers();
    }

    /**
     * @throws IllegalStateException once the answers have been scored
     */
    public void setAnswers(Map<String, ?> answers) {
        requireNotScored();
        model().setAnswers(answers);
    }

    public void setFieldValue(String fieldName, Object value) {
        requireNotScored();
        Map<String, Object> single = new LinkedHashMap<>();
        single.put(fieldName, value);
        model().setAnswers(single);
    }

    /**
     * Scores the current answers. Computed once; later answer changes are rejected.
     */
    public Map<String, Double> scores() {
        return scoreSheet().perField();
    }

    public double totalScore() {
        return scoreSheet().total();
    }

    public Map<String, Boolean> correct() {
        return memo.get(DerivedValue.CORRECT, () -> {
            Map<String, Boolean> correct = ScoreCalculator.correct(scoreSheet(), maxScoreSheet());
            correct.forEach((name, value) -> inputFields().get(name).setCorrect(value));
            return Collections.unmodifiableMap(correct);
        });
    }

    /**
     * Feedback for the current answers. Not memoized.
     */
    public String feedback() {
        Map<String, Object> bag = new LinkedHashMap<>(parameters());
        bag.putAll(answers());
        String feedback = definition.getFeedback().apply(bag);
        return feedback != null ? feedback : "";
    }

    /**
     * Every combination of no answer, the trivial input, the dummy input and the solution
     * across all input fields.
     */
    public List<Map<String, Object>> inputCombinations() {
        List<String> names = new ArrayList<>(inputFields().keySet());
        List<List<Object>> factors = new ArrayList<>();
        for (String name : names) {
            List<Object> factor = new ArrayList<>();
            factor.add(null);
            for (Map<String, Object> candidate : List.of(trivialInput(), dummyInput(), solution())) {
                if (candidate.get(name) != null) {
                    factor.add(candidate.get(name));
                }
            }
            factors.add(factor);
        }

        List<Map<String, Object>> combinations = new ArrayList<>();
        combinations.add(new LinkedHashMap<>());
        for (int i = 0; i < names.size(); i++) {
            List<Map<String, Object>> extended = new ArrayList<>();
            for (Map<String, Object> partial : combinations) {
                for (Object value : factors.get(i)) {
                    Map<String, Object> next = new LinkedHashMap<>(partial);
                    next.put(names.get(i), value);
                    extended.add(next);
                }
            }
            combinations = extended;
        }
        return combinations;
    }

    /**
     * Name of the exercise plus the requested items, ready for JSON serialization.
     *
     * @throws ExerciseConfigurationException for an unknown item
     */
    public Map<String, Object> summary(List<String> items) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("name", getName());
        for (String item : items) {
            summary.put(item, summaryItem(item));
        }
        return summary;
    }

    private Object summaryItem(String item) {
        return switch (item) {
            case "id" -> id();
            case "difficulty" -> difficulty();
            case "parameters" -> parameters();
            case "template" -> template();
            case "preamble" -> preamble();
            case "answers" -> answers();
            case "the_solution" -> theSolution();
            case "a_solution" -> aSolution();
            case "solution" -> solution();
            case "hints" -> hints();
            case "trivial_input" -> trivialInput();
            case "dummy_input" -> dummyInput();
            case "score_weights" -> {
                Map<String, Double> weights = new LinkedHashMap<>();
                scoreWeights().forEach((name, weight) -> weights.put(name == null ? "" : name, weight));
                yield weights;
            }
            case "scores" -> scores();
            case "max_scores" -> maxScores();
            case "total_score" -> totalScore();
            case "max_total_score" -> maxTotalScore();
            case "correct" -> correct();
            case "started_at" -> startedAt;
            case "submitted_at" -> submittedAt;
            case "user_name" -> getUserName();
            default -> throw new ExerciseConfigurationException("Unknown summary item '" + item + "'.");
        };
    }

    private ScoreSheet maxScoreSheet() {
        return memo.get(DerivedValue.MAX_SCORES, () -> {
            ScoreSheet sheet = scoreCalculator().maxScores();
            sheet.perField().forEach((name, max) -> inputFields().get(name).setDisplayedMaxScore(max));
            return sheet;
        });
    }

    private ScoreSheet scoreSheet() {
        return memo.get(DerivedValue.SCORES, () -> {
            ScoreSheet sheet = scoreCalculator().evaluate(answers());
            sheet.perField().forEach((name, score) -> inputFields().get(name).setDisplayedScore(score));
            log.debug("Scored {}: {} (total {})", getName(), sheet.perField(), sheet.total());
            return sheet;
        });
    }

    private void requireNotScored() {
        if (memo.isResolved(DerivedValue.SCORES)) {
            throw new IllegalStateException("Answers of '" + getName() + "' have already been scored.");
        }
    }

    private Map<String, Object> asMapping(SolutionResult result, String label) {
        Map<String, Object> mapping = new LinkedHashMap<>();
        if (result instanceof SolutionResult.Single single) {
            if (inputFields().size() != 1) {
                throw new IllPosedExerciseException(
                        "Unless there is only a single input field, " + label + " must be a mapping.");
            }
            mapping.put(inputFields().keySet().iterator().next(), single.value());
        } else if (result instanceof SolutionResult.PerField perField) {
            perField.values().forEach((name, value) -> {
                if (!inputFields().containsKey(name)) {
                    throw new IllPosedExerciseException(
                            "There is no input field '" + name + "' for " + label + ".");
                }
                if (value != null) {
                    mapping.put(name, value);
                }
            });
        }
        return mapping;
    }

    private Map<String, Object> collectFromFields(Map<String, Object> names,
                                                  Function<InputField, Object> getter) {
        Map<String, Object> collected = new LinkedHashMap<>();
        inputFields().forEach((name, field) -> {
            if (names.containsKey(name)) {
                collected.put(name, getter.apply(field));
            }
        });
        return Collections.unmodifiableMap(collected);
    }
}
