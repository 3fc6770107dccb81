package uk.gegc.quizforge.features.model.domain.model;

import lombok.Getter;
import lombok.Setter;
import uk.gegc.quizforge.shared.exception.IllPosedExerciseException;

import java.util.Objects;
import java.util.UUID;

/**
 * A named answer slot of a problem, together with the state of its widget:
 * the live value, the solutions and the displayed scores.
 */
@Getter
@Setter
public class InputField {

    private final String name;
    private final ValueType valueType;
    private final String widgetId;

    private Object value;
    private Object theSolution;
    private Object aSolution;
    private Double displayedScore;
    private Double displayedMaxScore;
    private Boolean correct;

    public InputField(String name, ValueType valueType) {
        this.name = Objects.requireNonNull(name, "name");
        this.valueType = Objects.requireNonNull(valueType, "valueType");
        this.widgetId = UUID.randomUUID().toString();
    }

    /**
     * The reference solution if there is one, otherwise a (possibly non-unique) solution.
     */
    public Object solution() {
        return theSolution != null ? theSolution : aSolution;
    }

    public double autoMaxScore() {
        return valueType.autoMaxScore();
    }

    /**
     * Scores {@code answer} against this field's solution.
     *
     * @throws IllPosedExerciseException if an answer is given but the field has no solution
     */
    public double autoScore(Object answer) {
        if (answer == null) {
            return 0.0;
        }
        Object solution = solution();
        if (solution == null) {
            throw new IllPosedExerciseException(
                    "Automatic scoring of input field '" + name + "' requires a solution.");
        }
        return valueType.autoScore(answer, solution);
    }

    public String info() {
        return valueType.typeName() + " input for '" + name + "'";
    }

    @Override
    public String toString() {
        return "InputField{" + name + ", " + valueType.typeName() + ", widget=" + widgetId + "}";
    }
}
