package uk.gegc.quizforge.features.model.domain.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Concrete problem produced by an exercise's {@code problem} hook.
 */
public interface ProblemModel {

    /**
     * Input fields in display order.
     */
    Map<String, InputField> inputFields();

    /**
     * Names of output fields; each must be filled from the parameter sample.
     */
    Set<String> outputFields();

    String template();

    /**
     * Renders the template with output fields substituted from {@code parameters}.
     */
    String render(Map<String, ?> parameters);

    default List<InputField> widgets() {
        return new ArrayList<>(inputFields().values());
    }

    /**
     * Current value of every input field, {@code null} for unanswered fields.
     */
    default Map<String, Object> answers() {
        Map<String, Object> answers = new LinkedHashMap<>();
        inputFields().forEach((name, field) -> answers.put(name, field.getValue()));
        return answers;
    }

    /**
     * Overwrites the values of the fields named in {@code answers}; other fields keep theirs.
     */
    default void setAnswers(Map<String, ?> answers) {
        answers.forEach((name, value) -> {
            InputField field = inputFields().get(name);
            if (field == null) {
                throw new IllegalArgumentException("There is no input field '" + name + "'.");
            }
            field.setValue(value);
        });
    }
}
