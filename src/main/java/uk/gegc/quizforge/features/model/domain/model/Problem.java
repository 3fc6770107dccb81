package uk.gegc.quizforge.features.model.domain.model;

import uk.gegc.quizforge.shared.exception.IllPosedExerciseException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Template based problem. Placeholders are written {@code <<name>>}; names bound to a
 * value type become input fields, every other placeholder is an output field.
 */
public class Problem implements ProblemModel {

    private static final Pattern PLACEHOLDER = Pattern.compile("<<\\s*([A-Za-z_][A-Za-z0-9_]*)\\s*>>");

    private final String template;
    private final Map<String, InputField> inputFields;
    private final Set<String> outputFields;

    public Problem(String template, Map<String, ? extends ValueType> inputs) {
        this.template = Objects.requireNonNull(template, "template");
        Set<String> placeholders = placeholders(template);

        Map<String, InputField> fields = new LinkedHashMap<>();
        Set<String> outputs = new LinkedHashSet<>();
        for (String name : placeholders) {
            ValueType type = inputs.get(name);
            if (type != null) {
                fields.put(name, new InputField(name, type));
            } else {
                outputs.add(name);
            }
        }
        for (String name : inputs.keySet()) {
            if (!fields.containsKey(name)) {
                throw new IllPosedExerciseException(
                        "Input field '" + name + "' does not appear in the template.");
            }
        }
        this.inputFields = Collections.unmodifiableMap(fields);
        this.outputFields = Collections.unmodifiableSet(outputs);
    }

    public Problem(String template) {
        this(template, Map.of());
    }

    @Override
    public Map<String, InputField> inputFields() {
        return inputFields;
    }

    @Override
    public Set<String> outputFields() {
        return outputFields;
    }

    @Override
    public String template() {
        return template;
    }

    @Override
    public String render(Map<String, ?> parameters) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder rendered = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement = outputFields.contains(name)
                    ? String.valueOf(parameters.get(name))
                    : "<<" + name + ">>";
            matcher.appendReplacement(rendered, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(rendered);
        return rendered.toString();
    }

    private static Set<String> placeholders(String template) {
        Set<String> names = new LinkedHashSet<>();
        Matcher matcher = PLACEHOLDER.matcher(template);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }

    @Override
    public String toString() {
        return template;
    }
}
