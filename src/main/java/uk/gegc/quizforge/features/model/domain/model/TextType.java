package uk.gegc.quizforge.features.model.domain.model;

public class TextType implements ValueType {

    private final double maxScore;
    private final boolean caseSensitive;

    public TextType() {
        this(1.0, true);
    }

    public TextType(double maxScore, boolean caseSensitive) {
        this.maxScore = maxScore;
        this.caseSensitive = caseSensitive;
    }

    @Override
    public String typeName() {
        return "Text";
    }

    @Override
    public Object trivialValue() {
        return "";
    }

    @Override
    public Object dummyValue() {
        return "dummy";
    }

    @Override
    public double autoMaxScore() {
        return maxScore;
    }

    @Override
    public boolean matches(Object answer, Object solution) {
        if (answer == null || solution == null) {
            return false;
        }
        String a = answer.toString().trim();
        String s = solution.toString().trim();
        return caseSensitive ? a.equals(s) : a.equalsIgnoreCase(s);
    }
}
