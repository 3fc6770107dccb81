package uk.gegc.quizforge.features.model.domain.model;

public class RealType implements ValueType {

    private final double maxScore;
    private final double tolerance;

    public RealType() {
        this(1.0, 1e-9);
    }

    public RealType(double maxScore, double tolerance) {
        this.maxScore = maxScore;
        this.tolerance = tolerance;
    }

    @Override
    public String typeName() {
        return "Real";
    }

    @Override
    public Object trivialValue() {
        return 0.0;
    }

    @Override
    public Object dummyValue() {
        return 1.0;
    }

    @Override
    public double autoMaxScore() {
        return maxScore;
    }

    @Override
    public boolean matches(Object answer, Object solution) {
        Double a = toDouble(answer);
        Double s = toDouble(solution);
        return a != null && s != null && Math.abs(a - s) <= tolerance;
    }

    private static Double toDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            try {
                return Double.valueOf(text.trim());
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }
}
