package uk.gegc.quizforge.features.model.domain.model;

import java.math.BigDecimal;

public class IntegerType implements ValueType {

    private final double maxScore;

    public IntegerType() {
        this(1.0);
    }

    public IntegerType(double maxScore) {
        this.maxScore = maxScore;
    }

    @Override
    public String typeName() {
        return "Integer";
    }

    @Override
    public Object trivialValue() {
        return 0L;
    }

    @Override
    public Object dummyValue() {
        return 1L;
    }

    @Override
    public double autoMaxScore() {
        return maxScore;
    }

    @Override
    public boolean matches(Object answer, Object solution) {
        BigDecimal a = toInteger(answer);
        BigDecimal s = toInteger(solution);
        return a != null && s != null && a.compareTo(s) == 0;
    }

    private static BigDecimal toInteger(Object value) {
        if (value == null) {
            return null;
        }
        try {
            BigDecimal decimal = new BigDecimal(value.toString().trim());
            return decimal.stripTrailingZeros().scale() <= 0 ? decimal : null;
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
