package uk.gegc.quizforge.features.pool.domain.util;

import uk.gegc.quizforge.shared.exception.ExerciseConfigurationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Weighted sampling without replacement.
 */
public final class WeightedSampler {

    private WeightedSampler() {
    }

    /**
     * Draws {@code count} distinct indices. Each draw picks a remaining index with
     * probability weight / total remaining weight; once only zero weights remain the
     * draw is uniform.
     *
     * @return drawn indices in draw order
     */
    public static List<Integer> sample(List<Double> weights, int count, Random random) {
        if (count < 0 || count > weights.size()) {
            throw new ExerciseConfigurationException(
                    "Cannot draw " + count + " of " + weights.size() + " items.");
        }
        List<Integer> remaining = new ArrayList<>();
        for (int i = 0; i < weights.size(); i++) {
            double weight = weights.get(i);
            if (weight < 0 || Double.isNaN(weight)) {
                throw new ExerciseConfigurationException("Weight " + i + " must not be negative, got " + weight);
            }
            remaining.add(i);
        }

        List<Integer> drawn = new ArrayList<>(count);
        while (drawn.size() < count) {
            double total = 0.0;
            for (int index : remaining) {
                total += weights.get(index);
            }
            int position;
            if (total <= 0.0) {
                position = random.nextInt(remaining.size());
            } else {
                position = pick(weights, remaining, random.nextDouble() * total);
            }
            drawn.add(remaining.remove(position));
        }
        return drawn;
    }

    private static int pick(List<Double> weights, List<Integer> remaining, double target) {
        double cumulative = 0.0;
        int last = 0;
        for (int position = 0; position < remaining.size(); position++) {
            double weight = weights.get(remaining.get(position));
            if (weight <= 0.0) {
                continue;
            }
            cumulative += weight;
            last = position;
            if (target < cumulative) {
                return position;
            }
        }
        // rounding at the upper end
        return last;
    }
}
