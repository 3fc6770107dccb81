package uk.gegc.quizforge.features.pool.domain.model;

import lombok.Getter;
import uk.gegc.quizforge.features.exercise.domain.model.ExerciseDefinition;
import uk.gegc.quizforge.features.pool.domain.util.WeightedSampler;
import uk.gegc.quizforge.shared.exception.ExerciseConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

/**
 * Ordered collection of exercises and nested pools.
 * <p>
 * Items are weighted by index; an index without an explicit weight weighs 1.
 * With {@code select} set, only that many items are exposed, drawn by weighted
 * sampling without replacement. Exposed items keep their index order unless the pool
 * shuffles and navigation is {@link NavigationMode#FREE}.
 * </p>
 */
@Getter
public class ExercisePool implements PoolItem {

    public static final double DEFAULT_WEIGHT = 1.0;

    private final String title;
    private final List<PoolItem> items = new ArrayList<>();
    private final Map<Integer, Double> weights = new LinkedHashMap<>();
    private NavigationMode navigation = NavigationMode.FREE;
    private Integer select;
    private boolean shuffle;

    public ExercisePool() {
        this(null);
    }

    public ExercisePool(String title) {
        this.title = title;
    }

    /**
     * @throws ExerciseConfigurationException if a nested pool reuses the title of a sibling
     *                                        pool, as exercise paths would collide
     */
    public ExercisePool add(PoolItem item) {
        Objects.requireNonNull(item, "item");
        if (item instanceof ExercisePool pool && pool.hasTitle()) {
            for (PoolItem sibling : items) {
                if (sibling instanceof ExercisePool other && pool.title.equals(other.title)) {
                    throw new ExerciseConfigurationException(
                            "Pool '" + title + "' already contains a pool titled '" + pool.title + "'.");
                }
            }
        }
        items.add(item);
        return this;
    }

    /**
     * Adds the item with an explicit weight.
     */
    public ExercisePool add(PoolItem item, double weight) {
        add(item);
        return weight(items.size() - 1, weight);
    }

    /**
     * Appends the items of another pool. Their weights are not carried over.
     */
    public ExercisePool addAll(ExercisePool pool) {
        pool.getItems().forEach(this::add);
        return this;
    }

    public ExercisePool weight(int index, double weight) {
        if (weight < 0 || Double.isNaN(weight) || Double.isInfinite(weight)) {
            throw new ExerciseConfigurationException(
                    "Weight of pool item " + index + " must be a non-negative number, got " + weight + ".");
        }
        weights.put(index, weight);
        return this;
    }

    public ExercisePool navigation(NavigationMode navigation) {
        this.navigation = Objects.requireNonNull(navigation, "navigation");
        return this;
    }

    /**
     * @param select number of items to expose, {@code null} for all of them
     */
    public ExercisePool select(Integer select) {
        if (select != null && select < 0) {
            throw new ExerciseConfigurationException("'select' must not be negative, got " + select + ".");
        }
        this.select = select;
        return this;
    }

    public ExercisePool shuffle(boolean shuffle) {
        this.shuffle = shuffle;
        return this;
    }

    public List<PoolItem> getItems() {
        return Collections.unmodifiableList(items);
    }

    public Map<Integer, Double> getWeights() {
        return Collections.unmodifiableMap(weights);
    }

    public double weightOf(int index) {
        if (index < 0 || index >= items.size()) {
            throw new IndexOutOfBoundsException("Pool has no item " + index);
        }
        return weights.getOrDefault(index, DEFAULT_WEIGHT);
    }

    public List<Double> itemWeights() {
        List<Double> result = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            result.add(weightOf(i));
        }
        return result;
    }

    public int size() {
        return items.size();
    }

    /**
     * Indices of the items exposed for one traversal.
     */
    public List<Integer> selectIndices(Random random) {
        List<Integer> indices;
        if (select == null || select >= items.size()) {
            indices = new ArrayList<>();
            for (int i = 0; i < items.size(); i++) {
                indices.add(i);
            }
        } else {
            indices = WeightedSampler.sample(itemWeights(), select, random);
            Collections.sort(indices);
        }
        if (shuffle && navigation == NavigationMode.FREE) {
            Collections.shuffle(indices, random);
        }
        return indices;
    }

    public List<PoolItem> selectItems(Random random) {
        List<PoolItem> selected = new ArrayList<>();
        for (int index : selectIndices(random)) {
            selected.add(items.get(index));
        }
        return selected;
    }

    /**
     * All exercises of this pool tree in depth-first order, with path identifiers and
     * effective weights. Exercises are numbered per pool, nested pools are named by
     * their title or {@code <n>_subpool}.
     */
    public List<WeightedExercise> exercises() {
        List<WeightedExercise> result = new ArrayList<>();
        collect("", 1.0, result);
        return result;
    }

    private void collect(String path, double baseWeight, List<WeightedExercise> result) {
        int exerciseCount = 0;
        int poolCount = 0;
        Set<String> segments = new HashSet<>();
        for (int i = 0; i < items.size(); i++) {
            PoolItem item = items.get(i);
            double weight = weightOf(i) * baseWeight;
            if (item instanceof ExerciseDefinition definition) {
                result.add(new WeightedExercise(path + "/" + exerciseCount + "_" + definition.getName(),
                        definition, weight));
                exerciseCount++;
            } else if (item instanceof ExercisePool pool) {
                String segment = pool.segmentName(poolCount);
                if (!segments.add(segment)) {
                    throw new ExerciseConfigurationException(
                            "Two nested pools of '" + path + "' share the path segment '" + segment + "'.");
                }
                pool.collect(path + "/" + segment, weight, result);
                poolCount++;
            }
        }
    }

    String segmentName(int poolIndex) {
        return hasTitle() ? title : poolIndex + "_subpool";
    }

    private boolean hasTitle() {
        return title != null && !title.isBlank();
    }

    @Override
    public String label() {
        return title;
    }

    @Override
    public String toString() {
        return "ExercisePool{" + title + ", " + items.size() + " items}";
    }
}
