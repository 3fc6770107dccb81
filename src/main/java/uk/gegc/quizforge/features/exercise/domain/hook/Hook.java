package uk.gegc.quizforge.features.exercise.domain.hook;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * One exercise hook: a body plus the keyword names it accepts.
 *
 * @param <R> the hook's result type
 */
public final class Hook<R> {

    private final HookSignature signature;
    private final Function<HookArguments, R> body;

    private Hook(HookSignature signature, Function<HookArguments, R> body) {
        this.signature = Objects.requireNonNull(signature, "signature");
        this.body = Objects.requireNonNull(body, "body");
    }

    public static <R> Hook<R> of(HookSignature signature, Function<HookArguments, R> body) {
        return new Hook<>(signature, body);
    }

    public static <R> Hook<R> of(Function<HookArguments, R> body, String... required) {
        return new Hook<>(HookSignature.of(required), body);
    }

    public static <R> Hook<R> constant(R value) {
        return new Hook<>(HookSignature.none(), args -> value);
    }

    public HookSignature getSignature() {
        return signature;
    }

    /**
     * Invokes the hook with the subset of {@code bag} its signature declares.
     */
    public R apply(Map<String, ?> bag) {
        return body.apply(new HookArguments(signature.bind(bag)));
    }

    /**
     * Default values this hook declares for any of the given input field names.
     */
    public Map<String, Object> fieldDefaults(Collection<String> fieldNames) {
        Map<String, Object> defaults = new LinkedHashMap<>();
        signature.getDefaults().forEach((name, value) -> {
            if (fieldNames.contains(name)) {
                defaults.put(name, value);
            }
        });
        return defaults;
    }
}
