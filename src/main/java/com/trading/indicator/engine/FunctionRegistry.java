package com.trading.indicator.engine;

import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Per-series cache of function instances keyed by {@link FunctionKey}.
 *
 * <p>
 * Lookups are lock-free on the hit path. The first request for a key
 * constructs the instance inside {@link ConcurrentHashMap#computeIfAbsent}, so
 * concurrent first requests never build duplicates. Factories must not call
 * back into the registry; functions resolve their dependencies lazily from
 * {@code computeSpot}, never from their constructors.
 */
public final class FunctionRegistry {
    private static final Logger log = LogManager.getLogger(FunctionRegistry.class);

    private final ConcurrentHashMap<FunctionKey, Function> functions = new ConcurrentHashMap<>();

    @SuppressWarnings("unchecked")
    public <F extends Function> F getOrCreate(FunctionKey key, Supplier<F> factory) {
        Function f = functions.get(key);
        if (f == null) {
            f = functions.computeIfAbsent(key, k -> {
                F created = factory.get();
                if (!k.type().isInstance(created)) {
                    throw new IllegalArgumentException(
                            "Factory for " + k + " produced " + created.getClass().getName());
                }
                log.debug("Created function {}", k);
                return created;
            });
        }
        return (F) f;
    }

    public boolean contains(FunctionKey key) {
        return functions.containsKey(key);
    }

    public int size() {
        return functions.size();
    }
}
