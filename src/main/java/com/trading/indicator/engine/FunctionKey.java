package com.trading.indicator.engine;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Identity of a function instance inside a base series: the concrete formula
 * type plus its constructor arguments.
 *
 * <p>
 * Arguments compare with {@code equals}: columns by identity, factors by value.
 * {@code null} arguments are allowed (an absent optional input).
 *
 * @param type The concrete function class, used as the formula tag.
 * @param args The constructor arguments, in declaration order.
 */
public record FunctionKey(Class<? extends Function> type, List<Object> args) {

    public FunctionKey {
        if (type == null)
            throw new IllegalArgumentException("Function type must not be null");
        args = Collections.unmodifiableList(Arrays.asList(args.toArray()));
    }

    public static FunctionKey of(Class<? extends Function> type, Object... args) {
        return new FunctionKey(type, Arrays.asList(args));
    }

    @Override
    public String toString() {
        return type.getSimpleName() + args.stream().map(String::valueOf).collect(Collectors.joining(", ", "(", ")"));
    }
}
