package com.smartchoice.config;

import com.smartchoice.tree.spec.PayoffFn;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/** Payoff functions that JSON definitions refer to by name. */
public final class PayoffRegistry {

    public static final String CUMULATIVE = "cumulative";

    private final Map<String, PayoffFn> payoffs = new LinkedHashMap<>();

    public static PayoffRegistry empty() {
        return new PayoffRegistry();
    }

    /** Holds {@value #CUMULATIVE}: the sum of the branch values on the path. */
    public static PayoffRegistry defaults() {
        return new PayoffRegistry().register(CUMULATIVE, PayoffFn.cumulative());
    }

    public PayoffRegistry register(String name, PayoffFn payoff) {
        payoffs.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(payoff, "payoff"));
        return this;
    }

    public Optional<PayoffFn> find(String name) {
        return Optional.ofNullable(payoffs.get(name));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(payoffs.keySet());
    }
}
