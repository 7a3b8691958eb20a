package com.purchasingpower.lahk.parser;

import com.google.common.collect.ImmutableMap;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.Function;

/**
 * Branch markers inside a decision: {@code else} opens a branch, {@code then} continues one.
 *
 * @since 1.0.0
 */
public enum SpecKey {
    ELSE("else"),
    THEN("then");

    private static final ImmutableMap<String, SpecKey> BY_TOKEN = Arrays.stream(values())
            .collect(ImmutableMap.toImmutableMap(SpecKey::getToken, Function.identity()));

    private final String token;

    SpecKey(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    public static Optional<SpecKey> fromToken(String token) {
        return Optional.ofNullable(BY_TOKEN.get(token));
    }
}
