package com.purchasingpower.lahk.parser;

import com.google.common.collect.ImmutableMap;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.Function;

/**
 * Markers that may appear anywhere after the leading keys.
 *
 * <p>{@code loop} jumps back to the most recent connector, {@code next} jumps forward to the
 * nearest following connector. {@code if} and {@code of} are reserved and only stripped from
 * the label.
 *
 * @since 1.0.0
 */
public enum InlineKey {
    IF("if"),
    OF("of"),
    LOOP("loop"),
    NEXT("next");

    private static final ImmutableMap<String, InlineKey> BY_TOKEN = Arrays.stream(values())
            .collect(ImmutableMap.toImmutableMap(InlineKey::getToken, Function.identity()));

    private final String token;

    InlineKey(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    public static Optional<InlineKey> fromToken(String token) {
        return Optional.ofNullable(BY_TOKEN.get(token));
    }
}
