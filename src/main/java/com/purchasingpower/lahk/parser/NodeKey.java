package com.purchasingpower.lahk.parser;

import com.google.common.collect.ImmutableMap;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.Function;

/**
 * Node-type markers. {@code do} has no dedicated handler and yields a plain process node.
 *
 * @since 1.0.0
 */
public enum NodeKey {
    DECISION("dec"),
    CONNECTOR("ii"),
    END("end"),
    DO("do"),
    FUNCTION("fun"),
    INPUT("im"),
    OUTPUT("ex");

    private static final ImmutableMap<String, NodeKey> BY_TOKEN = Arrays.stream(values())
            .collect(ImmutableMap.toImmutableMap(NodeKey::getToken, Function.identity()));

    private final String token;

    NodeKey(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    public static Optional<NodeKey> fromToken(String token) {
        return Optional.ofNullable(BY_TOKEN.get(token));
    }
}
