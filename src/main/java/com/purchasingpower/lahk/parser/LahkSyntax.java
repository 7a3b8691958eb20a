package com.purchasingpower.lahk.parser;

import com.google.common.collect.ImmutableSet;

/**
 * Lexical constants of the Lahk markup.
 *
 * @since 1.0.0
 */
public final class LahkSyntax {

    /** Separates several statements packed onto one physical line. */
    public static final char STATEMENT_DELIMITER = ':';

    /** Starts a trailing comment when it appears outside quotes. */
    public static final char COMMENT_INTRODUCER = '#';

    /** Optional prefix on any keyword token, e.g. {@code @dec}. */
    public static final char KEY_SIGIL = '@';

    public static final int SPACES_PER_INDENT = 4;

    /** Collapsed-function spellings; normalized to {@code fun} followed by {@link #COLLAPSED_MARKER}. */
    public static final ImmutableSet<String> COLLAPSED_FUN_TOKENS = ImmutableSet.of("fun!", "fun!{");

    public static final String COLLAPSED_MARKER = "!";

    private LahkSyntax() {
    }

    public static String stripSigil(String token) {
        return !token.isEmpty() && token.charAt(0) == KEY_SIGIL ? token.substring(1) : token;
    }
}
