package com.purchasingpower.lahk.parser;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Classifies the tokens of a segment into branch marker, node marker, inline markers and label.
 *
 * <p>The first token may be a spec key or a node key; the second token is checked only against
 * the category the first one did not fill. A second token of the same category stays in the label.
 *
 * @since 1.0.0
 */
@Component
public class GrammarResolver {

    public static final Splitter TOKEN_SPLITTER = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

    private static final CharMatcher BACKSLASH = CharMatcher.is('\\');

    /**
     * @return the grammar, or empty when the segment is not a statement
     */
    public Optional<Grammar> resolve(LogicalSegment segment) {
        String trimmed = segment.getCode().trim();
        if (trimmed.isEmpty() || BACKSLASH.matchesAllOf(trimmed)) {
            return Optional.empty();
        }

        List<String> tokens = new ArrayList<>(TOKEN_SPLITTER.splitToList(trimmed));
        KeyPrefix prefix = readKeyPrefix(tokens);
        if (prefix.collapsed) {
            tokens.add(1, LahkSyntax.COLLAPSED_MARKER);
        }

        List<InlineKey> lineKeys = new ArrayList<>();
        List<String> userTokens = new ArrayList<>();
        for (int j = prefix.consumed; j < tokens.size(); j++) {
            Optional<InlineKey> inline = InlineKey.fromToken(LahkSyntax.stripSigil(tokens.get(j)));
            if (inline.isPresent()) {
                lineKeys.add(inline.get());
            } else {
                userTokens.add(tokens.get(j));
            }
        }

        return Optional.of(Grammar.builder()
                .specKey(prefix.specKey)
                .nodeKey(prefix.nodeKey)
                .lineKeys(ImmutableList.copyOf(lineKeys))
                .trimmedCode(String.join(" ", userTokens).trim())
                .build());
    }

    /**
     * Number of leading tokens that are consumed as spec or node keys.
     */
    public int countLeadingKeys(List<String> tokens) {
        return readKeyPrefix(tokens).consumed;
    }

    /**
     * Splits a decision header on commas into its branch labels, dropping empty entries.
     */
    public static List<String> splitDecisionLabels(String text) {
        return Splitter.on(',').trimResults().omitEmptyStrings().splitToList(text);
    }

    private static KeyPrefix readKeyPrefix(List<String> tokens) {
        KeyPrefix prefix = new KeyPrefix();
        if (tokens.isEmpty()) {
            return prefix;
        }

        String first = LahkSyntax.stripSigil(tokens.get(0));
        if (LahkSyntax.COLLAPSED_FUN_TOKENS.contains(first)) {
            prefix.nodeKey = NodeKey.FUNCTION;
            prefix.collapsed = true;
            prefix.consumed = 1;
            return prefix;
        }
        SpecKey.fromToken(first).ifPresentOrElse(
                spec -> {
                    prefix.specKey = spec;
                    prefix.consumed = 1;
                },
                () -> NodeKey.fromToken(first).ifPresent(node -> {
                    prefix.nodeKey = node;
                    prefix.consumed = 1;
                }));

        if (prefix.consumed == 1 && tokens.size() > 1) {
            String second = LahkSyntax.stripSigil(tokens.get(1));
            if (prefix.specKey == null) {
                SpecKey.fromToken(second).ifPresent(spec -> {
                    prefix.specKey = spec;
                    prefix.consumed = 2;
                });
            } else {
                NodeKey.fromToken(second).ifPresent(node -> {
                    prefix.nodeKey = node;
                    prefix.consumed = 2;
                });
            }
        }
        return prefix;
    }

    private static final class KeyPrefix {
        private SpecKey specKey;
        private NodeKey nodeKey;
        private int consumed;
        private boolean collapsed;
    }
}
