package com.purchasingpower.lahk.parser;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a document into logical segments.
 *
 * <p>Each physical line is cut on {@link LahkSyntax#STATEMENT_DELIMITER}; every non-blank piece
 * becomes one {@link LogicalSegment} with its own indentation level and code/comment split.
 * Quote tracking in the comment split is a plain toggle: there are no escapes and quote state
 * does not carry across segments.
 *
 * @since 1.0.0
 */
@Component
public class Segmenter {

    private static final Splitter LINE_SPLITTER = Splitter.onPattern("\r?\n");
    private static final Splitter STATEMENT_SPLITTER = Splitter.on(LahkSyntax.STATEMENT_DELIMITER);
    private static final CharMatcher INDENT_CHARS = CharMatcher.anyOf(" \t");

    public List<LogicalSegment> collectSegments(String text) {
        Preconditions.checkNotNull(text, "Document text cannot be null");

        List<LogicalSegment> segments = new ArrayList<>();
        int lineIndex = 0;
        for (String line : LINE_SPLITTER.split(text)) {
            int segIndex = 0;
            for (String piece : STATEMENT_SPLITTER.split(line)) {
                if (!CharMatcher.whitespace().matchesAllOf(piece)) {
                    segments.add(toSegment(piece, lineIndex, segIndex));
                }
                segIndex++;
            }
            lineIndex++;
        }
        return segments;
    }

    private LogicalSegment toSegment(String piece, int lineIndex, int segIndex) {
        String raw = INDENT_CHARS.trimLeadingFrom(piece);
        String indentString = piece.substring(0, piece.length() - raw.length());
        String[] codeAndComment = splitCodeAndComment(raw);
        return LogicalSegment.builder()
                .physicalLine(lineIndex)
                .segmentIndex(segIndex)
                .indent(computeIndent(indentString))
                .raw(raw)
                .code(codeAndComment[0])
                .comment(codeAndComment[1])
                .build();
    }

    /**
     * Tabs count one level each; every complete run of four spaces counts one level.
     * A tab discards any partial space run.
     */
    static int computeIndent(String indentString) {
        int indent = 0;
        int spaceCount = 0;
        for (int i = 0; i < indentString.length(); i++) {
            char ch = indentString.charAt(i);
            if (ch == '\t') {
                indent++;
                spaceCount = 0;
            } else if (ch == ' ' && ++spaceCount == LahkSyntax.SPACES_PER_INDENT) {
                indent++;
                spaceCount = 0;
            }
        }
        return indent;
    }

    /**
     * @return two-element array: code, then comment text (without the introducer)
     */
    public static String[] splitCodeAndComment(String raw) {
        StringBuilder code = new StringBuilder();
        boolean inSingle = false;
        boolean inDouble = false;

        for (int i = 0; i < raw.length(); i++) {
            char ch = raw.charAt(i);
            if (ch == '\'' && !inDouble) {
                inSingle = !inSingle;
            } else if (ch == '"' && !inSingle) {
                inDouble = !inDouble;
            } else if (ch == LahkSyntax.COMMENT_INTRODUCER && !inSingle && !inDouble) {
                return new String[]{code.toString(), raw.substring(i + 1)};
            }
            code.append(ch);
        }
        return new String[]{code.toString(), ""};
    }
}
