package com.purchasingpower.lahk.service.impl;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.purchasingpower.lahk.exception.NodeEditException;
import com.purchasingpower.lahk.parser.GrammarResolver;
import com.purchasingpower.lahk.parser.InlineKey;
import com.purchasingpower.lahk.parser.LahkSyntax;
import com.purchasingpower.lahk.parser.Segmenter;
import com.purchasingpower.lahk.service.SourceEditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
@Service
@RequiredArgsConstructor
public class SourceEditServiceImpl implements SourceEditService {

    // indentation plus an optional list marker such as "- " or "> "
    private static final Pattern PREFIX = Pattern.compile("^(\\s*[->*]*\\s*)(.*)$", Pattern.DOTALL);
    private static final Pattern LINE_BREAK = Pattern.compile("\r?\n");
    private static final Splitter STATEMENT_SPLITTER = Splitter.on(LahkSyntax.STATEMENT_DELIMITER);
    private static final Joiner STATEMENT_JOINER = Joiner.on(LahkSyntax.STATEMENT_DELIMITER);
    private static final CharMatcher FORBIDDEN = CharMatcher.anyOf("\r\n")
            .or(CharMatcher.is(LahkSyntax.STATEMENT_DELIMITER))
            .or(CharMatcher.is(LahkSyntax.COMMENT_INTRODUCER));

    private final GrammarResolver grammarResolver;

    @Override
    public String rewriteSegment(String lineText, int segmentIndex, String newText) {
        Preconditions.checkNotNull(lineText, "Line text cannot be null");
        Preconditions.checkNotNull(newText, "New text cannot be null");
        Preconditions.checkArgument(segmentIndex >= 0, "Segment index cannot be negative");

        if (FORBIDDEN.matchesAnyOf(newText)) {
            throw new NodeEditException("New text cannot contain a statement delimiter, comment marker or line break", -1, segmentIndex);
        }
        List<String> pieces = new ArrayList<>(STATEMENT_SPLITTER.splitToList(lineText));
        if (segmentIndex >= pieces.size()) {
            throw new NodeEditException(
                    String.format("Line has %d segment(s), no segment %d", pieces.size(), segmentIndex), -1, segmentIndex);
        }
        pieces.set(segmentIndex, rewritePiece(pieces.get(segmentIndex), newText.trim()));
        return STATEMENT_JOINER.join(pieces);
    }

    @Override
    public String applyNodeTextEdit(String documentText, int line, int segmentIndex, String newText) {
        Preconditions.checkNotNull(documentText, "Document text cannot be null");

        List<String> lines = new ArrayList<>();
        List<String> breaks = new ArrayList<>();
        Matcher matcher = LINE_BREAK.matcher(documentText);
        int from = 0;
        while (matcher.find()) {
            lines.add(documentText.substring(from, matcher.start()));
            breaks.add(matcher.group());
            from = matcher.end();
        }
        lines.add(documentText.substring(from));

        if (line < 0 || line >= lines.size()) {
            throw new NodeEditException(String.format("Invalid node line %d for edit", line), line, segmentIndex);
        }
        String edited;
        try {
            edited = rewriteSegment(lines.get(line), segmentIndex, newText);
        } catch (NodeEditException e) {
            throw new NodeEditException("Could not map node back to source line: " + e.getMessage(), line, segmentIndex);
        }
        log.debug("Rewrote line {} segment {}", line, segmentIndex);
        lines.set(line, edited);

        StringBuilder result = new StringBuilder(lines.get(0));
        for (int i = 1; i < lines.size(); i++) {
            result.append(breaks.get(i - 1)).append(lines.get(i));
        }
        return result.toString();
    }

    private String rewritePiece(String piece, String newText) {
        Matcher matcher = PREFIX.matcher(piece);
        if (!matcher.matches()) {
            return newText;
        }
        String prefix = matcher.group(1);
        String body = matcher.group(2);
        String[] codeAndComment = Segmenter.splitCodeAndComment(body);
        boolean hasComment = codeAndComment[0].length() < body.length();

        List<String> tokens = GrammarResolver.TOKEN_SPLITTER.splitToList(codeAndComment[0]);
        int keyCount = grammarResolver.countLeadingKeys(tokens);

        List<String> rebuilt = new ArrayList<>(tokens.subList(0, keyCount));
        if (!newText.isEmpty()) {
            rebuilt.add(newText);
        }
        for (String token : tokens.subList(keyCount, tokens.size())) {
            if (InlineKey.fromToken(LahkSyntax.stripSigil(token)).isPresent()) {
                rebuilt.add(token);
            }
        }

        String text = prefix + String.join(" ", rebuilt);
        return hasComment ? text + " " + LahkSyntax.COMMENT_INTRODUCER + codeAndComment[1] : text;
    }
}
