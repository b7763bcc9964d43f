package io.github.sparkrew.varhistory.flow_slicer.utils;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Parses single recorded statements. A recorder sees one logical line at a time, so the text is often not a
 * complete statement on its own. A semicolon may be missing, a block may be left open (an {@code if} header ending
 * in its brace) or a closing brace may come first. Those cases are retried with a small fix-up before the statement
 * is given up as opaque.
 */
public class StatementParser {

    private static final Logger log = LoggerFactory.getLogger(StatementParser.class);
    private static final JavaParser parser = new JavaParser(
            new ParserConfiguration().setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
    // Statements repeat a lot in loops, cache by text
    private static final Map<String, ParsedStatement> cache = new HashMap<>();

    public static synchronized ParsedStatement parse(String text) {
        if (text == null) {
            return ParsedStatement.opaque("");
        }
        ParsedStatement cached = cache.get(text);
        if (cached != null) {
            return cached;
        }
        ParsedStatement parsed = doParse(text);
        cache.put(text, parsed);
        return parsed;
    }

    private static ParsedStatement doParse(String text) {
        if (text.isBlank()) {
            return ParsedStatement.opaque(text);
        }
        for (String suffix : new String[]{"", ";", "}"}) {
            ParsedStatement attempt = tryParse(text, 0, suffix);
            if (attempt != null) {
                return attempt;
            }
        }
        String stripped = text.stripLeading();
        if (stripped.startsWith("}")) {
            int shift = text.length() - stripped.length() + 1;
            for (String suffix : new String[]{"", ";", "}"}) {
                ParsedStatement attempt = tryParse(text, shift, suffix);
                if (attempt != null) {
                    return attempt;
                }
            }
        }
        log.warn("Could not parse statement `{}`, treating it as opaque", text);
        return ParsedStatement.opaque(text);
    }

    private static ParsedStatement tryParse(String text, int shift, String suffix) {
        String candidate = text.substring(shift) + suffix;
        if (candidate.isBlank()) {
            return null;
        }
        ParseResult<Statement> result = parser.parseStatement(candidate);
        if (result.isSuccessful() && result.getResult().isPresent()) {
            return new ParsedStatement(text, candidate, shift, result.getResult().get());
        }
        return null;
    }

    public static synchronized Optional<Expression> parseExpression(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        ParseResult<Expression> result = parser.parseExpression(text.strip());
        return result.isSuccessful() ? result.getResult() : Optional.empty();
    }

    /**
     * Canonical form of an expression, so that call texts differing only in whitespace compare equal.
     */
    public static String normalize(String expressionText) {
        if (expressionText == null) {
            return null;
        }
        return parseExpression(expressionText).map(Expression::toString).orElse(expressionText.strip());
    }

    public static synchronized void clearCache() {
        cache.clear();
    }
}
