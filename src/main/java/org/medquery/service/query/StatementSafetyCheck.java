package org.medquery.service.query;

import org.medquery.exceptions.SafetyViolationException;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;

/**
 * Allow-list gate for executable statements: only read-only leading keywords pass, and a single
 * statement per request. A semicolon anywhere but the very end is rejected, even inside a
 * literal.
 */
@Component
public class StatementSafetyCheck {

    static final Set<String> ALLOWED_LEADING_KEYWORDS = Set.of("select", "with", "show", "describe", "explain");

    /**
     * @return the statement with surrounding whitespace and one trailing semicolon removed
     * @throws SafetyViolationException when the statement is empty, starts with a disallowed
     *                                  keyword or chains several statements
     */
    public String check(String statement) {
        if (statement == null || statement.isBlank()) {
            throw new SafetyViolationException("Empty statement");
        }
        String trimmed = statement.trim();
        String keyword = leadingKeyword(trimmed);
        if (!ALLOWED_LEADING_KEYWORDS.contains(keyword)) {
            throw new SafetyViolationException("Only read-only statements are allowed, got: " + keyword.toUpperCase(Locale.ROOT));
        }

        String body = trimmed.endsWith(";") ? trimmed.substring(0, trimmed.length() - 1).trim() : trimmed;
        // Quotes, comments and dollar-quoting are not parsed, so no separator is trusted.
        if (body.indexOf(';') >= 0) {
            throw new SafetyViolationException("Multiple statements are not allowed");
        }
        return body;
    }

    static String leadingKeyword(String trimmed) {
        int end = 0;
        while (end < trimmed.length() && isWordChar(trimmed.charAt(end))) {
            end++;
        }
        if (end == 0) {
            int stop = 0;
            while (stop < trimmed.length() && !Character.isWhitespace(trimmed.charAt(stop))) {
                stop++;
            }
            return trimmed.substring(0, stop).toLowerCase(Locale.ROOT);
        }
        return trimmed.substring(0, end).toLowerCase(Locale.ROOT);
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
