package io.agentmesh.server.agents;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Pattern;

import io.agentmesh.spec.Message;

/**
 * Matches messages whose text contains one of a set of keywords.
 * <p>
 * Word keywords match whole words, case-insensitively. Operator keywords such as {@code +} only
 * match in a message that also contains a digit, so hyphenated prose does not look like math.
 */
public class KeywordPredicate implements Predicate<Message> {

    private static final Pattern DIGIT = Pattern.compile("\\d");

    private final List<String> keywords;
    private final List<Pattern> wordPatterns = new ArrayList<>();
    private final List<String> operators = new ArrayList<>();

    public KeywordPredicate(String... keywords) {
        this.keywords = List.of(keywords);
        for (String keyword : keywords) {
            String normalized = keyword.toLowerCase(Locale.ROOT).trim();
            if (normalized.isEmpty()) {
                continue;
            }
            if (Character.isLetterOrDigit(normalized.charAt(0))) {
                wordPatterns.add(Pattern.compile("\\b" + Pattern.quote(normalized) + "\\b"));
            } else {
                operators.add(normalized);
            }
        }
    }

    public List<String> keywords() {
        return keywords;
    }

    @Override
    public boolean test(Message message) {
        String text = message.joinedText().toLowerCase(Locale.ROOT);
        for (Pattern pattern : wordPatterns) {
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        if (!operators.isEmpty() && DIGIT.matcher(text).find()) {
            for (String operator : operators) {
                if (text.contains(operator)) {
                    return true;
                }
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "KeywordPredicate" + keywords;
    }
}
