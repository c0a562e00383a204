package io.switchboard.core.memory;

import io.switchboard.core.model.ChatMessage;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Offline extractor that recognises the facts support agents usually ask for:
 * names, account ids, model or part numbers, vendors and email addresses.
 * The first match wins.
 */
public final class HeuristicMemoryExtractor implements MemoryExtractor {
    private static final Pattern NAME_PATTERN = Pattern.compile(
        "\\b(?i:my name is) ([A-Za-z][A-Za-z'-]{1,30}(?: [A-Z][A-Za-z'-]{1,30})?)"
    );
    private static final Pattern ACCOUNT_PATTERN = Pattern.compile(
        "\\baccount (?:id|number|no\\.?|#)?\\s*(?:is|:)?\\s*#?((?=[A-Za-z-]*\\d)[A-Za-z0-9-]{4,32})",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern MODEL_PATTERN = Pattern.compile(
        "\\b(?:model|part|product|serial) (?:number|no\\.?|#)?\\s*(?:is|:)?\\s*((?=[A-Za-z-]*\\d)[A-Za-z0-9][A-Za-z0-9-]{2,31})",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern VENDOR_PATTERN = Pattern.compile(
        "\\b(?:bought|purchased|ordered) (?:it |this |them )?(?:from|at|on) ([A-Z][A-Za-z0-9&'-]*(?: [A-Z][A-Za-z0-9&'-]*){0,3})"
    );
    private static final Pattern EMAIL_PATTERN = Pattern.compile(
        "\\b([A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,})\\b"
    );
    private static final Pattern PREFERENCE_PATTERN = Pattern.compile(
        "\\bi prefer ([^.\\n!?]{3,100})",
        Pattern.CASE_INSENSITIVE
    );

    @Override
    public Optional<String> extract(String userText, List<ChatMessage> recentHistory) {
        String input = userText == null ? "" : userText.trim();
        if (input.isBlank()) {
            return Optional.empty();
        }
        return first(input, NAME_PATTERN, value -> "User's name is " + value)
            .or(() -> first(input, ACCOUNT_PATTERN, value -> "User's account ID is " + value))
            .or(() -> first(input, MODEL_PATTERN, value -> "Product model number is " + value))
            .or(() -> first(input, VENDOR_PATTERN, value -> value + " is a vendor the user purchased from"))
            .or(() -> first(input, EMAIL_PATTERN, value -> "User's email is " + value))
            .or(() -> first(input, PREFERENCE_PATTERN, value -> "User prefers " + value));
    }

    private Optional<String> first(String input, Pattern pattern, Function<String, String> statement) {
        Matcher matcher = pattern.matcher(input);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String value = normalizeTail(matcher.group(1));
        return value.isBlank() ? Optional.empty() : Optional.of(statement.apply(value));
    }

    private String normalizeTail(String text) {
        String normalized = text == null ? "" : text.trim().replaceAll("\\s+", " ");
        while (normalized.endsWith(",") || normalized.endsWith(".")) {
            normalized = normalized.substring(0, normalized.length() - 1).trim();
        }
        return normalized;
    }
}
