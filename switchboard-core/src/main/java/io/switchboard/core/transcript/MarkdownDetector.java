package io.switchboard.core.transcript;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Flags text that carries common markdown constructs, so chat clients know to
 * render it as rich text.
 */
public final class MarkdownDetector {
    private static final List<Pattern> INDICATORS = List.of(
        Pattern.compile("^#{1,6}\\s+\\S", Pattern.MULTILINE),
        Pattern.compile("\\*\\*[^*]+\\*\\*"),
        Pattern.compile("(?<![\\w*])\\*[^*\\s][^*]*\\*(?![\\w*])"),
        Pattern.compile("`[^`]+`"),
        Pattern.compile("```[\\s\\S]+?```"),
        Pattern.compile("!?\\[[^\\]]+\\]\\([^)]+\\)"),
        Pattern.compile("^\\s*[-*+]\\s+\\S", Pattern.MULTILINE),
        Pattern.compile("^\\s*\\d+\\.\\s+\\S", Pattern.MULTILINE),
        Pattern.compile("^>\\s+", Pattern.MULTILINE),
        Pattern.compile("~~[^~]+~~"),
        Pattern.compile("__[^_]+__"),
        Pattern.compile("\\|.*\\|.*\\|")
    );

    private MarkdownDetector() {
    }

    public static boolean isMarkdown(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        for (Pattern indicator : INDICATORS) {
            if (indicator.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }
}
