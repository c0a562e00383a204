package io.switchboard.core.oracle;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * System prompts used by the oracle, the memory extractor and the reply
 * composer. Built-in texts ship under {@code /prompts}; any of them can be
 * replaced by a file.
 */
public record OraclePrompts(String routing, String externalResponse, String memoryExtraction, String reply) {

    public static OraclePrompts defaults() {
        return new OraclePrompts(
            classpath("routing.md"),
            classpath("external-response.md"),
            classpath("memory-extraction.md"),
            classpath("reply.md")
        );
    }

    /**
     * Loads the defaults and replaces each prompt whose override path is set.
     */
    public static OraclePrompts load(
        Path routingFile,
        Path externalResponseFile,
        Path memoryExtractionFile,
        Path replyFile
    ) throws IOException {
        OraclePrompts defaults = defaults();
        return new OraclePrompts(
            orDefault(routingFile, defaults.routing()),
            orDefault(externalResponseFile, defaults.externalResponse()),
            orDefault(memoryExtractionFile, defaults.memoryExtraction()),
            orDefault(replyFile, defaults.reply())
        );
    }

    public String routing(boolean externalSessionActive) {
        return routing.replace("{{external_session_active}}", String.valueOf(externalSessionActive));
    }

    public String memoryExtraction(String userMessage) {
        return memoryExtraction.replace("{{user_message}}", userMessage == null ? "" : userMessage);
    }

    private static String orDefault(Path file, String fallback) throws IOException {
        if (file == null) {
            return fallback;
        }
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    private static String classpath(String name) {
        try (InputStream in = OraclePrompts.class.getResourceAsStream("/prompts/" + name)) {
            if (in == null) {
                throw new IllegalStateException("Missing built-in prompt: " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read built-in prompt " + name, e);
        }
    }
}
