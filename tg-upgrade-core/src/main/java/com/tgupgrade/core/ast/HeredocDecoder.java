package com.tgupgrade.core.ast;

import java.util.Arrays;
import java.util.List;

/**
 * Splits a raw HCL 1 heredoc token into its marker and body.
 *
 * <p>The raw token runs from {@code <<} through the terminator line, for example
 * {@code "<<-EOF\n    indented\n    EOF\n"}. For the indented form ({@code <<-}) every body
 * line is unindented by the terminator's leading whitespace, provided all lines share
 * it; otherwise the body is returned as written.
 */
public final class HeredocDecoder {

    private HeredocDecoder() {
        // Utility class
    }

    /**
     * Decodes a raw heredoc token.
     *
     * @param raw raw token text
     * @return decoded heredoc
     * @throws IllegalStateException if the token has no line break after its marker
     */
    public static Heredoc decode(String raw) {
        int newline = raw.indexOf('\n');
        if (newline < 0 || !raw.startsWith("<<")) {
            throw new IllegalStateException("malformed heredoc, missing newline after marker: " + raw);
        }

        String marker = raw.substring(2, newline).strip();
        boolean indented = marker.startsWith("-");
        if (indented) {
            marker = marker.substring(1);
        }

        List<String> lines = Arrays.asList(raw.substring(newline + 1).split("\n", -1));
        int terminator = lines.size() - 1;
        while (terminator >= 0 && !lines.get(terminator).strip().equals(marker)) {
            terminator--;
        }
        if (terminator < 0) {
            throw new IllegalStateException("malformed heredoc, missing terminator " + marker);
        }

        List<String> bodyLines = lines.subList(0, terminator);
        String closing = stripCarriageReturn(lines.get(terminator));
        if (indented) {
            String prefix = closing.substring(0, closing.indexOf(marker));
            if (bodyLines.stream().allMatch(line -> line.startsWith(prefix))) {
                bodyLines = bodyLines.stream()
                    .map(line -> line.substring(prefix.length()))
                    .toList();
            }
        }

        StringBuilder body = new StringBuilder();
        for (String line : bodyLines) {
            body.append(line).append('\n');
        }
        return new Heredoc(marker, indented, body.toString());
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    /**
     * A decoded heredoc.
     *
     * @param marker delimiter word without the indent flag (e.g., "EOF")
     * @param indented true if the heredoc was opened with {@code <<-}
     * @param body body text, each line terminated by a newline
     */
    public record Heredoc(
        String marker,
        boolean indented,
        String body
    ) {}
}
