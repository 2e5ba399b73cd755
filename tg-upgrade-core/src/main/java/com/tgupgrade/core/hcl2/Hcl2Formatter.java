package com.tgupgrade.core.hcl2;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Renders an HCL 2 token stream as canonically formatted text.
 *
 * <p><b>Rules:</b>
 * <ul>
 *   <li>Lines end at newline tokens and at line comments; a heredoc body and its closing
 *       marker form one verbatim line</li>
 *   <li>Each line that opens brackets indents the following lines by two spaces; a line
 *       that closes them is indented at the outer level</li>
 *   <li>Spacing between tokens is normalized, except inside quoted templates where the
 *       original spacing is kept</li>
 *   <li>The {@code =} of consecutive single-line attributes is aligned, and so are trailing
 *       comments on consecutive lines</li>
 * </ul>
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * domain = "app.foo.com"
 * instance_count = 10
 * }</pre>
 * becomes
 * <pre>{@code
 * domain         = "app.foo.com"
 * instance_count = 10
 * }</pre>
 */
public class Hcl2Formatter {

    private static final Set<Hcl2TokenType> OPERATORS = EnumSet.of(
        Hcl2TokenType.EQUAL, Hcl2TokenType.PLUS, Hcl2TokenType.MINUS, Hcl2TokenType.STAR,
        Hcl2TokenType.SLASH, Hcl2TokenType.PERCENT, Hcl2TokenType.EQUAL_OP, Hcl2TokenType.NOT_EQUAL,
        Hcl2TokenType.LT, Hcl2TokenType.LTE, Hcl2TokenType.GT, Hcl2TokenType.GTE, Hcl2TokenType.AND,
        Hcl2TokenType.OR, Hcl2TokenType.BANG, Hcl2TokenType.QUESTION, Hcl2TokenType.COLON,
        Hcl2TokenType.COMMA, Hcl2TokenType.FAT_ARROW, Hcl2TokenType.OBRACE, Hcl2TokenType.OBRACK,
        Hcl2TokenType.OPAREN, Hcl2TokenType.TEMPLATE_INTERP, Hcl2TokenType.TEMPLATE_CONTROL);

    /**
     * Formats a token stream.
     *
     * @param tokens tokens to render
     * @return formatted text
     */
    public String format(List<Hcl2Token> tokens) {
        List<FormatLine> lines = splitLines(tokens);
        indent(lines);
        for (FormatLine line : lines) {
            line.space();
        }
        alignAssignments(lines);
        alignComments(lines);

        StringBuilder out = new StringBuilder();
        for (FormatLine line : lines) {
            out.append(line.render());
            if (line.terminated) {
                out.append('\n');
            }
        }
        return out.toString();
    }

    private static List<FormatLine> splitLines(List<Hcl2Token> tokens) {
        List<FormatLine> lines = new ArrayList<>();
        List<Hcl2Token> current = new ArrayList<>();

        for (int i = 0; i < tokens.size(); i++) {
            Hcl2Token token = tokens.get(i);
            if (token.type() == Hcl2TokenType.EOF) {
                continue;
            }
            if (token.type() == Hcl2TokenType.NEWLINE) {
                lines.add(FormatLine.of(current, true));
                current = new ArrayList<>();
                continue;
            }

            current.add(token);
            if (token.isLineComment()) {
                lines.add(FormatLine.of(current, true));
                current = new ArrayList<>();
            } else if (token.type() == Hcl2TokenType.OHEREDOC) {
                lines.add(FormatLine.of(current, true));
                current = new ArrayList<>();

                StringBuilder verbatim = new StringBuilder();
                i++;
                while (i < tokens.size()
                    && tokens.get(i).type() != Hcl2TokenType.NEWLINE
                    && tokens.get(i).type() != Hcl2TokenType.EOF) {
                    verbatim.append(tokens.get(i).text());
                    i++;
                }
                boolean terminated = i < tokens.size() && tokens.get(i).type() == Hcl2TokenType.NEWLINE;
                lines.add(FormatLine.verbatim(verbatim.toString(), terminated));
            }
        }

        if (!current.isEmpty()) {
            lines.add(FormatLine.of(current, false));
        }
        return lines;
    }

    private static void indent(List<FormatLine> lines) {
        Deque<Integer> indents = new ArrayDeque<>();
        for (FormatLine line : lines) {
            if (line.verbatim != null || line.tokens.isEmpty()) {
                continue;
            }

            int net = 0;
            for (Hcl2Token token : line.tokens) {
                net += token.type().bracketChange();
            }

            if (net > 0) {
                line.indent = 2 * indents.size();
                indents.push(net);
            } else if (net < 0) {
                int closed = -net;
                while (closed > 0 && !indents.isEmpty()) {
                    int top = indents.pop();
                    if (closed < top) {
                        indents.push(top - closed);
                        closed = 0;
                    } else {
                        closed -= top;
                    }
                }
                line.indent = 2 * indents.size();
            } else {
                line.indent = 2 * indents.size();
            }
        }
    }

    private static void alignAssignments(List<FormatLine> lines) {
        int chainStart = -1;
        int maxColumns = 0;
        for (int i = 0; i <= lines.size(); i++) {
            FormatLine line = i < lines.size() ? lines.get(i) : null;
            if (line == null || line.assign < 0) {
                if (chainStart >= 0) {
                    for (FormatLine chained : lines.subList(chainStart, i)) {
                        chained.spacing[chained.assign] = maxColumns - chained.columns(0, chained.assign) + 1;
                    }
                    chainStart = -1;
                    maxColumns = 0;
                }
                continue;
            }
            if (chainStart < 0) {
                chainStart = i;
            }
            maxColumns = Math.max(maxColumns, line.columns(0, line.assign));
        }
    }

    private static void alignComments(List<FormatLine> lines) {
        int chainStart = -1;
        int maxColumns = 0;
        for (int i = 0; i <= lines.size(); i++) {
            FormatLine line = i < lines.size() ? lines.get(i) : null;
            if (line == null || line.comment < 0) {
                if (chainStart >= 0) {
                    for (FormatLine chained : lines.subList(chainStart, i)) {
                        chained.spacing[chained.comment] = maxColumns - chained.columns(0, chained.comment) + 1;
                    }
                    chainStart = -1;
                    maxColumns = 0;
                }
                continue;
            }
            if (chainStart < 0) {
                chainStart = i;
            }
            maxColumns = Math.max(maxColumns, line.columns(0, line.comment));
        }
    }

    /**
     * Spaces to put between {@code previous} and {@code current} outside quoted templates.
     */
    static int spacesBetween(Hcl2Token beforePrevious, Hcl2Token previous, Hcl2Token current) {
        Hcl2TokenType prev = previous.type();
        Hcl2TokenType cur = current.type();

        if (cur == Hcl2TokenType.COMMA) {
            return 0;
        }
        if (prev == Hcl2TokenType.COMMA) {
            return 1;
        }
        if (cur == Hcl2TokenType.CBRACK || cur == Hcl2TokenType.CPAREN) {
            return 0;
        }
        if (prev == Hcl2TokenType.OBRACK || prev == Hcl2TokenType.OPAREN) {
            return 0;
        }
        if (prev == Hcl2TokenType.OBRACE && cur == Hcl2TokenType.CBRACE) {
            return 0;
        }
        if (cur == Hcl2TokenType.OPAREN && prev == Hcl2TokenType.IDENT) {
            return 0;
        }
        if (cur == Hcl2TokenType.OBRACK
            && (prev == Hcl2TokenType.IDENT || prev == Hcl2TokenType.CBRACK || prev == Hcl2TokenType.CPAREN)) {
            return 0;
        }
        if (cur == Hcl2TokenType.DOT || prev == Hcl2TokenType.DOT || cur == Hcl2TokenType.ELLIPSIS) {
            return 0;
        }
        if (prev == Hcl2TokenType.BANG) {
            return 0;
        }
        if (prev == Hcl2TokenType.MINUS && (beforePrevious == null || OPERATORS.contains(beforePrevious.type()))) {
            return 0;
        }
        return 1;
    }

    /**
     * One output line with its layout state.
     */
    private static final class FormatLine {
        private final List<Hcl2Token> tokens;
        private final String verbatim;
        private final boolean terminated;
        private int[] spacing;
        private int indent;
        private int assign = -1;
        private int comment = -1;

        private FormatLine(List<Hcl2Token> tokens, String verbatim, boolean terminated) {
            this.tokens = tokens;
            this.verbatim = verbatim;
            this.terminated = terminated;
            this.spacing = new int[tokens.size()];
        }

        static FormatLine of(List<Hcl2Token> tokens, boolean terminated) {
            return new FormatLine(List.copyOf(tokens), null, terminated);
        }

        static FormatLine verbatim(String text, boolean terminated) {
            return new FormatLine(List.of(), text, terminated);
        }

        void space() {
            if (tokens.isEmpty()) {
                return;
            }
            spacing[0] = indent;
            int quoteDepth = 0;
            for (int i = 0; i < tokens.size(); i++) {
                Hcl2Token token = tokens.get(i);
                if (i > 0) {
                    spacing[i] = quoteDepth > 0
                        ? token.spacesBefore()
                        : spacesBetween(i > 1 ? tokens.get(i - 2) : null, tokens.get(i - 1), token);
                }
                if (token.type() == Hcl2TokenType.OQUOTE) {
                    quoteDepth++;
                } else if (token.type() == Hcl2TokenType.CQUOTE && quoteDepth > 0) {
                    quoteDepth--;
                }
            }

            int end = tokens.size();
            if (tokens.size() > 1 && tokens.get(end - 1).type() == Hcl2TokenType.COMMENT) {
                comment = end - 1;
                end--;
            }
            for (int i = 1; i < end; i++) {
                if (tokens.get(i).type() == Hcl2TokenType.EQUAL) {
                    int net = 0;
                    for (Hcl2Token token : tokens.subList(i, end)) {
                        net += token.type().bracketChange();
                        if (token.type() == Hcl2TokenType.OHEREDOC) {
                            break;
                        }
                    }
                    if (net == 0) {
                        assign = i;
                    }
                    break;
                }
            }
        }

        int columns(int from, int to) {
            int columns = 0;
            for (int i = from; i < to; i++) {
                String text = displayText(tokens.get(i));
                columns += spacing[i] + text.codePointCount(0, text.length());
            }
            return columns;
        }

        String render() {
            if (verbatim != null) {
                return verbatim;
            }
            StringBuilder out = new StringBuilder();
            for (int i = 0; i < tokens.size(); i++) {
                out.append(" ".repeat(Math.max(0, spacing[i]))).append(displayText(tokens.get(i)));
            }
            return out.toString().stripTrailing();
        }

        private static String displayText(Hcl2Token token) {
            if (token.type() == Hcl2TokenType.COMMENT || token.type() == Hcl2TokenType.OHEREDOC) {
                return token.text().stripTrailing();
            }
            return token.text();
        }
    }
}
