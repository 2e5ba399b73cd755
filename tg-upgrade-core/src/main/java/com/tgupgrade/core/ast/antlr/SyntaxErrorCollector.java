package com.tgupgrade.core.ast.antlr;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

import java.util.ArrayList;
import java.util.List;

/**
 * Error listener that records syntax errors instead of printing them.
 */
class SyntaxErrorCollector extends BaseErrorListener {

    private final List<SyntaxError> errors = new ArrayList<>();

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                            int charPositionInLine, String msg, RecognitionException e) {
        errors.add(new SyntaxError(line, charPositionInLine + 1, msg));
    }

    boolean hasErrors() {
        return !errors.isEmpty();
    }

    SyntaxError first() {
        return errors.get(0);
    }

    record SyntaxError(int line, int column, String message) {}
}
