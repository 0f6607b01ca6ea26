package com.stepwise.core.parser;

import com.stepwise.core.StepwiseException;

/**
 * A task list line could not be turned into a task. Fatal before any dispatch.
 */
public class ParseException extends StepwiseException {

    private final int lineNumber;
    private final String line;

    public ParseException(int lineNumber, String line, String message) {
        super("Line %d: %s [%s]".formatted(lineNumber, message, line == null ? "" : line.strip()));
        this.lineNumber = lineNumber;
        this.line = line;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public String getLine() {
        return line;
    }
}
