package org.dice.parsing.exceptions;

import org.dice.parsing.ParserErrors;

/**
 * Thrown when a token stream does not match the formula grammar.
 */
public class LogicSyntaxException extends LogicException {

    private final ParserErrors error;
    private final int position;

    public LogicSyntaxException(ParserErrors error, String message, int position) {
        super(message);
        this.error = error;
        this.position = position;
    }

    public ParserErrors getError() {
        return error;
    }

    /**
     * @return character offset of the offending token, or -1 when the error has no single location
     */
    public int getPosition() {
        return position;
    }
}
