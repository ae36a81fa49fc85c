package org.dice.parsing.exceptions;

/**
 * Base class for every failure raised while splitting, parsing or tabulating a logic statement.
 */
public class LogicException extends RuntimeException {

    public LogicException(String message) {
        super(message);
    }

    public LogicException(String message, Throwable cause) {
        super(message, cause);
    }
}
