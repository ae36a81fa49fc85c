package org.dice.parsing.exceptions;

import org.dice.parsing.ParserErrors;

/**
 * Raised by the premise splitter when parenthesis nesting does not return to zero.
 */
public class UnbalancedParenthesesException extends LogicSyntaxException {

    public UnbalancedParenthesesException(int position) {
        super(ParserErrors.UnbalancedParentheses, "Unbalanced parentheses in statement", position);
    }
}
