package org.dice.parsing;

public enum ParserErrors {
    MissingLeftParen(1),
    MissingRightParen(2),
    MissingOperand(3),
    TrailingTokens(4),
    EmptyExpression(5),
    UnbalancedParentheses(6);

    public int value;
    ParserErrors(int value){
        this.value = value;
    }
}
