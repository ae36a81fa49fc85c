package org.dice.parsing.exceptions;

public class UnboundVariableException extends LogicException {

    private final String variable;

    public UnboundVariableException(String variable) {
        super(String.format("Variable '%s' has no assigned value", variable));
        this.variable = variable;
    }

    public String getVariable() {
        return variable;
    }
}
