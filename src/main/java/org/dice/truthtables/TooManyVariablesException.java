package org.dice.truthtables;

import org.dice.parsing.exceptions.LogicException;

public class TooManyVariablesException extends LogicException {

    private final int variableCount;
    private final int maxVariables;

    public TooManyVariablesException(int variableCount, int maxVariables) {
        super(String.format("Too many variables: %d (maximum is %d)", variableCount, maxVariables));
        this.variableCount = variableCount;
        this.maxVariables = maxVariables;
    }

    public int getVariableCount() {
        return variableCount;
    }

    public int getMaxVariables() {
        return maxVariables;
    }
}
