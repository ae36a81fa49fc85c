package org.dice.parsing.ast.operators;

import org.dice.parsing.ast.Expression;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;

public abstract class UnaryOperator implements Expression {
    private final int index;
    protected final Expression child;

    UnaryOperator(int index, Expression child){
        this.index = index;
        this.child = child;
    }

    public Expression getChild() {
        return child;
    }

    @Override
    public int getIndex() {
        return index;
    }

    @Override
    public SortedSet<String> collectVariables() {
        return child.collectVariables();
    }

    @Override
    public List<Expression> getChildren() {
        return Collections.singletonList(child);
    }

    @Override
    public String toString(){
        return this.render();
    }
}
