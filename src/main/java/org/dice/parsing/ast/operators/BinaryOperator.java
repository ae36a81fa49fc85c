package org.dice.parsing.ast.operators;

import org.dice.parsing.ast.Expression;

import java.util.Arrays;
import java.util.List;
import java.util.SortedSet;

public abstract class BinaryOperator implements Expression {
	private final int index;
	protected final Expression left, right;

    BinaryOperator(int index, Expression left, Expression right){
        this.index = index;
        this.left = left;
        this.right = right;
    }

	public Expression getLeft() {
		return left;
	}

	public Expression getRight() {
		return right;
	}

	@Override
	public int getIndex() {
		return index;
	}

	@Override
	public SortedSet<String> collectVariables() {
		SortedSet<String> variables = left.collectVariables();
		variables.addAll(right.collectVariables());
		return variables;
	}

	@Override
	public List<Expression> getChildren() {
		return Arrays.asList(left, right);
	}

	@Override
	public String toString(){
		return this.render();
	}
}
