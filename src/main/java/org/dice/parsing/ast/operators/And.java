package org.dice.parsing.ast.operators;

import org.dice.parsing.ast.Expression;

import java.util.Map;

public class And extends BinaryOperator {
	public And(int index, Expression left, Expression right){
		super(index, left, right);
	}

	public boolean evaluate(Map<String, Boolean> assignment) {
		// no short circuit, an unbound variable on either side must surface
		boolean l = left.evaluate(assignment);
		boolean r = right.evaluate(assignment);
		return l && r;
	}

	public String render() {
		return String.format("(%s & %s)", left.render(), right.render());
	}
}
