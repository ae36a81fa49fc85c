package org.dice.parsing.ast.operators;

import org.dice.parsing.ast.Expression;

import java.util.Map;

/**
 * Biconditional: true when both sides agree.
 */
public class Iff extends BinaryOperator {

	public Iff(int index, Expression left, Expression right){
		super(index, left, right);
	}

	public boolean evaluate(Map<String, Boolean> assignment) {
		return left.evaluate(assignment) == right.evaluate(assignment);
	}

	public String render() {
		return String.format("(%s <-> %s)", left.render(), right.render());
	}
}
