package org.dice.parsing.ast.operators;

import org.dice.parsing.ast.Expression;

import java.util.Map;

public class Not extends UnaryOperator {
	public Not(int index, Expression child){
		super(index, child);
	}

	public boolean evaluate(Map<String, Boolean> assignment) {
		return !child.evaluate(assignment);
	}

	public String render() {
		return String.format("~%s", child.render());
	}
}
