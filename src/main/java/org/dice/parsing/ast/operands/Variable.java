package org.dice.parsing.ast.operands;

import org.dice.parsing.ast.Expression;
import org.dice.parsing.exceptions.UnboundVariableException;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

public class Variable implements Expression {
	private final int index;
	protected final String name;

	public Variable(int index, String name) {
		this.index = index;
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public int getIndex() {
		return index;
	}

	@Override
	public boolean evaluate(Map<String, Boolean> assignment) {
		Boolean value = assignment.get(name);
		if(value == null){
			throw new UnboundVariableException(name);
		}
		return value;
	}

	@Override
	public SortedSet<String> collectVariables() {
		SortedSet<String> variables = new TreeSet<String>();
		variables.add(name);
		return variables;
	}

	@Override
	public String render() {
		return name;
	}

	@Override
	public List<Expression> getChildren() {
		return Collections.emptyList();
	}

	@Override
	public String toString(){
		return this.render();
	}
}
