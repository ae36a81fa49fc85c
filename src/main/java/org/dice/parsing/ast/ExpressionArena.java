package org.dice.parsing.ast;

import com.google.common.base.Preconditions;
import org.dice.parsing.ast.operands.Variable;
import org.dice.parsing.ast.operators.And;
import org.dice.parsing.ast.operators.Iff;
import org.dice.parsing.ast.operators.Implies;
import org.dice.parsing.ast.operators.Not;
import org.dice.parsing.ast.operators.Or;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * Allocates expression nodes and gives each one a stable index, in creation order.
 *
 * All formulas of one statement (its premises and conclusion) share an arena, so the index
 * identifies a node uniquely across the whole statement. Syntactically identical sub-trees built
 * separately get different indices.
 */
public class ExpressionArena {

    private final List<Expression> nodes = new ArrayList<Expression>();
    // nodes that already have a parent; a child may be attached once
    private final BitSet attached = new BitSet();

    public Variable variable(String name) {
        Preconditions.checkArgument(name != null && !name.isEmpty(), "variable name must not be empty");
        return register(new Variable(nodes.size(), name));
    }

    public Not not(Expression child) {
        adopt(child);
        return register(new Not(nodes.size(), child));
    }

    public And and(Expression left, Expression right) {
        adopt(left, right);
        return register(new And(nodes.size(), left, right));
    }

    public Or or(Expression left, Expression right) {
        adopt(left, right);
        return register(new Or(nodes.size(), left, right));
    }

    public Implies implies(Expression left, Expression right) {
        adopt(left, right);
        return register(new Implies(nodes.size(), left, right));
    }

    public Iff iff(Expression left, Expression right) {
        adopt(left, right);
        return register(new Iff(nodes.size(), left, right));
    }

    public Expression get(int index) {
        return nodes.get(index);
    }

    public boolean owns(Expression expression) {
        return expression != null
                && expression.getIndex() >= 0
                && expression.getIndex() < nodes.size()
                && nodes.get(expression.getIndex()) == expression;
    }

    public int size() {
        return nodes.size();
    }

    private void adopt(Expression... children) {
        for (Expression child : children) {
            Preconditions.checkArgument(owns(child), "expression %s was not allocated by this arena", child);
            Preconditions.checkArgument(!attached.get(child.getIndex()), "expression %s already has a parent", child);
        }
        Preconditions.checkArgument(children.length < 2 || children[0] != children[1],
                "expression %s cannot be both operands", children[0]);
        for (Expression child : children) {
            attached.set(child.getIndex());
        }
    }

    private <T extends Expression> T register(T node) {
        nodes.add(node);
        return node;
    }
}
