package org.dice.truthtables;

import com.google.common.base.Preconditions;
import org.dice.parsing.ast.Expression;
import org.dice.parsing.ast.ExpressionArena;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;

/**
 * Lists the non-leaf nodes of one or more formulas in post order (children before parents, left
 * before right). A node is listed once, keyed by its arena index, so every formula added to a
 * collector must come from the collector's {@link ExpressionArena}.
 */
public class SubExpressionCollector {

    private final ExpressionArena arena;
    private final BitSet seen = new BitSet();
    private final List<Expression> collected = new ArrayList<Expression>();

    public SubExpressionCollector(ExpressionArena arena) {
        this.arena = Preconditions.checkNotNull(arena, "arena");
    }

    // a single tree never mixes arenas
    private SubExpressionCollector() {
        this.arena = null;
    }

    public static List<Expression> collect(Expression root) {
        SubExpressionCollector collector = new SubExpressionCollector();
        collector.add(root);
        return collector.getCollected();
    }

    public static List<Expression> collect(List<Expression> roots, ExpressionArena arena) {
        SubExpressionCollector collector = new SubExpressionCollector(arena);
        for (Expression root : roots) {
            collector.add(root);
        }
        return collector.getCollected();
    }

    /**
     * @return the nodes of {@code root} that were not collected before, in collection order
     * @throws IllegalArgumentException if {@code root} was allocated by another arena
     */
    public List<Expression> add(Expression root) {
        Preconditions.checkNotNull(root, "root");
        if (arena != null) {
            Preconditions.checkArgument(arena.owns(root), "expression %s was not allocated by this collector's arena", root);
        }
        int from = collected.size();
        visit(root);
        return Collections.unmodifiableList(new ArrayList<Expression>(collected.subList(from, collected.size())));
    }

    public List<Expression> getCollected() {
        return Collections.unmodifiableList(new ArrayList<Expression>(collected));
    }

    private void visit(Expression node) {
        if (seen.get(node.getIndex())) {
            return;
        }
        List<Expression> children = node.getChildren();
        if (children.isEmpty()) {
            return;
        }
        for (Expression child : children) {
            visit(child);
        }
        seen.set(node.getIndex());
        collected.add(node);
    }
}
