package org.dice.truthtables;

import com.google.common.base.Preconditions;
import org.dice.parsing.ast.Expression;
import org.dice.parsing.ast.ExpressionArena;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parsed premises and optional conclusion of one statement, all allocated from one arena.
 */
public class Statement {

    private final List<Expression> premises;
    private final Expression conclusion;
    private final ExpressionArena arena;

    /**
     * @throws IllegalArgumentException if a premise or the conclusion was allocated by another arena
     */
    public Statement(List<Expression> premises, Expression conclusion, ExpressionArena arena) {
        Preconditions.checkNotNull(arena, "arena");
        for (Expression premise : premises) {
            Preconditions.checkArgument(arena.owns(premise), "premise %s was not allocated by the statement's arena", premise);
        }
        Preconditions.checkArgument(conclusion == null || arena.owns(conclusion),
                "conclusion %s was not allocated by the statement's arena", conclusion);
        this.premises = Collections.unmodifiableList(new ArrayList<Expression>(premises));
        this.conclusion = conclusion;
        this.arena = arena;
    }

    public List<Expression> getPremises() {
        return premises;
    }

    /**
     * @return the conclusion, or null
     */
    public Expression getConclusion() {
        return conclusion;
    }

    public boolean hasConclusion() {
        return conclusion != null;
    }

    public ExpressionArena getArena() {
        return arena;
    }

    /**
     * A lone formula is tabulated without the ALL TRUE column.
     */
    public boolean isSingleFormula() {
        return premises.size() == 1 && conclusion == null;
    }

    public List<Expression> getFormulas() {
        List<Expression> formulas = new ArrayList<Expression>(premises);
        if (conclusion != null) {
            formulas.add(conclusion);
        }
        return formulas;
    }
}
