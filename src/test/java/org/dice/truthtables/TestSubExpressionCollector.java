package org.dice.truthtables;

import org.dice.parsing.Lexer;
import org.dice.parsing.RecursiveDescentParser;
import org.dice.parsing.ast.Expression;
import org.dice.parsing.ast.ExpressionArena;
import org.dice.parsing.ast.operators.And;
import org.dice.parsing.ast.operators.Not;
import org.dice.parsing.ast.operators.Or;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TestSubExpressionCollector {

    @Test
    public void collectsLeavesToRoot() {
        Expression root = parse("(p & q) | ~p", new ExpressionArena());
        List<Expression> nodes = SubExpressionCollector.collect(root);

        assertEquals(3, nodes.size());
        assertTrue(nodes.get(0) instanceof And);
        assertTrue(nodes.get(1) instanceof Not);
        assertTrue(nodes.get(2) instanceof Or);
        assertSame(root, nodes.get(2));
        assertEquals(Arrays.asList("(p & q)", "~p", "((p & q) | ~p)"), render(nodes));
    }

    @Test
    public void excludesVariables() {
        assertTrue(SubExpressionCollector.collect(parse("p", new ExpressionArena())).isEmpty());
        assertEquals(Arrays.asList("~p", "~~p"), render(SubExpressionCollector.collect(parse("~~p", new ExpressionArena()))));
    }

    @Test
    public void keepsSyntacticallyEqualNodesApart() {
        List<Expression> nodes = SubExpressionCollector.collect(parse("(p & q) | (p & q)", new ExpressionArena()));
        assertEquals(Arrays.asList("(p & q)", "(p & q)", "((p & q) | (p & q))"), render(nodes));
    }

    @Test
    public void isDeterministic() {
        Expression root = parse("(a -> b) <-> ~(c | a & d)", new ExpressionArena());
        List<String> first = render(SubExpressionCollector.collect(root));
        assertEquals(first, render(SubExpressionCollector.collect(root)));
        assertEquals(Arrays.asList("(a -> b)", "(a & d)", "(c | (a & d))", "~(c | (a & d))",
                "((a -> b) <-> ~(c | (a & d)))"), first);
    }

    @Test
    public void collectsEachNodeOnce() {
        ExpressionArena arena = new ExpressionArena();
        Expression root = parse("p & ~q", arena);
        SubExpressionCollector collector = new SubExpressionCollector(arena);

        assertEquals(Arrays.asList("~q", "(p & ~q)"), render(collector.add(root)));
        assertTrue(collector.add(root).isEmpty());
        assertEquals(2, collector.getCollected().size());
    }

    @Test
    public void collectsSeveralFormulasFromOneArena() {
        ExpressionArena arena = new ExpressionArena();
        List<Expression> roots = Arrays.asList(parse("p -> q", arena), parse("~q", arena), parse("r", arena));
        assertEquals(Arrays.asList("(p -> q)", "~q"), render(SubExpressionCollector.collect(roots, arena)));
    }

    @Test
    public void keepsFormulasOfOneArenaWithClashingShapesApart() {
        ExpressionArena arena = new ExpressionArena();
        List<Expression> roots = Arrays.asList(parse("~p", arena), parse("~q", arena), parse("~p", arena));
        assertEquals(Arrays.asList("~p", "~q", "~p"), render(SubExpressionCollector.collect(roots, arena)));
    }

    @Test
    public void rejectsFormulasFromSeparateArenas() {
        Expression first = new RecursiveDescentParser(new Lexer("~p")).parse();
        Expression second = new RecursiveDescentParser(new Lexer("~q")).parse();
        assertEquals(first.getIndex(), second.getIndex());

        ExpressionArena arena = new ExpressionArena();
        try {
            SubExpressionCollector.collect(Arrays.asList(first, second), arena);
            fail("expected the foreign formula to be rejected");
        }
        catch (IllegalArgumentException ex) {
            assertTrue(ex.getMessage().contains("~p"));
        }

        SubExpressionCollector collector = new SubExpressionCollector(arena);
        Expression own = parse("~r", arena);
        assertEquals(Arrays.asList("~r"), render(collector.add(own)));
        try {
            collector.add(second);
            fail("expected the foreign formula to be rejected");
        }
        catch (IllegalArgumentException ex) {
            assertEquals(Arrays.asList("~r"), render(collector.getCollected()));
        }
    }

    private static Expression parse(String formula, ExpressionArena arena) {
        return new RecursiveDescentParser(new Lexer(formula), arena).parse();
    }

    private static List<String> render(List<Expression> nodes) {
        List<String> rendered = new ArrayList<String>();
        for (Expression node : nodes) {
            rendered.add(node.render());
        }
        return rendered;
    }
}
