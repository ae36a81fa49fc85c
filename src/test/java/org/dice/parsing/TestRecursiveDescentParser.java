package org.dice.parsing;

import org.dice.parsing.ast.Expression;
import org.dice.parsing.ast.ExpressionArena;
import org.dice.parsing.ast.operators.Not;
import org.dice.parsing.exceptions.LexerException;
import org.dice.parsing.exceptions.LogicSyntaxException;
import org.junit.Test;

import static junit.framework.TestCase.assertEquals;
import static junit.framework.TestCase.assertTrue;
import static org.junit.Assert.fail;

public class TestRecursiveDescentParser {

    @Test
    public void enforcesOperatorPrecedence(){
        assertEquals("((p & q) | r)", parse("p & q | r"));
        assertEquals("(p | (q & r))", parse("p | q & r"));
        assertEquals("((p | q) -> r)", parse("p | q -> r"));
        assertEquals("(p -> (q | r))", parse("p -> q | r"));
        assertEquals("((p -> q) <-> r)", parse("p -> q <-> r"));
        assertEquals("(p <-> (q -> r))", parse("p <-> q -> r"));
        assertEquals("(((~p & q) | r) <-> (s -> t))", parse("~p & q | r <-> s -> t"));
    }

    @Test
    public void parsesBinaryOperatorsLeftAssociatively(){
        assertEquals("((p & q) & r)", parse("p & q & r"));
        assertEquals("((p | q) | r)", parse("p | q | r"));
        assertEquals("((p -> q) -> r)", parse("p -> q -> r"));
        assertEquals("((p <-> q) <-> r)", parse("p <-> q <-> r"));
    }

    @Test
    public void parsesNotOperator(){
        assertEquals("~p", parse("~p"));
        assertEquals("~~p", parse("~~p"));
        assertEquals("(~p & q)", parse("~p & q"));
        assertEquals("~(p & q)", parse("~(p & q)"));

        Expression doubleNegation = parseExpression("~~p");
        assertTrue(doubleNegation instanceof Not);
        assertTrue(((Not) doubleNegation).getChild() instanceof Not);
    }

    @Test
    public void parenthesesOverridePrecedence(){
        assertEquals("((p -> q) & r)", parse("(p -> q) & r"));
        assertEquals("(p & (q | r))", parse("p & (q | r)"));
        assertEquals("p", parse("((p))"));
        assertEquals("((p <-> q) -> r)", parse("(p <-> q) -> r"));
    }

    @Test
    public void reparsingCanonicalRenderingIsStable(){
        String[] formulas = {"p", "~~p", "p & q | ~r", "p -> q -> r", "(p <-> q) & (q -> ~r) | s",
                "~(a | b) <-> ~a & ~b", "x1 & (x2 | (x3 -> ~x4))"};
        for (String formula : formulas) {
            String canonical = parse(formula);
            assertEquals(canonical, parse(canonical));
        }
    }

    @Test
    public void addsErrorOnMissingRightParen(){
        assertEquals(ParserErrors.MissingRightParen, getParserError("p & (q"));
        assertEquals(ParserErrors.MissingRightParen, getParserError("(p"));
        assertEquals(ParserErrors.MissingRightParen, getParserError("((p | q)"));
        assertEquals(ParserErrors.MissingRightParen, getParserError("(p q)"));
    }

    @Test
    public void addsErrorOnMissingLeftParen(){
        assertEquals(ParserErrors.MissingLeftParen, getParserError("p)"));
        assertEquals(ParserErrors.MissingLeftParen, getParserError("(p & q))"));
    }

    @Test
    public void addsErrorOnMissingOperand(){
        assertEquals(ParserErrors.MissingOperand, getParserError("p &"));
        assertEquals(ParserErrors.MissingOperand, getParserError("& p"));
        assertEquals(ParserErrors.MissingOperand, getParserError("p -> -> q"));
        assertEquals(ParserErrors.MissingOperand, getParserError("~"));
        assertEquals(ParserErrors.MissingOperand, getParserError("()"));
        assertEquals(ParserErrors.MissingOperand, getParserError("("));
    }

    @Test
    public void rejectsTrailingTokens(){
        assertEquals(ParserErrors.TrailingTokens, getParserError("p q"));
        assertEquals(ParserErrors.TrailingTokens, getParserError("p & q r"));
        assertEquals(ParserErrors.TrailingTokens, getParserError("p ~q"));
    }

    @Test
    public void rejectsEmptyInput(){
        assertEquals(ParserErrors.EmptyExpression, getParserError(""));
        assertEquals(ParserErrors.EmptyExpression, getParserError("   "));
    }

    @Test
    public void reportsOffendingTokenAndPosition(){
        LogicSyntaxException ex = getParserException("p & )");
        assertEquals(4, ex.getPosition());
        assertEquals("Expected an operand but found ')' at position 4", ex.getMessage());

        ex = getParserException("p & (q");
        assertEquals(6, ex.getPosition());
        assertEquals("Expected closing parenthesis at position 6", ex.getMessage());

        ex = getParserException("p q");
        assertEquals("Unexpected token 'q' at position 2", ex.getMessage());
    }

    @Test(expected = LexerException.class)
    public void propagatesLexerErrors(){
        parse("p % q");
    }

    @Test
    public void parsesLenientInputAfterDroppingCharacters(){
        RecursiveDescentParser parser = new RecursiveDescentParser(new Lexer("p %& q", false));
        assertEquals("(p & q)", parser.parse().render());
    }

    @Test
    public void allocatesNodesFromTheGivenArena(){
        ExpressionArena arena = new ExpressionArena();
        Expression first = new RecursiveDescentParser(new Lexer("p & q"), arena).parse();
        Expression second = new RecursiveDescentParser(new Lexer("~p"), arena).parse();

        assertEquals(5, arena.size());
        assertEquals(2, first.getIndex());
        assertEquals(4, second.getIndex());
        assertTrue(arena.owns(first));
        assertTrue(arena.owns(second));
    }

    private String parse(String input){
        return parseExpression(input).render();
    }

    private Expression parseExpression(String input){
        RecursiveDescentParser parser = new RecursiveDescentParser(new Lexer(input));
        return parser.parse();
    }

    private ParserErrors getParserError(String input){
        return getParserException(input).getError();
    }

    private LogicSyntaxException getParserException(String input){
        try {
            parseExpression(input);
        }
        catch (LogicSyntaxException ex) {
            return ex;
        }
        fail("expected a syntax error for " + input);
        return null;
    }
}
