package org.dice.parsing;

import org.dice.parsing.ast.Expression;
import org.dice.parsing.ast.ExpressionArena;
import org.dice.parsing.exceptions.LogicSyntaxException;

/**
 * One method per precedence level, loosest first. Every binary level loops over operators of its
 * own precedence, so chains associate to the left: {@code p -> q -> r} is {@code ((p -> q) -> r)}.
 * Negation recurses on itself and is right associative.
 */
public class RecursiveDescentParser {

    private final Lexer lexer;
    private final ExpressionArena arena;
    private int symbol;
    private Expression root;

    public RecursiveDescentParser(Lexer lexer) {
        this(lexer, new ExpressionArena());
    }

    /**
     * @param arena allocator for the parsed nodes; pass the same arena for every formula of one statement
     */
    public RecursiveDescentParser(Lexer lexer, ExpressionArena arena) {
        this.lexer  = lexer;
        this.arena = arena;
        this.symbol = Lexer.NONE;
    }

    public Expression parse() {
        symbol = lexer.nextSymbol();
        if(symbol == Lexer.EOF){
            throw new LogicSyntaxException(ParserErrors.EmptyExpression, "Empty expression", lexer.getPosition());
        }

        iffExpression();
        if(symbol != Lexer.EOF){
            // unbalanced parens
            if(symbol == Lexer.RIGHT){
                throw unexpectedToken(ParserErrors.MissingLeftParen);
            }
            throw unexpectedToken(ParserErrors.TrailingTokens);
        }
        return root;
    }

    private void iffExpression() {
        impliesExpression();
        while (symbol == Lexer.IFF) {
            Expression left = root;
            symbol = lexer.nextSymbol();
            impliesExpression();
            root = arena.iff(left, root);
        }
    }

    private void impliesExpression() {
        orExpression();
        while (symbol == Lexer.IMPLIES) {
            Expression left = root;
            symbol = lexer.nextSymbol();
            orExpression();
            root = arena.implies(left, root);
        }
    }

    private void orExpression() {
        andExpression();
        while (symbol == Lexer.OR) {
            Expression left = root;
            symbol = lexer.nextSymbol();
            andExpression();
            root = arena.or(left, root);
        }
    }

    private void andExpression() {
        notExpression();
        while (symbol == Lexer.AND) {
            Expression left = root;
            symbol = lexer.nextSymbol();
            notExpression();
            root = arena.and(left, root);
        }
    }

    private void notExpression() {
        if (symbol == Lexer.NOT) {
            symbol = lexer.nextSymbol();
            notExpression();
            root = arena.not(root);
        }
        else {
            processTerminal();
        }
    }

    private void processTerminal() {
        switch (symbol){
            case Lexer.IDENTIFIER:
                root = arena.variable(lexer.toString());
                symbol = lexer.nextSymbol();
                break;

            case Lexer.LEFT:
                symbol = lexer.nextSymbol();
                iffExpression();
                if(symbol != Lexer.RIGHT){
                    throw new LogicSyntaxException(ParserErrors.MissingRightParen,
                            String.format("Expected closing parenthesis at position %d", lexer.getPosition()),
                            lexer.getPosition());
                }
                symbol = lexer.nextSymbol();
                break;

            case Lexer.EOF:
                throw new LogicSyntaxException(ParserErrors.MissingOperand,
                        "Expected an operand but reached end of input", lexer.getPosition());

            default:
                throw new LogicSyntaxException(ParserErrors.MissingOperand,
                        String.format("Expected an operand but found '%s' at position %d", lexer, lexer.getPosition()),
                        lexer.getPosition());
        }
    }

    private LogicSyntaxException unexpectedToken(ParserErrors error) {
        return new LogicSyntaxException(error,
                String.format("Unexpected token '%s' at position %d", lexer, lexer.getPosition()),
                lexer.getPosition());
    }
}
