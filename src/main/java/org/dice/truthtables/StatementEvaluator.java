package org.dice.truthtables;

import org.dice.parsing.Lexer;
import org.dice.parsing.ParserErrors;
import org.dice.parsing.PremiseSplitter;
import org.dice.parsing.RecursiveDescentParser;
import org.dice.parsing.SplitStatement;
import org.dice.parsing.ast.Expression;
import org.dice.parsing.ast.ExpressionArena;
import org.dice.parsing.exceptions.LogicSyntaxException;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs a raw statement through the whole pipeline: split, tokenize and parse each part, then
 * tabulate.
 */
public class StatementEvaluator {

    private final TruthTableConfig config;
    private final TruthTableGenerator generator;

    public StatementEvaluator() {
        this(TruthTableConfig.load());
    }

    public StatementEvaluator(TruthTableConfig config) {
        this.config = config;
        this.generator = new TruthTableGenerator(config);
    }

    public TruthTable evaluate(String statement) {
        return generator.generate(parse(statement));
    }

    public Statement parse(String statement) {
        SplitStatement split = PremiseSplitter.split(statement);
        if (split.getPremises().isEmpty()) {
            String message = split.hasConclusion() ? "A conclusion requires at least one premise" : "Empty expression";
            throw new LogicSyntaxException(ParserErrors.EmptyExpression, message, 0);
        }

        ExpressionArena arena = new ExpressionArena();
        List<Expression> premises = new ArrayList<Expression>();
        for (String premise : split.getPremises()) {
            premises.add(parseFormula(premise, arena));
        }
        Expression conclusion = null;
        if (split.hasConclusion()) {
            conclusion = parseFormula(split.getConclusion(), arena);
        }
        return new Statement(premises, conclusion, arena);
    }

    public Expression parseFormula(String formula, ExpressionArena arena) {
        return new RecursiveDescentParser(new Lexer(formula, config.isStrictLexer()), arena).parse();
    }

    public TruthTableConfig getConfig() {
        return config;
    }
}
