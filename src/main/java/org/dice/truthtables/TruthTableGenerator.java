package org.dice.truthtables;

import org.dice.parsing.ast.Expression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Evaluates formulas for every assignment of their variables.
 *
 * Variables are sorted and rows follow binary counting with false as 0 and the first variable as
 * the most significant bit, so {@code p, q} gives FF, FT, TF, TT. A formula without variables
 * still gets one row.
 */
public class TruthTableGenerator {

    private static final Logger log = LoggerFactory.getLogger( TruthTableGenerator.class );

    private final TruthTableConfig config;

    public TruthTableGenerator(TruthTableConfig config) {
        this.config = config;
    }

    public TruthTable generate(Statement statement) {
        if (statement.isSingleFormula()) {
            return generate(statement.getPremises().get(0));
        }

        SubExpressionCollector collector = new SubExpressionCollector(statement.getArena());
        List<TruthTableColumn> columns = new ArrayList<TruthTableColumn>();
        for (Expression premise : statement.getPremises()) {
            addFormulaColumns(columns, collector.add(premise), premise, ColumnType.PREMISE);
        }
        columns.add(TruthTableColumn.allTrue());
        if (statement.hasConclusion()) {
            Expression conclusion = statement.getConclusion();
            addFormulaColumns(columns, collector.add(conclusion), conclusion, ColumnType.CONCLUSION);
        }
        return build(statement.getFormulas(), columns, statement.getPremises());
    }

    /**
     * Table of one formula: its sub-expressions, leaves to root, with the formula itself last.
     */
    public TruthTable generate(Expression formula) {
        List<TruthTableColumn> columns = new ArrayList<TruthTableColumn>();
        addFormulaColumns(columns, SubExpressionCollector.collect(formula), formula, ColumnType.FORMULA);

        List<Expression> formulas = new ArrayList<Expression>();
        formulas.add(formula);
        return build(formulas, columns, null);
    }

    public static List<String> sortedVariables(List<Expression> formulas) {
        SortedSet<String> variables = new TreeSet<String>();
        for (Expression formula : formulas) {
            variables.addAll(formula.collectVariables());
        }
        return new ArrayList<String>(variables);
    }

    /**
     * @return the assignment of row {@code row} in counting order
     */
    public static Map<String, Boolean> assignment(List<String> variables, long row) {
        int n = variables.size();
        Map<String, Boolean> assignment = new HashMap<String, Boolean>();
        for (int j = 0; j < n; j++) {
            assignment.put(variables.get(j), ((row >> (n - 1 - j)) & 1L) == 1L);
        }
        return assignment;
    }

    private void addFormulaColumns(List<TruthTableColumn> columns, List<Expression> nodes,
                                   Expression formula, ColumnType formulaType) {
        if (config.isShowSubExpressions()) {
            for (Expression node : nodes) {
                if (node != formula) {
                    columns.add(TruthTableColumn.expression(node, ColumnType.SUB_EXPRESSION));
                }
            }
        }
        columns.add(TruthTableColumn.expression(formula, formulaType));
    }

    private TruthTable build(List<Expression> formulas, List<TruthTableColumn> expressionColumns,
                             List<Expression> premises) {
        List<String> variables = sortedVariables(formulas);
        if (variables.size() > config.getMaxVariables()) {
            throw new TooManyVariablesException(variables.size(), config.getMaxVariables());
        }

        List<TruthTableColumn> columns = new ArrayList<TruthTableColumn>();
        for (String variable : variables) {
            columns.add(TruthTableColumn.variable(variable));
        }
        columns.addAll(expressionColumns);

        long rowCount = 1L << variables.size();
        log.debug(String.format("Generating %d rows over %d columns", rowCount, columns.size()));

        List<TruthTableRow> rows = new ArrayList<TruthTableRow>();
        for (long i = 0; i < rowCount; i++) {
            Map<String, Boolean> assignment = assignment(variables, i);
            boolean[] values = new boolean[columns.size()];
            for (int c = 0; c < columns.size(); c++) {
                values[c] = evaluate(columns.get(c), assignment, premises);
            }
            rows.add(new TruthTableRow(values));
        }
        return new TruthTable(variables, columns, rows);
    }

    private static boolean evaluate(TruthTableColumn column, Map<String, Boolean> assignment, List<Expression> premises) {
        switch (column.getType()) {
            case VARIABLE:
                return assignment.get(column.getHeader());
            case ALL_TRUE:
                for (Expression premise : premises) {
                    if (!premise.evaluate(assignment)) {
                        return false;
                    }
                }
                return true;
            default:
                return column.getExpression().evaluate(assignment);
        }
    }
}
