package org.dice.truthtables;

import org.dice.parsing.ast.Expression;

/**
 * A table column: a variable, an expression node, or the conjunction of all premises.
 */
public class TruthTableColumn {

    public static final String ALL_TRUE_HEADER = "ALL TRUE";

    private final String header;
    private final ColumnType type;
    private final Expression expression;

    private TruthTableColumn(String header, ColumnType type, Expression expression) {
        this.header = header;
        this.type = type;
        this.expression = expression;
    }

    public static TruthTableColumn variable(String name) {
        return new TruthTableColumn(name, ColumnType.VARIABLE, null);
    }

    public static TruthTableColumn expression(Expression expression, ColumnType type) {
        return new TruthTableColumn(expression.render(), type, expression);
    }

    public static TruthTableColumn allTrue() {
        return new TruthTableColumn(ALL_TRUE_HEADER, ColumnType.ALL_TRUE, null);
    }

    public String getHeader() {
        return header;
    }

    public ColumnType getType() {
        return type;
    }

    /**
     * @return the evaluated node, or null for variable and ALL TRUE columns
     */
    public Expression getExpression() {
        return expression;
    }

    @Override
    public String toString(){
        return String.format("%s [%s]", header, type);
    }
}
