package org.dice.parsing;

import org.dice.parsing.exceptions.UnbalancedParenthesesException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a statement such as {@code p -> q, p therefore q} into premises and an optional conclusion.
 *
 * Commas separate premises. The first {@code therefore} or {@code |-} ends the premises and the rest of
 * the statement is the conclusion. Separators only count outside parentheses, so
 * {@code p & (q, r)} is a single premise.
 */
public class PremiseSplitter {

    public static final String THEREFORE = "therefore";
    public static final String TURNSTILE = "|-";

    private static final char COMMA = ',';

    public static SplitStatement split(String statement) {
        List<String> premises = new ArrayList<String>();
        if(statement == null){
            return new SplitStatement(premises, null);
        }

        int depth = 0;
        int start = 0;
        for (int i = 0; i < statement.length(); i++) {
            char c = statement.charAt(i);
            if (c == '(') {
                depth++;
            }
            else if (c == ')') {
                depth--;
                if (depth < 0) {
                    throw new UnbalancedParenthesesException(i);
                }
            }
            if (depth != 0) {
                continue;
            }

            int separatorLength = conclusionSeparatorAt(statement, i);
            if (separatorLength > 0) {
                addSegment(premises, statement.substring(start, i), true);
                checkBalanced(statement, i + separatorLength);
                return new SplitStatement(premises, statement.substring(i + separatorLength).trim());
            }
            if (c == COMMA) {
                addSegment(premises, statement.substring(start, i), false);
                start = i + 1;
            }
        }

        if (depth != 0) {
            throw new UnbalancedParenthesesException(statement.length());
        }
        addSegment(premises, statement.substring(start), true);
        return new SplitStatement(premises, null);
    }

    /**
     * @return length of the conclusion separator starting at {@code i}, or 0 if there is none
     */
    static int conclusionSeparatorAt(String statement, int i) {
        if (statement.startsWith(TURNSTILE, i)) {
            return TURNSTILE.length();
        }
        int end = i + THEREFORE.length();
        if (statement.regionMatches(true, i, THEREFORE, 0, THEREFORE.length())
                && (i == 0 || !Lexer.isIdentifierPart(statement.charAt(i - 1)))
                && (end == statement.length() || !Lexer.isIdentifierPart(statement.charAt(end)))) {
            return THEREFORE.length();
        }
        return 0;
    }

    private static void addSegment(List<String> premises, String segment, boolean dropIfEmpty) {
        String premise = segment.trim();
        // an empty segment between two commas is kept so that parsing reports it
        if (premise.isEmpty() && dropIfEmpty) {
            return;
        }
        premises.add(premise);
    }

    private static void checkBalanced(String statement, int from) {
        int depth = 0;
        for (int i = from; i < statement.length(); i++) {
            char c = statement.charAt(i);
            if (c == '(') {
                depth++;
            }
            else if (c == ')' && --depth < 0) {
                throw new UnbalancedParenthesesException(i);
            }
        }
        if (depth != 0) {
            throw new UnbalancedParenthesesException(statement.length());
        }
    }
}
