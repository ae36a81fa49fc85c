package org.dice.parsing;

import org.dice.parsing.exceptions.LexerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits a formula into symbols. Operator symbols are matched longest first, so {@code <->} is
 * never read as {@code <} followed by {@code ->}.
 */
public class Lexer {

    private static final Logger log = LoggerFactory.getLogger(Lexer.class);

    private final String inputString;
    private final boolean strict;

    private int position = 0;
    private int tokenStart = 0;
    private int symbol = NONE;
    private String currentToken   = "";

    public static final int EOF   = -1;
    public static final int IDENTIFIER = 999;

    public static final int NONE  = 0;

    public static final int NOT     = 1;
    public static final int AND     = 2;
    public static final int OR      = 3;
    public static final int IMPLIES = 4;
    public static final int IFF     = 5;

    public static final int LEFT  = 6;
    public static final int RIGHT = 7;

    private static final String sIFF = "<->";
    private static final String sIMPLIES = "->";
    private static final String sNOT = "~";
    private static final String sAND = "&";
    private static final String sOR = "|";
    private static final String sLPAREN = "(";
    private static final String sRPAREN = ")";

    // insertion order is match order
    private static final Map<String, Integer> stringToCode = generateStringToCode();
    private static Map<String, Integer> generateStringToCode(){
        Map<String, Integer> hm = new LinkedHashMap<String, Integer>();

        hm.put(sIFF, IFF);
        hm.put(sIMPLIES, IMPLIES);

        hm.put(sNOT, NOT);
        hm.put(sAND, AND);
        hm.put(sOR, OR);

        hm.put(sLPAREN, LEFT);
        hm.put(sRPAREN, RIGHT);
        return hm;
    }

    public Lexer(String s) {
        this(s, true);
    }

    /**
     * @param strict when false, characters that start no token are dropped with a warning
     *               instead of raising a {@link LexerException}
     */
    public Lexer(String s, boolean strict) {
        this.inputString = s == null ? "" : s;
        this.strict = strict;
    }

    public int nextSymbol() {
        while (true) {
            skipWhitespace();
            tokenStart = position;
            if (position >= inputString.length()) {
                currentToken = "";
                symbol = EOF;
                return symbol;
            }

            for (Map.Entry<String, Integer> entry : stringToCode.entrySet()) {
                if (inputString.startsWith(entry.getKey(), position)) {
                    currentToken = entry.getKey();
                    position += currentToken.length();
                    symbol = entry.getValue();
                    return symbol;
                }
            }

            char c = inputString.charAt(position);
            if (isIdentifierStart(c)) {
                int end = position + 1;
                while (end < inputString.length() && isIdentifierPart(inputString.charAt(end))) {
                    end++;
                }
                currentToken = inputString.substring(position, end);
                position = end;
                symbol = IDENTIFIER;
                return symbol;
            }

            if (strict) {
                throw new LexerException(c, position);
            }
            log.warn(String.format("Dropping unrecognized character '%s' at position %d", c, position));
            position++;
        }
    }

    public static List<Integer> tokenize(String inputString){
        return tokenize(inputString, true);
    }

    public static List<Integer> tokenize(String inputString, boolean strict){
        // create a new lexer so as not to reset this one
        Lexer temp = new Lexer(inputString, strict);
        List<Integer> symbols = new ArrayList<Integer>();
        int symbol;
        while ( (symbol = temp.nextSymbol()) != Lexer.EOF){
            symbols.add(symbol);
        }
        return symbols;
    }

    /**
     * @return the token texts of the input, in order
     */
    public static List<String> tokenTexts(String inputString, boolean strict){
        Lexer temp = new Lexer(inputString, strict);
        List<String> tokens = new ArrayList<String>();
        while (temp.nextSymbol() != Lexer.EOF){
            tokens.add(temp.toString());
        }
        return tokens;
    }

    public static boolean isIdentifierStart(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }

    public static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9') || c == '_';
    }

    /**
     * @return character offset of the current token, or the input length once EOF is reached
     */
    public int getPosition() {
        return tokenStart;
    }

    public String toString() {
        return this.currentToken;
    }

    private void skipWhitespace() {
        while (position < inputString.length() && Character.isWhitespace(inputString.charAt(position))) {
            position++;
        }
    }
}
