package org.dice.parsing.exceptions;

/**
 * Thrown by a strict lexer when the input holds a character that starts no valid token.
 */
public class LexerException extends LogicException {

    private final char character;
    private final int position;

    public LexerException(char character, int position) {
        super(String.format("Unrecognized character '%s' at position %d", character, position));
        this.character = character;
        this.position = position;
    }

    public char getCharacter() {
        return character;
    }

    public int getPosition() {
        return position;
    }
}
