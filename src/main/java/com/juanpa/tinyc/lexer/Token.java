package com.juanpa.tinyc.lexer;

import java.util.Objects;

/**
 * Represents a single token produced by the TinyC Lexer.
 * Each token encapsulates its type, the actual text (lexeme),
 * and its position in the source file for error reporting.
 */
public class Token
{
	private final TokenType type;    // The classification of the token (e.g., IDENTIFIER, KEYWORD)
	private final String lexeme;     // The actual text of the token (e.g., "myVariable", "123", "==")
	private final Object literal;    // Long for integer literals, String for string literals, null otherwise
	private final int offset;        // Character offset of the token start
	private final int line;          // The line number in the source file where the token starts
	private final int column;        // The column number in the source file where the token starts

	/**
	 * Constructs a new Token instance.
	 *
	 * @param type    The TokenType of this token.
	 * @param lexeme  The raw string value of the token from the source code.
	 * @param literal The parsed literal value for literal tokens, null for everything else.
	 *                Integer literals hold their value as an unsigned 64-bit Long.
	 * @param offset  The character offset where this token begins.
	 * @param line    The line number where this token begins.
	 * @param column  The column number where this token begins.
	 */
	public Token(TokenType type, String lexeme, Object literal, int offset, int line, int column)
	{
		this.type = type;
		this.lexeme = lexeme;
		this.literal = literal;
		this.offset = offset;
		this.line = line;
		this.column = column;
	}

	// --- Position-less factories, used for expected token sequences ---

	public static Token of(TokenType type, String lexeme)
	{
		return new Token(type, lexeme, null, 0, 0, 0);
	}

	public static Token operator(String text)
	{
		return of(TokenType.OPERATOR, text);
	}

	public static Token keyword(String text)
	{
		return of(TokenType.KEYWORD, text);
	}

	public static Token identifier(String text)
	{
		return of(TokenType.IDENTIFIER, text);
	}

	public static Token integer(long value)
	{
		return new Token(TokenType.INTEGER_LITERAL, Long.toUnsignedString(value), value, 0, 0, 0);
	}

	public static Token string(String contents)
	{
		return new Token(TokenType.STRING_LITERAL, "\"" + contents + "\"", contents, 0, 0, 0);
	}

	// --- Getters for Token properties ---

	public TokenType getType()
	{
		return type;
	}

	public String getLexeme()
	{
		return lexeme;
	}

	public Object getLiteral()
	{
		return literal;
	}

	public int getOffset()
	{
		return offset;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	public boolean is(TokenType expectedType, String expectedLexeme)
	{
		return type == expectedType && lexeme.equals(expectedLexeme);
	}

	/**
	 * Provides a string representation of the Token, useful for debugging.
	 * Format: "TokenType 'Lexeme' [Literal] (Line:Column)"
	 */
	@Override
	public String toString()
	{
		String literalStr = (literal instanceof Long) ? " [" + Long.toUnsignedString((Long) literal) + "]"
				: (literal != null) ? " [" + literal + "]" : "";
		return type + " '" + lexeme + "'" + literalStr + " (Line:" + line + ", Col:" + column + ")";
	}

	/**
	 * Structural equality: type, lexeme and literal. Position is left out so a token
	 * built by hand compares equal to the one the lexer produced.
	 */
	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;

		Token token = (Token) o;

		if (type != token.type)
			return false;
		if (!lexeme.equals(token.lexeme))
			return false;
		return Objects.equals(literal, token.literal);
	}

	@Override
	public int hashCode()
	{
		int result = type.hashCode();
		result = 31 * result + lexeme.hashCode();
		result = 31 * result + (literal != null ? literal.hashCode() : 0);
		return result;
	}
}
