// File: src/main/java/com/juanpa/tinyc/lexer/Lexer.java

package com.juanpa.tinyc.lexer;

import com.juanpa.tinyc.util.Debug;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The Lexer is responsible for performing lexical analysis (scanning).
 * It reads the raw TinyC source code and converts it into a list of Tokens.
 * The first character that fits no token rule aborts the scan with a {@link LexicalException}.
 */
public class Lexer
{
	/**
	 * Reserved words. A word-like run equal to one of these becomes a KEYWORD token.
	 */
	public static final Set<String> KEYWORDS = Collections.unmodifiableSet(new LinkedHashSet<>(
			List.of("int", "return", "if", "else", "void", "char")));

	/**
	 * Operator vocabulary. Matching picks the longest entry that prefixes the input.
	 */
	public static final List<String> OPERATORS = List.of("+", "-", "*", "/", "=", "==");

	private final String source; // The raw source code string
	private final List<Token> tokens = new ArrayList<>(); // List to store generated tokens

	private int start = 0; // Current token's starting position in the source
	private int current = 0; // Current position in the source
	private int line = 1; // Current line number
	private int column = 1; // Current column number

	private int startLine = 1;
	private int startColumn = 1;

	/**
	 * Constructs a Lexer.
	 *
	 * @param source The source code string to tokenize.
	 */
	public Lexer(String source)
	{
		this.source = source;
	}

	/**
	 * Convenience entry point: scans the whole source in one call.
	 *
	 * @param source The source code string to tokenize.
	 * @return The tokens, in source order.
	 * @throws LexicalException at the first character that cannot start a token.
	 */
	public static List<Token> tokenize(String source)
	{
		return new Lexer(source).scanTokens();
	}

	/**
	 * Scans the entire source code and returns a list of tokens.
	 * There is no end-of-file marker; the list simply ends.
	 */
	public List<Token> scanTokens()
	{
		while (!isAtEnd())
		{
			start = current; // Mark the beginning of the current token
			startLine = line;
			startColumn = column;

			scanToken(); // Scan and add the next token
		}

		Debug.log("Lexer produced %d tokens", tokens.size());
		return tokens;
	}

	/**
	 * Scans a single token from the source code.
	 */
	private void scanToken()
	{
		char c = peek();

		if (Character.isWhitespace(c))
		{
			advance();
			return;
		}

		switch (c)
		{
			// --- Single-character tokens ---
			case '(':
				advance();
				addToken(TokenType.LEFT_PAREN);
				return;
			case ')':
				advance();
				addToken(TokenType.RIGHT_PAREN);
				return;
			case '{':
				advance();
				addToken(TokenType.LEFT_BRACE);
				return;
			case '}':
				advance();
				addToken(TokenType.RIGHT_BRACE);
				return;
			case ';':
				advance();
				addToken(TokenType.SEMICOLON);
				return;
			default:
				break;
		}

		// Order matters: operators, then strings, then words.
		if (scanOperator())
		{
			return;
		}
		if (c == '"')
		{
			scanStringLiteral();
			return;
		}
		if (isWordChar(c))
		{
			scanWord();
			return;
		}

		throw error("Tokenization error at position " + current + " character " + c);
	}

	/**
	 * Tries every operator at the current position and keeps the longest that matches,
	 * so "==" wins over two consecutive "=".
	 *
	 * @return True if an operator token was added.
	 */
	private boolean scanOperator()
	{
		String longest = null;
		for (String operator : OPERATORS)
		{
			if (source.startsWith(operator, current) && (longest == null || operator.length() > longest.length()))
			{
				longest = operator;
			}
		}

		if (longest == null)
		{
			return false;
		}

		for (int i = 0; i < longest.length(); i++)
		{
			advance();
		}
		addToken(TokenType.OPERATOR);
		return true;
	}

	/**
	 * Scans a string literal enclosed in double quotes.
	 * Contents are taken verbatim; there are no escape sequences.
	 */
	private void scanStringLiteral()
	{
		advance(); // Consume the opening '"'

		while (peek() != '"' && !isAtEnd())
		{
			advance();
		}

		if (isAtEnd())
		{
			throw new LexicalException("String literal starting at position " + start + " is missing its closing quote.",
					start, '"', startLine, startColumn);
		}

		advance(); // Consume the closing '"'
		addToken(TokenType.STRING_LITERAL, source.substring(start + 1, current - 1));
	}

	/**
	 * Scans a maximal run of letters, digits and underscores and classifies it as a
	 * keyword, an unsigned integer literal, or an identifier, in that order.
	 * A digit run that does not fit in 64 bits is not a literal, so it becomes an identifier.
	 */
	private void scanWord()
	{
		while (isWordChar(peek()))
		{
			advance();
		}

		String text = source.substring(start, current);

		if (KEYWORDS.contains(text))
		{
			addToken(TokenType.KEYWORD);
			return;
		}

		if (isAllDigits(text))
		{
			try
			{
				addToken(TokenType.INTEGER_LITERAL, Long.parseUnsignedLong(text));
				return;
			}
			catch (NumberFormatException e)
			{
				Debug.log("%s does not fit in 64 bits, lexing it as an identifier", text);
			}
		}

		// Anything else, including runs like "123abc" and oversized numbers, is an identifier
		addToken(TokenType.IDENTIFIER);
	}

	private static boolean isWordChar(char c)
	{
		return Character.isLetterOrDigit(c) || c == '_';
	}

	private static boolean isAllDigits(String text)
	{
		for (int i = 0; i < text.length(); i++)
		{
			char c = text.charAt(i);
			if (c < '0' || c > '9')
			{
				return false;
			}
		}
		return true;
	}

	/**
	 * Consumes the current character and returns it, keeping line and column in step.
	 *
	 * @return The consumed character.
	 */
	private char advance()
	{
		char c = source.charAt(current++);
		if (c == '\n')
		{
			line++;
			column = 1;
		}
		else
		{
			column++;
		}
		return c;
	}

	/**
	 * Helper method to add a token without a literal value.
	 *
	 * @param type The TokenType to add.
	 */
	private void addToken(TokenType type)
	{
		addToken(type, null);
	}

	/**
	 * Adds a token covering source[start, current).
	 *
	 * @param type    The TokenType to add.
	 * @param literal The literal value, or null.
	 */
	private void addToken(TokenType type, Object literal)
	{
		String text = source.substring(start, current);
		tokens.add(new Token(type, text, literal, start, startLine, startColumn));
	}

	/**
	 * Looks at the current character without consuming it.
	 *
	 * @return The current character, or '\0' if at the end of the source.
	 */
	private char peek()
	{
		if (isAtEnd())
		{
			return '\0';
		}
		return source.charAt(current);
	}

	/**
	 * Checks if the lexer has reached the end of the code.
	 *
	 * @return True if at the end, false otherwise.
	 */
	private boolean isAtEnd()
	{
		return current >= source.length();
	}

	private LexicalException error(String message)
	{
		return new LexicalException(message, current, peek(), line, column);
	}
}
