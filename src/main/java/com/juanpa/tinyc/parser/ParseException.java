package com.juanpa.tinyc.parser;

import com.juanpa.tinyc.CompilationException;
import com.juanpa.tinyc.CompilationStage;
import com.juanpa.tinyc.lexer.Token;

/**
 * Raised at the first token the parser cannot accept.
 * The parser does not recover, so no partial AST exists once this is thrown.
 */
public class ParseException extends CompilationException
{
	private final Token token;   // null when input ended early
	private final int position;  // Index into the token list

	public ParseException(String message, Token token, int position)
	{
		super(CompilationStage.PARSING, message,
				token != null ? token.getLine() : 0,
				token != null ? token.getColumn() : 0);
		this.token = token;
		this.position = position;
	}

	public Token getToken()
	{
		return token;
	}

	public int getPosition()
	{
		return position;
	}
}
