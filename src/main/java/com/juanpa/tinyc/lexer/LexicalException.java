package com.juanpa.tinyc.lexer;

import com.juanpa.tinyc.CompilationException;
import com.juanpa.tinyc.CompilationStage;

/**
 * Raised when the source text cannot be split into tokens.
 */
public class LexicalException extends CompilationException
{
	private final int offset;        // Character offset into the source
	private final char character;    // The character the lexer stopped at

	public LexicalException(String message, int offset, char character, int line, int column)
	{
		super(CompilationStage.LEXING, message, line, column);
		this.offset = offset;
		this.character = character;
	}

	public int getOffset()
	{
		return offset;
	}

	public char getCharacter()
	{
		return character;
	}
}
