// File: src/main/java/com/juanpa/tinyc/lexer/TokenType.java
package com.juanpa.tinyc.lexer;

/**
 * Defines the types of tokens recognized by the TinyC Lexer.
 * Operators and keywords share one type each; the lexeme tells them apart.
 */
public enum TokenType
{
	// --- Punctuation & Delimiters ---
	LEFT_PAREN, RIGHT_PAREN,       // ( )
	LEFT_BRACE, RIGHT_BRACE,       // { }
	SEMICOLON,                     // ;

	// --- Words ---
	OPERATOR,                      // + - * / = ==
	KEYWORD,                       // int return if else void char
	IDENTIFIER,

	// --- Literals ---
	INTEGER_LITERAL,
	STRING_LITERAL
}
