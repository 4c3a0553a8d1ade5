package com.juanpa.tinyc.ast.expressions;

import com.juanpa.tinyc.lexer.Token;
import com.juanpa.tinyc.lexer.TokenType;

/**
 * The binary operators and their binding strength. A higher precedence binds tighter.
 */
public enum BinaryOperator
{
	ADD("+", 30),
	SUB("-", 30),
	MUL("*", 40),
	DIV("/", 40),
	ASSIGN("=", 10),
	EQUALS("==", 20);

	private final String symbol;
	private final int precedence;

	BinaryOperator(String symbol, int precedence)
	{
		this.symbol = symbol;
		this.precedence = precedence;
	}

	public String getSymbol()
	{
		return symbol;
	}

	public int getPrecedence()
	{
		return precedence;
	}

	/**
	 * Maps an operator token to its operator.
	 *
	 * @param token Any token; null is allowed.
	 * @return The operator, or null if the token is not a binary operator.
	 */
	public static BinaryOperator fromToken(Token token)
	{
		if (token == null || token.getType() != TokenType.OPERATOR)
		{
			return null;
		}
		for (BinaryOperator op : values())
		{
			if (op.symbol.equals(token.getLexeme()))
			{
				return op;
			}
		}
		return null;
	}
}
