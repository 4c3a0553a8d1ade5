package com.juanpa.tinyc.ast.expressions;

import com.juanpa.tinyc.ast.ASTVisitor;
import com.juanpa.tinyc.lexer.Token;

/**
 * AST node for an integer literal. The value is an unsigned 64-bit number stored in a long.
 */
public class IntegerLiteralExpression implements Expression
{
	private final long value;
	private final Token token;

	public IntegerLiteralExpression(long value)
	{
		this(value, null);
	}

	public IntegerLiteralExpression(long value, Token token)
	{
		this.value = value;
		this.token = token;
	}

	public long getValue()
	{
		return value;
	}

	@Override
	public Token getFirstToken()
	{
		return token;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitIntegerLiteralExpression(this);
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (!(o instanceof IntegerLiteralExpression))
			return false;
		return value == ((IntegerLiteralExpression) o).value;
	}

	@Override
	public int hashCode()
	{
		return Long.hashCode(value);
	}

	@Override
	public String toString()
	{
		return Long.toUnsignedString(value);
	}
}
