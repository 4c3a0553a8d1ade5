package com.juanpa.tinyc.ast.expressions;

import com.juanpa.tinyc.ast.ASTVisitor;
import com.juanpa.tinyc.lexer.Token;

/**
 * AST node for a string literal; the value excludes the quotes.
 */
public class StringLiteralExpression implements Expression
{
	private final String value;
	private final Token token;

	public StringLiteralExpression(String value)
	{
		this(value, null);
	}

	public StringLiteralExpression(String value, Token token)
	{
		this.value = value;
		this.token = token;
	}

	public String getValue()
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
		return visitor.visitStringLiteralExpression(this);
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (!(o instanceof StringLiteralExpression))
			return false;
		return value.equals(((StringLiteralExpression) o).value);
	}

	@Override
	public int hashCode()
	{
		return value.hashCode();
	}

	@Override
	public String toString()
	{
		return "\"" + value + "\"";
	}
}
