// File: src/main/java/com/juanpa/tinyc/ast/expressions/IdentifierExpression.java

package com.juanpa.tinyc.ast.expressions;

import com.juanpa.tinyc.ast.ASTVisitor;
import com.juanpa.tinyc.lexer.Token;

/**
 * AST node representing a reference to a variable by name.
 */
public class IdentifierExpression implements Expression
{
	private final String name;
	private final Token token; // The identifier token, when parsed from source

	public IdentifierExpression(String name)
	{
		this(name, null);
	}

	public IdentifierExpression(String name, Token token)
	{
		this.name = name;
		this.token = token;
	}

	public String getName()
	{
		return name;
	}

	@Override
	public Token getFirstToken()
	{
		return token;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitIdentifierExpression(this);
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (!(o instanceof IdentifierExpression))
			return false;
		return name.equals(((IdentifierExpression) o).name);
	}

	@Override
	public int hashCode()
	{
		return name.hashCode();
	}

	@Override
	public String toString()
	{
		return name;
	}
}
