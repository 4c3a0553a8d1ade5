package com.juanpa.tinyc.ast.statements;

import com.juanpa.tinyc.ast.ASTVisitor;
import com.juanpa.tinyc.ast.expressions.Expression;

/**
 * AST node for {@code return <expr>;}. The value is mandatory.
 */
public class ReturnStatement implements Statement
{
	private final Expression value;

	public ReturnStatement(Expression value)
	{
		this.value = value;
	}

	public Expression getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitReturnStatement(this);
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (!(o instanceof ReturnStatement))
			return false;
		return value.equals(((ReturnStatement) o).value);
	}

	@Override
	public int hashCode()
	{
		return value.hashCode();
	}

	@Override
	public String toString()
	{
		return "Return " + value;
	}
}
