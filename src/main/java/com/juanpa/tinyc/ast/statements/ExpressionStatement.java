package com.juanpa.tinyc.ast.statements;

import com.juanpa.tinyc.ast.ASTVisitor;
import com.juanpa.tinyc.ast.expressions.Expression;

/**
 * AST node representing an expression evaluated for its effect, e.g. {@code x = 1;}.
 */
public class ExpressionStatement implements Statement
{
	private final Expression expression;

	public ExpressionStatement(Expression expression)
	{
		this.expression = expression;
	}

	public Expression getExpression()
	{
		return expression;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitExpressionStatement(this);
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (!(o instanceof ExpressionStatement))
			return false;
		return expression.equals(((ExpressionStatement) o).expression);
	}

	@Override
	public int hashCode()
	{
		return expression.hashCode();
	}

	@Override
	public String toString()
	{
		return "Expression " + expression;
	}
}
