// File: src/main/java/com/juanpa/tinyc/ast/expressions/BinaryExpression.java

package com.juanpa.tinyc.ast.expressions;

import com.juanpa.tinyc.ast.ASTVisitor;
import com.juanpa.tinyc.lexer.Token;

import java.util.Objects;

/**
 * AST node representing a binary operation (e.g., a + b, x == y, x = 1).
 * Assignment is a binary operation too; its left operand is the target.
 */
public class BinaryExpression implements Expression
{
	private final BinaryOperator operator;
	private final Expression left;
	private final Expression right;

	public BinaryExpression(BinaryOperator operator, Expression left, Expression right)
	{
		this.operator = operator;
		this.left = left;
		this.right = right;
	}

	public BinaryOperator getOperator()
	{
		return operator;
	}

	public Expression getLeft()
	{
		return left;
	}

	public Expression getRight()
	{
		return right;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitBinaryExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return left.getFirstToken(); // The first token of a binary expression is its left operand's first token
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (!(o instanceof BinaryExpression))
			return false;
		BinaryExpression that = (BinaryExpression) o;
		return operator == that.operator && left.equals(that.left) && right.equals(that.right);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(operator, left, right);
	}

	@Override
	public String toString()
	{
		return "(" + left + " " + operator.getSymbol() + " " + right + ")";
	}
}
