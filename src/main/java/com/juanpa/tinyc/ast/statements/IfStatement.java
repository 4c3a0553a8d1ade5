// File: src/main/java/com/juanpa/tinyc/ast/statements/IfStatement.java
package com.juanpa.tinyc.ast.statements;

import com.juanpa.tinyc.ast.ASTVisitor;
import com.juanpa.tinyc.ast.Scope;
import com.juanpa.tinyc.ast.expressions.Expression;

import java.util.Objects;

/**
 * AST node representing an 'if-else' statement.
 * Both branches are brace-delimited blocks, each with its own scope. The else branch is optional.
 */
public class IfStatement implements Statement
{
	private final Expression condition;
	private final Scope thenScope;
	private final Scope elseScope; // null when there is no 'else'

	/**
	 * Constructs an IfStatement.
	 *
	 * @param condition The expression for the condition.
	 * @param thenScope The block to execute if the condition is true.
	 * @param elseScope The optional block to execute if the condition is false.
	 */
	public IfStatement(Expression condition, Scope thenScope, Scope elseScope)
	{
		this.condition = condition;
		this.thenScope = thenScope;
		this.elseScope = elseScope;
	}

	public Expression getCondition()
	{
		return condition;
	}

	public Scope getThenScope()
	{
		return thenScope;
	}

	public Scope getElseScope()
	{
		return elseScope;
	}

	public boolean hasElse()
	{
		return elseScope != null;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitIfStatement(this);
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (!(o instanceof IfStatement))
			return false;
		IfStatement that = (IfStatement) o;
		return condition.equals(that.condition)
				&& thenScope.equals(that.thenScope)
				&& Objects.equals(elseScope, that.elseScope);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(condition, thenScope, elseScope);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder("If (").append(condition).append(") ").append(thenScope);
		if (elseScope != null)
		{
			sb.append(" Else ").append(elseScope);
		}
		return sb.toString();
	}
}
