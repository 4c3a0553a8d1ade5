// File: src/main/java/com/juanpa/tinyc/ast/statements/VariableDeclarationStatement.java

package com.juanpa.tinyc.ast.statements;

import com.juanpa.tinyc.ast.ASTVisitor;
import com.juanpa.tinyc.ast.expressions.Expression;
import com.juanpa.tinyc.lexer.Token;
import com.juanpa.tinyc.semantics.Type;

import java.util.Objects;

/**
 * AST node representing a local variable declaration, with or without an initializer.
 * Example: `int x;` or `MyType z = "text";`
 */
public class VariableDeclarationStatement implements Statement
{
	private final String name;
	private final Type type;
	private final Expression initializer; // null when the declaration has no '= expr'
	private final Token nameToken;

	public VariableDeclarationStatement(String name, Type type, Expression initializer)
	{
		this(name, type, initializer, null);
	}

	/**
	 * Constructs a VariableDeclarationStatement.
	 *
	 * @param name        The declared variable name.
	 * @param type        The declared type.
	 * @param initializer The initializer expression, or null.
	 * @param nameToken   The identifier token of the name, when parsed from source.
	 */
	public VariableDeclarationStatement(String name, Type type, Expression initializer, Token nameToken)
	{
		this.name = name;
		this.type = type;
		this.initializer = initializer;
		this.nameToken = nameToken;
	}

	public String getName()
	{
		return name;
	}

	public Type getType()
	{
		return type;
	}

	public Expression getInitializer()
	{
		return initializer;
	}

	public boolean hasInitializer()
	{
		return initializer != null;
	}

	public Token getNameToken()
	{
		return nameToken;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitVariableDeclarationStatement(this);
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (!(o instanceof VariableDeclarationStatement))
			return false;
		VariableDeclarationStatement that = (VariableDeclarationStatement) o;
		return name.equals(that.name) && type.equals(that.type) && Objects.equals(initializer, that.initializer);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(name, type, initializer);
	}

	@Override
	public String toString()
	{
		return "VarDeclare " + type + " " + name + (initializer != null ? " = " + initializer : "");
	}
}
