// File: src/main/java/com/juanpa/tinyc/ast/Scope.java
package com.juanpa.tinyc.ast;

import com.juanpa.tinyc.ast.statements.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A brace-delimited block of statements with a numeric id.
 * Ids come from the parse's {@code ScopeIdCounter} and are handed out only after the
 * block's own statements are parsed, so a scope's id is larger than every id nested in it.
 */
public class Scope implements ASTNode
{
	private final int id;
	private final List<Statement> statements;

	public Scope(int id, List<Statement> statements)
	{
		this.id = id;
		this.statements = new ArrayList<>(statements);
	}

	public int getId()
	{
		return id;
	}

	public List<Statement> getStatements()
	{
		return Collections.unmodifiableList(statements);
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitScope(this);
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (!(o instanceof Scope))
			return false;
		Scope scope = (Scope) o;
		return id == scope.id && statements.equals(scope.statements);
	}

	@Override
	public int hashCode()
	{
		return 31 * id + statements.hashCode();
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder("{ // scope ").append(id).append("\n");
		for (Statement stmt : statements)
		{
			// Indent statements within the block
			sb.append(indent(stmt.toString()));
		}
		sb.append("}");
		return sb.toString();
	}

	// Helper for indentation
	private static String indent(String text)
	{
		StringBuilder indentedText = new StringBuilder();
		for (String line : text.split("\n"))
		{
			indentedText.append("  ").append(line).append("\n");
		}
		return indentedText.toString();
	}
}
