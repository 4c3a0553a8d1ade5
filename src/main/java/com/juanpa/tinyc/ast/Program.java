// File: src/main/java/com/juanpa/tinyc/ast/Program.java

package com.juanpa.tinyc.ast;

import com.juanpa.tinyc.ast.declarations.Declaration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The root AST node: the ordered list of top-level declarations.
 * Today the parser always produces exactly one, the `main` function.
 */
public class Program implements ASTNode
{
	private final List<Declaration> declarations;

	public Program(List<Declaration> declarations)
	{
		this.declarations = new ArrayList<>(declarations);
	}

	public List<Declaration> getDeclarations()
	{
		return Collections.unmodifiableList(declarations);
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitProgram(this);
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (!(o instanceof Program))
			return false;
		return declarations.equals(((Program) o).declarations);
	}

	@Override
	public int hashCode()
	{
		return declarations.hashCode();
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder();
		for (Declaration declaration : declarations)
		{
			sb.append(declaration).append("\n");
		}
		return sb.toString();
	}
}
