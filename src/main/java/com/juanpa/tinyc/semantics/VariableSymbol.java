// File: src/main/java/com/juanpa/tinyc/semantics/VariableSymbol.java

package com.juanpa.tinyc.semantics;

import com.juanpa.tinyc.lexer.Token;

import java.util.Objects;

/**
 * Represents a declared local variable in the symbol table: its name and declared type.
 */
public class VariableSymbol
{
	private final String name;
	private final Type type;
	private final Token declarationToken; // The token where this symbol was declared, may be null

	public VariableSymbol(String name, Type type)
	{
		this(name, type, null);
	}

	/**
	 * Constructs a VariableSymbol.
	 *
	 * @param name             The name of the variable.
	 * @param type             The declared type of the variable.
	 * @param declarationToken The token where this variable was declared.
	 */
	public VariableSymbol(String name, Type type, Token declarationToken)
	{
		this.name = name;
		this.type = type;
		this.declarationToken = declarationToken;
	}

	public String getName()
	{
		return name;
	}

	public Type getType()
	{
		return type;
	}

	public Token getDeclarationToken()
	{
		return declarationToken;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (!(o instanceof VariableSymbol))
			return false;
		VariableSymbol that = (VariableSymbol) o;
		return name.equals(that.name) && type.equals(that.type);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(name, type);
	}

	@Override
	public String toString()
	{
		String line = declarationToken != null ? ", line=" + declarationToken.getLine() : "";
		return "VariableSymbol{name='" + name + "', type=" + type + line + "}";
	}
}
