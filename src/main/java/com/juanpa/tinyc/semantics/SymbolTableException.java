package com.juanpa.tinyc.semantics;

import com.juanpa.tinyc.CompilationException;
import com.juanpa.tinyc.CompilationStage;

/**
 * Raised while building the symbol table when a scope declares the same name twice.
 */
public class SymbolTableException extends CompilationException
{
	private final String variableName;
	private final int scopeId;

	public SymbolTableException(String variableName, int scopeId)
	{
		super(CompilationStage.SYMBOL_TABLE, "Duplicate insertion of variable " + variableName + " into scope " + scopeId + ".");
		this.variableName = variableName;
		this.scopeId = scopeId;
	}

	public String getVariableName()
	{
		return variableName;
	}

	public int getScopeId()
	{
		return scopeId;
	}
}
