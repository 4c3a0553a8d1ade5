package com.juanpa.tinyc.semantics;

import com.juanpa.tinyc.CompilationException;
import com.juanpa.tinyc.CompilationStage;
import com.juanpa.tinyc.lexer.Token;

/**
 * Raised for a variable reference that does not resolve through the scope chain.
 */
public class SemanticException extends CompilationException
{
	private final String variableName;
	private final int scopeId;

	public SemanticException(String variableName, int scopeId, Token reference)
	{
		super(CompilationStage.SEMANTIC_ANALYSIS, "Undefined variable " + variableName + " in scope " + scopeId,
				reference != null ? reference.getLine() : 0,
				reference != null ? reference.getColumn() : 0);
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
