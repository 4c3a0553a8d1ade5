package com.juanpa.tinyc;

/**
 * The pipeline stages, in the order the compiler runs them.
 */
public enum CompilationStage
{
	LEXING("Lexical"),
	PARSING("Syntax"),
	SYMBOL_TABLE("Symbol Table"),
	SEMANTIC_ANALYSIS("Semantic"),
	LOWERING("Lowering"),
	CODE_GENERATION("Codegen");

	private final String displayName;

	CompilationStage(String displayName)
	{
		this.displayName = displayName;
	}

	public String getDisplayName()
	{
		return displayName;
	}
}
