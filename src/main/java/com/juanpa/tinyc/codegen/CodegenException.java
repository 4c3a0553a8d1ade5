package com.juanpa.tinyc.codegen;

import com.juanpa.tinyc.CompilationException;
import com.juanpa.tinyc.CompilationStage;

public class CodegenException extends CompilationException
{
	public CodegenException(String message)
	{
		super(CompilationStage.CODE_GENERATION, message);
	}
}
