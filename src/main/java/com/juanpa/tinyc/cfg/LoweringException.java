package com.juanpa.tinyc.cfg;

import com.juanpa.tinyc.CompilationException;
import com.juanpa.tinyc.CompilationStage;

/**
 * Raised when a valid program uses a construct the CFG builder cannot lower yet
 * (branches, expression statements, non-literal initializers).
 */
public class LoweringException extends CompilationException
{
	public LoweringException(String message)
	{
		super(CompilationStage.LOWERING, message);
	}
}
