package com.juanpa.tinyc;

/**
 * Base class for every error that aborts a compilation.
 * Stages throw the first error they hit and never try to recover, so one of these
 * always means no assembly is produced.
 */
public abstract class CompilationException extends RuntimeException
{
	private final CompilationStage stage;
	private final int line;   // 0 when the error has no source position
	private final int column;

	protected CompilationException(CompilationStage stage, String message)
	{
		this(stage, message, 0, 0);
	}

	protected CompilationException(CompilationStage stage, String message, int line, int column)
	{
		super(message);
		this.stage = stage;
		this.line = line;
		this.column = column;
	}

	public CompilationStage getStage()
	{
		return stage;
	}

	public boolean hasPosition()
	{
		return line > 0;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}
}
