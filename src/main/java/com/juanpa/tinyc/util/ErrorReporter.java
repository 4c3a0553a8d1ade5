package com.juanpa.tinyc.util;

import com.juanpa.tinyc.CompilationException;

import java.io.PrintStream;

public class ErrorReporter
{
	private final PrintStream out;
	private boolean hasErrors = false; // Set once anything has been reported
	private CompilationException firstError; // The error that stopped the pipeline, if any

	public ErrorReporter()
	{
		this(System.err);
	}

	public ErrorReporter(PrintStream out)
	{
		this.out = out;
	}

	/**
	 * Reports a compilation error at a source position.
	 *
	 * @param line    The line number where the error occurred.
	 * @param column  The column number where the error occurred.
	 * @param message The error message.
	 */
	public void report(int line, int column, String message)
	{
		out.println("[Error] Line " + line + ", Column " + column + ": " + message);
		hasErrors = true;
	}

	/**
	 * Reports an error that has no meaningful source position (scope or CFG level errors).
	 *
	 * @param message The error message.
	 */
	public void report(String message)
	{
		out.println("[Error] " + message);
		hasErrors = true;
	}

	/**
	 * Reports the exception that aborted a pipeline stage.
	 * Positioned errors keep their line and column, the rest are reported by stage.
	 *
	 * @param error The exception thrown by the failing stage.
	 */
	public void report(CompilationException error)
	{
		if (firstError == null)
		{
			firstError = error;
		}
		String message = "[" + error.getStage().getDisplayName() + " Error] " + error.getMessage();
		if (error.hasPosition())
		{
			report(error.getLine(), error.getColumn(), message);
		}
		else
		{
			report(message);
		}
	}

	/**
	 * Checks if any errors have been reported.
	 *
	 * @return True if errors exist, false otherwise.
	 */
	public boolean hasErrors()
	{
		return hasErrors;
	}

	public CompilationException getFirstError()
	{
		return firstError;
	}

	/**
	 * Resets the error flag.
	 */
	public void reset()
	{
		hasErrors = false;
		firstError = null;
	}
}
