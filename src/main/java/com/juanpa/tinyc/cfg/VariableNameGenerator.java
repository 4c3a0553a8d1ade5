package com.juanpa.tinyc.cfg;

/**
 * Produces the CFG's variable names, v1, v2, ... One generator per build.
 */
public class VariableNameGenerator
{
	public static final String PREFIX = "v";

	private long counter = 0;

	public String next()
	{
		counter++;
		return PREFIX + counter;
	}
}
