package com.juanpa.tinyc.parser;

/**
 * Hands out scope ids for one parse. Each parser owns its own counter, so two
 * compilations running side by side never share a sequence.
 */
public class ScopeIdCounter
{
	private int counter = 0;

	/**
	 * @return The next id; the first call returns 1.
	 */
	public int next()
	{
		return ++counter;
	}
}
