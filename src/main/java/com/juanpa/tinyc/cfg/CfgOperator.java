package com.juanpa.tinyc.cfg;

/**
 * Arithmetic operators available to {@link OperationInstruction}.
 */
public enum CfgOperator
{
	ADD("+"),
	SUB("-"),
	MUL("*"),
	DIV("/");

	private final String symbol;

	CfgOperator(String symbol)
	{
		this.symbol = symbol;
	}

	public String getSymbol()
	{
		return symbol;
	}
}
