package com.juanpa.tinyc.cfg;

/**
 * Returns the value held in a variable.
 */
public class ReturnInstruction implements Instruction
{
	private final String variable;

	public ReturnInstruction(String variable)
	{
		this.variable = variable;
	}

	public String getVariable()
	{
		return variable;
	}

	@Override
	public <R> R accept(InstructionVisitor<R> visitor)
	{
		return visitor.visitReturn(this);
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (!(o instanceof ReturnInstruction))
			return false;
		return variable.equals(((ReturnInstruction) o).variable);
	}

	@Override
	public int hashCode()
	{
		return variable.hashCode();
	}

	@Override
	public String toString()
	{
		return "return " + variable;
	}
}
