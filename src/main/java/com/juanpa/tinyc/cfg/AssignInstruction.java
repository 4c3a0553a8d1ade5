package com.juanpa.tinyc.cfg;

import java.util.Objects;

/**
 * {@code dest = <literal>}. The literal is an unsigned 64-bit value held in a long.
 */
public class AssignInstruction implements Instruction
{
	private final String destination;
	private final long value;

	public AssignInstruction(String destination, long value)
	{
		this.destination = destination;
		this.value = value;
	}

	public String getDestination()
	{
		return destination;
	}

	public long getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(InstructionVisitor<R> visitor)
	{
		return visitor.visitAssign(this);
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (!(o instanceof AssignInstruction))
			return false;
		AssignInstruction that = (AssignInstruction) o;
		return value == that.value && destination.equals(that.destination);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(destination, value);
	}

	@Override
	public String toString()
	{
		return destination + " = " + Long.toUnsignedString(value);
	}
}
