package com.juanpa.tinyc.cfg;

import java.util.Objects;

/**
 * {@code dest = lhs <op> rhs} over previously assigned variables.
 */
public class OperationInstruction implements Instruction
{
	private final String destination;
	private final CfgOperator operator;
	private final String left;
	private final String right;

	public OperationInstruction(String destination, CfgOperator operator, String left, String right)
	{
		this.destination = destination;
		this.operator = operator;
		this.left = left;
		this.right = right;
	}

	public String getDestination()
	{
		return destination;
	}

	public CfgOperator getOperator()
	{
		return operator;
	}

	public String getLeft()
	{
		return left;
	}

	public String getRight()
	{
		return right;
	}

	@Override
	public <R> R accept(InstructionVisitor<R> visitor)
	{
		return visitor.visitOperation(this);
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (!(o instanceof OperationInstruction))
			return false;
		OperationInstruction that = (OperationInstruction) o;
		return destination.equals(that.destination) && operator == that.operator
				&& left.equals(that.left) && right.equals(that.right);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(destination, operator, left, right);
	}

	@Override
	public String toString()
	{
		return destination + " = " + left + " " + operator.getSymbol() + " " + right;
	}
}
