package com.juanpa.tinyc.cfg;

/**
 * Unconditional transfer to another block.
 */
public class JumpInstruction implements Instruction
{
	private final int targetBlockId;

	public JumpInstruction(int targetBlockId)
	{
		this.targetBlockId = targetBlockId;
	}

	public int getTargetBlockId()
	{
		return targetBlockId;
	}

	@Override
	public <R> R accept(InstructionVisitor<R> visitor)
	{
		return visitor.visitJump(this);
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (!(o instanceof JumpInstruction))
			return false;
		return targetBlockId == ((JumpInstruction) o).targetBlockId;
	}

	@Override
	public int hashCode()
	{
		return Integer.hashCode(targetBlockId);
	}

	@Override
	public String toString()
	{
		return "goto block " + targetBlockId;
	}
}
