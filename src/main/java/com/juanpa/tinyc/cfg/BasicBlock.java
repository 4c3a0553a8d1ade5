package com.juanpa.tinyc.cfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A straight-line run of instructions with a single entry. Control leaves through the
 * successor blocks; a block that ends in a return has none.
 */
public class BasicBlock
{
	private final int id;
	private final List<Instruction> instructions = new ArrayList<>();
	private final List<Integer> successors = new ArrayList<>();

	public BasicBlock(int id)
	{
		this.id = id;
	}

	public int getId()
	{
		return id;
	}

	public void addInstruction(Instruction instruction)
	{
		instructions.add(instruction);
	}

	public List<Instruction> getInstructions()
	{
		return Collections.unmodifiableList(instructions);
	}

	public void addSuccessor(int blockId)
	{
		if (!successors.contains(blockId))
		{
			successors.add(blockId);
		}
	}

	public List<Integer> getSuccessors()
	{
		return Collections.unmodifiableList(successors);
	}

	@Override
	public String toString()
	{
		return "block " + id + " " + instructions;
	}
}
