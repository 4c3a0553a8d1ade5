package com.juanpa.tinyc.cfg;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Blocks of one function keyed by id, iterated in id order. Block 0 is the entry.
 */
public class ControlFlowGraph
{
	public static final int ENTRY_BLOCK_ID = 0;

	private final Map<Integer, BasicBlock> blocks = new TreeMap<>();

	/**
	 * Creates and registers an empty block.
	 *
	 * @param id The new block's id.
	 * @return The new block.
	 * @throws IllegalArgumentException if the id is already taken.
	 */
	public BasicBlock createBlock(int id)
	{
		if (blocks.containsKey(id))
		{
			throw new IllegalArgumentException("Block " + id + " already exists.");
		}
		BasicBlock block = new BasicBlock(id);
		blocks.put(id, block);
		return block;
	}

	/**
	 * @return The block with the given id, or null if there is none.
	 */
	public BasicBlock getBlock(int id)
	{
		return blocks.get(id);
	}

	public BasicBlock getEntryBlock()
	{
		return blocks.get(ENTRY_BLOCK_ID);
	}

	public Collection<BasicBlock> getBlocks()
	{
		return Collections.unmodifiableCollection(blocks.values());
	}

	public int size()
	{
		return blocks.size();
	}

	@Override
	public String toString()
	{
		return CfgPrinter.print(this);
	}
}
