package com.juanpa.tinyc.cfg;

import java.util.stream.Collectors;

/**
 * Renders a control-flow graph as text, one instruction per line:
 * <pre>
 * block 0:
 *   v1 = 123
 *   return v1
 * </pre>
 */
public final class CfgPrinter
{
	private CfgPrinter()
	{
	}

	public static String print(ControlFlowGraph graph)
	{
		StringBuilder sb = new StringBuilder();
		for (BasicBlock block : graph.getBlocks())
		{
			sb.append("block ").append(block.getId()).append(":");
			if (!block.getSuccessors().isEmpty())
			{
				sb.append(" -> ").append(block.getSuccessors().stream()
						.map(String::valueOf)
						.collect(Collectors.joining(", ")));
			}
			sb.append("\n");
			for (Instruction instruction : block.getInstructions())
			{
				sb.append("  ").append(instruction).append("\n");
			}
		}
		return sb.toString();
	}
}
