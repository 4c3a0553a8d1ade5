// File: src/main/java/com/juanpa/tinyc/codegen/X86CodeGenerator.java

package com.juanpa.tinyc.codegen;

import com.juanpa.tinyc.cfg.AssignInstruction;
import com.juanpa.tinyc.cfg.BasicBlock;
import com.juanpa.tinyc.cfg.ControlFlowGraph;
import com.juanpa.tinyc.cfg.Instruction;
import com.juanpa.tinyc.cfg.InstructionVisitor;
import com.juanpa.tinyc.cfg.JumpInstruction;
import com.juanpa.tinyc.cfg.OperationInstruction;
import com.juanpa.tinyc.cfg.ReturnInstruction;
import com.juanpa.tinyc.util.Debug;

import java.util.ArrayList;
import java.util.List;

/**
 * Emits GNU as (AT&T syntax) for a single-block control-flow graph.
 * Each CFG variable lives in the register {@link Register#forVariable} gives it.
 * The output is a list of lines without terminators.
 */
public class X86CodeGenerator implements InstructionVisitor<Void>
{
	public static final List<String> HEADER = List.of(".global main", "main:");

	private final List<String> lines = new ArrayList<>();

	/**
	 * Convenience entry point for a one-off generation.
	 */
	public static List<String> emit(ControlFlowGraph graph)
	{
		return new X86CodeGenerator().generate(graph);
	}

	/**
	 * Generates the assembly for a graph.
	 *
	 * @param graph A graph with exactly one block, block 0.
	 * @return The assembly lines, starting with the `.global main` header.
	 * @throws CodegenException if the graph has other blocks, or uses a variable or
	 *                          instruction this backend cannot handle.
	 */
	public List<String> generate(ControlFlowGraph graph)
	{
		if (graph.size() != 1 || graph.getEntryBlock() == null)
		{
			throw new CodegenException("Expected a single block with id " + ControlFlowGraph.ENTRY_BLOCK_ID
					+ ", got " + graph.size() + " block(s); branching code is not supported.");
		}

		lines.clear();
		lines.addAll(HEADER);

		BasicBlock block = graph.getEntryBlock();
		for (Instruction instruction : block.getInstructions())
		{
			instruction.accept(this);
		}

		Debug.log("Generated %d lines of assembly", lines.size());
		return new ArrayList<>(lines);
	}

	@Override
	public Void visitAssign(AssignInstruction instruction)
	{
		Register destination = registerFor(instruction.getDestination());
		lines.add("mov $" + Long.toUnsignedString(instruction.getValue()) + ", " + destination);
		return null;
	}

	@Override
	public Void visitReturn(ReturnInstruction instruction)
	{
		Register source = registerFor(instruction.getVariable());
		lines.add("mov " + source + ", " + Register.RETURN);
		return null;
	}

	@Override
	public Void visitJump(JumpInstruction instruction)
	{
		throw new CodegenException("Cannot emit '" + instruction + "': jumps need more than one block.");
	}

	@Override
	public Void visitOperation(OperationInstruction instruction)
	{
		throw new CodegenException("Cannot emit '" + instruction + "': arithmetic is not supported by this backend.");
	}

	private static Register registerFor(String variable)
	{
		Register register = Register.forVariable(variable);
		if (register == null)
		{
			throw new CodegenException("Could not map variable " + variable + " to a register.");
		}
		return register;
	}
}
