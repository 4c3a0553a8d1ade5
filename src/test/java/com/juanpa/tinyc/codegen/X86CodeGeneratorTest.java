package com.juanpa.tinyc.codegen;

import com.juanpa.tinyc.cfg.AssignInstruction;
import com.juanpa.tinyc.cfg.BasicBlock;
import com.juanpa.tinyc.cfg.CfgOperator;
import com.juanpa.tinyc.cfg.ControlFlowGraph;
import com.juanpa.tinyc.cfg.JumpInstruction;
import com.juanpa.tinyc.cfg.OperationInstruction;
import com.juanpa.tinyc.cfg.ReturnInstruction;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class X86CodeGeneratorTest
{
	private final ControlFlowGraph graph = new ControlFlowGraph();
	private final BasicBlock entry = graph.createBlock(ControlFlowGraph.ENTRY_BLOCK_ID);

	@Test
	void assignAndReturn()
	{
		entry.addInstruction(new AssignInstruction("v1", 123));
		entry.addInstruction(new ReturnInstruction("v1"));

		assertEquals(List.of(".global main", "main:", "mov $123, %rbx", "mov %rbx, %rax"), X86CodeGenerator.emit(graph));
	}

	@Test
	void emptyBlockEmitsOnlyTheHeader()
	{

		assertEquals(X86CodeGenerator.HEADER, X86CodeGenerator.emit(graph));
	}

	@Test
	void valuesAreWrittenUnsigned()
	{
		entry.addInstruction(new AssignInstruction("v4", -1L));

		assertEquals("mov $18446744073709551615, %r8", X86CodeGenerator.emit(graph).get(2));
	}

	@Test
	void registerTable()
	{
		assertEquals(Register.RBX, Register.forVariable("v1"));
		assertEquals(Register.RCX, Register.forVariable("v2"));
		assertEquals(Register.RDX, Register.forVariable("v3"));
		assertEquals(Register.R8, Register.forVariable("v4"));
		assertEquals(Register.R9, Register.forVariable("v5"));
		assertNull(Register.forVariable("v6"));
		assertEquals("%r9", Register.R9.toString());
	}

	@Test
	void sixthVariableHasNoRegister()
	{
		entry.addInstruction(new AssignInstruction("v6", 1));

		CodegenException e = assertThrows(CodegenException.class, () -> X86CodeGenerator.emit(graph));
		assertEquals("Could not map variable v6 to a register.", e.getMessage());
	}

	@Test
	void multipleBlocksAreRejected()
	{
		entry.addInstruction(new JumpInstruction(1));
		graph.createBlock(1);

		assertThrows(CodegenException.class, () -> X86CodeGenerator.emit(graph));
	}

	@Test
	void singleBlockMustBeTheEntry()
	{
		ControlFlowGraph other = new ControlFlowGraph();
		other.createBlock(3);

		assertThrows(CodegenException.class, () -> X86CodeGenerator.emit(other));
	}

	@Test
	void arithmeticIsRejected()
	{
		entry.addInstruction(new OperationInstruction("v3", CfgOperator.ADD, "v1", "v2"));

		assertThrows(CodegenException.class, () -> X86CodeGenerator.emit(graph));
	}
}
