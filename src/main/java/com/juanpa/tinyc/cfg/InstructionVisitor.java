package com.juanpa.tinyc.cfg;

/**
 * One method per instruction kind, so every backend has to say what it does with each.
 */
public interface InstructionVisitor<R>
{
	R visitJump(JumpInstruction instruction);

	R visitAssign(AssignInstruction instruction);

	R visitOperation(OperationInstruction instruction);

	R visitReturn(ReturnInstruction instruction);
}
