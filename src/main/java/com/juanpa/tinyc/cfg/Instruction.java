package com.juanpa.tinyc.cfg;

/**
 * A three-address instruction: at most one destination and two source variables.
 */
public interface Instruction
{
	<R> R accept(InstructionVisitor<R> visitor);
}
