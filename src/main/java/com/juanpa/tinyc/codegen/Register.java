package com.juanpa.tinyc.codegen;

import java.util.Map;

/**
 * x86-64 general purpose registers, named as AT&T syntax writes them (without the '%').
 */
public enum Register
{
	RAX("rax"),
	RBX("rbx"),
	RCX("rcx"),
	RDX("rdx"),
	R8("r8"),
	R9("r9"),
	R10("r10"),
	R11("r11"),
	R12("r12"),
	R13("r13"),
	R14("r14"),
	R15("r15");

	/**
	 * Where the System V ABI expects a function's integer result.
	 */
	public static final Register RETURN = RAX;

	// Fixed assignment of CFG variables to registers. No spilling: a sixth variable has nowhere to go.
	private static final Map<String, Register> VARIABLE_REGISTERS = Map.of(
			"v1", RBX,
			"v2", RCX,
			"v3", RDX,
			"v4", R8,
			"v5", R9);

	private final String assemblyName;

	Register(String assemblyName)
	{
		this.assemblyName = assemblyName;
	}

	/**
	 * @return The register holding a CFG variable, or null if the table has no slot for it.
	 */
	public static Register forVariable(String variable)
	{
		return VARIABLE_REGISTERS.get(variable);
	}

	@Override
	public String toString()
	{
		return "%" + assemblyName;
	}
}
