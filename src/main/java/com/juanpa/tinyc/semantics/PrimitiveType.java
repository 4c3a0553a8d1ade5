// File: src/main/java/com/juanpa/tinyc/semantics/PrimitiveType.java

package com.juanpa.tinyc.semantics;

import java.util.Map;

/**
 * The built-in types. Each one is a singleton, so identity and equality coincide.
 */
public final class PrimitiveType extends Type
{
	public static final PrimitiveType VOID = new PrimitiveType("void");
	public static final PrimitiveType INT = new PrimitiveType("int");
	public static final PrimitiveType CHAR = new PrimitiveType("char");

	private static final Map<String, PrimitiveType> BY_KEYWORD = Map.of(
			"void", VOID,
			"int", INT,
			"char", CHAR);

	private PrimitiveType(String name)
	{
		super(name);
	}

	/**
	 * Finds the primitive type named by a type keyword.
	 *
	 * @param keyword The keyword lexeme, e.g. "int".
	 * @return The matching type, or null if the keyword does not name a type.
	 */
	public static PrimitiveType fromKeyword(String keyword)
	{
		return BY_KEYWORD.get(keyword);
	}

	@Override
	public boolean isPrimitive()
	{
		return true;
	}
}
