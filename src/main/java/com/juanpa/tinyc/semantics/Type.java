// File: src/main/java/com/juanpa/tinyc/semantics/Type.java

package com.juanpa.tinyc.semantics;

/**
 * Abstract base class for all types in the TinyC language.
 * This includes the primitive types (void, int, char) and user-named types.
 * Types are values: two instances describing the same type are equal.
 */
public abstract class Type
{
	protected final String name;

	protected Type(String name)
	{
		this.name = name;
	}

	public String getName()
	{
		return name;
	}

	/**
	 * Checks if this type is one of the built-in types.
	 *
	 * @return True for void, int and char.
	 */
	public abstract boolean isPrimitive();

	@Override
	public String toString()
	{
		return name;
	}
}
