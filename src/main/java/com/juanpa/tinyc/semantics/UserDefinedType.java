package com.juanpa.tinyc.semantics;

/**
 * A type referred to by an identifier, e.g. {@code MyType z;}.
 * Nothing checks that the name is declared anywhere; it is carried through as written.
 */
public final class UserDefinedType extends Type
{
	public UserDefinedType(String name)
	{
		super(name);
	}

	@Override
	public boolean isPrimitive()
	{
		return false;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (!(o instanceof UserDefinedType))
			return false;
		return name.equals(((UserDefinedType) o).name);
	}

	@Override
	public int hashCode()
	{
		return name.hashCode();
	}
}
