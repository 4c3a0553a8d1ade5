package com.juanpa.tinyc.ast.declarations;

import com.juanpa.tinyc.semantics.Type;

import java.util.Objects;

/**
 * A function parameter: a type and a name.
 */
public class Parameter
{
	private final Type type;
	private final String name;

	public Parameter(Type type, String name)
	{
		this.type = type;
		this.name = name;
	}

	public Type getType()
	{
		return type;
	}

	public String getName()
	{
		return name;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (!(o instanceof Parameter))
			return false;
		Parameter other = (Parameter) o;
		return type.equals(other.type) && name.equals(other.name);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(type, name);
	}

	@Override
	public String toString()
	{
		return type + " " + name;
	}
}
