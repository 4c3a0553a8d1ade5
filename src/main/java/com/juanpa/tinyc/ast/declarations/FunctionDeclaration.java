// File: src/main/java/com/juanpa/tinyc/ast/declarations/FunctionDeclaration.java

package com.juanpa.tinyc.ast.declarations;

import com.juanpa.tinyc.ast.ASTVisitor;
import com.juanpa.tinyc.ast.Scope;
import com.juanpa.tinyc.semantics.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * AST node representing a function definition: its signature and the top-level scope of its body.
 */
public class FunctionDeclaration implements Declaration
{
	private final String name;
	private final List<Parameter> parameters;
	private final Type returnType;
	private final Scope body;

	/**
	 * Constructs a FunctionDeclaration.
	 *
	 * @param name       The function name.
	 * @param parameters The declared parameters, in order.
	 * @param returnType The declared return type.
	 * @param body       The outermost scope of the function body.
	 */
	public FunctionDeclaration(String name, List<Parameter> parameters, Type returnType, Scope body)
	{
		this.name = name;
		this.parameters = new ArrayList<>(parameters);
		this.returnType = returnType;
		this.body = body;
	}

	@Override
	public String getName()
	{
		return name;
	}

	public List<Parameter> getParameters()
	{
		return Collections.unmodifiableList(parameters);
	}

	public Type getReturnType()
	{
		return returnType;
	}

	public Scope getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitFunctionDeclaration(this);
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (!(o instanceof FunctionDeclaration))
			return false;
		FunctionDeclaration that = (FunctionDeclaration) o;
		return name.equals(that.name)
				&& parameters.equals(that.parameters)
				&& returnType.equals(that.returnType)
				&& body.equals(that.body);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(name, parameters, returnType, body);
	}

	@Override
	public String toString()
	{
		String params = parameters.stream().map(Parameter::toString).collect(Collectors.joining(", "));
		return "Function " + returnType + " " + name + "(" + params + ") " + body;
	}
}
