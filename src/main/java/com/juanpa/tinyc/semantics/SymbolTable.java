package com.juanpa.tinyc.semantics;

import com.juanpa.tinyc.ast.declarations.FunctionDeclaration;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * The variables of one function, keyed by (scope id, name), plus a parent link for
 * every nested scope. Scopes are stored flat and indexed by id; a lookup walks the
 * parent links in a loop, so deep nesting costs no stack.
 * <p>
 * Read-only once {@link #fromFunction} returns.
 */
public class SymbolTable
{
	private final Map<Integer, Map<String, VariableSymbol>> scopes = new TreeMap<>();
	private final Map<Integer, Integer> parents = new HashMap<>(); // scope id -> enclosing scope id

	SymbolTable()
	{
	}

	/**
	 * Builds the table for a function body.
	 *
	 * @param function The function to index.
	 * @return The populated table.
	 * @throws SymbolTableException if a scope declares the same name twice.
	 */
	public static SymbolTable fromFunction(FunctionDeclaration function)
	{
		return new SymbolTableBuilder().build(function);
	}

	void addScope(int scopeId)
	{
		scopes.computeIfAbsent(scopeId, id -> new LinkedHashMap<>());
	}

	void setParent(int scopeId, int parentId)
	{
		if (scopeId == parentId)
		{
			throw new IllegalArgumentException("Scope " + scopeId + " cannot be its own parent.");
		}
		parents.put(scopeId, parentId);
	}

	/**
	 * Defines a variable in a scope. Shadowing a name from an enclosing scope is fine;
	 * declaring it twice in the same scope is not.
	 *
	 * @throws SymbolTableException if the scope already holds the name.
	 */
	void define(int scopeId, VariableSymbol symbol)
	{
		Map<String, VariableSymbol> variables = scopes.computeIfAbsent(scopeId, id -> new LinkedHashMap<>());
		if (variables.containsKey(symbol.getName()))
		{
			throw new SymbolTableException(symbol.getName(), scopeId);
		}
		variables.put(symbol.getName(), symbol);
	}

	/**
	 * Looks up a variable, starting from the given scope and moving out through its parents.
	 *
	 * @param scopeId The scope the name is referenced from.
	 * @param name    The variable name.
	 * @return The nearest declaration, or null if no enclosing scope declares it.
	 */
	public VariableSymbol resolve(int scopeId, String name)
	{
		Integer id = scopeId;
		while (id != null)
		{
			VariableSymbol symbol = resolveCurrentScope(id, name);
			if (symbol != null)
			{
				return symbol;
			}
			id = parents.get(id);
		}
		return null;
	}

	/**
	 * Looks up a variable only in the given scope.
	 *
	 * @return The declaration, or null if this scope does not declare the name.
	 */
	public VariableSymbol resolveCurrentScope(int scopeId, String name)
	{
		Map<String, VariableSymbol> variables = scopes.get(scopeId);
		return variables != null ? variables.get(name) : null;
	}

	/**
	 * @return The enclosing scope id, or null for the function's outermost scope.
	 */
	public Integer getParentScopeId(int scopeId)
	{
		return parents.get(scopeId);
	}

	public Set<Integer> getScopeIds()
	{
		return Collections.unmodifiableSet(scopes.keySet());
	}

	public Map<String, VariableSymbol> getVariables(int scopeId)
	{
		Map<String, VariableSymbol> variables = scopes.get(scopeId);
		return variables != null ? Collections.unmodifiableMap(variables) : Collections.emptyMap();
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder();
		for (Map.Entry<Integer, Map<String, VariableSymbol>> scope : scopes.entrySet())
		{
			Integer parent = parents.get(scope.getKey());
			sb.append("Scope ").append(scope.getKey());
			if (parent != null)
			{
				sb.append(" (parent ").append(parent).append(")");
			}
			sb.append(":\n");
			for (VariableSymbol symbol : scope.getValue().values())
			{
				sb.append("  ").append(symbol).append("\n");
			}
		}
		return sb.toString();
	}
}
