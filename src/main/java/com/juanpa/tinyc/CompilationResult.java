package com.juanpa.tinyc;

import com.juanpa.tinyc.ast.Program;
import com.juanpa.tinyc.cfg.ControlFlowGraph;
import com.juanpa.tinyc.lexer.Token;
import com.juanpa.tinyc.semantics.SymbolTable;

import java.util.Collections;
import java.util.List;

/**
 * What every stage produced for one successful compilation.
 */
public class CompilationResult
{
	private final List<Token> tokens;
	private final Program program;
	private final SymbolTable symbolTable;
	private final ControlFlowGraph controlFlowGraph;
	private final List<String> assembly;

	public CompilationResult(List<Token> tokens, Program program, SymbolTable symbolTable,
							 ControlFlowGraph controlFlowGraph, List<String> assembly)
	{
		this.tokens = Collections.unmodifiableList(tokens);
		this.program = program;
		this.symbolTable = symbolTable;
		this.controlFlowGraph = controlFlowGraph;
		this.assembly = Collections.unmodifiableList(assembly);
	}

	public List<Token> getTokens()
	{
		return tokens;
	}

	public Program getProgram()
	{
		return program;
	}

	public SymbolTable getSymbolTable()
	{
		return symbolTable;
	}

	public ControlFlowGraph getControlFlowGraph()
	{
		return controlFlowGraph;
	}

	public List<String> getAssembly()
	{
		return assembly;
	}

	/**
	 * @return The assembly as file contents: one instruction per line, newline terminated.
	 */
	public String getAssemblyText()
	{
		return String.join("\n", assembly) + "\n";
	}
}
