// File: src/main/java/com/juanpa/tinyc/Compiler.java

package com.juanpa.tinyc;

import com.juanpa.tinyc.ast.Program;
import com.juanpa.tinyc.cfg.CfgBuilder;
import com.juanpa.tinyc.cfg.ControlFlowGraph;
import com.juanpa.tinyc.codegen.X86CodeGenerator;
import com.juanpa.tinyc.lexer.Lexer;
import com.juanpa.tinyc.lexer.Token;
import com.juanpa.tinyc.parser.TinyCParser;
import com.juanpa.tinyc.semantics.SemanticAnalyzer;
import com.juanpa.tinyc.semantics.SymbolTable;
import com.juanpa.tinyc.util.Debug;
import com.juanpa.tinyc.util.ErrorReporter;

import java.util.List;

/**
 * Runs the pipeline on one source text: lex, parse, check, lower, generate.
 * Every call starts from fresh stage objects, so scope ids and CFG names restart
 * and the same input always gives the same assembly.
 */
public class Compiler
{
	private final ErrorReporter errorReporter;

	public Compiler(ErrorReporter errorReporter)
	{
		this.errorReporter = errorReporter;
	}

	/**
	 * Compiles a source text, letting the first stage error propagate.
	 *
	 * @param source The program text.
	 * @return Everything the stages produced.
	 * @throws CompilationException from whichever stage failed first.
	 */
	public static CompilationResult compile(String source)
	{
		Debug.log("--- Lexing ---");
		List<Token> tokens = Lexer.tokenize(source);

		Debug.log("--- Parsing ---");
		Program program = TinyCParser.parse(tokens);

		Debug.log("--- Semantic Analysis ---");
		SymbolTable symbolTable = new SemanticAnalyzer().analyze(program);

		Debug.log("--- Lowering ---");
		ControlFlowGraph graph = CfgBuilder.build(program);

		Debug.log("--- Code Generation ---");
		List<String> assembly = X86CodeGenerator.emit(graph);

		return new CompilationResult(tokens, program, symbolTable, graph, assembly);
	}

	/**
	 * Compiles a source text and reports a failure instead of throwing it.
	 *
	 * @param source The program text.
	 * @return The result, or null if compilation failed (the error has been reported).
	 */
	public CompilationResult tryCompile(String source)
	{
		try
		{
			return compile(source);
		}
		catch (CompilationException e)
		{
			errorReporter.report(e);
			return null;
		}
	}
}
