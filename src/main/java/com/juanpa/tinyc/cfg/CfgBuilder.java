// File: src/main/java/com/juanpa/tinyc/cfg/CfgBuilder.java

package com.juanpa.tinyc.cfg;

import com.juanpa.tinyc.ast.ASTVisitor;
import com.juanpa.tinyc.ast.Program;
import com.juanpa.tinyc.ast.Scope;
import com.juanpa.tinyc.ast.declarations.Declaration;
import com.juanpa.tinyc.ast.declarations.FunctionDeclaration;
import com.juanpa.tinyc.ast.expressions.BinaryExpression;
import com.juanpa.tinyc.ast.expressions.Expression;
import com.juanpa.tinyc.ast.expressions.IdentifierExpression;
import com.juanpa.tinyc.ast.expressions.IntegerLiteralExpression;
import com.juanpa.tinyc.ast.expressions.StringLiteralExpression;
import com.juanpa.tinyc.ast.statements.ExpressionStatement;
import com.juanpa.tinyc.ast.statements.IfStatement;
import com.juanpa.tinyc.ast.statements.ReturnStatement;
import com.juanpa.tinyc.ast.statements.VariableDeclarationStatement;
import com.juanpa.tinyc.semantics.PrimitiveType;
import com.juanpa.tinyc.util.Debug;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lowers a checked program into a control-flow graph of three-address instructions.
 * <p>
 * Every source variable is renamed to a fresh CFG variable when it is declared, and that
 * binding never changes. The lowering understands integer-literal initializers and
 * returns of a literal or a variable; everything else raises {@link LoweringException}.
 * Branching is not lowered yet, so the result is always the single entry block.
 */
public class CfgBuilder implements ASTVisitor<Void>
{
	private final VariableNameGenerator names = new VariableNameGenerator();
	private final Map<String, String> bindings = new LinkedHashMap<>(); // source name -> CFG name
	private ControlFlowGraph graph;
	private BasicBlock currentBlock;

	/**
	 * Convenience entry point for a one-off build.
	 */
	public static ControlFlowGraph build(Program program)
	{
		return new CfgBuilder().lower(program);
	}

	/**
	 * Lowers the program's `main` function.
	 *
	 * @param program A program that passed semantic analysis.
	 * @return The control-flow graph.
	 * @throws IllegalArgumentException if the program is not a single `int main()`.
	 * @throws LoweringException        if the body uses a construct that cannot be lowered.
	 */
	public ControlFlowGraph lower(Program program)
	{
		if (graph != null)
		{
			throw new IllegalStateException("A CfgBuilder lowers a single program.");
		}
		program.accept(this);
		return graph;
	}

	/**
	 * @return The CFG variable bound to a source variable, or null if it has none.
	 */
	public String getBinding(String sourceName)
	{
		return bindings.get(sourceName);
	}

	@Override
	public Void visitProgram(Program program)
	{
		if (program.getDeclarations().size() != 1)
		{
			throw new IllegalArgumentException("Expected exactly one declaration, got " + program.getDeclarations().size() + ".");
		}
		Declaration declaration = program.getDeclarations().get(0);
		return declaration.accept(this);
	}

	@Override
	public Void visitFunctionDeclaration(FunctionDeclaration declaration)
	{
		if (!declaration.getName().equals("main"))
		{
			throw new IllegalArgumentException("Expected function 'main', got '" + declaration.getName() + "'.");
		}
		if (!declaration.getParameters().isEmpty())
		{
			throw new IllegalArgumentException("main must not take parameters.");
		}
		if (!declaration.getReturnType().equals(PrimitiveType.INT))
		{
			throw new IllegalArgumentException("main must return int, not " + declaration.getReturnType() + ".");
		}

		graph = new ControlFlowGraph();
		currentBlock = graph.createBlock(ControlFlowGraph.ENTRY_BLOCK_ID);
		Debug.log("Lowering main into block %d", currentBlock.getId());
		Debug.indent();
		try
		{
			declaration.getBody().accept(this);
		}
		finally
		{
			Debug.dedent();
		}
		return null;
	}

	@Override
	public Void visitScope(Scope scope)
	{
		scope.getStatements().forEach(statement -> statement.accept(this));
		return null;
	}

	// --- Statements ---

	@Override
	public Void visitVariableDeclarationStatement(VariableDeclarationStatement statement)
	{
		String sourceName = statement.getName();
		String cfgName = names.next();
		if (bindings.putIfAbsent(sourceName, cfgName) != null)
		{
			throw new LoweringException("Variable " + sourceName + " is declared more than once; redeclaration cannot be lowered.");
		}
		Debug.log("%s -> %s", sourceName, cfgName);

		if (!statement.hasInitializer())
		{
			return null;
		}
		Expression initializer = statement.getInitializer();
		if (!(initializer instanceof IntegerLiteralExpression))
		{
			throw new LoweringException("Cannot lower initializer " + initializer + " of " + sourceName
					+ ": only integer literal initializers are supported.");
		}
		emit(new AssignInstruction(cfgName, ((IntegerLiteralExpression) initializer).getValue()));
		return null;
	}

	@Override
	public Void visitReturnStatement(ReturnStatement statement)
	{
		Expression value = statement.getValue();
		if (value instanceof IntegerLiteralExpression)
		{
			String temporary = names.next();
			emit(new AssignInstruction(temporary, ((IntegerLiteralExpression) value).getValue()));
			emit(new ReturnInstruction(temporary));
			return null;
		}
		if (value instanceof IdentifierExpression)
		{
			String sourceName = ((IdentifierExpression) value).getName();
			String cfgName = bindings.get(sourceName);
			if (cfgName == null)
			{
				throw new LoweringException("Variable " + sourceName + " is returned before it is declared.");
			}
			emit(new ReturnInstruction(cfgName));
			return null;
		}
		throw new LoweringException("Cannot lower return of " + value + ": only integer literals and variables can be returned.");
	}

	@Override
	public Void visitExpressionStatement(ExpressionStatement statement)
	{
		throw new LoweringException("Lowering of expression statements is not implemented: " + statement.getExpression());
	}

	@Override
	public Void visitIfStatement(IfStatement statement)
	{
		// TODO: lower to a conditional jump once blocks can branch; thenScope/elseScope become successor blocks
		throw new LoweringException("Lowering of if statements is not implemented.");
	}

	// --- Expressions are inspected by the statements that own them ---

	@Override
	public Void visitIntegerLiteralExpression(IntegerLiteralExpression expression)
	{
		throw new IllegalStateException("Expressions are not visited directly.");
	}

	@Override
	public Void visitStringLiteralExpression(StringLiteralExpression expression)
	{
		throw new IllegalStateException("Expressions are not visited directly.");
	}

	@Override
	public Void visitIdentifierExpression(IdentifierExpression expression)
	{
		throw new IllegalStateException("Expressions are not visited directly.");
	}

	@Override
	public Void visitBinaryExpression(BinaryExpression expression)
	{
		throw new IllegalStateException("Expressions are not visited directly.");
	}

	private void emit(Instruction instruction)
	{
		Debug.log("emit %s", instruction);
		currentBlock.addInstruction(instruction);
	}
}
