// File: src/main/java/com/juanpa/tinyc/semantics/SemanticAnalyzer.java
package com.juanpa.tinyc.semantics;

import com.juanpa.tinyc.ast.ASTVisitor;
import com.juanpa.tinyc.ast.Program;
import com.juanpa.tinyc.ast.Scope;
import com.juanpa.tinyc.ast.declarations.Declaration;
import com.juanpa.tinyc.ast.declarations.FunctionDeclaration;
import com.juanpa.tinyc.ast.expressions.BinaryExpression;
import com.juanpa.tinyc.ast.expressions.IdentifierExpression;
import com.juanpa.tinyc.ast.expressions.IntegerLiteralExpression;
import com.juanpa.tinyc.ast.expressions.StringLiteralExpression;
import com.juanpa.tinyc.ast.statements.ExpressionStatement;
import com.juanpa.tinyc.ast.statements.IfStatement;
import com.juanpa.tinyc.ast.statements.ReturnStatement;
import com.juanpa.tinyc.ast.statements.VariableDeclarationStatement;
import com.juanpa.tinyc.util.Debug;

/**
 * Checks that every variable reference resolves through the scope chain.
 * Builds the symbol table first, then walks each scope with the table in hand.
 * Only existence is checked; types are carried but not compared.
 */
public class SemanticAnalyzer implements ASTVisitor<Void>
{
	private SymbolTable symbolTable;
	private int currentScopeId;

	/**
	 * Analyzes a whole program.
	 *
	 * @param program The parsed program; must hold exactly one function.
	 * @return The symbol table of that function.
	 * @throws SymbolTableException if a scope declares a name twice.
	 * @throws SemanticException    at the first reference that resolves to nothing.
	 */
	public SymbolTable analyze(Program program)
	{
		if (program.getDeclarations().size() != 1)
		{
			throw new IllegalArgumentException("Expected exactly one declaration, got " + program.getDeclarations().size() + ".");
		}
		Declaration declaration = program.getDeclarations().get(0);
		if (!(declaration instanceof FunctionDeclaration))
		{
			throw new IllegalArgumentException("Expected a function declaration, got " + declaration + ".");
		}

		FunctionDeclaration function = (FunctionDeclaration) declaration;
		symbolTable = SymbolTable.fromFunction(function);
		Debug.log("Checking %s", function.getName());
		Debug.indent();
		try
		{
			function.accept(this);
		}
		finally
		{
			Debug.dedent();
		}
		return symbolTable;
	}

	@Override
	public Void visitProgram(Program program)
	{
		analyze(program);
		return null;
	}

	@Override
	public Void visitFunctionDeclaration(FunctionDeclaration declaration)
	{
		return declaration.getBody().accept(this);
	}

	@Override
	public Void visitScope(Scope scope)
	{
		int enclosing = currentScopeId;
		currentScopeId = scope.getId();
		scope.getStatements().forEach(statement -> statement.accept(this));
		currentScopeId = enclosing;
		return null;
	}

	// --- Statements ---

	@Override
	public Void visitReturnStatement(ReturnStatement statement)
	{
		return statement.getValue().accept(this);
	}

	@Override
	public Void visitExpressionStatement(ExpressionStatement statement)
	{
		return statement.getExpression().accept(this);
	}

	@Override
	public Void visitVariableDeclarationStatement(VariableDeclarationStatement statement)
	{
		if (statement.hasInitializer())
		{
			statement.getInitializer().accept(this);
		}
		return null;
	}

	@Override
	public Void visitIfStatement(IfStatement statement)
	{
		// The condition is evaluated in the enclosing scope
		statement.getCondition().accept(this);
		statement.getThenScope().accept(this);
		if (statement.hasElse())
		{
			statement.getElseScope().accept(this);
		}
		return null;
	}

	// --- Expressions ---

	@Override
	public Void visitIdentifierExpression(IdentifierExpression expression)
	{
		if (symbolTable.resolve(currentScopeId, expression.getName()) == null)
		{
			throw new SemanticException(expression.getName(), currentScopeId, expression.getFirstToken());
		}
		return null;
	}

	@Override
	public Void visitBinaryExpression(BinaryExpression expression)
	{
		expression.getLeft().accept(this);
		expression.getRight().accept(this);
		return null;
	}

	@Override
	public Void visitIntegerLiteralExpression(IntegerLiteralExpression expression)
	{
		return null;
	}

	@Override
	public Void visitStringLiteralExpression(StringLiteralExpression expression)
	{
		return null;
	}
}
