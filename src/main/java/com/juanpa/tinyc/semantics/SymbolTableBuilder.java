package com.juanpa.tinyc.semantics;

import com.juanpa.tinyc.ast.ASTVisitor;
import com.juanpa.tinyc.ast.Program;
import com.juanpa.tinyc.ast.Scope;
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

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Fills a {@link SymbolTable} from a function body. Nested scopes go on an explicit
 * work stack instead of being visited recursively; each one is queued with the id of
 * the scope that contains it.
 */
class SymbolTableBuilder implements ASTVisitor<Void>
{
	private static class PendingScope
	{
		final Scope scope;
		final Integer parentId; // null for the function body

		PendingScope(Scope scope, Integer parentId)
		{
			this.scope = scope;
			this.parentId = parentId;
		}
	}

	private final SymbolTable table = new SymbolTable();
	private final Deque<PendingScope> pending = new ArrayDeque<>();
	private int currentScopeId;

	SymbolTable build(FunctionDeclaration function)
	{
		function.accept(this);
		while (!pending.isEmpty())
		{
			PendingScope next = pending.pop();
			table.addScope(next.scope.getId());
			if (next.parentId != null)
			{
				table.setParent(next.scope.getId(), next.parentId);
			}
			next.scope.accept(this);
		}
		Debug.log("Symbol table built with %d scopes", table.getScopeIds().size());
		return table;
	}

	@Override
	public Void visitProgram(Program program)
	{
		throw new IllegalArgumentException("Symbol tables are built per function.");
	}

	@Override
	public Void visitFunctionDeclaration(FunctionDeclaration declaration)
	{
		pending.push(new PendingScope(declaration.getBody(), null));
		return null;
	}

	@Override
	public Void visitScope(Scope scope)
	{
		currentScopeId = scope.getId();
		scope.getStatements().forEach(statement -> statement.accept(this));
		return null;
	}

	@Override
	public Void visitVariableDeclarationStatement(VariableDeclarationStatement statement)
	{
		Debug.log("scope %d: define %s", currentScopeId, statement.getName());
		table.define(currentScopeId, new VariableSymbol(statement.getName(), statement.getType(), statement.getNameToken()));
		return null;
	}

	@Override
	public Void visitIfStatement(IfStatement statement)
	{
		if (statement.hasElse())
		{
			pending.push(new PendingScope(statement.getElseScope(), currentScopeId));
		}
		pending.push(new PendingScope(statement.getThenScope(), currentScopeId));
		return null;
	}

	// Statements and expressions below declare nothing.

	@Override
	public Void visitReturnStatement(ReturnStatement statement)
	{
		return null;
	}

	@Override
	public Void visitExpressionStatement(ExpressionStatement statement)
	{
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

	@Override
	public Void visitIdentifierExpression(IdentifierExpression expression)
	{
		return null;
	}

	@Override
	public Void visitBinaryExpression(BinaryExpression expression)
	{
		return null;
	}
}
