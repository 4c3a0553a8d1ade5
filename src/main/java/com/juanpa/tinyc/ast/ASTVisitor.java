// File: src/main/java/com/juanpa/tinyc/ast/ASTVisitor.java

package com.juanpa.tinyc.ast;

import com.juanpa.tinyc.ast.declarations.FunctionDeclaration;
import com.juanpa.tinyc.ast.expressions.BinaryExpression;
import com.juanpa.tinyc.ast.expressions.IdentifierExpression;
import com.juanpa.tinyc.ast.expressions.IntegerLiteralExpression;
import com.juanpa.tinyc.ast.expressions.StringLiteralExpression;
import com.juanpa.tinyc.ast.statements.ExpressionStatement;
import com.juanpa.tinyc.ast.statements.IfStatement;
import com.juanpa.tinyc.ast.statements.ReturnStatement;
import com.juanpa.tinyc.ast.statements.VariableDeclarationStatement;

/**
 * Interface for the Visitor pattern that allows AST traversal.
 * Each `visit` method corresponds to a specific AST node type.
 * For declarations and statements, which do not produce a value, `R` is usually `Void`.
 */
public interface ASTVisitor<R>
{
	// --- Declarations ---
	R visitProgram(Program program);

	R visitFunctionDeclaration(FunctionDeclaration declaration);

	R visitScope(Scope scope);

	// --- Statements ---
	R visitReturnStatement(ReturnStatement statement);

	R visitExpressionStatement(ExpressionStatement statement);

	R visitVariableDeclarationStatement(VariableDeclarationStatement statement);

	R visitIfStatement(IfStatement statement);

	// --- Expressions ---
	R visitIntegerLiteralExpression(IntegerLiteralExpression expression);

	R visitStringLiteralExpression(StringLiteralExpression expression);

	R visitIdentifierExpression(IdentifierExpression expression);

	R visitBinaryExpression(BinaryExpression expression);
}
