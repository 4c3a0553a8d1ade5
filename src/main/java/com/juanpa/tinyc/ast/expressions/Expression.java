// File: src/main/java/com/juanpa/tinyc/ast/expressions/Expression.java

package com.juanpa.tinyc.ast.expressions;

import com.juanpa.tinyc.ast.ASTNode;
import com.juanpa.tinyc.lexer.Token;

/**
 * Base interface for all expression nodes in the Abstract Syntax Tree (AST).
 * Expressions form a tree: each node owns its children and nothing is shared.
 */
public interface Expression extends ASTNode
{
	/**
	 * Returns the first token that constitutes this expression.
	 * Useful for error reporting to pinpoint the location of a semantic error.
	 *
	 * @return The first Token of this expression, or null for nodes built without tokens.
	 */
	Token getFirstToken();
}
