package com.juanpa.tinyc.ast;

/**
 * Base interface for all nodes in the Abstract Syntax Tree (AST).
 * The node set is closed: every kind has its own method on {@link ASTVisitor},
 * so adding a kind breaks every pass until it handles the new node.
 */
public interface ASTNode
{
	/**
	 * Accepts an ASTVisitor to traverse this node.
	 *
	 * @param visitor The ASTVisitor instance.
	 * @param <R>     The return type of the visitor's visit methods.
	 * @return The result of the visitor's operation.
	 */
	<R> R accept(ASTVisitor<R> visitor);
}
