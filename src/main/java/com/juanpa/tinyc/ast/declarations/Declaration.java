package com.juanpa.tinyc.ast.declarations;

import com.juanpa.tinyc.ast.ASTNode;

/**
 * Marker for top-level declarations. Functions are the only kind so far.
 */
public interface Declaration extends ASTNode
{
	String getName();
}
