package com.juanpa.tinyc.ast.statements;

import com.juanpa.tinyc.ast.ASTNode;

/**
 * Base interface for all statement nodes in the AST.
 */
public interface Statement extends ASTNode
{
}
