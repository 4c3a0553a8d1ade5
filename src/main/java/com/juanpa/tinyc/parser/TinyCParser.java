// File: src/main/java/com/juanpa/tinyc/parser/TinyCParser.java

package com.juanpa.tinyc.parser;

import com.juanpa.tinyc.ast.Program;
import com.juanpa.tinyc.ast.Scope;
import com.juanpa.tinyc.ast.declarations.FunctionDeclaration;
import com.juanpa.tinyc.ast.expressions.BinaryExpression;
import com.juanpa.tinyc.ast.expressions.BinaryOperator;
import com.juanpa.tinyc.ast.expressions.Expression;
import com.juanpa.tinyc.ast.expressions.IdentifierExpression;
import com.juanpa.tinyc.ast.expressions.IntegerLiteralExpression;
import com.juanpa.tinyc.ast.expressions.StringLiteralExpression;
import com.juanpa.tinyc.ast.statements.ExpressionStatement;
import com.juanpa.tinyc.ast.statements.IfStatement;
import com.juanpa.tinyc.ast.statements.ReturnStatement;
import com.juanpa.tinyc.ast.statements.Statement;
import com.juanpa.tinyc.ast.statements.VariableDeclarationStatement;
import com.juanpa.tinyc.lexer.Lexer;
import com.juanpa.tinyc.lexer.Token;
import com.juanpa.tinyc.lexer.TokenType;
import com.juanpa.tinyc.semantics.PrimitiveType;
import com.juanpa.tinyc.semantics.Type;
import com.juanpa.tinyc.semantics.UserDefinedType;
import com.juanpa.tinyc.util.Debug;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The TinyCParser is responsible for performing syntactic analysis.
 * It takes the list of tokens from the lexer and builds the Abstract Syntax Tree.
 * Statements are parsed by recursive descent, expressions by precedence climbing.
 * The first unexpected token ends the parse with a {@link ParseException}.
 */
public class TinyCParser
{
	/**
	 * Every program is exactly one function with this header.
	 */
	public static final String MAIN_SIGNATURE = "int main()";

	/**
	 * Deepest allowed nesting of blocks and parenthesized expressions, counted together.
	 * Parsing recurses once per level, so deeper input is rejected before it can exhaust the stack.
	 */
	public static final int MAX_NESTING_DEPTH = 1000;

	private final List<Token> tokens; // The list of tokens from the lexer
	private final ScopeIdCounter scopeIds = new ScopeIdCounter();
	private int current = 0; // Current position in the token list
	private int depth = 0; // Open blocks and parentheses

	/**
	 * Constructs a TinyCParser.
	 *
	 * @param tokens The list of tokens produced by the lexer.
	 */
	public TinyCParser(List<Token> tokens)
	{
		this.tokens = new ArrayList<>(tokens);
	}

	/**
	 * Convenience entry point for a one-off parse.
	 *
	 * @param tokens The tokens of a whole program.
	 * @return The parsed program.
	 */
	public static Program parse(List<Token> tokens)
	{
		return new TinyCParser(tokens).parseProgram();
	}

	/**
	 * Parses the whole token list as the `main` function.
	 * Grammar: `int main ( ) BLOCK`
	 *
	 * @return A Program holding the single `main` declaration.
	 * @throws ParseException if the tokens do not form a valid program.
	 */
	public Program parseProgram()
	{
		List<Token> expectedPrefix = Lexer.tokenize(MAIN_SIGNATURE);
		for (int i = 0; i < expectedPrefix.size(); i++)
		{
			if (i >= tokens.size() || !tokens.get(i).equals(expectedPrefix.get(i)))
			{
				throw new ParseException("Expected the program to start with '" + MAIN_SIGNATURE + "'" + found(tokenAt(i)),
						tokenAt(i), i);
			}
		}
		Token last = tokens.get(tokens.size() - 1);
		if (last.getType() != TokenType.RIGHT_BRACE)
		{
			throw new ParseException("Expected the program to end with '}'" + found(last), last, tokens.size() - 1);
		}

		current = expectedPrefix.size();
		Debug.log("Parsing body of main");
		Debug.indent();
		List<Statement> body;
		try
		{
			body = braceBlock();
		}
		finally
		{
			Debug.dedent();
		}

		if (!isAtEnd())
		{
			throw error(peek(), "Unexpected token after the end of main.");
		}

		Scope bodyScope = new Scope(scopeIds.next(), body);
		Debug.log("main body is scope %d", bodyScope.getId());
		FunctionDeclaration main = new FunctionDeclaration("main", Collections.emptyList(), PrimitiveType.INT, bodyScope);
		return new Program(List.of(main));
	}

	/**
	 * Parses a brace-delimited list of statements. The caller wraps the result in a
	 * Scope, so the scope id is taken after all nested statements are done.
	 * Grammar: `{ STATEMENT* }`
	 *
	 * @return The statements between the braces.
	 */
	private List<Statement> braceBlock()
	{
		Token open = consume(TokenType.LEFT_BRACE, "Expected '{' before block.");
		enterNesting(open);
		List<Statement> statements = new ArrayList<>();

		while (!check(TokenType.RIGHT_BRACE))
		{
			statements.add(statement());
		}

		consume(TokenType.RIGHT_BRACE, "Expected '}' after block.");
		depth--;
		return statements;
	}

	/**
	 * Parses a single statement.
	 * This method acts as a dispatcher for different statement types, using up to two tokens of lookahead.
	 *
	 * @return A Statement AST node.
	 */
	private Statement statement()
	{
		if (isAtEnd())
		{
			throw error(null, "Expected a statement or '}'.");
		}
		if (checkKeyword("return"))
		{
			return returnStatement();
		}
		if (checkKeyword("if"))
		{
			return ifStatement();
		}
		if (isTypeKeyword(peek()) || (check(TokenType.IDENTIFIER) && check(1, TokenType.IDENTIFIER)))
		{
			return variableDeclarationStatement();
		}
		return expressionStatement();
	}

	/**
	 * Parses a return statement.
	 * Grammar: `RETURN EXPRESSION ;`
	 *
	 * @return A ReturnStatement AST node.
	 */
	private ReturnStatement returnStatement()
	{
		advance(); // 'return'
		Expression value = expression();
		consume(TokenType.SEMICOLON, "Expected ';' after return value.");
		return new ReturnStatement(value);
	}

	/**
	 * Parses an if statement. The else block gets its scope id before the then block,
	 * and both before the scope that contains the if.
	 * Grammar: `IF ( EXPRESSION ) BLOCK ( ELSE BLOCK )?`
	 *
	 * @return An IfStatement AST node.
	 */
	private IfStatement ifStatement()
	{
		advance(); // 'if'
		consume(TokenType.LEFT_PAREN, "Expected '(' after 'if'.");
		Expression condition = expression();
		consume(TokenType.RIGHT_PAREN, "Expected ')' after if condition.");

		List<Statement> thenStatements = braceBlock();

		Scope elseScope = null;
		if (checkKeyword("else"))
		{
			advance();
			elseScope = new Scope(scopeIds.next(), braceBlock());
		}

		Scope thenScope = new Scope(scopeIds.next(), thenStatements);
		Debug.log("if: then scope %d, else scope %s", thenScope.getId(), elseScope != null ? elseScope.getId() : "-");
		return new IfStatement(condition, thenScope, elseScope);
	}

	/**
	 * Parses a variable declaration statement.
	 * Grammar: `TYPE IDENTIFIER ( = EXPRESSION )? ;`
	 *
	 * @return A VariableDeclarationStatement AST node.
	 */
	private VariableDeclarationStatement variableDeclarationStatement()
	{
		Type type = typeSpecifier();
		Token name = consume(TokenType.IDENTIFIER, "Expected variable name.");

		Expression initializer = null;
		if (check(TokenType.SEMICOLON))
		{
			advance();
		}
		else
		{
			consumeOperator("=", "Expected '=' or ';' after variable name.");
			initializer = expression();
			consume(TokenType.SEMICOLON, "Expected ';' after variable declaration.");
		}

		Debug.log("declare %s %s", type, name.getLexeme());
		return new VariableDeclarationStatement(name.getLexeme(), type, initializer, name);
	}

	/**
	 * Parses a type: a type keyword, or an identifier naming a user-defined type.
	 */
	private Type typeSpecifier()
	{
		Token token = peek();
		if (isTypeKeyword(token))
		{
			advance();
			return PrimitiveType.fromKeyword(token.getLexeme());
		}
		if (check(TokenType.IDENTIFIER))
		{
			advance();
			return new UserDefinedType(token.getLexeme());
		}
		throw error(token, "Expected a type name.");
	}

	/**
	 * Parses an expression statement.
	 * Grammar: `EXPRESSION ;`
	 *
	 * @return An ExpressionStatement AST node.
	 */
	private ExpressionStatement expressionStatement()
	{
		Expression expr = expression();
		consume(TokenType.SEMICOLON, "Expected ';' after expression.");
		return new ExpressionStatement(expr);
	}

	/**
	 * Parses a full expression: a primary followed by any chain of binary operators.
	 *
	 * @return The parsed Expression AST node.
	 */
	private Expression expression()
	{
		Expression lhs = primary();
		return binaryRhs(lhs, 0);
	}

	/**
	 * Precedence climbing. Folds operators whose precedence is at least
	 * {@code minPrecedence} onto {@code lhs}, left to right. After reading an operand,
	 * any following operator that binds strictly tighter than the current one first
	 * extends that operand.
	 *
	 * @param lhs           The expression parsed so far.
	 * @param minPrecedence The weakest operator this call may consume.
	 * @return The combined expression.
	 */
	private Expression binaryRhs(Expression lhs, int minPrecedence)
	{
		while (true)
		{
			BinaryOperator op = BinaryOperator.fromToken(peek());
			if (op == null || op.getPrecedence() < minPrecedence)
			{
				break;
			}
			advance(); // Consume the operator

			Expression rhs = primary();

			while (true)
			{
				BinaryOperator next = BinaryOperator.fromToken(peek());
				if (next == null || next.getPrecedence() <= op.getPrecedence())
				{
					break;
				}
				rhs = binaryRhs(rhs, next.getPrecedence());
			}

			lhs = new BinaryExpression(op, lhs, rhs);
		}
		return lhs;
	}

	/**
	 * Parses the most basic expressions: literals, identifiers and parenthesized expressions.
	 * Grammar: `INTEGER | STRING | IDENTIFIER | ( EXPRESSION )`
	 *
	 * @return The parsed primary Expression AST node.
	 */
	private Expression primary()
	{
		Token token = peek();
		if (check(TokenType.INTEGER_LITERAL))
		{
			advance();
			return new IntegerLiteralExpression((Long) token.getLiteral(), token);
		}
		if (check(TokenType.STRING_LITERAL))
		{
			advance();
			return new StringLiteralExpression((String) token.getLiteral(), token);
		}
		if (check(TokenType.IDENTIFIER))
		{
			advance();
			return new IdentifierExpression(token.getLexeme(), token);
		}
		if (check(TokenType.LEFT_PAREN))
		{
			enterNesting(advance());
			Expression inner = expression();
			consume(TokenType.RIGHT_PAREN, "Expected ')' after expression.");
			depth--;
			return inner;
		}
		throw error(token, "Expected expression.");
	}

	private void enterNesting(Token opening)
	{
		if (++depth > MAX_NESTING_DEPTH)
		{
			throw new ParseException("Nesting too deep: more than " + MAX_NESTING_DEPTH
					+ " levels of blocks and parentheses." + found(opening), opening, current - 1);
		}
	}

	// --- Token helpers ---

	private boolean isTypeKeyword(Token token)
	{
		return token != null && token.getType() == TokenType.KEYWORD && PrimitiveType.fromKeyword(token.getLexeme()) != null;
	}

	private boolean checkKeyword(String keyword)
	{
		return !isAtEnd() && peek().is(TokenType.KEYWORD, keyword);
	}

	/**
	 * Consumes the current token if it has the expected type, otherwise fails.
	 *
	 * @param type    The expected TokenType.
	 * @param message The error message to report if the type doesn't match.
	 * @return The consumed Token.
	 */
	private Token consume(TokenType type, String message)
	{
		if (check(type))
		{
			return advance();
		}
		throw error(peek(), message);
	}

	private Token consumeOperator(String symbol, String message)
	{
		if (!isAtEnd() && peek().is(TokenType.OPERATOR, symbol))
		{
			return advance();
		}
		throw error(peek(), message);
	}

	/**
	 * Checks if the current token's type matches, without consuming it.
	 */
	private boolean check(TokenType type)
	{
		return !isAtEnd() && peek().getType() == type;
	}

	/**
	 * Checks the token type at a given offset from the current position.
	 *
	 * @param offset The offset from the current token (0 for current, 1 for next, etc.)
	 * @param type   The TokenType to check for.
	 * @return True if the token at the offset exists and matches the type.
	 */
	private boolean check(int offset, TokenType type)
	{
		Token token = tokenAt(current + offset);
		return token != null && token.getType() == type;
	}

	private Token advance()
	{
		if (!isAtEnd())
		{
			current++;
		}
		return tokens.get(current - 1);
	}

	/**
	 * Looks at the current token without consuming it.
	 *
	 * @return The current Token, or null once the input is exhausted.
	 */
	private Token peek()
	{
		return tokenAt(current);
	}

	private Token tokenAt(int index)
	{
		return index < tokens.size() ? tokens.get(index) : null;
	}

	private boolean isAtEnd()
	{
		return current >= tokens.size();
	}

	private ParseException error(Token token, String message)
	{
		return new ParseException(message + found(token), token, current);
	}

	private static String found(Token token)
	{
		if (token == null)
		{
			return " Reached end of input.";
		}
		return " Found " + token.getType() + " '" + token.getLexeme() + "' at line " + token.getLine() + ", column " + token.getColumn() + ".";
	}
}
