package com.juanpa.tinyc.parser;

import com.juanpa.tinyc.ast.Program;
import com.juanpa.tinyc.ast.Scope;
import com.juanpa.tinyc.ast.declarations.FunctionDeclaration;
import com.juanpa.tinyc.ast.expressions.BinaryExpression;
import com.juanpa.tinyc.ast.expressions.BinaryOperator;
import com.juanpa.tinyc.ast.expressions.IdentifierExpression;
import com.juanpa.tinyc.ast.expressions.IntegerLiteralExpression;
import com.juanpa.tinyc.ast.expressions.StringLiteralExpression;
import com.juanpa.tinyc.ast.statements.ExpressionStatement;
import com.juanpa.tinyc.ast.statements.IfStatement;
import com.juanpa.tinyc.ast.statements.ReturnStatement;
import com.juanpa.tinyc.ast.statements.Statement;
import com.juanpa.tinyc.ast.statements.VariableDeclarationStatement;
import com.juanpa.tinyc.lexer.Lexer;
import com.juanpa.tinyc.semantics.PrimitiveType;
import com.juanpa.tinyc.semantics.UserDefinedType;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TinyCParserTest
{
	private static Program parse(String source)
	{
		return TinyCParser.parse(Lexer.tokenize(source));
	}

	private static Program main(Scope body)
	{
		return new Program(List.of(new FunctionDeclaration("main", Collections.emptyList(), PrimitiveType.INT, body)));
	}

	private static Scope body(Program program)
	{
		return ((FunctionDeclaration) program.getDeclarations().get(0)).getBody();
	}

	@Test
	void returnZero()
	{
		Program expected = main(new Scope(1, List.of(new ReturnStatement(new IntegerLiteralExpression(0)))));

		assertEquals(expected, parse("int main() { return 0; }"));
	}

	@Test
	void variableDeclarations()
	{
		Program program = parse("int main() { int x; int y = x; MyType z = \"value of z\"; }");

		List<Statement> expected = List.of(
				new VariableDeclarationStatement("x", PrimitiveType.INT, null),
				new VariableDeclarationStatement("y", PrimitiveType.INT, new IdentifierExpression("x")),
				new VariableDeclarationStatement("z", new UserDefinedType("MyType"), new StringLiteralExpression("value of z")));
		assertEquals(main(new Scope(1, expected)), program);
	}

	@Test
	void ifWithoutElse()
	{
		Program program = parse("int main() { if(x) { return 0; } return 1; }");

		Scope then = new Scope(1, List.of(new ReturnStatement(new IntegerLiteralExpression(0))));
		Scope expected = new Scope(2, List.of(
				new IfStatement(new IdentifierExpression("x"), then, null),
				new ReturnStatement(new IntegerLiteralExpression(1))));
		assertEquals(main(expected), program);
	}

	@Test
	void elseScopeIsNumberedBeforeThenScope()
	{
		Program program = parse("int main() { if (x) { return 1; } else { return 2; } }");

		IfStatement statement = (IfStatement) body(program).getStatements().get(0);
		assertEquals(2, statement.getThenScope().getId());
		assertEquals(1, statement.getElseScope().getId());
		assertEquals(3, body(program).getId());
	}

	@Test
	void nestedScopesAreNumberedInnermostFirst()
	{
		Program program = parse("int main() { if (a) { if (b) { int c; } } }");

		IfStatement outer = (IfStatement) body(program).getStatements().get(0);
		IfStatement inner = (IfStatement) outer.getThenScope().getStatements().get(0);
		assertEquals(1, inner.getThenScope().getId());
		assertEquals(2, outer.getThenScope().getId());
		assertEquals(3, body(program).getId());
	}

	@Test
	void assignmentStatement()
	{
		Program program = parse("int main() { x = 5; }");

		Statement expected = new ExpressionStatement(new BinaryExpression(BinaryOperator.ASSIGN,
				new IdentifierExpression("x"), new IntegerLiteralExpression(5)));
		assertEquals(main(new Scope(1, List.of(expected))), program);
	}

	@Test
	void multiplicationBindsTighterThanAddition()
	{
		Program program = parse("int main() { return 1 + 2 * 3 - 4; }");

		// (1 + (2 * 3)) - 4
		BinaryExpression expected = new BinaryExpression(BinaryOperator.SUB,
				new BinaryExpression(BinaryOperator.ADD,
						new IntegerLiteralExpression(1),
						new BinaryExpression(BinaryOperator.MUL, new IntegerLiteralExpression(2), new IntegerLiteralExpression(3))),
				new IntegerLiteralExpression(4));
		assertEquals(new ReturnStatement(expected), body(program).getStatements().get(0));
	}

	@Test
	void leadingMultiplicationIsFoldedFirst()
	{
		Program program = parse("int main() { return 1 * 2 + 3; }");

		BinaryExpression expected = new BinaryExpression(BinaryOperator.ADD,
				new BinaryExpression(BinaryOperator.MUL, new IntegerLiteralExpression(1), new IntegerLiteralExpression(2)),
				new IntegerLiteralExpression(3));
		assertEquals(new ReturnStatement(expected), body(program).getStatements().get(0));
	}

	@Test
	void assignmentTakesTheWholeComparison()
	{
		Program program = parse("int main() { x = a == b + 1; }");

		BinaryExpression expected = new BinaryExpression(BinaryOperator.ASSIGN,
				new IdentifierExpression("x"),
				new BinaryExpression(BinaryOperator.EQUALS,
						new IdentifierExpression("a"),
						new BinaryExpression(BinaryOperator.ADD, new IdentifierExpression("b"), new IntegerLiteralExpression(1))));
		assertEquals(new ExpressionStatement(expected), body(program).getStatements().get(0));
	}

	@Test
	void parenthesesOverridePrecedence()
	{
		Program program = parse("int main() { return (1 + 2) * 3; }");

		BinaryExpression expected = new BinaryExpression(BinaryOperator.MUL,
				new BinaryExpression(BinaryOperator.ADD, new IntegerLiteralExpression(1), new IntegerLiteralExpression(2)),
				new IntegerLiteralExpression(3));
		assertEquals(new ReturnStatement(expected), body(program).getStatements().get(0));
	}

	@Test
	void assignmentOfSumWithProduct()
	{
		Program program = parse("int main() { x = 1 + 2 * 3; }");

		BinaryExpression expected = new BinaryExpression(BinaryOperator.ASSIGN,
				new IdentifierExpression("x"),
				new BinaryExpression(BinaryOperator.ADD,
						new IntegerLiteralExpression(1),
						new BinaryExpression(BinaryOperator.MUL, new IntegerLiteralExpression(2), new IntegerLiteralExpression(3))));
		assertEquals(new ExpressionStatement(expected), body(program).getStatements().get(0));
	}

	@Test
	void assignmentOfProductWithSum()
	{
		Program program = parse("int main() { x = 1 * 2 + 3; }");

		BinaryExpression expected = new BinaryExpression(BinaryOperator.ASSIGN,
				new IdentifierExpression("x"),
				new BinaryExpression(BinaryOperator.ADD,
						new BinaryExpression(BinaryOperator.MUL, new IntegerLiteralExpression(1), new IntegerLiteralExpression(2)),
						new IntegerLiteralExpression(3)));
		assertEquals(new ExpressionStatement(expected), body(program).getStatements().get(0));
	}

	@Test
	void assignmentOfDoublyParenthesizedExpression()
	{
		Program program = parse("int main() { x = ((1 + 2) * 3); }");

		BinaryExpression expected = new BinaryExpression(BinaryOperator.ASSIGN,
				new IdentifierExpression("x"),
				new BinaryExpression(BinaryOperator.MUL,
						new BinaryExpression(BinaryOperator.ADD, new IntegerLiteralExpression(1), new IntegerLiteralExpression(2)),
						new IntegerLiteralExpression(3)));
		assertEquals(new ExpressionStatement(expected), body(program).getStatements().get(0));
	}

	@Test
	void typeKeywordsDeclarePrimitiveTypes()
	{
		Program program = parse("int main() { void v; char c = 1; }");

		List<Statement> expected = List.of(
				new VariableDeclarationStatement("v", PrimitiveType.VOID, null),
				new VariableDeclarationStatement("c", PrimitiveType.CHAR, new IntegerLiteralExpression(1)));
		assertEquals(main(new Scope(1, expected)), program);
	}

	@Test
	void typeKeywordsCannotNameVariables()
	{
		ParseException e = assertThrows(ParseException.class, () -> parse("int main() { int char; }"));

		assertTrue(e.getMessage().startsWith("Expected variable name."));
		assertEquals("char", e.getToken().getLexeme());
		assertThrows(ParseException.class, () -> parse("int main() { void = 1; }"));
	}

	@Test
	void nestingUpToTheLimitIsAccepted()
	{
		// The function body is the first level
		int ifs = TinyCParser.MAX_NESTING_DEPTH - 1;
		String source = "int main() { " + "if (x) { ".repeat(ifs) + "} ".repeat(ifs) + "}";

		Program program = parse(source);

		assertEquals(TinyCParser.MAX_NESTING_DEPTH, body(program).getId());
	}

	@Test
	void nestingBeyondTheLimitIsRejected()
	{
		int ifs = TinyCParser.MAX_NESTING_DEPTH;
		String source = "int main() { " + "if (x) { ".repeat(ifs) + "} ".repeat(ifs) + "}";

		ParseException e = assertThrows(ParseException.class, () -> parse(source));

		assertTrue(e.getMessage().startsWith("Nesting too deep"));
		assertEquals("{", e.getToken().getLexeme());
	}

	@Test
	void parenthesesCountTowardsTheNestingLimit()
	{
		int parens = TinyCParser.MAX_NESTING_DEPTH;
		String source = "int main() { return " + "(".repeat(parens) + "1" + ")".repeat(parens) + "; }";

		assertThrows(ParseException.class, () -> parse(source));
	}

	@Test
	void wrongSignatureIsRejected()
	{
		ParseException e = assertThrows(ParseException.class, () -> parse("int foo() { return 0; }"));

		assertEquals(1, e.getPosition());
		assertTrue(e.getMessage().startsWith("Expected the program to start with 'int main()'"));
	}

	@Test
	void emptyInputIsRejected()
	{
		ParseException e = assertThrows(ParseException.class, () -> parse(""));

		assertNull(e.getToken());
	}

	@Test
	void missingClosingBraceIsRejected()
	{
		assertThrows(ParseException.class, () -> parse("int main() { return 0;"));
	}

	@Test
	void missingSemicolonIsRejected()
	{
		ParseException e = assertThrows(ParseException.class, () -> parse("int main() { int x = 1 return x; }"));

		assertTrue(e.getMessage().startsWith("Expected ';' after variable declaration."));
		assertEquals("return", e.getToken().getLexeme());
	}

	@Test
	void tokensAfterMainAreRejected()
	{
		assertThrows(ParseException.class, () -> parse("int main() { return 0; } }"));
	}
}
