package com.juanpa.tinyc.semantics;

import com.juanpa.tinyc.ast.Program;
import com.juanpa.tinyc.lexer.Lexer;
import com.juanpa.tinyc.parser.TinyCParser;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SemanticAnalyzerTest
{
	private static SymbolTable analyze(String source)
	{
		Program program = TinyCParser.parse(Lexer.tokenize(source));
		return new SemanticAnalyzer().analyze(program);
	}

	@Test
	void validProgram()
	{
		SymbolTable table = analyze("int main() { int x; int y = x; MyType z = \"value of z\"; return y; }");

		assertNotNull(table.resolve(1, "z"));
		assertEquals(new UserDefinedType("MyType"), table.resolve(1, "z").getType());
	}

	@Test
	void undefinedVariable()
	{
		SemanticException e = assertThrows(SemanticException.class,
				() -> analyze("int main() { int x; int y = z; }"));

		assertEquals("Undefined variable z in scope 1", e.getMessage());
		assertEquals("z", e.getVariableName());
		assertEquals(1, e.getScopeId());
		assertEquals(1, e.getLine());
		assertEquals(29, e.getColumn());
	}

	@Test
	void undefinedInsideBinaryExpression()
	{
		assertThrows(SemanticException.class, () -> analyze("int main() { int a; return a + b * 2; }"));
	}

	@Test
	void conditionIsCheckedInEnclosingScope()
	{
		SemanticException e = assertThrows(SemanticException.class,
				() -> analyze("int main() { if (q) { int q; } }"));

		assertEquals(2, e.getScopeId());
	}

	@Test
	void undefinedInElseBranch()
	{
		SemanticException e = assertThrows(SemanticException.class,
				() -> analyze("int main() { int x; if (x) { return x; } else { return w; } }"));

		// else is scope 1, then is scope 2
		assertEquals(1, e.getScopeId());
		assertEquals("w", e.getVariableName());
	}

	@Test
	void outerVariablesAreVisibleInBranches()
	{
		assertDoesNotThrow(() -> analyze("int main() { int x; if (x) { int y = x; } else { x = 1; } return x; }"));
	}

	@Test
	void branchVariablesAreNotVisibleOutside()
	{
		SemanticException e = assertThrows(SemanticException.class,
				() -> analyze("int main() { int x; if (x) { int y; } return y; }"));

		assertEquals(2, e.getScopeId());
	}

	@Test
	void useBeforeDeclarationPasses()
	{
		// Only existence in the scope chain is checked, not order
		assertDoesNotThrow(() -> analyze("int main() { int y = x; int x; }"));
	}

	@Test
	void duplicateDeclarationIsReported()
	{
		assertThrows(SymbolTableException.class, () -> analyze("int main() { int x; char x; }"));
	}

	@Test
	void programMustHoldOneFunction()
	{
		assertThrows(IllegalArgumentException.class,
				() -> new SemanticAnalyzer().analyze(new Program(Collections.emptyList())));
	}
}
