package com.juanpa.tinyc.cfg;

import com.juanpa.tinyc.ast.Program;
import com.juanpa.tinyc.ast.Scope;
import com.juanpa.tinyc.ast.declarations.FunctionDeclaration;
import com.juanpa.tinyc.ast.declarations.Parameter;
import com.juanpa.tinyc.lexer.Lexer;
import com.juanpa.tinyc.parser.TinyCParser;
import com.juanpa.tinyc.semantics.PrimitiveType;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CfgBuilderTest
{
	private static Program parse(String source)
	{
		return TinyCParser.parse(Lexer.tokenize(source));
	}

	private static List<Instruction> lower(String source)
	{
		ControlFlowGraph graph = CfgBuilder.build(parse(source));
		assertEquals(1, graph.size());
		return graph.getEntryBlock().getInstructions();
	}

	@Test
	void initializedVariableIsReturned()
	{
		List<Instruction> instructions = lower("int main() { int x = 123; return x; }");

		assertEquals(List.of(new AssignInstruction("v1", 123), new ReturnInstruction("v1")), instructions);
	}

	@Test
	void literalReturnGetsATemporary()
	{
		List<Instruction> instructions = lower("int main() { return 5; }");

		assertEquals(List.of(new AssignInstruction("v1", 5), new ReturnInstruction("v1")), instructions);
	}

	@Test
	void uninitializedDeclarationStillTakesAName()
	{
		CfgBuilder builder = new CfgBuilder();
		ControlFlowGraph graph = builder.lower(parse("int main() { int a; int b = 7; return b; }"));

		assertEquals("v1", builder.getBinding("a"));
		assertEquals("v2", builder.getBinding("b"));
		assertNull(builder.getBinding("c"));
		assertEquals(List.of(new AssignInstruction("v2", 7), new ReturnInstruction("v2")),
				graph.getEntryBlock().getInstructions());
	}

	@Test
	void printedGraph()
	{
		ControlFlowGraph graph = CfgBuilder.build(parse("int main() { int x = 123; return x; }"));

		assertEquals("block 0:\n  v1 = 123\n  return v1\n", graph.toString());
	}

	@Test
	void nonLiteralInitializerIsRejected()
	{
		assertThrows(LoweringException.class, () -> lower("int main() { int x = 1; int y = x; return y; }"));
	}

	@Test
	void returnOfExpressionIsRejected()
	{
		assertThrows(LoweringException.class, () -> lower("int main() { int x = 1; return x + 1; }"));
	}

	@Test
	void returnBeforeDeclarationIsRejected()
	{
		LoweringException e = assertThrows(LoweringException.class, () -> lower("int main() { return x; int x; }"));

		assertTrue(e.getMessage().contains("before it is declared"));
	}

	@Test
	void ifIsNotLowered()
	{
		assertThrows(LoweringException.class, () -> lower("int main() { int x = 1; if (x) { return 1; } return 0; }"));
	}

	@Test
	void expressionStatementIsNotLowered()
	{
		assertThrows(LoweringException.class, () -> lower("int main() { int x; x = 2; return x; }"));
	}

	@Test
	void builderIsSingleUse()
	{
		CfgBuilder builder = new CfgBuilder();
		Program program = parse("int main() { return 0; }");
		builder.lower(program);

		assertThrows(IllegalStateException.class, () -> builder.lower(program));
	}

	@Test
	void mainWithParametersIsRejected()
	{
		FunctionDeclaration main = new FunctionDeclaration("main", List.of(new Parameter(PrimitiveType.INT, "argc")),
				PrimitiveType.INT, new Scope(1, Collections.emptyList()));

		assertThrows(IllegalArgumentException.class, () -> CfgBuilder.build(new Program(List.of(main))));
	}

	@Test
	void printedGraphListsSuccessors()
	{
		ControlFlowGraph graph = new ControlFlowGraph();
		BasicBlock entry = graph.createBlock(ControlFlowGraph.ENTRY_BLOCK_ID);
		BasicBlock exit = graph.createBlock(1);
		entry.addInstruction(new AssignInstruction("v1", 0));
		entry.addInstruction(new JumpInstruction(exit.getId()));
		entry.addSuccessor(exit.getId());
		exit.addInstruction(new ReturnInstruction("v1"));

		assertEquals(List.of(1), graph.getBlock(0).getSuccessors());
		assertEquals("block 0: -> 1\n  v1 = 0\n  goto block 1\nblock 1:\n  return v1\n", graph.toString());
	}

	@Test
	void graphRejectsDuplicateBlockIds()
	{
		ControlFlowGraph graph = new ControlFlowGraph();
		graph.createBlock(0);

		assertThrows(IllegalArgumentException.class, () -> graph.createBlock(0));
	}
}
