package com.juanpa.tinyc;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class MainTest
{
	@TempDir
	Path workDir;

	@Test
	void writesAssemblyNextToTheSource() throws IOException
	{
		Path source = workDir.resolve("prog.c");
		Files.writeString(source, "int main() { int x = 7; return x; }", StandardCharsets.UTF_8);
		Path output = workDir.resolve("out").resolve("prog.s");

		int exitCode = Main.run(new String[]{"--dump-cfg", source.toString(), "-o", output.toString()});

		assertEquals(0, exitCode);
		assertEquals(".global main\nmain:\nmov $7, %rbx\nmov %rbx, %rax\n", Files.readString(output, StandardCharsets.UTF_8));
	}

	@Test
	void failedCompilationWritesNothing() throws IOException
	{
		Path source = workDir.resolve("bad.c");
		Files.writeString(source, "int main() { return y; }", StandardCharsets.UTF_8);
		Path output = workDir.resolve("bad.s");

		assertEquals(1, Main.run(new String[]{source.toString(), "-o", output.toString()}));
		assertFalse(Files.exists(output));
	}

	@Test
	void usageErrors()
	{
		assertEquals(2, Main.run(new String[0]));
		assertEquals(2, Main.run(new String[]{"--bogus", "a.c"}));
		assertEquals(2, Main.run(new String[]{workDir.resolve("missing.c").toString()}));
	}

	@Test
	void replaceExtension()
	{
		assertEquals(Paths.get("dir", "prog.s"), Main.replaceExtension(Paths.get("dir", "prog.c"), ".s"));
		assertEquals(Paths.get("prog"), Main.replaceExtension(Paths.get("prog.s"), ""));
		assertEquals(Paths.get("noext.s"), Main.replaceExtension(Paths.get("noext"), ".s"));
	}

	@Test
	void executableNeverOverwritesTheAssembly()
	{
		assertEquals(Paths.get("dir", "prog"), Main.executableFor(Paths.get("dir", "prog.s")));
		assertEquals(Paths.get("dir", "prog.out"), Main.executableFor(Paths.get("dir", "prog")));
	}
}
