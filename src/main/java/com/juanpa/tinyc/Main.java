// File: src/main/java/com/juanpa/tinyc/Main.java

package com.juanpa.tinyc;

import com.juanpa.tinyc.lexer.Token;
import com.juanpa.tinyc.util.CompilerConfig;
import com.juanpa.tinyc.util.Debug;
import com.juanpa.tinyc.util.ErrorReporter;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Entry point for the TinyC compiler.
 * Reads one source file, writes the assembly next to it, and optionally assembles it.
 */
public class Main
{
	private static final String USAGE = "Usage: tinyc [--dump-tokens] [--dump-ast] [--dump-cfg] [--assemble] [-o <out.s>] <source.c>";

	public static void main(String[] args)
	{
		System.exit(run(args));
	}

	/**
	 * Runs the command line and returns the process exit code.
	 */
	static int run(String[] args)
	{
		// 1. Load Compiler Configuration
		CompilerConfig config = loadConfiguration();
		Debug.setEnabled(config.isDebugEnabled());

		// 2. Argument parsing
		boolean dumpTokens = false;
		boolean dumpAst = false;
		boolean dumpCfg = false;
		boolean assemble = false;
		Path outputFile = null;
		List<String> positional = new ArrayList<>();
		for (int i = 0; i < args.length; i++)
		{
			String arg = args[i];
			switch (arg)
			{
				case "--dump-tokens":
					dumpTokens = true;
					break;
				case "--dump-ast":
					dumpAst = true;
					break;
				case "--dump-cfg":
					dumpCfg = true;
					break;
				case "--assemble":
					assemble = true;
					break;
				case "-o":
					if (i + 1 >= args.length)
					{
						System.err.println("Error: -o needs a file name.");
						System.err.println(USAGE);
						return 2;
					}
					outputFile = Paths.get(args[++i]);
					break;
				default:
					if (arg.startsWith("--"))
					{
						System.err.println("Error: unknown option " + arg);
						System.err.println(USAGE);
						return 2;
					}
					positional.add(arg);
			}
		}

		if (positional.size() != 1)
		{
			System.err.println(USAGE);
			return 2;
		}

		Path sourceFile = Paths.get(positional.get(0));
		if (!Files.exists(sourceFile))
		{
			System.err.println("Error: Source file not found: " + sourceFile);
			return 2;
		}
		if (outputFile == null)
		{
			outputFile = replaceExtension(sourceFile, config.getOutputExtension());
		}

		String source;
		try
		{
			source = Files.readString(sourceFile, StandardCharsets.UTF_8);
		}
		catch (IOException e)
		{
			System.err.println("Error reading " + sourceFile + ": " + e.getMessage());
			return 2;
		}

		// 3. Compile
		System.out.println("--- Compiling " + sourceFile.getFileName() + " ---");
		ErrorReporter errorReporter = new ErrorReporter();
		CompilationResult result = new Compiler(errorReporter).tryCompile(source);
		if (result == null || errorReporter.hasErrors())
		{
			System.err.println("Compilation failed.");
			return 1;
		}

		if (dumpTokens)
		{
			System.out.println("\n--- Tokens ---");
			for (Token token : result.getTokens())
			{
				System.out.println(token);
			}
		}
		if (dumpAst)
		{
			System.out.println("\n--- AST ---");
			System.out.print(result.getProgram());
			System.out.println("\n--- Symbol Table ---");
			System.out.print(result.getSymbolTable());
		}
		if (dumpCfg)
		{
			System.out.println("\n--- Control Flow Graph ---");
			System.out.print(result.getControlFlowGraph());
		}

		// 4. Write the assembly
		if (!saveToFile(outputFile, result.getAssemblyText()))
		{
			return 2;
		}

		// 5. Optionally hand it to the system assembler
		if (assemble)
		{
			return assembleAndLink(outputFile, executableFor(outputFile), config);
		}

		System.out.println("\nCompilation finished.");
		return 0;
	}

	private static CompilerConfig loadConfiguration()
	{
		Properties props = new Properties();

		// Bundled defaults first, the user's file overrides them
		try (InputStream bundled = Main.class.getResourceAsStream("/tinyc.properties"))
		{
			if (bundled != null)
			{
				props.load(bundled);
			}
		}
		catch (IOException e)
		{
			System.err.println("Warning: Could not read bundled tinyc.properties. Using built-in defaults.");
		}

		Path configPath = Paths.get(System.getProperty("user.home"), ".config", "tinyc", "tinyc.conf");
		if (Files.exists(configPath))
		{
			try (InputStream input = new FileInputStream(configPath.toFile()))
			{
				props.load(input);
				System.out.println("--- Loaded configuration from: " + configPath + " ---");
			}
			catch (IOException e)
			{
				System.err.println("Warning: Could not read config file at " + configPath + ". Using default settings.");
			}
		}
		else
		{
			System.out.println("--- No config file found at ~/.config/tinyc/tinyc.conf. Using default settings. ---");
			System.out.println("--- You can create this file to customize the toolchain. Example: ---");
			System.out.println("# ~/.config/tinyc/tinyc.conf");
			System.out.println(CompilerConfig.ASSEMBLER_PATH + " = /usr/bin/gcc");
			System.out.println(CompilerConfig.DEBUG + " = true");
			System.out.println("--------------------------------------------------------------------");
		}
		return new CompilerConfig(props);
	}

	// --- HELPER METHODS ---

	static Path replaceExtension(Path file, String extension)
	{
		String name = file.getFileName().toString();
		int dot = name.lastIndexOf('.');
		String base = dot > 0 ? name.substring(0, dot) : name;
		return file.resolveSibling(base + extension);
	}

	/**
	 * Names the executable after the assembly file without its extension. An assembly
	 * file that has no extension gets ".out" appended, so the assembler never overwrites its input.
	 */
	static Path executableFor(Path assemblyFile)
	{
		Path executable = replaceExtension(assemblyFile, "");
		if (executable.equals(assemblyFile))
		{
			return assemblyFile.resolveSibling(assemblyFile.getFileName() + ".out");
		}
		return executable;
	}

	private static boolean saveToFile(Path filePath, String content)
	{
		try
		{
			Path parent = filePath.toAbsolutePath().getParent();
			if (parent != null)
			{
				Files.createDirectories(parent);
			}
			Files.write(filePath, content.getBytes(StandardCharsets.UTF_8));
			System.out.println("Saved: " + filePath);
			return true;
		}
		catch (IOException e)
		{
			System.err.println("Error saving generated assembly to file '" + filePath + "': " + e.getMessage());
			return false;
		}
	}

	private static int assembleAndLink(Path assemblyFile, Path executable, CompilerConfig config)
	{
		List<String> command = List.of(
				config.getAssemblerPath(),
				assemblyFile.toAbsolutePath().toString(),
				"-o", executable.toAbsolutePath().toString());

		System.out.println("Assembling with command: " + String.join(" ", command));
		try
		{
			Process process = new ProcessBuilder(command).inheritIO().start();
			int exitCode = process.waitFor();
			if (exitCode != 0)
			{
				System.err.println("Assembler exited with code " + exitCode + ".");
				return 1;
			}
			System.out.println("Built executable: " + executable);
			return 0;
		}
		catch (IOException e)
		{
			System.err.println("Could not run the assembler '" + config.getAssemblerPath() + "': " + e.getMessage());
			return 1;
		}
		catch (InterruptedException e)
		{
			Thread.currentThread().interrupt();
			System.err.println("Interrupted while waiting for the assembler.");
			return 1;
		}
	}
}
