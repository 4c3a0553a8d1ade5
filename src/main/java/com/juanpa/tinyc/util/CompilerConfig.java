package com.juanpa.tinyc.util;

import java.util.Properties;

/**
 * Holds configuration settings for the TinyC compiler, loaded from a properties file.
 * Provides sensible defaults if settings are not specified.
 */
public class CompilerConfig
{
	public static final String ASSEMBLER_PATH = "compiler.assembler_path";
	public static final String OUTPUT_EXTENSION = "compiler.output_extension";
	public static final String DEBUG = "compiler.debug";

	private final String assemblerPath;
	private final String outputExtension;
	private final boolean debugEnabled;

	public CompilerConfig(Properties props)
	{
		// gcc assembles and links AT&T syntax in one step
		this.assemblerPath = props.getProperty(ASSEMBLER_PATH, "gcc").trim();
		this.outputExtension = normalizeExtension(props.getProperty(OUTPUT_EXTENSION, ".s"));
		this.debugEnabled = Boolean.parseBoolean(props.getProperty(DEBUG, "false").trim());
	}

	public static CompilerConfig defaults()
	{
		return new CompilerConfig(new Properties());
	}

	private static String normalizeExtension(String extension)
	{
		String trimmed = extension.trim();
		if (trimmed.isEmpty())
		{
			return ".s";
		}
		return trimmed.startsWith(".") ? trimmed : "." + trimmed;
	}

	public String getAssemblerPath()
	{
		return assemblerPath;
	}

	public String getOutputExtension()
	{
		return outputExtension;
	}

	public boolean isDebugEnabled()
	{
		return debugEnabled;
	}
}
