package com.earnix.parquet.inspector.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Entry point of the {@code parquet-inspector} command line
 */
@Command(name = "parquet-inspector", mixinStandardHelpOptions = true, version = "parquet-inspector 0.1.0",
		description = "Inspect parquet files: schema, row count, rows, samples and value frequencies",
		subcommands = { SchemaCommand.class, CountCommand.class, ReadCommand.class, SampleCommand.class,
				FrequencyCommand.class })
public class ParquetInspectorCli implements Runnable
{
	@Spec
	private CommandSpec spec;

	@Override
	public void run()
	{
		throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand");
	}

	/**
	 * @return the command line, with the error reporting of the tool installed
	 */
	public static CommandLine createCommandLine()
	{
		return new CommandLine(new ParquetInspectorCli()).setCaseInsensitiveEnumValuesAllowed(true)
				.setExecutionExceptionHandler(new ErrorMessageHandler());
	}

	public static void main(String[] args)
	{
		System.exit(createCommandLine().execute(args));
	}
}
