package com.earnix.parquet.inspector.cli;

import com.earnix.parquet.inspector.schema.SchemaTranslator;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "schema", description = "Show the schema. For a directory, the schema of its first file.")
public class SchemaCommand implements Callable<Integer>
{
	@Spec
	private CommandSpec spec;

	@Mixin
	private InputOption input;

	@Override
	public Integer call() throws Exception
	{
		String schema = SchemaTranslator.render(input.open().getSchema());
		PrintWriter out = spec.commandLine().getOut();
		out.print(schema);
		out.flush();
		return 0;
	}
}
