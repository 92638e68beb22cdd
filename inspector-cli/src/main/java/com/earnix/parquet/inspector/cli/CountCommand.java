package com.earnix.parquet.inspector.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "count", description = "Show the number of rows, read from the footers only")
public class CountCommand implements Callable<Integer>
{
	@Spec
	private CommandSpec spec;

	@Mixin
	private InputOption input;

	@Override
	public Integer call() throws Exception
	{
		long count = input.open().countRows();
		PrintWriter out = spec.commandLine().getOut();
		out.println(count);
		out.flush();
		return 0;
	}
}
