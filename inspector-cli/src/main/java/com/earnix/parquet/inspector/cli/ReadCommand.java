package com.earnix.parquet.inspector.cli;

import com.earnix.parquet.inspector.file.reader.ParquetDataset;
import com.earnix.parquet.inspector.file.reader.RowReadConfig;
import com.earnix.parquet.inspector.value.Value;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "read", description = "Read rows in file order")
public class ReadCommand implements Callable<Integer>
{
	@Spec
	private CommandSpec spec;

	@Mixin
	private InputOption input;

	@Mixin
	private OutputOptions output;

	@Option(names = { "-c", "--columns" }, split = ",", paramLabel = "COLUMN",
			description = "Top level columns to read, ignoring case (default: all)")
	private List<String> columns = new ArrayList<>();

	@Option(names = { "-l", "--limit" }, defaultValue = "300",
			description = "Maximum number of rows (default: ${DEFAULT-VALUE})")
	private long limit;

	@Override
	public Integer call() throws Exception
	{
		ParquetDataset dataset = input.open();
		RowReadConfig config = RowReadConfig.allRows().withColumns(columns).withLimit(limit);
		List<String> headers = RowCells.headers(dataset.getProjection(config));

		List<List<String>> rows = new ArrayList<>();
		Iterator<Value.GroupValue> it = dataset.rows(config);
		while (it.hasNext())
			rows.add(RowCells.cells(it.next()));

		PrintWriter out = spec.commandLine().getOut();
		out.print(output.createWriter().render(headers, rows));
		out.flush();
		return 0;
	}
}
