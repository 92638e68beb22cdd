package com.earnix.parquet.inspector.cli;

import com.earnix.parquet.inspector.aggregate.ColumnFrequencies;
import com.earnix.parquet.inspector.aggregate.FrequencyCounter;
import com.earnix.parquet.inspector.aggregate.FrequencyEntry;
import com.earnix.parquet.inspector.file.reader.ParquetDataset;
import com.earnix.parquet.inspector.file.reader.RowReadConfig;
import com.earnix.parquet.inspector.schema.GroupNode;
import com.earnix.parquet.inspector.schema.LeafNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "frequency", description = "Count the distinct values of leaf columns, most frequent first")
public class FrequencyCommand implements Callable<Integer>
{
	private static final Logger LOG = LoggerFactory.getLogger(FrequencyCommand.class);

	static final List<String> HEADERS = List.of("FIELD", "VALUE", "COUNT");

	@Spec
	private CommandSpec spec;

	@Mixin
	private InputOption input;

	@Mixin
	private OutputOptions output;

	@Option(names = { "-c", "--columns" }, split = ",", paramLabel = "COLUMN",
			description = "Dotted paths of leaf columns, such as address.city, ignoring case (default: all leaf columns)")
	private List<String> columns;

	@Option(names = { "-l", "--limit" }, description = "Maximum number of rows to scan (default: all)")
	private Long limit;

	@Override
	public Integer call() throws Exception
	{
		ParquetDataset dataset = input.open();
		List<String> paths = columns != null ? columns : leafPaths(dataset.getSchema());
		List<List<String>> rows = new ArrayList<>();
		if (!paths.isEmpty())
		{
			FrequencyCounter counter = new FrequencyCounter(dataset.getSchema(), paths);
			RowReadConfig config = RowReadConfig.allRows().withColumns(RowCells.headers(counter.getProjection()));
			if (limit != null)
				config = config.withLimit(limit);
			counter.addAll(dataset.rows(config));
			LOG.debug("Counted {} columns over {} rows", paths.size(), counter.getRowsCounted());

			for (ColumnFrequencies column : counter.getResult())
			{
				for (FrequencyEntry entry : column.getEntries())
					rows.add(List.of(column.getColumn(), entry.getValue(), Long.toString(entry.getCount())));
			}
		}

		PrintWriter out = spec.commandLine().getOut();
		out.print(output.createWriter().render(HEADERS, rows));
		out.flush();
		return 0;
	}

	private static List<String> leafPaths(GroupNode schema)
	{
		List<String> paths = new ArrayList<>();
		for (LeafNode leaf : schema.getLeaves())
			paths.add(leaf.getDottedPath());
		return paths;
	}
}
