package com.earnix.parquet.inspector.cli;

import com.earnix.parquet.inspector.aggregate.ReservoirSampler;
import com.earnix.parquet.inspector.file.reader.ParquetDataset;
import com.earnix.parquet.inspector.file.reader.RowReadConfig;
import com.earnix.parquet.inspector.value.Value;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;

@Command(name = "sample", description = "Print a uniform random sample of the rows")
public class SampleCommand implements Callable<Integer>
{
	@Spec
	private CommandSpec spec;

	@Mixin
	private InputOption input;

	@Mixin
	private OutputOptions output;

	@Option(names = { "-n", "-l", "--limit" }, defaultValue = "100",
			description = "Sample size (default: ${DEFAULT-VALUE})")
	private int sampleSize;

	@Option(names = { "-s", "--seed" }, description = "Seed of the random generator, for a reproducible sample")
	private Long seed;

	@Override
	public Integer call() throws Exception
	{
		ParquetDataset dataset = input.open();
		Random random = seed == null ? new Random() : new Random(seed);
		List<Value.GroupValue> sample = ReservoirSampler.sample(dataset.rows(RowReadConfig.allRows()), sampleSize,
				random);

		PrintWriter out = spec.commandLine().getOut();
		out.print(output.createWriter().render(RowCells.headers(dataset.getSchema()), RowCells.cells(sample)));
		out.flush();
		return 0;
	}
}
