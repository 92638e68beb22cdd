package com.earnix.parquet.inspector.cli;

import com.earnix.parquet.inspector.file.reader.ParquetDataset;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The input path shared by all commands
 */
public class InputOption
{
	@Parameters(index = "0", paramLabel = "PATH",
			description = "A parquet file, or a directory searched recursively for *.parquet files")
	private Path path;

	public Path getPath()
	{
		return path;
	}

	ParquetDataset open() throws IOException
	{
		return ParquetDataset.open(path);
	}
}
