package com.earnix.parquet.inspector.file.reader;

import com.earnix.parquet.inspector.reader.MetadataException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Expands an input path into the parquet files to read
 */
public class ParquetPaths
{
	private static final Logger LOG = LoggerFactory.getLogger(ParquetPaths.class);

	public static final String PARQUET_EXTENSION = ".parquet";

	private ParquetPaths()
	{
	}

	/**
	 * A file is returned as is, whatever its name. A directory is searched recursively for files named
	 * {@code *.parquet}, returned in sorted path order. Empty files of a directory are skipped with a warning.
	 *
	 * @param input a parquet file or a directory
	 * @return the files to read, never empty
	 * @throws NoSuchFileException if the input does not exist
	 * @throws MetadataException   if a directory holds no non empty parquet file
	 * @throws IOException         on failure to list a directory
	 */
	public static List<Path> listParquetFiles(Path input) throws IOException
	{
		if (!Files.exists(input))
			throw new NoSuchFileException(input.toString());
		if (!Files.isDirectory(input))
			return List.of(input);

		List<Path> candidates;
		try (Stream<Path> walk = Files.walk(input))
		{
			candidates = walk.filter(Files::isRegularFile)
					.filter(p -> p.getFileName().toString().endsWith(PARQUET_EXTENSION)).sorted()
					.collect(Collectors.toList());
		}

		List<Path> files = new ArrayList<>(candidates.size());
		for (Path candidate : candidates)
		{
			if (Files.size(candidate) == 0)
			{
				LOG.warn("Ignoring empty file {}", candidate);
				continue;
			}
			files.add(candidate);
		}
		if (files.isEmpty())
			throw new MetadataException("No parquet files found in " + input);
		LOG.debug("Found {} parquet files in {}", files.size(), input);
		return files;
	}
}
