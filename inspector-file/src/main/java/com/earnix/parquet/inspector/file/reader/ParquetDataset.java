package com.earnix.parquet.inspector.file.reader;

import com.earnix.parquet.inspector.aggregate.RowCounter;
import com.earnix.parquet.inspector.reader.MetadataException;
import com.earnix.parquet.inspector.reader.ParquetFileIndex;
import com.earnix.parquet.inspector.schema.GroupNode;
import com.earnix.parquet.inspector.schema.InvalidColumnException;
import com.earnix.parquet.inspector.schema.SchemaNodes;
import com.earnix.parquet.inspector.value.Value;
import org.apache.parquet.format.FileMetaData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * A parquet file, or a directory of parquet files sharing one schema. Opening reads and indexes every footer, the
 * column chunks are only read when rows are iterated.
 */
public class ParquetDataset
{
	private static final Logger LOG = LoggerFactory.getLogger(ParquetDataset.class);

	private final Path input;
	private final List<ParquetFileIndex> files;

	private ParquetDataset(Path input, List<ParquetFileIndex> files)
	{
		this.input = input;
		this.files = files;
	}

	/**
	 * @param input a parquet file or a directory, see {@link ParquetPaths#listParquetFiles(Path)}
	 * @return the dataset
	 * @throws IOException       on failure to read a file
	 * @throws MetadataException if a file is not valid parquet, or its schema differs from the first file's
	 */
	public static ParquetDataset open(Path input) throws IOException
	{
		List<ParquetFileIndex> files = new ArrayList<>();
		for (Path path : ParquetPaths.listParquetFiles(input))
		{
			ParquetFileIndex reader = ParquetFileReaderFactory.open(path);
			if (!files.isEmpty())
				checkSameSchema(files.get(0), reader);
			files.add(reader);
		}
		LOG.debug("Opened {} with {} files", input, files.size());
		return new ParquetDataset(input, files);
	}

	// the name of the root is not part of the comparison, writers name it differently
	private static void checkSameSchema(ParquetFileIndex first, ParquetFileIndex other)
	{
		if (!first.getMessageType().getFields().equals(other.getMessageType().getFields()))
		{
			throw new MetadataException(
					"Schema of " + other.describe() + " differs from the schema of " + first.describe());
		}
	}

	/**
	 * @return the schema of the first file, which all the files share
	 */
	public GroupNode getSchema()
	{
		return files.get(0).getSchema();
	}

	public Path getInput()
	{
		return input;
	}

	public List<ParquetFileIndex> getFiles()
	{
		return Collections.unmodifiableList(files);
	}

	/**
	 * @return the footers of the files, in file order
	 */
	public List<FileMetaData> getFileMetaData()
	{
		List<FileMetaData> footers = new ArrayList<>(files.size());
		for (ParquetFileIndex file : files)
			footers.add(file.getFileMetaData());
		return footers;
	}

	/**
	 * @return the total number of rows, from the footers only
	 */
	public long countRows()
	{
		return RowCounter.countRows(getFileMetaData());
	}

	/**
	 * Iterate the rows of all the files in order
	 *
	 * @param config the columns and the row limit
	 * @return the rows
	 * @throws InvalidColumnException if a selected column does not exist, before any row is read
	 */
	public Iterator<Value.GroupValue> rows(RowReadConfig config)
	{
		// unknown columns fail here rather than on the first row
		getProjection(config);
		return new MultiFileRowReader(files, config);
	}

	/**
	 * @param config the columns and the row limit
	 * @return the schema of the rows read with the config
	 * @throws InvalidColumnException if a selected column does not exist
	 */
	public GroupNode getProjection(RowReadConfig config)
	{
		return SchemaNodes.selectFields(getSchema(), config.getColumns());
	}
}
