package com.earnix.parquet.inspector.reader;

import com.earnix.parquet.inspector.assembler.AssemblyException;
import com.earnix.parquet.inspector.assembler.RowAssembler;
import com.earnix.parquet.inspector.assembler.TripleCursor;
import com.earnix.parquet.inspector.reader.chunk.internal.InMemChunk;
import com.earnix.parquet.inspector.schema.GroupNode;
import com.earnix.parquet.inspector.schema.LeafNode;
import com.earnix.parquet.inspector.value.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Iterates the rows of a parquet file, one row group at a time. Only the column chunks of the current row group are
 * held in memory.
 * <p>Note that this class is *NOT* threadsafe</p>
 */
public class ParquetRowReader implements Iterator<Value.GroupValue>
{
	private static final Logger LOG = LoggerFactory.getLogger(ParquetRowReader.class);

	private final ParquetFileIndex reader;
	private final GroupNode projection;
	private int nextRowGroup = 0;
	private Iterator<Value.GroupValue> currentRowGroup = Collections.emptyIterator();

	/**
	 * Read all the columns of the file
	 *
	 * @param reader the reader of the file
	 */
	public ParquetRowReader(ParquetFileIndex reader)
	{
		this(reader, reader.getSchema());
	}

	/**
	 * @param reader     the reader of the file
	 * @param projection the schema of the returned rows. Must be the schema of the reader or a projection of it.
	 */
	public ParquetRowReader(ParquetFileIndex reader, GroupNode projection)
	{
		this.reader = reader;
		this.projection = projection;
	}

	@Override
	public boolean hasNext()
	{
		while (!currentRowGroup.hasNext())
		{
			if (nextRowGroup >= reader.getNumRowGroups())
				return false;
			currentRowGroup = openRowGroup(nextRowGroup++);
		}
		return true;
	}

	@Override
	public Value.GroupValue next()
	{
		if (!hasNext())
			throw new NoSuchElementException();
		return currentRowGroup.next();
	}

	private Iterator<Value.GroupValue> openRowGroup(int rowGroup)
	{
		long numRows = reader.getNumRowsInRowGroup(rowGroup);
		if (numRows == 0)
		{
			LOG.debug("Skipping empty row group {} of {}", rowGroup, reader.describe());
			return Collections.emptyIterator();
		}
		LOG.debug("Reading row group {} of {} with {} rows", rowGroup, reader.describe(), numRows);

		Map<LeafNode, TripleCursor> cursors = new HashMap<>();
		for (LeafNode leaf : projection.getLeaves())
		{
			InMemChunk chunk;
			try
			{
				chunk = reader.readColumnChunk(rowGroup, leaf.getDescriptor());
			}
			catch (IOException e)
			{
				throw new UncheckedIOException(
						"Failed to read column " + leaf.getDottedPath() + " in row group " + rowGroup + " of "
								+ reader.describe(), e);
			}
			if (chunk.getTotalValues() <= 0)
			{
				throw new AssemblyException(rowGroup,
						"column " + leaf.getDottedPath() + " has no values but the row group has " + numRows
								+ " rows");
			}
			cursors.put(leaf, chunk.openCursor());
		}
		return RowAssembler.assemble(projection, cursors, rowGroup, numRows);
	}
}
