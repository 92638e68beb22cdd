package com.earnix.parquet.inspector.file.reader;

import com.earnix.parquet.inspector.reader.ParquetFileIndex;
import com.earnix.parquet.inspector.reader.ParquetRowReader;
import com.earnix.parquet.inspector.schema.SchemaNodes;
import com.earnix.parquet.inspector.value.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Reads the rows of several files one after the other, up to a row limit. A file is only read once the rows of the
 * files before it are consumed.
 */
public class MultiFileRowReader implements Iterator<Value.GroupValue>
{
	private static final Logger LOG = LoggerFactory.getLogger(MultiFileRowReader.class);

	private final Iterator<ParquetFileIndex> files;
	private final RowReadConfig config;
	private Iterator<Value.GroupValue> current = Collections.emptyIterator();
	private long rowsRead = 0;

	/**
	 * @param files  the files, all with the same schema
	 * @param config the columns to select and the row limit
	 */
	public MultiFileRowReader(List<ParquetFileIndex> files, RowReadConfig config)
	{
		this.files = files.iterator();
		this.config = config;
	}

	@Override
	public boolean hasNext()
	{
		if (rowsRead >= config.getLimit())
			return false;
		while (!current.hasNext())
		{
			if (!files.hasNext())
				return false;
			ParquetFileIndex file = files.next();
			LOG.debug("Reading rows of {}", file.describe());
			current = new ParquetRowReader(file, SchemaNodes.selectFields(file.getSchema(), config.getColumns()));
		}
		return true;
	}

	@Override
	public Value.GroupValue next()
	{
		if (!hasNext())
			throw new NoSuchElementException();
		rowsRead++;
		return current.next();
	}

	public long getRowsRead()
	{
		return rowsRead;
	}
}
