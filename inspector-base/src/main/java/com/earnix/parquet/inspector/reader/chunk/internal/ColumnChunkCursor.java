package com.earnix.parquet.inspector.reader.chunk.internal;

import com.earnix.parquet.inspector.assembler.TripleCursor;
import org.apache.parquet.VersionParser;
import org.apache.parquet.column.impl.ColumnReaderImpl;
import org.apache.parquet.io.api.PrimitiveConverter;
import org.apache.parquet.schema.PrimitiveType;

/**
 * Walks the triples of an {@link InMemChunk}. Values are pulled through the getters of the column reader, so its
 * converter is never fed.
 * <p>Note that this class is *NOT* threadsafe</p>
 */
class ColumnChunkCursor implements TripleCursor
{
	// Reading files with known writer bugs is out of scope, so no writer version is reported.
	private static final VersionParser.ParsedVersion NO_WRITER_FIXUPS = new VersionParser.ParsedVersion("inspector",
			"1.0", "");

	private final ColumnReaderImpl columnReader;
	private final PrimitiveType.PrimitiveTypeName physicalType;
	private final int maxDefinitionLevel;
	private final long numTriples;
	private long position;

	ColumnChunkCursor(InMemChunk chunk)
	{
		columnReader = new ColumnReaderImpl(chunk.getDescriptor(), chunk.newPageReader(), new PrimitiveConverter()
		{
		}, NO_WRITER_FIXUPS);
		physicalType = chunk.getDescriptor().getPrimitiveType().getPrimitiveTypeName();
		maxDefinitionLevel = chunk.getDescriptor().getMaxDefinitionLevel();
		numTriples = chunk.getTotalValues();
	}

	@Override
	public boolean hasCurrent()
	{
		return position < numTriples;
	}

	@Override
	public int getRepetitionLevel()
	{
		return columnReader.getCurrentRepetitionLevel();
	}

	@Override
	public int getDefinitionLevel()
	{
		return columnReader.getCurrentDefinitionLevel();
	}

	@Override
	public Object getValue()
	{
		switch (physicalType)
		{
			case BOOLEAN:
				return columnReader.getBoolean();
			case INT32:
				return columnReader.getInteger();
			case INT64:
				return columnReader.getLong();
			case FLOAT:
				return columnReader.getFloat();
			case DOUBLE:
				return columnReader.getDouble();
			case INT96:
			case BINARY:
			case FIXED_LEN_BYTE_ARRAY:
				// the reader reuses its buffers once it moves on
				return columnReader.getBinary().copy();
			default:
				throw new IllegalStateException("Unknown physical type " + physicalType);
		}
	}

	@Override
	public void advance()
	{
		if (!hasCurrent())
			throw new IllegalStateException("Cursor already exhausted");
		if (++position >= numTriples)
			return;

		// skip() only drops the data value of the current triple if the getters never read it. Null triples have no
		// data value, so there is nothing to drop for them.
		if (columnReader.getCurrentDefinitionLevel() == maxDefinitionLevel)
			columnReader.skip();

		// consume() moves to the levels of the next triple and leaves its data value unread
		columnReader.consume();
	}
}
