package com.earnix.parquet.inspector.reader;

import com.earnix.parquet.inspector.reader.chunk.internal.InMemChunk;
import com.earnix.parquet.inspector.schema.GroupNode;
import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.format.FileMetaData;
import org.apache.parquet.schema.MessageType;

import java.io.IOException;

/**
 * The decoded footer of a parquet file, with the column chunks of every row group indexed by column so any chunk can
 * be read on demand.
 * <p>Nothing needs to be closed. The underlying source is opened and closed for every chunk read.</p>
 */
public interface ParquetFileIndex
{
	int getNumRowGroups();

	/**
	 * @param rowGroup the row group offset
	 * @return the number of rows the footer declares for the row group
	 */
	long getNumRowsInRowGroup(int rowGroup);

	/**
	 * @return the num_rows of the footer
	 */
	long getTotalNumRows();

	MessageType getMessageType();

	/**
	 * @return the schema tree of the file
	 */
	GroupNode getSchema();

	/**
	 * @return the footer metadata. Callers must not modify it.
	 */
	FileMetaData getFileMetaData();

	/**
	 * Read and decompress one column chunk
	 *
	 * @param rowGroup   the row group offset
	 * @param descriptor the leaf column
	 * @return the chunk
	 * @throws IOException on failure to read or decompress the chunk
	 */
	InMemChunk readColumnChunk(int rowGroup, ColumnDescriptor descriptor) throws IOException;

	/**
	 * @return the name of the source, such as a file path
	 */
	String describe();
}
