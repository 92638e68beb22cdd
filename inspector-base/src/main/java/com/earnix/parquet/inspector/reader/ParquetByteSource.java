package com.earnix.parquet.inspector.reader;

import org.apache.parquet.format.FileMetaData;

import java.io.IOException;
import java.io.InputStream;

/**
 * The bytes of one parquet file, wherever they are stored
 */
public interface ParquetByteSource
{
	/**
	 * @return the decoded footer
	 * @throws IOException       on failure to read the bytes
	 * @throws MetadataException if the trailer or the footer is not valid
	 */
	FileMetaData readFooter() throws IOException;

	/**
	 * @param startOffset    the first byte of the range
	 * @param numBytesToRead the length of the range
	 * @return a stream over the range. The caller MUST close it.
	 * @throws IOException on failure to open the range
	 */
	InputStream openRange(long startOffset, long numBytesToRead) throws IOException;

	/**
	 * @return a name for the source, used in log and error messages
	 */
	String describe();
}
