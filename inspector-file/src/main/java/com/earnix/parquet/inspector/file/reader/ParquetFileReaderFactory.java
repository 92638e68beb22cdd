package com.earnix.parquet.inspector.file.reader;

import com.earnix.parquet.inspector.reader.IndexedParquetFile;
import com.earnix.parquet.inspector.reader.MetadataException;
import com.earnix.parquet.inspector.reader.ParquetFileIndex;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Opens local parquet files
 */
public class ParquetFileReaderFactory
{
	/**
	 * Read and index the footer of a parquet file
	 *
	 * @param parquetPath the path to the parquet file
	 * @return the index of the file
	 * @throws IOException       on failure reading the metadata of the parquet file
	 * @throws MetadataException if the file is not a valid parquet file. The message starts with the path.
	 */
	public static ParquetFileIndex open(Path parquetPath) throws IOException
	{
		try
		{
			return new IndexedParquetFile(new ParquetFileByteSource(parquetPath));
		}
		catch (MetadataException ex)
		{
			throw new MetadataException(parquetPath + ": " + ex.getMessage(), ex);
		}
	}
}
