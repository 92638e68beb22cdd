package com.earnix.parquet.inspector.reader;

import com.earnix.parquet.inspector.ParquetInspectionException;

/**
 * Thrown when the footer metadata of a parquet file cannot be read, or describes a malformed schema.
 */
public class MetadataException extends ParquetInspectionException
{
	public MetadataException(String message)
	{
		super(message);
	}

	public MetadataException(String message, Throwable cause)
	{
		super(message, cause);
	}
}
