package com.earnix.parquet.inspector;

/**
 * Base class of the errors raised while inspecting a parquet file. All of them are fatal for the current command;
 * the data is static, so nothing is retried.
 */
public class ParquetInspectionException extends RuntimeException
{
	public ParquetInspectionException(String message)
	{
		super(message);
	}

	public ParquetInspectionException(String message, Throwable cause)
	{
		super(message, cause);
	}
}
