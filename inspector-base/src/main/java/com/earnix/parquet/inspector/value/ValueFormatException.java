package com.earnix.parquet.inspector.value;

import com.earnix.parquet.inspector.ParquetInspectionException;

/**
 * Thrown when the payload of a scalar does not match its declared type
 */
public class ValueFormatException extends ParquetInspectionException
{
	public ValueFormatException(String message)
	{
		super(message);
	}
}
