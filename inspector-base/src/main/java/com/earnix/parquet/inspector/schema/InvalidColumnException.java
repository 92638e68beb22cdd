package com.earnix.parquet.inspector.schema;

import com.earnix.parquet.inspector.ParquetInspectionException;

/**
 * Thrown when a requested column does not exist, or is not a leaf where a leaf is required
 */
public class InvalidColumnException extends ParquetInspectionException
{
	private final String column;

	public InvalidColumnException(String column, String message)
	{
		super(message);
		this.column = column;
	}

	/**
	 * @return the column as requested by the caller
	 */
	public String getColumn()
	{
		return column;
	}
}
