package com.earnix.parquet.inspector.assembler;

import com.earnix.parquet.inspector.ParquetInspectionException;

/**
 * Thrown when the repetition and definition levels of a row group are inconsistent with the schema
 */
public class AssemblyException extends ParquetInspectionException
{
	private final int rowGroup;

	public AssemblyException(int rowGroup, String message)
	{
		super("Row group " + rowGroup + ": " + message);
		this.rowGroup = rowGroup;
	}

	/**
	 * @return the index of the row group that failed to assemble
	 */
	public int getRowGroup()
	{
		return rowGroup;
	}
}
