package com.earnix.parquet.inspector.aggregate;

import com.earnix.parquet.inspector.ParquetInspectionException;

/**
 * Thrown when a sample of a negative number of rows is requested
 */
public class InvalidSampleSizeException extends ParquetInspectionException
{
	private final long sampleSize;

	public InvalidSampleSizeException(long sampleSize)
	{
		super("Sample size must not be negative: " + sampleSize);
		this.sampleSize = sampleSize;
	}

	public long getSampleSize()
	{
		return sampleSize;
	}
}
