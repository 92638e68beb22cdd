package com.earnix.parquet.inspector.aggregate;

import org.apache.parquet.format.FileMetaData;
import org.apache.parquet.format.RowGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;

/**
 * Counts rows from footer metadata only, without decoding any column
 */
public class RowCounter
{
	private static final Logger LOG = LoggerFactory.getLogger(RowCounter.class);

	private RowCounter()
	{
	}

	/**
	 * @param fileMetaData the footer of a parquet file
	 * @return the sum of the row counts of the row groups
	 */
	public static long countRows(FileMetaData fileMetaData)
	{
		long rows = 0;
		if (fileMetaData.isSetRow_groups())
		{
			for (RowGroup rowGroup : fileMetaData.getRow_groups())
				rows += rowGroup.getNum_rows();
		}
		if (rows != fileMetaData.getNum_rows())
		{
			LOG.warn("Row groups hold {} rows but the footer declares {}, using the row group counts", rows,
					fileMetaData.getNum_rows());
		}
		return rows;
	}

	/**
	 * @param files the footers of several parquet files
	 * @return the total number of rows in all of the files
	 */
	public static long countRows(Collection<FileMetaData> files)
	{
		long rows = 0;
		for (FileMetaData file : files)
			rows += countRows(file);
		return rows;
	}
}
