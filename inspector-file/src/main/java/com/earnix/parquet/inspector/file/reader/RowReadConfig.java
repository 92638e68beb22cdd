package com.earnix.parquet.inspector.file.reader;

import java.util.Collections;
import java.util.List;

/**
 * Which rows and columns to read. Immutable, the {@code with} methods return a modified copy.
 */
public final class RowReadConfig
{
	public static final long NO_LIMIT = Long.MAX_VALUE;

	private static final RowReadConfig ALL = new RowReadConfig(Collections.emptyList(), NO_LIMIT);

	private final List<String> columns;
	private final long limit;

	private RowReadConfig(List<String> columns, long limit)
	{
		this.columns = columns;
		this.limit = limit;
	}

	/**
	 * @return a config reading every column of every row
	 */
	public static RowReadConfig allRows()
	{
		return ALL;
	}

	/**
	 * @param columns top level field names, matched ignoring case. An empty list reads all columns.
	 * @return a copy reading only these columns
	 */
	public RowReadConfig withColumns(List<String> columns)
	{
		return new RowReadConfig(List.copyOf(columns), limit);
	}

	/**
	 * @param limit the maximum number of rows to read
	 * @return a copy reading at most limit rows
	 */
	public RowReadConfig withLimit(long limit)
	{
		if (limit < 0)
			throw new IllegalArgumentException("Row limit must not be negative: " + limit);
		return new RowReadConfig(columns, limit);
	}

	public List<String> getColumns()
	{
		return columns;
	}

	public long getLimit()
	{
		return limit;
	}

	@Override
	public String toString()
	{
		return "RowReadConfig{columns=" + columns + ", limit=" + (limit == NO_LIMIT ? "none" : limit) + '}';
	}
}
