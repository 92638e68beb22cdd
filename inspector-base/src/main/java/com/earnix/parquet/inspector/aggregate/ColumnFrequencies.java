package com.earnix.parquet.inspector.aggregate;

import java.util.Collections;
import java.util.List;

/**
 * The ranked distinct values of one leaf column
 */
public final class ColumnFrequencies
{
	private final String column;
	private final List<FrequencyEntry> entries;

	public ColumnFrequencies(String column, List<FrequencyEntry> entries)
	{
		this.column = column;
		this.entries = Collections.unmodifiableList(entries);
	}

	/**
	 * @return the dotted path of the column, as it is named in the schema
	 */
	public String getColumn()
	{
		return column;
	}

	/**
	 * @return the entries, by descending count
	 */
	public List<FrequencyEntry> getEntries()
	{
		return entries;
	}

	/**
	 * @return the number of occurrences counted, including nulls
	 */
	public long getTotal()
	{
		long total = 0;
		for (FrequencyEntry entry : entries)
			total += entry.getCount();
		return total;
	}

	@Override
	public String toString()
	{
		return column + "=" + entries;
	}
}
