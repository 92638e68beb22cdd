package com.earnix.parquet.inspector.aggregate;

import java.util.Objects;

/**
 * A distinct formatted value of a column and the number of its occurrences
 */
public final class FrequencyEntry
{
	private final String value;
	private final long count;

	public FrequencyEntry(String value, long count)
	{
		this.value = value;
		this.count = count;
	}

	/**
	 * @return the value, as rendered by the value formatter
	 */
	public String getValue()
	{
		return value;
	}

	public long getCount()
	{
		return count;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (!(o instanceof FrequencyEntry))
			return false;
		FrequencyEntry that = (FrequencyEntry) o;
		return count == that.count && value.equals(that.value);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(value, count);
	}

	@Override
	public String toString()
	{
		return "(" + value + ", " + count + ")";
	}
}
