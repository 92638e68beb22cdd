package com.earnix.parquet.inspector.cli.output;

/**
 * How tabular command output is printed. Immutable, the {@code with} methods return a modified copy.
 */
public final class TableOutputConfig
{
	public static final int DEFAULT_MAX_CELL_WIDTH = 80;
	static final int MIN_CELL_WIDTH = 8;

	public static final TableOutputConfig DEFAULT = new TableOutputConfig(OutputFormat.TABLE, DEFAULT_MAX_CELL_WIDTH,
			true);

	private final OutputFormat format;
	private final int maxCellWidth;
	private final boolean header;

	private TableOutputConfig(OutputFormat format, int maxCellWidth, boolean header)
	{
		this.format = format;
		this.maxCellWidth = maxCellWidth;
		this.header = header;
	}

	public TableOutputConfig withFormat(OutputFormat format)
	{
		return new TableOutputConfig(format, maxCellWidth, header);
	}

	/**
	 * @param maxCellWidth the width beyond which table cells are truncated, at least 8
	 * @return the modified copy
	 */
	public TableOutputConfig withMaxCellWidth(int maxCellWidth)
	{
		if (maxCellWidth < MIN_CELL_WIDTH)
		{
			throw new IllegalArgumentException(
					"Maximum cell width must be at least " + MIN_CELL_WIDTH + ": " + maxCellWidth);
		}
		return new TableOutputConfig(format, maxCellWidth, header);
	}

	public TableOutputConfig withHeader(boolean header)
	{
		return new TableOutputConfig(format, maxCellWidth, header);
	}

	public OutputFormat getFormat()
	{
		return format;
	}

	public int getMaxCellWidth()
	{
		return maxCellWidth;
	}

	public boolean isHeader()
	{
		return header;
	}
}
