package com.earnix.parquet.inspector.cli.output;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Renders rows of text cells as a table, vertically or as CSV, per {@link TableOutputConfig}.
 * <p>
 * In a table every column is as wide as its widest cell, up to the maximum cell width. Longer cells are cut and end
 * with {@code ...}, quoted text keeps its closing quote. Columns are separated by two spaces, the last column is not
 * padded.
 * </p>
 */
public class TableOutputWriter
{
	private static final String COLUMN_SEPARATOR = "  ";
	private static final CSVFormat CSV_FORMAT = CSVFormat.DEFAULT.builder().setRecordSeparator('\n').build();

	private final TableOutputConfig config;

	public TableOutputWriter(TableOutputConfig config)
	{
		this.config = config;
	}

	/**
	 * @param headers the column names
	 * @param rows    the cells of every row, one per column
	 * @return the rendered text, every line ending with a new line
	 * @throws IllegalArgumentException if a row does not have one cell per column
	 */
	public String render(List<String> headers, List<List<String>> rows)
	{
		for (List<String> row : rows)
		{
			if (row.size() != headers.size())
			{
				throw new IllegalArgumentException(
						"Row has " + row.size() + " cells but there are " + headers.size() + " columns");
			}
		}
		StringBuilder sb = new StringBuilder();
		switch (config.getFormat())
		{
			case VERTICAL:
				renderVertical(headers, rows, sb);
				break;
			case CSV:
				renderCsv(headers, rows, sb);
				break;
			default:
				renderTable(headers, rows, sb);
		}
		return sb.toString();
	}

	private void renderTable(List<String> headers, List<List<String>> rows, StringBuilder sb)
	{
		int[] widths = new int[headers.size()];
		if (config.isHeader())
			updateWidths(headers, widths);
		for (List<String> row : rows)
			updateWidths(row, widths);

		if (config.isHeader())
			renderLine(headers, widths, sb);
		for (List<String> row : rows)
			renderLine(row, widths, sb);
	}

	private void updateWidths(List<String> cells, int[] widths)
	{
		for (int i = 0; i < widths.length; i++)
			widths[i] = Math.max(widths[i], Math.min(cells.get(i).length(), config.getMaxCellWidth()));
	}

	private static void renderLine(List<String> cells, int[] widths, StringBuilder sb)
	{
		for (int i = 0; i < widths.length; i++)
		{
			String cell = fit(cells.get(i), widths[i]);
			if (i == widths.length - 1)
			{
				sb.append(cell);
			}
			else
			{
				sb.append(StringUtils.rightPad(cell, widths[i])).append(COLUMN_SEPARATOR);
			}
		}
		sb.append('\n');
	}

	/**
	 * @param cell  the cell text
	 * @param width the column width
	 * @return the cell, truncated to the width if longer
	 */
	static String fit(String cell, int width)
	{
		if (cell.length() <= width)
			return cell;
		if (cell.startsWith("\"") && cell.endsWith("\""))
			return StringUtils.abbreviate(cell, width - 1) + '"';
		return StringUtils.abbreviate(cell, width);
	}

	private static void renderVertical(List<String> headers, List<List<String>> rows, StringBuilder sb)
	{
		for (int r = 0; r < rows.size(); r++)
		{
			if (r > 0)
				sb.append('\n');
			List<String> row = rows.get(r);
			for (int i = 0; i < headers.size(); i++)
				sb.append(headers.get(i)).append(": ").append(row.get(i)).append('\n');
		}
	}

	private void renderCsv(List<String> headers, List<List<String>> rows, StringBuilder sb)
	{
		try (CSVPrinter printer = new CSVPrinter(sb, CSV_FORMAT))
		{
			if (config.isHeader())
				printer.printRecord(headers);
			for (List<String> row : rows)
				printer.printRecord(row);
		}
		catch (IOException ex)
		{
			throw new UncheckedIOException("Failed to render CSV", ex);
		}
	}
}
