package com.earnix.parquet.inspector.cli;

import com.earnix.parquet.inspector.cli.output.OutputFormat;
import com.earnix.parquet.inspector.cli.output.TableOutputConfig;
import com.earnix.parquet.inspector.cli.output.TableOutputWriter;
import picocli.CommandLine.Option;

/**
 * Output options of the commands that print rows
 */
public class OutputOptions
{
	@Option(names = { "-f", "--format" }, defaultValue = "table",
			description = "Output format, one of ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
	private OutputFormat format;

	@Option(names = "--max-width", defaultValue = "" + TableOutputConfig.DEFAULT_MAX_CELL_WIDTH,
			description = "Cells wider than this are truncated in table output (default: ${DEFAULT-VALUE})")
	private int maxCellWidth;

	@Option(names = "--no-header", description = "Do not print the header line of table or CSV output")
	private boolean noHeader;

	TableOutputConfig toConfig()
	{
		return TableOutputConfig.DEFAULT.withFormat(format).withMaxCellWidth(maxCellWidth).withHeader(!noHeader);
	}

	TableOutputWriter createWriter()
	{
		return new TableOutputWriter(toConfig());
	}
}
