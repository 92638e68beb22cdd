package com.earnix.parquet.inspector.cli.output;

public enum OutputFormat
{
	/**
	 * aligned columns under a header line
	 */
	TABLE,
	/**
	 * one {@code name: value} line per field, rows separated by a blank line
	 */
	VERTICAL,
	/**
	 * comma separated values, cells are never truncated
	 */
	CSV
}
