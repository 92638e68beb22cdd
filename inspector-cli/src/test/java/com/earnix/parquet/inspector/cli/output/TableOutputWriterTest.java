package com.earnix.parquet.inspector.cli.output;

import org.junit.Assert;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

public class TableOutputWriterTest
{
	@Test
	public void testFitCell()
	{
		assertEquals("1234...", TableOutputWriter.fit("123456789", 7));
		assertEquals("1234567", TableOutputWriter.fit("1234567", 7));
		assertEquals("1234", TableOutputWriter.fit("1234", 7));

		assertEquals("\"12345...\"", TableOutputWriter.fit("\"123456789\"", 10));
		assertEquals("\"12345678\"", TableOutputWriter.fit("\"12345678\"", 10));
		assertEquals("\"\"", TableOutputWriter.fit("\"\"", 10));
	}

	@Test
	public void testTable()
	{
		TableOutputWriter writer = new TableOutputWriter(TableOutputConfig.DEFAULT);
		String actual = writer.render(List.of("c1", "c2"),
				List.of(List.of("r1 - 1", "r1 - 2"), List.of("r2 - 1", "r2 - 2")));
		assertEquals("c1      c2\nr1 - 1  r1 - 2\nr2 - 1  r2 - 2\n", actual);

		assertEquals("c\n1\n2\n", writer.render(List.of("c"), List.of(List.of("1"), List.of("2"))));
		assertEquals("c\n", writer.render(List.of("c"), List.of()));
	}

	@Test
	public void testLongCellsAreTruncated()
	{
		TableOutputWriter writer = new TableOutputWriter(TableOutputConfig.DEFAULT.withMaxCellWidth(8));
		String actual = writer.render(List.of("id", "text"),
				List.of(List.of("abcdefghijkl", "\"a long quoted value\""), List.of("x", "\"short\"")));
		String expected = String.format("%-8s  %s\n", "id", "text")
				+ String.format("%-8s  %s\n", "abcde...", "\"a l...\"")
				+ String.format("%-8s  %s\n", "x", "\"short\"");
		assertEquals(expected, actual);
	}

	@Test
	public void testWithoutHeader()
	{
		TableOutputWriter writer = new TableOutputWriter(TableOutputConfig.DEFAULT.withHeader(false));
		assertEquals("1   a\n22  b\n",
				writer.render(List.of("long header", "h"), List.of(List.of("1", "a"), List.of("22", "b"))));
	}

	@Test
	public void testVertical()
	{
		TableOutputWriter writer = new TableOutputWriter(TableOutputConfig.DEFAULT.withFormat(OutputFormat.VERTICAL));
		assertEquals("a: 1\nb: \"x\"\n\na: 3\nb: null\n",
				writer.render(List.of("a", "b"), List.of(List.of("1", "\"x\""), List.of("3", "null"))));
		assertEquals("", writer.render(List.of("a"), List.of()));
	}

	@Test
	public void testCsv()
	{
		TableOutputWriter writer = new TableOutputWriter(
				TableOutputConfig.DEFAULT.withFormat(OutputFormat.CSV).withMaxCellWidth(8));
		List<List<String>> rows = List.of(List.of("name", "\"Alyssa, Jr\"", "1"),
				List.of("id", "a value longer than the width", "12"));
		assertEquals("FIELD,VALUE,COUNT\nname,\"\"\"Alyssa, Jr\"\"\",1\nid,a value longer than the width,12\n",
				writer.render(List.of("FIELD", "VALUE", "COUNT"), rows));

		TableOutputWriter noHeader = new TableOutputWriter(
				TableOutputConfig.DEFAULT.withFormat(OutputFormat.CSV).withHeader(false));
		assertEquals("1,2\n", noHeader.render(List.of("a", "b"), List.of(List.of("1", "2"))));
		assertEquals("", noHeader.render(List.of("a", "b"), List.of()));
	}

	@Test
	public void testInvalidInput()
	{
		TableOutputWriter writer = new TableOutputWriter(TableOutputConfig.DEFAULT);
		IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
				() -> writer.render(List.of("a", "b"), List.of(List.of("1"))));
		Assert.assertEquals("Row has 1 cells but there are 2 columns", ex.getMessage());

		assertThrows(IllegalArgumentException.class, () -> TableOutputConfig.DEFAULT.withMaxCellWidth(3));
	}
}
