package com.earnix.parquet.inspector.file.reader;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

public class ParquetFileByteSourceTest
{
	private Path tmpFolder;
	private Path file;

	@Before
	public void setUp() throws Exception
	{
		tmpFolder = Files.createTempDirectory("file_byte_source_test");
		file = Files.write(tmpFolder.resolve("digits"), "0123456789".getBytes(StandardCharsets.US_ASCII));
	}

	@After
	public void tearDown() throws Exception
	{
		FileUtils.forceDelete(tmpFolder.toFile());
	}

	@Test
	public void testReadRange() throws IOException
	{
		try (InputStream is = new ParquetFileByteSource(file).openRange(3, 4))
		{
			assertEquals("3456", IOUtils.toString(is, StandardCharsets.US_ASCII));
		}
		try (InputStream is = new ParquetFileByteSource(file).openRange(10, 0))
		{
			assertEquals(-1, is.read());
		}
	}

	@Test
	public void testRangePastEndOfFile()
	{
		IOException pastEnd = assertThrows(IOException.class,
				() -> new ParquetFileByteSource(file).openRange(8, 4));
		Assert.assertTrue(pastEnd.getMessage(), pastEnd.getMessage().contains("ends before end offset"));

		IOException startPastEnd = assertThrows(IOException.class,
				() -> new ParquetFileByteSource(file).openRange(11, 0));
		Assert.assertTrue(startPastEnd.getMessage(), startPastEnd.getMessage().contains("ends before startOffset"));
	}
}
