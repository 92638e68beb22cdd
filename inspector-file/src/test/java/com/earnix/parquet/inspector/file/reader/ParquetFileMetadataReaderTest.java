package com.earnix.parquet.inspector.file.reader;

import com.earnix.parquet.inspector.reader.MetadataException;
import com.earnix.parquet.inspector.reader.ParquetFileIndex;
import com.earnix.parquet.inspector.testing.ParquetFileForTesting;
import org.apache.commons.io.FileUtils;
import org.apache.parquet.format.FileMetaData;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

public class ParquetFileMetadataReaderTest
{
	private Path tmpFolder;

	@Before
	public void setUp() throws Exception
	{
		tmpFolder = Files.createTempDirectory("parquet_footer_test");
	}

	@After
	public void tearDown() throws Exception
	{
		FileUtils.forceDelete(tmpFolder.toFile());
	}

	@Test
	public void testReadFooter() throws Exception
	{
		Path file = ParquetFileForTesting.alyssaAndBen().writeTo(tmpFolder.resolve("users.parquet"));

		FileMetaData md = ParquetFileMetadataReader.readFileMetadata(file);
		assertEquals(2, md.getNum_rows());
		assertEquals(1, md.getRow_groupsSize());

		ParquetFileIndex reader = ParquetFileReaderFactory.open(file);
		assertEquals(file.toString(), reader.describe());
		assertEquals(3, reader.getSchema().getLeaves().size());
	}

	@Test
	public void testFileSmallerThanFooter() throws Exception
	{
		Path file = Files.write(tmpFolder.resolve("tiny.parquet"), new byte[] { 'P', 'A', 'R', '1', 0 });
		MetadataException ex = assertThrows(MetadataException.class,
				() -> ParquetFileMetadataReader.readFileMetadata(file));
		assertEquals("Invalid Parquet file. Size is smaller than footer", ex.getMessage());
	}

	@Test
	public void testMagicAtBothEnds() throws Exception
	{
		byte[] bytes = ParquetFileForTesting.alyssaAndBen().toBytes();

		byte[] badStart = bytes.clone();
		badStart[0] = 'X';
		Path startFile = Files.write(tmpFolder.resolve("start.parquet"), badStart);
		MetadataException start = assertThrows(MetadataException.class,
				() -> ParquetFileMetadataReader.readFileMetadata(startFile));
		assertEquals("Invalid Parquet file. Magic bytes not found at the start of the file", start.getMessage());

		byte[] badEnd = bytes.clone();
		badEnd[badEnd.length - 1] = 'X';
		Path endFile = Files.write(tmpFolder.resolve("end.parquet"), badEnd);
		MetadataException end = assertThrows(MetadataException.class,
				() -> ParquetFileMetadataReader.readFileMetadata(endFile));
		assertEquals("Invalid Parquet file. Magic bytes not found at the end of the file", end.getMessage());
	}

	@Test
	public void testReaderErrorsNameTheFile() throws Exception
	{
		Path file = Files.write(tmpFolder.resolve("text.parquet"), "just some text, not parquet".getBytes());
		MetadataException ex = assertThrows(MetadataException.class,
				() -> ParquetFileReaderFactory.open(file));
		Assert.assertTrue(ex.getMessage(), ex.getMessage().startsWith(file + ": Invalid Parquet file."));
	}

	@Test
	public void testMissingFile()
	{
		assertThrows(NoSuchFileException.class,
				() -> ParquetFileMetadataReader.readFileMetadata(tmpFolder.resolve("missing.parquet")));
	}
}
