package com.earnix.parquet.inspector.reader.chunk.internal;

import org.apache.commons.io.IOUtils;
import org.apache.commons.io.input.BoundedInputStream;
import org.apache.parquet.bytes.BytesInput;
import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.column.page.DataPage;
import org.apache.parquet.column.page.DataPageV1;
import org.apache.parquet.column.page.DataPageV2;
import org.apache.parquet.column.page.DictionaryPage;
import org.apache.parquet.format.CompressionCodec;
import org.apache.parquet.format.DataPageHeader;
import org.apache.parquet.format.DataPageHeaderV2;
import org.apache.parquet.format.DictionaryPageHeader;
import org.apache.parquet.format.PageHeader;
import org.apache.parquet.format.Util;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import static com.earnix.parquet.inspector.utils.FooterEnums.toColumnEncoding;

/**
 * Walks the pages of one column chunk and keeps their decompressed bytes in an {@link InMemChunk}. Index pages and
 * page types this reader does not know are skipped.
 * <p>Note that this class is *NOT* threadsafe</p>
 */
public class ColumnChunkPageDecoder
{
	private static final Logger LOG = LoggerFactory.getLogger(ColumnChunkPageDecoder.class);

	private static final byte[] EMPTY = new byte[0];

	private final ColumnDescriptor descriptor;
	private final PageDecompressor decompressor;
	private final BoundedInputStream in;

	private ColumnChunkPageDecoder(ColumnDescriptor descriptor, PageDecompressor decompressor, BoundedInputStream in)
	{
		this.descriptor = descriptor;
		this.decompressor = decompressor;
		this.in = in;
	}

	/**
	 * Decode every page of a column chunk
	 *
	 * @param descriptor the column of the chunk
	 * @param is         the stream positioned at the first page header. It is not closed.
	 * @param chunkLen   the number of bytes of the chunk, page headers included
	 * @param codec      the compression codec of the pages
	 * @return the decoded chunk
	 * @throws IOException on failure to read from the stream or to decompress a page
	 * @throws com.earnix.parquet.inspector.reader.MetadataException if the codec is not supported
	 */
	public static InMemChunk decode(ColumnDescriptor descriptor, InputStream is, long chunkLen, CompressionCodec codec)
			throws IOException
	{
		BoundedInputStream bounded = BoundedInputStream.builder().setInputStream(is).setMaxCount(chunkLen)
				.setPropagateClose(false).get();
		return new ColumnChunkPageDecoder(descriptor, PageDecompressor.forCodec(codec), bounded).readPages(chunkLen);
	}

	private InMemChunk readPages(long chunkLen) throws IOException
	{
		Supplier<DictionaryPage> dictionary = () -> null;
		List<Supplier<DataPage>> dataPages = new ArrayList<>();
		long totalValues = 0L;
		boolean firstPage = true;
		while (in.getCount() < chunkLen)
		{
			PageHeader header = Util.readPageHeader(in);
			if (header.isSetDictionary_page_header())
			{
				if (!firstPage)
					throw new IOException("Dictionary page only possible at beginning of column " + descriptor);
				dictionary = dictionaryPage(header);
			}
			else if (header.isSetData_page_header())
			{
				totalValues += header.getData_page_header().getNum_values();
				dataPages.add(dataPageV1(header));
			}
			else if (header.isSetData_page_header_v2())
			{
				totalValues += header.getData_page_header_v2().getNum_values();
				dataPages.add(dataPageV2(header));
			}
			else
			{
				LOG.debug("Skipping page of type {} in column {}", header.getType(), descriptor);
				IOUtils.skipFully(in, header.getCompressed_page_size());
			}
			firstPage = false;
		}
		LOG.debug("Read {} data pages with {} values for column {}", dataPages.size(), totalValues, descriptor);
		return new InMemChunk(descriptor, dictionary, dataPages, totalValues);
	}

	private Supplier<DictionaryPage> dictionaryPage(PageHeader header) throws IOException
	{
		DictionaryPageHeader dictionaryHeader = header.getDictionary_page_header();
		byte[] bytes = decompressor.decompress(readBytes(header.getCompressed_page_size()),
				header.getUncompressed_page_size());
		int numEntries = dictionaryHeader.getNum_values();
		org.apache.parquet.column.Encoding encoding = toColumnEncoding(dictionaryHeader.getEncoding());
		return () -> new DictionaryPage(wrap(bytes), numEntries, encoding);
	}

	/**
	 * Levels and values of a v1 page are compressed together
	 */
	private Supplier<DataPage> dataPageV1(PageHeader header) throws IOException
	{
		DataPageHeader pageHeader = header.getData_page_header();
		byte[] bytes = decompressor.decompress(readBytes(header.getCompressed_page_size()),
				header.getUncompressed_page_size());
		int numValues = pageHeader.getNum_values();
		org.apache.parquet.column.Encoding repetitionEncoding = toColumnEncoding(
				pageHeader.getRepetition_level_encoding());
		org.apache.parquet.column.Encoding definitionEncoding = toColumnEncoding(
				pageHeader.getDefinition_level_encoding());
		org.apache.parquet.column.Encoding valueEncoding = toColumnEncoding(pageHeader.getEncoding());
		return () -> new DataPageV1(wrap(bytes), numValues, bytes.length, null, repetitionEncoding,
				definitionEncoding, valueEncoding);
	}

	/**
	 * The levels of a v2 page are never compressed, and the values only when is_compressed is set or missing
	 */
	private Supplier<DataPage> dataPageV2(PageHeader header) throws IOException
	{
		DataPageHeaderV2 pageHeader = header.getData_page_header_v2();
		int repetitionLen = pageHeader.getRepetition_levels_byte_length();
		int definitionLen = pageHeader.getDefinition_levels_byte_length();
		byte[] repetitionLevels = readBytes(repetitionLen);
		byte[] definitionLevels = readBytes(definitionLen);

		int levelsLen = repetitionLen + definitionLen;
		byte[] stored = readBytes(header.getCompressed_page_size() - levelsLen);
		int valuesLen = header.getUncompressed_page_size() - levelsLen;
		boolean compressed = !pageHeader.isSetIs_compressed() || pageHeader.isIs_compressed();
		byte[] values = compressed ? decompressor.decompress(stored, valuesLen) : checkLength(stored, valuesLen);

		int numRows = pageHeader.getNum_rows();
		int numNulls = pageHeader.getNum_nulls();
		int numValues = pageHeader.getNum_values();
		org.apache.parquet.column.Encoding valueEncoding = toColumnEncoding(pageHeader.getEncoding());
		return () -> DataPageV2.uncompressed(numRows, numNulls, numValues, wrap(repetitionLevels),
				wrap(definitionLevels), valueEncoding, wrap(values), null);
	}

	private byte[] readBytes(int len) throws IOException
	{
		if (len == 0)
			return EMPTY;
		byte[] bytes = new byte[len];
		IOUtils.readFully(in, bytes);
		return bytes;
	}

	static byte[] checkLength(byte[] bytes, int expectedLen) throws IOException
	{
		if (bytes.length != expectedLen)
			throw new IOException("Page decompressed to " + bytes.length + " bytes, expected " + expectedLen);
		return bytes;
	}

	private static BytesInput wrap(byte[] bytes)
	{
		return bytes.length == 0 ? BytesInput.empty() : BytesInput.from(bytes);
	}
}
