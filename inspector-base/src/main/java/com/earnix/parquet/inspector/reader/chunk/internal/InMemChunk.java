package com.earnix.parquet.inspector.reader.chunk.internal;

import com.earnix.parquet.inspector.assembler.TripleCursor;
import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.column.page.DataPage;
import org.apache.parquet.column.page.DictionaryPage;
import org.apache.parquet.column.page.PageReader;

import java.util.Iterator;
import java.util.List;
import java.util.function.Supplier;

/**
 * The decompressed pages of one column chunk. Pages are kept as suppliers because a {@link DataPage} wraps a
 * BytesInput, which is not guaranteed to be readable more than once. The chunk can therefore be walked any number of
 * times.
 */
public class InMemChunk
{
	private final ColumnDescriptor descriptor;
	private final Supplier<DictionaryPage> dictionaryPage;
	private final List<Supplier<DataPage>> dataPages;
	private final long totalValues;

	InMemChunk(ColumnDescriptor descriptor, Supplier<DictionaryPage> dictionaryPage,
			List<Supplier<DataPage>> dataPages, long totalValues)
	{
		this.descriptor = descriptor;
		this.dictionaryPage = dictionaryPage;
		this.dataPages = List.copyOf(dataPages);
		this.totalValues = totalValues;
	}

	public ColumnDescriptor getDescriptor()
	{
		return descriptor;
	}

	/**
	 * @return the number of triples, nulls and empty lists included, over all of the data pages
	 */
	public long getTotalValues()
	{
		return totalValues;
	}

	public int getNumDataPages()
	{
		return dataPages.size();
	}

	/**
	 * Open a cursor positioned on the first triple of the chunk
	 *
	 * @return the cursor
	 * @throws IllegalStateException if the chunk holds no triples
	 */
	public TripleCursor openCursor()
	{
		if (totalValues <= 0)
			throw new IllegalStateException("Chunk of " + descriptor + " has no values");
		return new ColumnChunkCursor(this);
	}

	PageReader newPageReader()
	{
		return new ReplayPageReader(dictionaryPage.get(), dataPages.iterator(), totalValues);
	}

	/**
	 * Hands the stored pages to a column reader, one materialized page at a time
	 */
	private static class ReplayPageReader implements PageReader
	{
		private final DictionaryPage dictionary;
		private final Iterator<Supplier<DataPage>> remaining;
		private final long totalValues;

		ReplayPageReader(DictionaryPage dictionary, Iterator<Supplier<DataPage>> remaining, long totalValues)
		{
			this.dictionary = dictionary;
			this.remaining = remaining;
			this.totalValues = totalValues;
		}

		@Override
		public DictionaryPage readDictionaryPage()
		{
			return dictionary;
		}

		@Override
		public long getTotalValueCount()
		{
			return totalValues;
		}

		@Override
		public DataPage readPage()
		{
			return remaining.hasNext() ? remaining.next().get() : null;
		}
	}
}
