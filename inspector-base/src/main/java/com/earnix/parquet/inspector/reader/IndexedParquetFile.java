package com.earnix.parquet.inspector.reader;

import com.earnix.parquet.inspector.reader.chunk.internal.ColumnChunkPageDecoder;
import com.earnix.parquet.inspector.reader.chunk.internal.InMemChunk;
import com.earnix.parquet.inspector.schema.GroupNode;
import com.earnix.parquet.inspector.schema.SchemaNodes;
import com.earnix.parquet.inspector.utils.ParquetMagic;
import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.format.ColumnChunk;
import org.apache.parquet.format.ColumnMetaData;
import org.apache.parquet.format.FileMetaData;
import org.apache.parquet.format.RowGroup;
import org.apache.parquet.schema.MessageType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A {@link ParquetFileIndex} over any {@link ParquetByteSource}. The footer is decoded and validated on construction:
 * every non empty row group must hold exactly one chunk for each leaf column.
 */
public class IndexedParquetFile implements ParquetFileIndex
{
	private static final Logger LOG = LoggerFactory.getLogger(IndexedParquetFile.class);

	private final ParquetByteSource source;
	private final FileMetaData fileMetaData;
	private final MessageType messageType;
	private final GroupNode schema;
	private final List<Map<ColumnDescriptor, ColumnMetaData>> chunksByRowGroup;

	/**
	 * @param source the bytes of the file
	 * @throws IOException       on failure to read the footer
	 * @throws MetadataException if the footer is not valid
	 */
	public IndexedParquetFile(ParquetByteSource source) throws IOException
	{
		this.source = source;
		this.fileMetaData = source.readFooter();
		this.messageType = ParquetMetadataUtils.buildMessageType(fileMetaData);
		this.schema = SchemaNodes.fromMessageType(messageType);

		List<RowGroup> rowGroups = fileMetaData.isSetRow_groups() ? fileMetaData.getRow_groups() :
				Collections.emptyList();
		chunksByRowGroup = new ArrayList<>(rowGroups.size());
		for (int i = 0; i < rowGroups.size(); i++)
			chunksByRowGroup.add(indexRowGroup(i, rowGroups.get(i)));
		LOG.debug("Indexed {}: {} row groups, {} columns", source.describe(), rowGroups.size(),
				messageType.getColumns().size());
	}

	private Map<ColumnDescriptor, ColumnMetaData> indexRowGroup(int rowGroupIdx, RowGroup rowGroup)
	{
		// nothing is ever read from an empty row group, so its chunks are not checked
		if (rowGroup.getNum_rows() == 0)
			return Collections.emptyMap();

		Map<ColumnDescriptor, ColumnMetaData> chunks = new HashMap<>();
		for (ColumnChunk columnChunk : rowGroup.getColumns())
		{
			if (!columnChunk.isSetMeta_data())
				throw new MetadataException("Column chunk without metadata in row group " + rowGroupIdx);
			ColumnMetaData chunkMetaData = columnChunk.getMeta_data();
			ColumnDescriptor descriptor = lookupDescriptor(chunkMetaData.getPath_in_schema());
			if (chunks.put(descriptor, chunkMetaData) != null)
			{
				throw new MetadataException(
						"Column " + dotted(descriptor) + " present twice in row group " + rowGroupIdx);
			}
		}
		for (ColumnDescriptor descriptor : messageType.getColumns())
		{
			if (!chunks.containsKey(descriptor))
				throw new MetadataException("Column " + dotted(descriptor) + " missing from row group " + rowGroupIdx);
		}
		return chunks;
	}

	private ColumnDescriptor lookupDescriptor(List<String> path)
	{
		String[] pathArr = path.toArray(new String[0]);
		if (!messageType.containsPath(pathArr) || !messageType.getType(pathArr).isPrimitive())
			throw new MetadataException("Column chunk for unknown column " + String.join(".", path));
		return messageType.getColumnDescription(pathArr);
	}

	private static String dotted(ColumnDescriptor descriptor)
	{
		return String.join(".", descriptor.getPath());
	}

	/**
	 * The chunk starts at its dictionary page when it has a usable one, matching ParquetMetadataConverter.getOffset()
	 * of parquet-hadoop.
	 */
	static long chunkStartOffset(ColumnMetaData chunkMetaData)
	{
		long start = chunkMetaData.getData_page_offset();
		if (chunkMetaData.isSetDictionary_page_offset())
		{
			long dictionaryOffset = chunkMetaData.getDictionary_page_offset();
			if (dictionaryOffset > 0L && dictionaryOffset < start)
				start = dictionaryOffset;
		}
		if (start < ParquetMagic.MAGIC_LEN)
			throw new MetadataException("Corrupted chunk metadata invalid startOffset: " + start);
		return start;
	}

	@Override
	public InMemChunk readColumnChunk(int rowGroup, ColumnDescriptor descriptor) throws IOException
	{
		if (rowGroup < 0 || rowGroup >= chunksByRowGroup.size())
		{
			throw new IllegalArgumentException(
					"Tried to read row group " + rowGroup + " but there are only " + chunksByRowGroup.size()
							+ " row groups.");
		}
		ColumnMetaData chunkMetaData = chunksByRowGroup.get(rowGroup)
				.get(Objects.requireNonNull(descriptor, "descriptor must not be null"));
		if (chunkMetaData == null)
			throw new IllegalArgumentException("Row group " + rowGroup + " has no chunk for " + dotted(descriptor));

		long chunkLen = chunkMetaData.getTotal_compressed_size();
		try (InputStream is = source.openRange(chunkStartOffset(chunkMetaData), chunkLen))
		{
			return ColumnChunkPageDecoder.decode(descriptor, is, chunkLen, chunkMetaData.getCodec());
		}
	}

	@Override
	public int getNumRowGroups()
	{
		return chunksByRowGroup.size();
	}

	@Override
	public long getNumRowsInRowGroup(int rowGroup)
	{
		return fileMetaData.getRow_groups().get(rowGroup).getNum_rows();
	}

	@Override
	public long getTotalNumRows()
	{
		return fileMetaData.getNum_rows();
	}

	@Override
	public MessageType getMessageType()
	{
		return messageType;
	}

	@Override
	public GroupNode getSchema()
	{
		return schema;
	}

	@Override
	public FileMetaData getFileMetaData()
	{
		return fileMetaData;
	}

	@Override
	public String describe()
	{
		return source.describe();
	}
}
