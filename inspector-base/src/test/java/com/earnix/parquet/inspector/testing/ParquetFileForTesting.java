package com.earnix.parquet.inspector.testing;

import com.earnix.parquet.inspector.utils.ParquetMagic;
import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.column.ColumnWriteStore;
import org.apache.parquet.column.ParquetProperties;
import org.apache.parquet.column.impl.ColumnWriteStoreV1;
import org.apache.parquet.column.impl.ColumnWriteStoreV2;
import org.apache.parquet.column.page.PageWriteStore;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.example.data.GroupWriter;
import org.apache.parquet.example.data.simple.SimpleGroupFactory;
import org.apache.parquet.format.ColumnChunk;
import org.apache.parquet.format.ColumnMetaData;
import org.apache.parquet.format.CompressionCodec;
import org.apache.parquet.format.FileMetaData;
import org.apache.parquet.format.Float16Type;
import org.apache.parquet.format.LogicalType;
import org.apache.parquet.format.MicroSeconds;
import org.apache.parquet.format.MilliSeconds;
import org.apache.parquet.format.NanoSeconds;
import org.apache.parquet.format.RowGroup;
import org.apache.parquet.format.SchemaElement;
import org.apache.parquet.format.TimeUnit;
import org.apache.parquet.format.TimestampType;
import org.apache.parquet.format.UUIDType;
import org.apache.parquet.format.Util;
import org.apache.parquet.io.ColumnIOFactory;
import org.apache.parquet.io.MessageColumnIO;
import org.apache.parquet.schema.GroupType;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.MessageTypeParser;
import org.apache.parquet.schema.OriginalType;
import org.apache.parquet.schema.PrimitiveType;
import org.apache.parquet.schema.Type;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Builds small parquet files for tests. Rows are built with the example {@link Group} model of parquet-column and
 * shredded into column chunks by its column write stores.
 */
public class ParquetFileForTesting
{
	private final MessageType schema;
	private final SimpleGroupFactory groupFactory;
	private final List<List<Group>> rowGroups = new ArrayList<>();
	private CompressionCodec codec = CompressionCodec.UNCOMPRESSED;
	private boolean dictionary = false;
	private boolean pageV2 = false;
	private Consumer<FileMetaData> footerEditor = md -> {
	};

	public ParquetFileForTesting(MessageType schema)
	{
		this.schema = schema;
		this.groupFactory = new SimpleGroupFactory(schema);
	}

	/**
	 * @param schema the schema in the parquet text format, such as {@code message m { required int32 a; }}
	 * @return a new file builder
	 */
	public static ParquetFileForTesting forSchema(String schema)
	{
		return new ParquetFileForTesting(MessageTypeParser.parseMessageType(schema));
	}

	/**
	 * The file of the example in the Dremel paper style used throughout the tests: two rows, a null, an empty list
	 *
	 * @return the file builder
	 */
	public static ParquetFileForTesting alyssaAndBen()
	{
		ParquetFileForTesting file = forSchema(
				"message user { required binary name (UTF8); optional binary favorite_color (UTF8); "
						+ "required group favorite_numbers (LIST) { repeated int32 array; } }");
		Group alyssa = file.newRow().append("name", "Alyssa");
		Group numbers = alyssa.addGroup("favorite_numbers");
		for (int n : new int[] { 3, 9, 15, 20 })
			numbers.append("array", n);
		Group ben = file.newRow().append("name", "Ben").append("favorite_color", "red");
		ben.addGroup("favorite_numbers");
		return file.rowGroup(alyssa, ben);
	}

	public MessageType getSchema()
	{
		return schema;
	}

	public Group newRow()
	{
		return groupFactory.newGroup();
	}

	public ParquetFileForTesting rowGroup(Group... rows)
	{
		rowGroups.add(Arrays.asList(rows));
		return this;
	}

	public ParquetFileForTesting rowGroup(List<Group> rows)
	{
		rowGroups.add(new ArrayList<>(rows));
		return this;
	}

	public ParquetFileForTesting codec(CompressionCodec codec)
	{
		this.codec = codec;
		return this;
	}

	public ParquetFileForTesting dictionary(boolean dictionary)
	{
		this.dictionary = dictionary;
		return this;
	}

	public ParquetFileForTesting pageV2(boolean pageV2)
	{
		this.pageV2 = pageV2;
		return this;
	}

	/**
	 * @param footerEditor called on the footer before it is serialized, to build corrupt files
	 * @return this builder
	 */
	public ParquetFileForTesting editFooter(Consumer<FileMetaData> footerEditor)
	{
		this.footerEditor = footerEditor;
		return this;
	}

	/**
	 * Write the file
	 *
	 * @param file the path of the file to create
	 * @return the path
	 * @throws IOException on failure to write the file
	 */
	public Path writeTo(Path file) throws IOException
	{
		Files.write(file, toBytes());
		return file;
	}

	/**
	 * @return the bytes of the parquet file
	 */
	public byte[] toBytes()
	{
		try
		{
			ByteArrayOutputStream out = new ByteArrayOutputStream();
			out.write(ParquetMagic.magic());

			List<RowGroup> footerRowGroups = new ArrayList<>();
			long totalRows = 0;
			for (List<Group> rows : rowGroups)
			{
				footerRowGroups.add(writeRowGroup(rows, out));
				totalRows += rows.size();
			}

			FileMetaData fileMetaData = new FileMetaData(1, schemaElements(), totalRows, footerRowGroups);
			fileMetaData.setCreated_by("parquet-inspector tests");
			footerEditor.accept(fileMetaData);

			ByteArrayOutputStream footer = new ByteArrayOutputStream();
			Util.writeFileMetaData(fileMetaData, footer);
			footer.writeTo(out);
			out.write(ParquetMagic.trailer(footer.size()));
			return out.toByteArray();
		}
		catch (IOException ex)
		{
			throw new UncheckedIOException(ex);
		}
	}

	private RowGroup writeRowGroup(List<Group> rows, ByteArrayOutputStream out)
	{
		Map<ColumnDescriptor, SerializingPageWriter> pageWriters = new HashMap<>();
		PageWriteStore pageWriteStore = descriptor -> pageWriters.computeIfAbsent(descriptor,
				d -> new SerializingPageWriter(codec));
		if (!rows.isEmpty())
		{
			ParquetProperties properties = ParquetProperties.builder().withDictionaryEncoding(dictionary)
					.withWriterVersion(pageV2 ?
							ParquetProperties.WriterVersion.PARQUET_2_0 :
							ParquetProperties.WriterVersion.PARQUET_1_0).build();
			ColumnWriteStore writeStore = pageV2 ?
					new ColumnWriteStoreV2(schema, pageWriteStore, properties) :
					new ColumnWriteStoreV1(schema, pageWriteStore, properties);
			MessageColumnIO columnIO = new ColumnIOFactory().getColumnIO(schema);
			GroupWriter groupWriter = new GroupWriter(columnIO.getRecordWriter(writeStore), schema);
			for (Group row : rows)
				groupWriter.write(row);
			writeStore.flush();
			writeStore.close();
		}

		List<ColumnChunk> chunks = new ArrayList<>();
		long totalUncompressed = 0;
		for (ColumnDescriptor descriptor : schema.getColumns())
		{
			SerializingPageWriter pages = pageWriters.computeIfAbsent(descriptor,
					d -> new SerializingPageWriter(codec));
			long chunkStart = out.size();
			byte[] dictionaryBytes = pages.getDictionaryBytes();
			byte[] dataBytes = pages.getDataBytes();
			out.write(dictionaryBytes, 0, dictionaryBytes.length);
			out.write(dataBytes, 0, dataBytes.length);

			ColumnMetaData metaData = new ColumnMetaData(
					FooterWriteEnums.toFooterType(descriptor.getPrimitiveType().getPrimitiveTypeName()),
					new ArrayList<>(pages.getEncodings()), Arrays.asList(descriptor.getPath()), codec,
					pages.getTotalValueCount(), pages.getUncompressedSize(),
					dictionaryBytes.length + dataBytes.length, chunkStart + dictionaryBytes.length);
			if (pages.hasDictionary())
				metaData.setDictionary_page_offset(chunkStart);
			ColumnChunk chunk = new ColumnChunk(chunkStart);
			chunk.setMeta_data(metaData);
			chunks.add(chunk);
			totalUncompressed += pages.getUncompressedSize();
		}
		return new RowGroup(chunks, totalUncompressed, rows.size());
	}

	private List<SchemaElement> schemaElements()
	{
		List<SchemaElement> elements = new ArrayList<>();
		SchemaElement root = new SchemaElement(schema.getName());
		root.setNum_children(schema.getFieldCount());
		elements.add(root);
		for (Type field : schema.getFields())
			addSchemaElements(field, elements);
		return elements;
	}

	private static void addSchemaElements(Type type, List<SchemaElement> elements)
	{
		SchemaElement element = new SchemaElement(type.getName());
		element.setRepetition_type(FooterWriteEnums.toFooterRepetition(type.getRepetition()));
		LogicalTypeAnnotation annotation = type.getLogicalTypeAnnotation();
		if (annotation != null)
			annotate(element, annotation);
		elements.add(element);

		if (type.isPrimitive())
		{
			PrimitiveType primitive = type.asPrimitiveType();
			element.setType(FooterWriteEnums.toFooterType(primitive.getPrimitiveTypeName()));
			if (primitive.getPrimitiveTypeName() == PrimitiveType.PrimitiveTypeName.FIXED_LEN_BYTE_ARRAY)
				element.setType_length(primitive.getTypeLength());
		}
		else
		{
			GroupType group = type.asGroupType();
			element.setNum_children(group.getFieldCount());
			for (Type child : group.getFields())
				addSchemaElements(child, elements);
		}
	}

	private static void annotate(SchemaElement element, LogicalTypeAnnotation annotation)
	{
		OriginalType originalType = annotation.toOriginalType();
		if (originalType != null)
			element.setConverted_type(FooterWriteEnums.toConvertedType(originalType));
		if (annotation instanceof LogicalTypeAnnotation.DecimalLogicalTypeAnnotation)
		{
			LogicalTypeAnnotation.DecimalLogicalTypeAnnotation decimal =
					(LogicalTypeAnnotation.DecimalLogicalTypeAnnotation) annotation;
			element.setScale(decimal.getScale());
			element.setPrecision(decimal.getPrecision());
		}

		// annotations without an exact legacy converted type also get the logical type
		if (annotation instanceof LogicalTypeAnnotation.UUIDLogicalTypeAnnotation)
		{
			element.setLogicalType(LogicalType.UUID(new UUIDType()));
		}
		else if (annotation instanceof LogicalTypeAnnotation.Float16LogicalTypeAnnotation)
		{
			element.setLogicalType(LogicalType.FLOAT16(new Float16Type()));
		}
		else if (annotation instanceof LogicalTypeAnnotation.TimestampLogicalTypeAnnotation)
		{
			LogicalTypeAnnotation.TimestampLogicalTypeAnnotation timestamp =
					(LogicalTypeAnnotation.TimestampLogicalTypeAnnotation) annotation;
			element.setLogicalType(LogicalType.TIMESTAMP(
					new TimestampType(timestamp.isAdjustedToUTC(), timeUnit(timestamp.getUnit()))));
		}
	}

	private static TimeUnit timeUnit(LogicalTypeAnnotation.TimeUnit unit)
	{
		switch (unit)
		{
			case MILLIS:
				return TimeUnit.MILLIS(new MilliSeconds());
			case MICROS:
				return TimeUnit.MICROS(new MicroSeconds());
			default:
				return TimeUnit.NANOS(new NanoSeconds());
		}
	}
}
