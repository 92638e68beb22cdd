package com.earnix.parquet.inspector.reader;

import com.earnix.parquet.inspector.utils.FooterEnums;
import com.earnix.parquet.inspector.utils.ParquetMagic;
import com.earnix.parquet.inspector.utils.SchemaAnnotations;
import org.apache.parquet.format.FileMetaData;
import org.apache.parquet.format.SchemaElement;
import org.apache.parquet.format.Util;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.PrimitiveType;
import org.apache.parquet.schema.Type;
import org.apache.parquet.schema.Types;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Utils for processing parquet metadata
 */
public class ParquetMetadataUtils
{
	/**
	 * Build a message type schema from parquet footer metadata. The footer stores the schema tree flattened in depth
	 * first order, each group followed by its {@code num_children} children.
	 *
	 * @param md the parquet footer metadata
	 * @return the message type
	 * @throws MetadataException if the schema is malformed
	 */
	public static MessageType buildMessageType(FileMetaData md)
	{
		if (md.getSchemaSize() == 0)
			throw new MetadataException("Footer metadata has an empty schema");

		Iterator<SchemaElement> it = md.getSchemaIterator();
		SchemaElement root = it.next();
		List<Type> fields = readChildren(root, it);
		if (it.hasNext())
		{
			throw new MetadataException(
					"Malformed schema: elements remain after the root's " + root.getNum_children() + " children");
		}
		try
		{
			return new MessageType(root.getName(), fields);
		}
		catch (RuntimeException ex)
		{
			throw new MetadataException("Malformed schema: " + ex.getMessage(), ex);
		}
	}

	private static List<Type> readChildren(SchemaElement parent, Iterator<SchemaElement> it)
	{
		int numChildren = parent.isSetNum_children() ? parent.getNum_children() : 0;
		if (numChildren < 0)
			throw new MetadataException("Malformed schema: " + parent.getName() + " has " + numChildren + " children");

		List<Type> fields = new ArrayList<>(numChildren);
		Set<String> names = new HashSet<>();
		for (int i = 0; i < numChildren; i++)
		{
			if (!it.hasNext())
			{
				throw new MetadataException(
						"Malformed schema: " + parent.getName() + " declares " + numChildren + " children but only "
								+ i + " are present");
			}
			Type field = readField(it.next(), it);
			if (!names.add(field.getName()))
			{
				throw new MetadataException(
						"Malformed schema: duplicate field " + field.getName() + " in group " + parent.getName());
			}
			fields.add(field);
		}
		return fields;
	}

	private static Type readField(SchemaElement schemaElement, Iterator<SchemaElement> it)
	{
		String name = schemaElement.getName();
		if (!schemaElement.isSetRepetition_type())
			throw new MetadataException("Malformed schema: field " + name + " has no repetition");
		Type.Repetition repetition = FooterEnums.toRepetition(schemaElement.getRepetition_type());
		LogicalTypeAnnotation annotation = SchemaAnnotations.forElement(schemaElement);

		try
		{
			if (schemaElement.isSetType())
			{
				if (schemaElement.isSetNum_children() && schemaElement.getNum_children() > 0)
					throw new MetadataException("Malformed schema: primitive field " + name + " has children");
				return readPrimitive(schemaElement, repetition, annotation);
			}
			List<Type> children = readChildren(schemaElement, it);
			return Types.buildGroup(repetition).as(annotation).addFields(children.toArray(new Type[0])).named(name);
		}
		catch (IllegalArgumentException | IllegalStateException ex)
		{
			throw new MetadataException("Malformed schema at field " + name + ": " + ex.getMessage(), ex);
		}
	}

	private static Type readPrimitive(SchemaElement schemaElement, Type.Repetition repetition,
			LogicalTypeAnnotation annotation)
	{
		String name = schemaElement.getName();
		PrimitiveType.PrimitiveTypeName primitiveTypeName = FooterEnums.toPrimitiveTypeName(schemaElement.getType());
		Types.PrimitiveBuilder<PrimitiveType> builder = Types.primitive(primitiveTypeName, repetition);
		if (primitiveTypeName == PrimitiveType.PrimitiveTypeName.FIXED_LEN_BYTE_ARRAY)
		{
			if (!schemaElement.isSetType_length() || schemaElement.getType_length() <= 0)
				throw new MetadataException("Malformed schema: fixed length binary " + name + " must have a valid len");
			builder.length(schemaElement.getType_length());
		}
		return builder.as(annotation).named(name);
	}

	/**
	 * Parse the trailer at the end of a parquet file
	 *
	 * @param trailer  the last {@link ParquetMagic#TRAILER_LEN} bytes of the file
	 * @param fileSize the size of the file
	 * @return the length of the thrift footer, which ends where the trailer starts
	 * @throws MetadataException if the magic is missing or the footer length does not fit in the file
	 */
	public static int readFooterLength(ByteBuffer trailer, long fileSize)
	{
		trailer.order(ByteOrder.LITTLE_ENDIAN);
		int footerLen = trailer.getInt();
		if (!ParquetMagic.matches(trailer))
			throw new MetadataException("Invalid Parquet file. Magic bytes not found at the end of the file");
		long maxFooterLen = fileSize - ParquetMagic.TRAILER_LEN - ParquetMagic.MAGIC_LEN;
		if (footerLen <= 0 || footerLen > maxFooterLen)
			throw new MetadataException("Invalid Parquet file. Footer length " + footerLen + " does not fit in file");
		return footerLen;
	}

	/**
	 * Decode the thrift footer
	 *
	 * @param is the stream positioned at the start of the footer
	 * @return the footer metadata
	 * @throws MetadataException if the footer cannot be read or decoded
	 */
	public static FileMetaData readFileMetaData(InputStream is)
	{
		try
		{
			return Util.readFileMetaData(is);
		}
		catch (IOException | RuntimeException ex)
		{
			throw new MetadataException("Unable to decode the parquet footer: " + ex.getMessage(), ex);
		}
	}
}
