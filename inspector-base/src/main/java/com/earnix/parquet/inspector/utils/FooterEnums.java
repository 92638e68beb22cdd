package com.earnix.parquet.inspector.utils;

import com.earnix.parquet.inspector.reader.MetadataException;
import org.apache.parquet.column.Encoding;
import org.apache.parquet.format.FieldRepetitionType;
import org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName;
import org.apache.parquet.schema.Type;

/**
 * Maps the thrift enums of the footer to the parquet-column enums. Both sides use the same constant names apart from
 * BYTE_ARRAY, which parquet-column calls BINARY.
 * <p>Footer values unknown to parquet-column fail with a {@link MetadataException}.</p>
 */
public final class FooterEnums
{
	private FooterEnums()
	{
	}

	public static Encoding toColumnEncoding(org.apache.parquet.format.Encoding encoding)
	{
		return byName(Encoding.class, encoding.name(), "encoding");
	}

	public static PrimitiveTypeName toPrimitiveTypeName(org.apache.parquet.format.Type type)
	{
		if (type == org.apache.parquet.format.Type.BYTE_ARRAY)
			return PrimitiveTypeName.BINARY;
		return byName(PrimitiveTypeName.class, type.name(), "physical type");
	}

	public static Type.Repetition toRepetition(FieldRepetitionType repetition)
	{
		return byName(Type.Repetition.class, repetition.name(), "repetition");
	}

	private static <E extends Enum<E>> E byName(Class<E> enumClass, String name, String what)
	{
		try
		{
			return Enum.valueOf(enumClass, name);
		}
		catch (IllegalArgumentException ex)
		{
			throw new MetadataException("Unsupported " + what + " " + name, ex);
		}
	}
}
