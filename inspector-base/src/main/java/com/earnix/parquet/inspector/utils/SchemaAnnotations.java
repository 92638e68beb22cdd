package com.earnix.parquet.inspector.utils;

import com.earnix.parquet.inspector.reader.MetadataException;
import org.apache.parquet.format.ConvertedType;
import org.apache.parquet.format.DecimalType;
import org.apache.parquet.format.IntType;
import org.apache.parquet.format.LogicalType;
import org.apache.parquet.format.SchemaElement;
import org.apache.parquet.format.TimeType;
import org.apache.parquet.format.TimeUnit;
import org.apache.parquet.format.TimestampType;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the annotation of a footer schema element into a parquet-column {@link LogicalTypeAnnotation}. The rules
 * follow ParquetMetadataConverter of parquet-hadoop, which is not used here to stay clear of hadoop.
 */
public final class SchemaAnnotations
{
	private static final Logger LOG = LoggerFactory.getLogger(SchemaAnnotations.class);

	private SchemaAnnotations()
	{
	}

	/**
	 * The logical type wins over the legacy converted type when both are set. A logical type this reader does not
	 * know falls back to the converted type.
	 *
	 * @param schemaElement the footer schema element
	 * @return the annotation, or null when the element carries none
	 * @throws MetadataException if the converted type is unknown
	 */
	public static LogicalTypeAnnotation forElement(SchemaElement schemaElement)
	{
		LogicalTypeAnnotation annotation = null;
		if (schemaElement.isSetLogicalType())
			annotation = fromLogicalType(schemaElement.getLogicalType());
		if (annotation == null && schemaElement.isSetConverted_type())
			annotation = fromConvertedType(schemaElement.getConverted_type(), schemaElement);
		return annotation;
	}

	private static LogicalTypeAnnotation fromLogicalType(LogicalType type)
	{
		switch (type.getSetField())
		{
			case STRING:
				return LogicalTypeAnnotation.stringType();
			case ENUM:
				return LogicalTypeAnnotation.enumType();
			case JSON:
				return LogicalTypeAnnotation.jsonType();
			case BSON:
				return LogicalTypeAnnotation.bsonType();
			case UUID:
				return LogicalTypeAnnotation.uuidType();
			case FLOAT16:
				return LogicalTypeAnnotation.float16Type();
			case DATE:
				return LogicalTypeAnnotation.dateType();
			case MAP:
				return LogicalTypeAnnotation.mapType();
			case LIST:
				return LogicalTypeAnnotation.listType();
			case INTEGER:
			{
				IntType integer = type.getINTEGER();
				return LogicalTypeAnnotation.intType(integer.getBitWidth(), integer.isIsSigned());
			}
			case DECIMAL:
			{
				DecimalType decimal = type.getDECIMAL();
				return LogicalTypeAnnotation.decimalType(decimal.getScale(), decimal.getPrecision());
			}
			case TIME:
			{
				TimeType time = type.getTIME();
				return LogicalTypeAnnotation.timeType(time.isIsAdjustedToUTC(), timeUnit(time.getUnit()));
			}
			case TIMESTAMP:
			{
				TimestampType timestamp = type.getTIMESTAMP();
				return LogicalTypeAnnotation.timestampType(timestamp.isIsAdjustedToUTC(),
						timeUnit(timestamp.getUnit()));
			}
			default:
				LOG.debug("Ignoring logical type {}", type);
				return null;
		}
	}

	private static LogicalTypeAnnotation fromConvertedType(ConvertedType type, SchemaElement schemaElement)
	{
		switch (type)
		{
			case UTF8:
				return LogicalTypeAnnotation.stringType();
			case ENUM:
				return LogicalTypeAnnotation.enumType();
			case JSON:
				return LogicalTypeAnnotation.jsonType();
			case BSON:
				return LogicalTypeAnnotation.bsonType();
			case DATE:
				return LogicalTypeAnnotation.dateType();
			case INTERVAL:
				return LogicalTypeAnnotation.IntervalLogicalTypeAnnotation.getInstance();
			case MAP:
				return LogicalTypeAnnotation.mapType();
			case MAP_KEY_VALUE:
				return LogicalTypeAnnotation.MapKeyValueTypeAnnotation.getInstance();
			case LIST:
				return LogicalTypeAnnotation.listType();
			case DECIMAL:
				return LogicalTypeAnnotation.decimalType(schemaElement.getScale(), schemaElement.getPrecision());
			// legacy time types are always UTC adjusted
			case TIME_MILLIS:
			case TIMESTAMP_MILLIS:
				return timeOrTimestamp(type, LogicalTypeAnnotation.TimeUnit.MILLIS);
			case TIME_MICROS:
			case TIMESTAMP_MICROS:
				return timeOrTimestamp(type, LogicalTypeAnnotation.TimeUnit.MICROS);
			case INT_8:
			case INT_16:
			case INT_32:
			case INT_64:
			case UINT_8:
			case UINT_16:
			case UINT_32:
			case UINT_64:
				return integer(type);
			default:
				throw new MetadataException("Unsupported converted type " + type);
		}
	}

	private static LogicalTypeAnnotation timeOrTimestamp(ConvertedType type, LogicalTypeAnnotation.TimeUnit unit)
	{
		if (type.name().startsWith("TIMESTAMP"))
			return LogicalTypeAnnotation.timestampType(true, unit);
		return LogicalTypeAnnotation.timeType(true, unit);
	}

	/**
	 * INT_8 through UINT_64 spell the signedness and the bit width in the constant name
	 */
	private static LogicalTypeAnnotation integer(ConvertedType type)
	{
		String name = type.name();
		int bitWidth = Integer.parseInt(name.substring(name.indexOf('_') + 1));
		return LogicalTypeAnnotation.intType(bitWidth, !name.startsWith("U"));
	}

	private static LogicalTypeAnnotation.TimeUnit timeUnit(TimeUnit unit)
	{
		if (unit.isSetMILLIS())
			return LogicalTypeAnnotation.TimeUnit.MILLIS;
		if (unit.isSetMICROS())
			return LogicalTypeAnnotation.TimeUnit.MICROS;
		if (unit.isSetNANOS())
			return LogicalTypeAnnotation.TimeUnit.NANOS;
		throw new MetadataException("Unknown time unit " + unit);
	}
}
