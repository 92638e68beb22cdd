package com.earnix.parquet.inspector.value;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.parquet.io.api.Binary;
import org.apache.parquet.schema.LogicalTypeAnnotation;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.StringJoiner;
import java.util.UUID;

/**
 * Renders values as display text. Formatting is pure: the same value always renders the same way.
 * <ul>
 *     <li>null renders as {@code null}</li>
 *     <li>strings and other byte arrays render double quoted, with {@code "} and {@code \} escaped</li>
 *     <li>numbers render in their shortest decimal form, without trailing zeros</li>
 *     <li>dates and timestamps render in ISO-8601</li>
 *     <li>lists render as {@code [a, b]}, maps as {@code {k -> v}} and groups as {@code {name: v}}</li>
 * </ul>
 */
public class ValueFormatter
{
	public static final String NULL = "null";

	private static final FormattingVisitor VISITOR = new FormattingVisitor();

	private static final long NANOS_PER_SECOND = 1_000_000_000L;
	private static final long MICROS_PER_SECOND = 1_000_000L;
	private static final long NANOS_PER_MILLI = 1_000_000L;
	private static final long SECONDS_PER_DAY = 86_400L;
	private static final long JULIAN_DAY_OF_EPOCH = 2_440_588L;

	// beyond these decimal exponents numbers render in scientific notation
	private static final int MIN_PLAIN_EXPONENT = -6;
	private static final int MAX_PLAIN_EXPONENT = 20;

	/**
	 * @param value the value to render
	 * @return the display text
	 * @throws ValueFormatException if a scalar payload does not match its declared type
	 */
	public static String format(Value value)
	{
		return value.accept(VISITOR);
	}

	private static class FormattingVisitor implements ValueVisitor<String>
	{
		@Override
		public String visitNull(Value.Null value)
		{
			return NULL;
		}

		@Override
		public String visitScalar(Value.Scalar value)
		{
			return formatScalar(value);
		}

		@Override
		public String visitList(Value.ListValue value)
		{
			StringJoiner joiner = new StringJoiner(", ", "[", "]");
			for (Value element : value.getElements())
				joiner.add(element.accept(this));
			return joiner.toString();
		}

		@Override
		public String visitMap(Value.MapValue value)
		{
			StringJoiner joiner = new StringJoiner(", ", "{", "}");
			for (Pair<Value, Value> entry : value.getEntries())
				joiner.add(entry.getKey().accept(this) + " -> " + entry.getValue().accept(this));
			return joiner.toString();
		}

		@Override
		public String visitGroup(Value.GroupValue value)
		{
			StringJoiner joiner = new StringJoiner(", ", "{", "}");
			value.getFields().forEach((name, field) -> joiner.add(name + ": " + field.accept(this)));
			return joiner.toString();
		}
	}

	private static String formatScalar(Value.Scalar scalar)
	{
		LogicalTypeAnnotation logicalType = scalar.getLogicalType();
		switch (scalar.getKind())
		{
			case BOOLEAN:
				return Boolean.toString(payload(scalar, Boolean.class));
			case INT32:
				return formatInt32(payload(scalar, Integer.class), logicalType);
			case INT64:
				return formatInt64(payload(scalar, Long.class), logicalType);
			case FLOAT:
				float f = payload(scalar, Float.class);
				if (Float.isNaN(f) || Float.isInfinite(f))
					return Float.toString(f);
				return minimalDecimal(new BigDecimal(Float.toString(f)));
			case DOUBLE:
				double d = payload(scalar, Double.class);
				if (Double.isNaN(d) || Double.isInfinite(d))
					return Double.toString(d);
				return minimalDecimal(new BigDecimal(Double.toString(d)));
			case INT96:
				return formatInt96(payload(scalar, Binary.class));
			case BINARY:
			case FIXED_LEN_BYTE_ARRAY:
				return formatBinary(payload(scalar, Binary.class), logicalType);
			default:
				throw new ValueFormatException("Unknown scalar kind " + scalar.getKind());
		}
	}

	private static <T> T payload(Value.Scalar scalar, Class<T> expected)
	{
		Object payload = scalar.getPayload();
		if (!expected.isInstance(payload))
		{
			throw new ValueFormatException(
					"Scalar of kind " + scalar.getKind() + " holds a " + payload.getClass().getSimpleName()
							+ " payload, expected " + expected.getSimpleName());
		}
		return expected.cast(payload);
	}

	private static String formatInt32(int value, LogicalTypeAnnotation logicalType)
	{
		try
		{
			if (logicalType instanceof LogicalTypeAnnotation.DecimalLogicalTypeAnnotation)
			{
				int scale = ((LogicalTypeAnnotation.DecimalLogicalTypeAnnotation) logicalType).getScale();
				return new BigDecimal(BigInteger.valueOf(value), scale).toPlainString();
			}
			if (logicalType instanceof LogicalTypeAnnotation.DateLogicalTypeAnnotation)
				return LocalDate.ofEpochDay(value).toString();
			if (logicalType instanceof LogicalTypeAnnotation.TimeLogicalTypeAnnotation)
				return LocalTime.ofNanoOfDay(value * NANOS_PER_MILLI).toString();
		}
		catch (DateTimeException ex)
		{
			// out of range for the annotation, show the stored number
			return Integer.toString(value);
		}
		if (isUnsigned(logicalType))
			return Integer.toUnsignedString(value);
		return Integer.toString(value);
	}

	private static String formatInt64(long value, LogicalTypeAnnotation logicalType)
	{
		try
		{
			if (logicalType instanceof LogicalTypeAnnotation.DecimalLogicalTypeAnnotation)
			{
				int scale = ((LogicalTypeAnnotation.DecimalLogicalTypeAnnotation) logicalType).getScale();
				return new BigDecimal(BigInteger.valueOf(value), scale).toPlainString();
			}
			if (logicalType instanceof LogicalTypeAnnotation.TimestampLogicalTypeAnnotation)
			{
				LogicalTypeAnnotation.TimestampLogicalTypeAnnotation timestamp = (LogicalTypeAnnotation.TimestampLogicalTypeAnnotation) logicalType;
				Instant instant = toInstant(value, timestamp.getUnit());
				if (timestamp.isAdjustedToUTC())
					return instant.toString();
				return LocalDateTime.ofEpochSecond(instant.getEpochSecond(), instant.getNano(), ZoneOffset.UTC)
						.toString();
			}
			if (logicalType instanceof LogicalTypeAnnotation.TimeLogicalTypeAnnotation)
			{
				LogicalTypeAnnotation.TimeUnit unit = ((LogicalTypeAnnotation.TimeLogicalTypeAnnotation) logicalType).getUnit();
				long nanos = unit == LogicalTypeAnnotation.TimeUnit.NANOS ? value : Math.multiplyExact(value, 1000L);
				return LocalTime.ofNanoOfDay(nanos).toString();
			}
		}
		catch (DateTimeException | ArithmeticException ex)
		{
			return Long.toString(value);
		}
		if (isUnsigned(logicalType))
			return Long.toUnsignedString(value);
		return Long.toString(value);
	}

	private static boolean isUnsigned(LogicalTypeAnnotation logicalType)
	{
		return logicalType instanceof LogicalTypeAnnotation.IntLogicalTypeAnnotation
				&& !((LogicalTypeAnnotation.IntLogicalTypeAnnotation) logicalType).isSigned();
	}

	private static Instant toInstant(long value, LogicalTypeAnnotation.TimeUnit unit)
	{
		switch (unit)
		{
			case MILLIS:
				return Instant.ofEpochMilli(value);
			case MICROS:
				return Instant.ofEpochSecond(Math.floorDiv(value, MICROS_PER_SECOND),
						Math.floorMod(value, MICROS_PER_SECOND) * 1000L);
			case NANOS:
				return Instant.ofEpochSecond(Math.floorDiv(value, NANOS_PER_SECOND),
						Math.floorMod(value, NANOS_PER_SECOND));
			default:
				throw new IllegalArgumentException("Unknown time unit " + unit);
		}
	}

	/**
	 * Legacy timestamps: 8 little endian bytes of nanoseconds in the day followed by 4 bytes of julian day
	 */
	private static String formatInt96(Binary binary)
	{
		if (binary.length() != 12)
			throw new ValueFormatException("INT96 value must have 12 bytes, found " + binary.length());
		ByteBuffer buf = binary.toByteBuffer().order(ByteOrder.LITTLE_ENDIAN);
		long nanosOfDay = buf.getLong();
		long julianDay = Integer.toUnsignedLong(buf.getInt());
		try
		{
			return Instant.ofEpochSecond((julianDay - JULIAN_DAY_OF_EPOCH) * SECONDS_PER_DAY, nanosOfDay).toString();
		}
		catch (DateTimeException | ArithmeticException ex)
		{
			throw new ValueFormatException("INT96 value out of range: julian day " + julianDay);
		}
	}

	private static String formatBinary(Binary binary, LogicalTypeAnnotation logicalType)
	{
		if (logicalType instanceof LogicalTypeAnnotation.DecimalLogicalTypeAnnotation)
		{
			int scale = ((LogicalTypeAnnotation.DecimalLogicalTypeAnnotation) logicalType).getScale();
			if (binary.length() == 0)
				return BigDecimal.ZERO.setScale(scale).toPlainString();
			return new BigDecimal(new BigInteger(binary.getBytes()), scale).toPlainString();
		}
		if (logicalType instanceof LogicalTypeAnnotation.UUIDLogicalTypeAnnotation && binary.length() == 16)
		{
			ByteBuffer buf = binary.toByteBuffer();
			return quote(new UUID(buf.getLong(), buf.getLong()).toString());
		}
		if (logicalType instanceof LogicalTypeAnnotation.Float16LogicalTypeAnnotation && binary.length() == 2)
		{
			float f = halfToFloat(binary.getBytes());
			if (Float.isNaN(f) || Float.isInfinite(f))
				return Float.toString(f);
			return minimalDecimal(new BigDecimal(Float.toString(f)));
		}
		return quote(binary.toStringUsingUTF8());
	}

	private static float halfToFloat(byte[] littleEndian)
	{
		int bits = (littleEndian[1] & 0xff) << 8 | (littleEndian[0] & 0xff);
		int exponent = (bits >>> 10) & 0x1f;
		int mantissa = bits & 0x3ff;
		float magnitude;
		if (exponent == 0)
			magnitude = Math.scalb((float) mantissa, -24);
		else if (exponent == 0x1f)
			magnitude = mantissa == 0 ? Float.POSITIVE_INFINITY : Float.NaN;
		else
			magnitude = Math.scalb((float) (mantissa | 0x400), exponent - 25);
		return (bits & 0x8000) != 0 ? -magnitude : magnitude;
	}

	static String minimalDecimal(BigDecimal value)
	{
		BigDecimal stripped = value.stripTrailingZeros();
		int exponent = stripped.precision() - stripped.scale() - 1;
		if (exponent < MIN_PLAIN_EXPONENT || exponent > MAX_PLAIN_EXPONENT)
			return stripped.toString();
		return stripped.toPlainString();
	}

	/**
	 * @param text the text to quote
	 * @return the text in double quotes, with quotes and backslashes escaped
	 */
	public static String quote(String text)
	{
		return '"' + StringUtils.replaceEach(text, new String[] { "\\", "\"" }, new String[] { "\\\\", "\\\"" }) + '"';
	}
}
