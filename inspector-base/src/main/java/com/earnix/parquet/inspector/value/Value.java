package com.earnix.parquet.inspector.value;

import org.apache.commons.lang3.tuple.Pair;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.PrimitiveType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A materialized value of a row. The set of variants is closed: {@link Null}, {@link Scalar}, {@link ListValue},
 * {@link MapValue} and {@link GroupValue}. Use a {@link ValueVisitor} to handle all of them.
 */
public abstract class Value
{
	private Value()
	{
	}

	public abstract <T> T accept(ValueVisitor<T> visitor);

	public static Null nullValue()
	{
		return Null.INSTANCE;
	}

	public static Scalar scalar(PrimitiveType.PrimitiveTypeName kind, LogicalTypeAnnotation logicalType,
			Object payload)
	{
		return new Scalar(kind, logicalType, payload);
	}

	public static ListValue list(List<Value> elements)
	{
		return new ListValue(elements);
	}

	public static MapValue map(List<Pair<Value, Value>> entries)
	{
		return new MapValue(entries);
	}

	public static GroupValue group(Map<String, Value> fields)
	{
		return new GroupValue(fields);
	}

	/**
	 * An absent value
	 */
	public static final class Null extends Value
	{
		private static final Null INSTANCE = new Null();

		private Null()
		{
		}

		@Override
		public <T> T accept(ValueVisitor<T> visitor)
		{
			return visitor.visitNull(this);
		}

		@Override
		public String toString()
		{
			return "null";
		}
	}

	/**
	 * A leaf value. The payload is a {@link Boolean}, {@link Integer}, {@link Long}, {@link Float}, {@link Double}
	 * or {@link org.apache.parquet.io.api.Binary}, according to the physical type.
	 */
	public static final class Scalar extends Value
	{
		private final PrimitiveType.PrimitiveTypeName kind;
		private final LogicalTypeAnnotation logicalType;
		private final Object payload;

		private Scalar(PrimitiveType.PrimitiveTypeName kind, LogicalTypeAnnotation logicalType, Object payload)
		{
			this.kind = Objects.requireNonNull(kind, "kind must not be null");
			this.logicalType = logicalType;
			this.payload = Objects.requireNonNull(payload, "payload must not be null");
		}

		public PrimitiveType.PrimitiveTypeName getKind()
		{
			return kind;
		}

		/**
		 * @return the annotation of the column, or null
		 */
		public LogicalTypeAnnotation getLogicalType()
		{
			return logicalType;
		}

		public Object getPayload()
		{
			return payload;
		}

		@Override
		public <T> T accept(ValueVisitor<T> visitor)
		{
			return visitor.visitScalar(this);
		}

		@Override
		public boolean equals(Object o)
		{
			if (this == o)
				return true;
			if (!(o instanceof Scalar))
				return false;
			Scalar scalar = (Scalar) o;
			return kind == scalar.kind && Objects.equals(logicalType, scalar.logicalType) && payload.equals(
					scalar.payload);
		}

		@Override
		public int hashCode()
		{
			return Objects.hash(kind, logicalType, payload);
		}

		@Override
		public String toString()
		{
			return kind + ":" + payload;
		}
	}

	/**
	 * The values of a repeated field, in file order
	 */
	public static final class ListValue extends Value
	{
		private final List<Value> elements;

		private ListValue(List<Value> elements)
		{
			this.elements = List.copyOf(elements);
		}

		public List<Value> getElements()
		{
			return elements;
		}

		@Override
		public <T> T accept(ValueVisitor<T> visitor)
		{
			return visitor.visitList(this);
		}

		@Override
		public boolean equals(Object o)
		{
			return o instanceof ListValue && elements.equals(((ListValue) o).elements);
		}

		@Override
		public int hashCode()
		{
			return elements.hashCode();
		}

		@Override
		public String toString()
		{
			return elements.toString();
		}
	}

	/**
	 * The entries of a map, in file order. Keys are not deduplicated.
	 */
	public static final class MapValue extends Value
	{
		private final List<Pair<Value, Value>> entries;

		private MapValue(List<Pair<Value, Value>> entries)
		{
			this.entries = List.copyOf(entries);
		}

		public List<Pair<Value, Value>> getEntries()
		{
			return entries;
		}

		@Override
		public <T> T accept(ValueVisitor<T> visitor)
		{
			return visitor.visitMap(this);
		}

		@Override
		public boolean equals(Object o)
		{
			return o instanceof MapValue && entries.equals(((MapValue) o).entries);
		}

		@Override
		public int hashCode()
		{
			return entries.hashCode();
		}

		@Override
		public String toString()
		{
			return entries.toString();
		}
	}

	/**
	 * The fields of a group in schema order. A row is the group value of the schema root.
	 */
	public static final class GroupValue extends Value
	{
		private final Map<String, Value> fields;

		private GroupValue(Map<String, Value> fields)
		{
			this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
		}

		public Map<String, Value> getFields()
		{
			return fields;
		}

		/**
		 * @param name the field name
		 * @return the value of the field or null if the group has no such field
		 */
		public Value get(String name)
		{
			return fields.get(name);
		}

		@Override
		public <T> T accept(ValueVisitor<T> visitor)
		{
			return visitor.visitGroup(this);
		}

		@Override
		public boolean equals(Object o)
		{
			// field order is part of the value
			return o instanceof GroupValue && List.copyOf(fields.entrySet())
					.equals(List.copyOf(((GroupValue) o).fields.entrySet()));
		}

		@Override
		public int hashCode()
		{
			return fields.hashCode();
		}

		@Override
		public String toString()
		{
			return fields.toString();
		}
	}
}
