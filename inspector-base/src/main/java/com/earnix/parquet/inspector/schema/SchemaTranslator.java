package com.earnix.parquet.inspector.schema;

import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.PrimitiveType;

import java.util.Optional;

import static java.util.Optional.of;

/**
 * Renders a schema tree as message definition text:
 *
 * <pre>
 * message schema {
 *   REQUIRED BYTE_ARRAY name (UTF8);
 *   OPTIONAL group address {
 *     OPTIONAL INT32 zip;
 *   }
 * }
 * </pre>
 */
public class SchemaTranslator
{
	private static final String INDENT = "  ";

	/**
	 * Render a schema node. The root renders as a {@code message}, other groups as {@code group}, leaves as a single
	 * field line.
	 *
	 * @param node the node to render
	 * @return the text, ending with a new line
	 */
	public static String render(SchemaNode node)
	{
		StringBuilder sb = new StringBuilder();
		render(node, 0, sb);
		return sb.toString();
	}

	private static void render(SchemaNode node, int depth, StringBuilder sb)
	{
		indent(depth, sb);
		if (node.isLeaf())
		{
			renderLeaf((LeafNode) node, sb);
			return;
		}
		GroupNode group = (GroupNode) node;
		if (group.isRoot())
		{
			sb.append("message ").append(group.getName());
		}
		else
		{
			sb.append(group.getRepetition()).append(" group ").append(group.getName());
			appendAnnotation(group.getLogicalType(), sb);
		}
		sb.append(" {\n");
		for (SchemaNode child : group.getChildren())
		{
			render(child, depth + 1, sb);
		}
		indent(depth, sb);
		sb.append("}\n");
	}

	private static void renderLeaf(LeafNode leaf, StringBuilder sb)
	{
		sb.append(leaf.getRepetition()).append(' ').append(physicalTypeName(leaf.getPhysicalType()));
		if (leaf.getPhysicalType() == PrimitiveType.PrimitiveTypeName.FIXED_LEN_BYTE_ARRAY)
			sb.append('(').append(leaf.getTypeLength()).append(')');
		sb.append(' ').append(leaf.getName());
		appendAnnotation(leaf.getLogicalType(), sb);
		sb.append(";\n");
	}

	private static String physicalTypeName(PrimitiveType.PrimitiveTypeName physicalType)
	{
		return physicalType == PrimitiveType.PrimitiveTypeName.BINARY ? "BYTE_ARRAY" : physicalType.name();
	}

	private static void appendAnnotation(LogicalTypeAnnotation annotation, StringBuilder sb)
	{
		if (annotation == null)
			return;
		sb.append(" (").append(annotationName(annotation)).append(')');
	}

	/**
	 * The legacy converted type name is used where one exists, as most tools print it.
	 *
	 * @param annotation the annotation
	 * @return the display name of the annotation
	 */
	static String annotationName(LogicalTypeAnnotation annotation)
	{
		return annotation.accept(new AnnotationNameVisitor()).orElse(annotation.toString());
	}

	private static class AnnotationNameVisitor implements LogicalTypeAnnotation.LogicalTypeAnnotationVisitor<String>
	{
		@Override
		public Optional<String> visit(LogicalTypeAnnotation.StringLogicalTypeAnnotation stringLogicalType)
		{
			return of("UTF8");
		}

		@Override
		public Optional<String> visit(LogicalTypeAnnotation.MapLogicalTypeAnnotation mapLogicalType)
		{
			return of("MAP");
		}

		@Override
		public Optional<String> visit(LogicalTypeAnnotation.MapKeyValueTypeAnnotation mapKeyValueLogicalType)
		{
			return of("MAP_KEY_VALUE");
		}

		@Override
		public Optional<String> visit(LogicalTypeAnnotation.ListLogicalTypeAnnotation listLogicalType)
		{
			return of("LIST");
		}

		@Override
		public Optional<String> visit(LogicalTypeAnnotation.EnumLogicalTypeAnnotation enumLogicalType)
		{
			return of("ENUM");
		}

		@Override
		public Optional<String> visit(LogicalTypeAnnotation.DecimalLogicalTypeAnnotation decimalLogicalType)
		{
			return of("DECIMAL(" + decimalLogicalType.getPrecision() + "," + decimalLogicalType.getScale() + ")");
		}

		@Override
		public Optional<String> visit(LogicalTypeAnnotation.DateLogicalTypeAnnotation dateLogicalType)
		{
			return of("DATE");
		}

		@Override
		public Optional<String> visit(LogicalTypeAnnotation.TimeLogicalTypeAnnotation timeLogicalType)
		{
			switch (timeLogicalType.getUnit())
			{
				case MILLIS:
					return of("TIME_MILLIS");
				case MICROS:
					return of("TIME_MICROS");
				default:
					return Optional.empty();
			}
		}

		@Override
		public Optional<String> visit(LogicalTypeAnnotation.TimestampLogicalTypeAnnotation timestampLogicalType)
		{
			switch (timestampLogicalType.getUnit())
			{
				case MILLIS:
					return of("TIMESTAMP_MILLIS");
				case MICROS:
					return of("TIMESTAMP_MICROS");
				default:
					return Optional.empty();
			}
		}

		@Override
		public Optional<String> visit(LogicalTypeAnnotation.IntLogicalTypeAnnotation intLogicalType)
		{
			return of((intLogicalType.isSigned() ? "INT_" : "UINT_") + intLogicalType.getBitWidth());
		}

		@Override
		public Optional<String> visit(LogicalTypeAnnotation.JsonLogicalTypeAnnotation jsonLogicalType)
		{
			return of("JSON");
		}

		@Override
		public Optional<String> visit(LogicalTypeAnnotation.BsonLogicalTypeAnnotation bsonLogicalType)
		{
			return of("BSON");
		}

		@Override
		public Optional<String> visit(LogicalTypeAnnotation.IntervalLogicalTypeAnnotation intervalLogicalType)
		{
			return of("INTERVAL");
		}
	}

	private static void indent(int depth, StringBuilder sb)
	{
		for (int i = 0; i < depth; i++)
			sb.append(INDENT);
	}
}
