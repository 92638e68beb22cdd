package com.earnix.parquet.inspector.schema;

import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.PrimitiveType;
import org.apache.parquet.schema.Type;

import java.util.List;

/**
 * A primitive column of the schema
 */
public final class LeafNode extends SchemaNode
{
	private final PrimitiveType.PrimitiveTypeName physicalType;
	private final int typeLength;
	private final ColumnDescriptor descriptor;

	LeafNode(String name, Type.Repetition repetition, LogicalTypeAnnotation logicalType, List<String> path,
			int maxRepetitionLevel, int maxDefinitionLevel, PrimitiveType.PrimitiveTypeName physicalType,
			int typeLength, ColumnDescriptor descriptor)
	{
		super(name, repetition, logicalType, path, maxRepetitionLevel, maxDefinitionLevel);
		this.physicalType = physicalType;
		this.typeLength = typeLength;
		this.descriptor = descriptor;
	}

	public PrimitiveType.PrimitiveTypeName getPhysicalType()
	{
		return physicalType;
	}

	/**
	 * @return the length of a FIXED_LEN_BYTE_ARRAY column, 0 for other types
	 */
	public int getTypeLength()
	{
		return typeLength;
	}

	/**
	 * @return the parquet-column descriptor used to decode the chunks of this column
	 */
	public ColumnDescriptor getDescriptor()
	{
		return descriptor;
	}

	@Override
	public boolean isLeaf()
	{
		return true;
	}

	@Override
	public <T> T accept(SchemaNodeVisitor<T> visitor)
	{
		return visitor.visitLeaf(this);
	}

	@Override
	public String toString()
	{
		return "LeafNode{" + getDottedPath() + " " + getRepetition() + " " + physicalType + "}";
	}
}
