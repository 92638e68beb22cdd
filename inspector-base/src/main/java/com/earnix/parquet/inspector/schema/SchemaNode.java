package com.earnix.parquet.inspector.schema;

import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.Type;

import java.util.List;
import java.util.Objects;

/**
 * A node of the logical schema of a parquet file: either a {@link LeafNode} holding values or a {@link GroupNode}
 * holding fields. Nodes are immutable, and carry the repetition and definition levels reached at them, so the row
 * assembler never has to walk back to the root.
 */
public abstract class SchemaNode
{
	private final String name;
	private final Type.Repetition repetition;
	private final LogicalTypeAnnotation logicalType;
	private final List<String> path;
	private final int maxRepetitionLevel;
	private final int maxDefinitionLevel;

	SchemaNode(String name, Type.Repetition repetition, LogicalTypeAnnotation logicalType, List<String> path,
			int maxRepetitionLevel, int maxDefinitionLevel)
	{
		this.name = Objects.requireNonNull(name, "name must not be null");
		this.repetition = Objects.requireNonNull(repetition, "repetition must not be null");
		this.logicalType = logicalType;
		this.path = List.copyOf(path);
		this.maxRepetitionLevel = maxRepetitionLevel;
		this.maxDefinitionLevel = maxDefinitionLevel;
	}

	public String getName()
	{
		return name;
	}

	public Type.Repetition getRepetition()
	{
		return repetition;
	}

	/**
	 * @return the logical type annotation or null if the node is not annotated
	 */
	public LogicalTypeAnnotation getLogicalType()
	{
		return logicalType;
	}

	/**
	 * @return the names from the root (exclusive) down to this node. Empty for the root.
	 */
	public List<String> getPath()
	{
		return path;
	}

	/**
	 * @return the path joined with dots, as columns are named on the command line
	 */
	public String getDottedPath()
	{
		return String.join(".", path);
	}

	/**
	 * @return the number of repeated nodes from the root down to and including this node
	 */
	public int getMaxRepetitionLevel()
	{
		return maxRepetitionLevel;
	}

	/**
	 * @return the number of optional or repeated nodes from the root down to and including this node
	 */
	public int getMaxDefinitionLevel()
	{
		return maxDefinitionLevel;
	}

	public boolean isRepeated()
	{
		return repetition == Type.Repetition.REPEATED;
	}

	public boolean isRequired()
	{
		return repetition == Type.Repetition.REQUIRED;
	}

	public abstract boolean isLeaf();

	public abstract <T> T accept(SchemaNodeVisitor<T> visitor);
}
