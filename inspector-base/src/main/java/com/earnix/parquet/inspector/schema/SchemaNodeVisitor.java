package com.earnix.parquet.inspector.schema;

public interface SchemaNodeVisitor<T>
{
	T visitGroup(GroupNode group);

	T visitLeaf(LeafNode leaf);
}
