package com.earnix.parquet.inspector.schema;

import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A group of fields. The root of a schema is a group with an empty path.
 */
public final class GroupNode extends SchemaNode
{
	private final List<SchemaNode> children;
	private final Map<String, SchemaNode> childrenByName;

	GroupNode(String name, Type.Repetition repetition, LogicalTypeAnnotation logicalType, List<String> path,
			int maxRepetitionLevel, int maxDefinitionLevel, List<SchemaNode> children)
	{
		super(name, repetition, logicalType, path, maxRepetitionLevel, maxDefinitionLevel);
		this.children = List.copyOf(children);
		Map<String, SchemaNode> byName = new LinkedHashMap<>();
		for (SchemaNode child : this.children)
		{
			if (byName.put(child.getName(), child) != null)
				throw new IllegalArgumentException("Duplicate field " + child.getName() + " in group " + name);
		}
		this.childrenByName = Collections.unmodifiableMap(byName);
	}

	public List<SchemaNode> getChildren()
	{
		return children;
	}

	/**
	 * @param name the field name
	 * @return the child with this exact name or null
	 */
	public SchemaNode getChild(String name)
	{
		return childrenByName.get(name);
	}

	/**
	 * Find a child ignoring case. An exact match wins over a case-insensitive one.
	 *
	 * @param name the field name
	 * @return the child or null
	 */
	public SchemaNode findChildIgnoreCase(String name)
	{
		SchemaNode exact = childrenByName.get(name);
		if (exact != null)
			return exact;
		for (SchemaNode child : children)
		{
			if (child.getName().equalsIgnoreCase(name))
				return child;
		}
		return null;
	}

	public boolean isRoot()
	{
		return getPath().isEmpty();
	}

	/**
	 * @return all leaves below this group in schema order
	 */
	public List<LeafNode> getLeaves()
	{
		List<LeafNode> leaves = new ArrayList<>();
		collectLeaves(this, leaves);
		return leaves;
	}

	private static void collectLeaves(GroupNode group, List<LeafNode> leaves)
	{
		for (SchemaNode child : group.children)
		{
			if (child.isLeaf())
				leaves.add((LeafNode) child);
			else
				collectLeaves((GroupNode) child, leaves);
		}
	}

	/**
	 * @return whether this group is an annotated list with a single repeated field, and so collapses into a list of
	 * 		its elements
	 */
	public boolean isList()
	{
		return getLogicalType() instanceof LogicalTypeAnnotation.ListLogicalTypeAnnotation && children.size() == 1
				&& children.get(0).isRepeated();
	}

	/**
	 * Resolve the element of a list, following the backward compatibility rules of the parquet format: the repeated
	 * field is itself the element when it is a primitive, a group of several fields, or is named {@code array} or
	 * {@code <list name>_tuple}. Otherwise it is the three level layout and the element is its only child.
	 *
	 * @return the node whose values are the elements of the list
	 */
	public SchemaNode getListElement()
	{
		if (!isList())
			throw new IllegalStateException(getDottedPath() + " is not a list");
		SchemaNode repeated = children.get(0);
		if (repeated.isLeaf())
			return repeated;
		GroupNode repeatedGroup = (GroupNode) repeated;
		if (repeatedGroup.children.size() != 1 || "array".equals(repeated.getName()) || (getName() + "_tuple").equals(
				repeated.getName()))
			return repeated;
		return repeatedGroup.children.get(0);
	}

	/**
	 * @return whether this group is an annotated map whose single repeated group holds a key and optionally a value
	 */
	public boolean isMap()
	{
		LogicalTypeAnnotation logicalType = getLogicalType();
		boolean annotated = logicalType instanceof LogicalTypeAnnotation.MapLogicalTypeAnnotation
				|| logicalType instanceof LogicalTypeAnnotation.MapKeyValueTypeAnnotation;
		if (!annotated || children.size() != 1)
			return false;
		SchemaNode keyValue = children.get(0);
		if (!keyValue.isRepeated() || keyValue.isLeaf())
			return false;
		int numChildren = ((GroupNode) keyValue).children.size();
		return numChildren == 1 || numChildren == 2;
	}

	/**
	 * @return the repeated key value group of a map
	 */
	public GroupNode getMapKeyValue()
	{
		if (!isMap())
			throw new IllegalStateException(getDottedPath() + " is not a map");
		return (GroupNode) children.get(0);
	}

	/**
	 * @return the key node of a map
	 */
	public SchemaNode getMapKey()
	{
		return getMapKeyValue().children.get(0);
	}

	/**
	 * @return the value node of a map, or null for a map that only holds keys
	 */
	public SchemaNode getMapValue()
	{
		List<SchemaNode> keyValueChildren = getMapKeyValue().children;
		return keyValueChildren.size() == 2 ? keyValueChildren.get(1) : null;
	}

	/**
	 * Keep only some of the fields of this group. The kept nodes are shared, so their levels stay valid.
	 *
	 * @param fields the fields to keep in the order they should appear
	 * @return the projected group
	 */
	public GroupNode project(List<SchemaNode> fields)
	{
		for (SchemaNode field : fields)
		{
			if (childrenByName.get(field.getName()) != field)
				throw new IllegalArgumentException(field.getName() + " is not a field of " + getName());
		}
		return new GroupNode(getName(), getRepetition(), getLogicalType(), getPath(), getMaxRepetitionLevel(),
				getMaxDefinitionLevel(), fields);
	}

	@Override
	public boolean isLeaf()
	{
		return false;
	}

	@Override
	public <T> T accept(SchemaNodeVisitor<T> visitor)
	{
		return visitor.visitGroup(this);
	}

	@Override
	public String toString()
	{
		return "GroupNode{" + (isRoot() ? getName() : getDottedPath()) + " " + getRepetition() + " " + children.size()
				+ " fields}";
	}
}
