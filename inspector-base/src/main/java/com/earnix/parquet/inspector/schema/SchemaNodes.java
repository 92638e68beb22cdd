package com.earnix.parquet.inspector.schema;

import org.apache.parquet.schema.GroupType;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.PrimitiveType;
import org.apache.parquet.schema.Type;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builds schema trees from parquet-column message types, and resolves column names against them
 */
public class SchemaNodes
{
	/**
	 * Build the schema tree of a message type
	 *
	 * @param messageType the message type of the file
	 * @return the root group
	 */
	public static GroupNode fromMessageType(MessageType messageType)
	{
		List<SchemaNode> children = buildChildren(messageType, messageType, new ArrayList<>(), 0, 0);
		return new GroupNode(messageType.getName(), Type.Repetition.REQUIRED, messageType.getLogicalTypeAnnotation(),
				List.of(), 0, 0, children);
	}

	private static List<SchemaNode> buildChildren(MessageType messageType, GroupType group, List<String> parentPath,
			int parentRep, int parentDef)
	{
		List<SchemaNode> children = new ArrayList<>(group.getFieldCount());
		for (Type field : group.getFields())
		{
			List<String> path = new ArrayList<>(parentPath);
			path.add(field.getName());
			int rep = field.isRepetition(Type.Repetition.REPEATED) ? parentRep + 1 : parentRep;
			int def = field.isRepetition(Type.Repetition.REQUIRED) ? parentDef : parentDef + 1;
			if (field.isPrimitive())
			{
				PrimitiveType primitive = field.asPrimitiveType();
				children.add(new LeafNode(field.getName(), field.getRepetition(), field.getLogicalTypeAnnotation(),
						path, rep, def, primitive.getPrimitiveTypeName(), primitive.getTypeLength(),
						messageType.getColumnDescription(path.toArray(new String[0]))));
			}
			else
			{
				GroupType childGroup = field.asGroupType();
				children.add(new GroupNode(field.getName(), field.getRepetition(), field.getLogicalTypeAnnotation(),
						path, rep, def, buildChildren(messageType, childGroup, path, rep, def)));
			}
		}
		return children;
	}

	/**
	 * Resolve a dotted column path, ignoring case
	 *
	 * @param root       the root of the schema
	 * @param dottedPath the path such as {@code address.city}
	 * @return the node
	 * @throws InvalidColumnException if there is no such node
	 */
	public static SchemaNode resolve(GroupNode root, String dottedPath)
	{
		List<String> names = Arrays.asList(dottedPath.split("\\.", -1));
		SchemaNode current = root;
		for (String name : names)
		{
			if (current.isLeaf())
				throw new InvalidColumnException(dottedPath, "Column " + dottedPath + " not found: "
						+ current.getDottedPath() + " is a leaf column");
			SchemaNode child = ((GroupNode) current).findChildIgnoreCase(name);
			if (child == null)
				throw new InvalidColumnException(dottedPath, "Column " + dottedPath + " not found in schema");
			current = child;
		}
		return current;
	}

	/**
	 * Resolve a dotted path that must name a leaf column
	 *
	 * @param root       the root of the schema
	 * @param dottedPath the path
	 * @return the leaf
	 * @throws InvalidColumnException if there is no such node or it is a group
	 */
	public static LeafNode resolveLeaf(GroupNode root, String dottedPath)
	{
		SchemaNode node = resolve(root, dottedPath);
		if (!node.isLeaf())
			throw new InvalidColumnException(dottedPath,
					"Column " + dottedPath + " is a group, only leaf columns can be counted");
		return (LeafNode) node;
	}

	/**
	 * Select top level fields of the root
	 *
	 * @param root    the root of the schema
	 * @param columns field names, matched ignoring case. An empty list selects all fields.
	 * @return the projected root
	 * @throws InvalidColumnException if a field does not exist
	 */
	public static GroupNode selectFields(GroupNode root, List<String> columns)
	{
		if (columns.isEmpty())
			return root;
		List<SchemaNode> fields = new ArrayList<>(columns.size());
		for (String column : columns)
		{
			SchemaNode field = root.findChildIgnoreCase(column);
			if (field == null)
				throw new InvalidColumnException(column, "Column " + column + " not found in schema");
			if (!fields.contains(field))
				fields.add(field);
		}
		return root.project(fields);
	}
}
