package com.earnix.parquet.inspector.assembler;

import com.earnix.parquet.inspector.schema.GroupNode;
import com.earnix.parquet.inspector.schema.LeafNode;
import com.earnix.parquet.inspector.schema.SchemaNode;
import com.earnix.parquet.inspector.value.Value;
import org.apache.commons.lang3.tuple.ImmutablePair;
import org.apache.commons.lang3.tuple.Pair;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recursive descent record assembly. Every schema node gets an assembler that reads one value of the node from the
 * cursors of the leaves below it. Decisions are taken on the first leaf below the node: a definition level above
 * the node's parent level means the node is present, a repetition level above the node's parent level means another
 * element of the same list follows. When a node is absent every leaf below it holds exactly one null slot, which is
 * consumed so the leaves stay in step.
 */
class FieldAssemblers
{
	/**
	 * Build the assembler of a row
	 *
	 * @param root    the (possibly projected) root of the schema
	 * @param cursors the cursor of every leaf below the root
	 * @return the assembler producing group values of the root
	 */
	static FieldAssembler forRoot(GroupNode root, Map<LeafNode, LeafCursor> cursors)
	{
		return group(root, cursors);
	}

	private static FieldAssembler field(SchemaNode node, Map<LeafNode, LeafCursor> cursors)
	{
		FieldAssembler instance = instance(node, cursors);
		switch (node.getRepetition())
		{
			case REPEATED:
				return new RepeatedAssembler(node, instance);
			case OPTIONAL:
				return new OptionalAssembler(node, instance);
			default:
				return instance;
		}
	}

	private static FieldAssembler instance(SchemaNode node, Map<LeafNode, LeafCursor> cursors)
	{
		if (node.isLeaf())
		{
			LeafCursor cursor = cursors.get(node);
			if (cursor == null)
				throw new IllegalArgumentException("No cursor for column " + node.getDottedPath());
			return new PrimitiveAssembler((LeafNode) node, cursor);
		}

		GroupNode group = (GroupNode) node;
		if (group.isList())
		{
			SchemaNode repeated = group.getChildren().get(0);
			SchemaNode element = group.getListElement();
			// in the two level layouts the repeated field is the element itself
			FieldAssembler elementAssembler = element == repeated ?
					instance(repeated, cursors) :
					field(element, cursors);
			return new RepeatedAssembler(repeated, elementAssembler);
		}
		if (group.isMap())
		{
			FieldAssembler key = field(group.getMapKey(), cursors);
			FieldAssembler value = group.getMapValue() == null ? null : field(group.getMapValue(), cursors);
			return new MapAssembler(group.getMapKeyValue(), key, value);
		}
		return group(group, cursors);
	}

	private static FieldAssembler group(GroupNode group, Map<LeafNode, LeafCursor> cursors)
	{
		Map<String, FieldAssembler> fields = new LinkedHashMap<>();
		for (SchemaNode child : group.getChildren())
			fields.put(child.getName(), field(child, cursors));
		return new GroupAssembler(fields);
	}

	abstract static class FieldAssembler
	{
		private final List<LeafCursor> cursors;

		FieldAssembler(List<LeafCursor> cursors)
		{
			this.cursors = cursors;
		}

		/**
		 * @return the next value, consuming its triples from every leaf below
		 */
		abstract Value read();

		List<LeafCursor> cursors()
		{
			return cursors;
		}

		LeafCursor column()
		{
			return cursors.get(0);
		}

		void skipNull(int maxDefinitionLevel)
		{
			for (LeafCursor cursor : cursors)
				cursor.skipNull(maxDefinitionLevel);
		}
	}

	private static class PrimitiveAssembler extends FieldAssembler
	{
		private final LeafNode leaf;

		PrimitiveAssembler(LeafNode leaf, LeafCursor cursor)
		{
			super(Collections.singletonList(cursor));
			this.leaf = leaf;
		}

		@Override
		Value read()
		{
			return Value.scalar(leaf.getPhysicalType(), leaf.getLogicalType(), column().readValue());
		}
	}

	private static class OptionalAssembler extends FieldAssembler
	{
		private final int definitionLevel;
		private final FieldAssembler present;

		OptionalAssembler(SchemaNode node, FieldAssembler present)
		{
			super(present.cursors());
			this.definitionLevel = node.getMaxDefinitionLevel() - 1;
			this.present = present;
		}

		@Override
		Value read()
		{
			if (column().definitionLevel() > definitionLevel)
				return present.read();
			skipNull(definitionLevel);
			return Value.nullValue();
		}
	}

	private abstract static class BaseRepeatedAssembler<E> extends FieldAssembler
	{
		private final int definitionLevel;
		private final int repetitionLevel;

		BaseRepeatedAssembler(SchemaNode repeatedNode, List<LeafCursor> cursors)
		{
			super(cursors);
			this.definitionLevel = repeatedNode.getMaxDefinitionLevel() - 1;
			this.repetitionLevel = repeatedNode.getMaxRepetitionLevel() - 1;
		}

		abstract E readElement();

		abstract Value build(List<E> elements);

		@Override
		Value read()
		{
			List<E> elements = new ArrayList<>();
			do
			{
				if (column().definitionLevel() > definitionLevel)
				{
					elements.add(readElement());
				}
				else
				{
					if (!elements.isEmpty())
						throw column().fail("undefined element inside a non-empty list");
					// an empty list still holds one slot in every leaf
					skipNull(definitionLevel);
					break;
				}
			}
			while (column().repetitionLevel() > repetitionLevel);
			return build(elements);
		}
	}

	private static class RepeatedAssembler extends BaseRepeatedAssembler<Value>
	{
		private final FieldAssembler element;

		RepeatedAssembler(SchemaNode repeatedNode, FieldAssembler element)
		{
			super(repeatedNode, element.cursors());
			this.element = element;
		}

		@Override
		Value readElement()
		{
			return element.read();
		}

		@Override
		Value build(List<Value> elements)
		{
			return Value.list(elements);
		}
	}

	private static class MapAssembler extends BaseRepeatedAssembler<Pair<Value, Value>>
	{
		private final FieldAssembler key;
		private final FieldAssembler value;

		MapAssembler(SchemaNode keyValueNode, FieldAssembler key, FieldAssembler value)
		{
			super(keyValueNode, concat(key, value));
			this.key = key;
			this.value = value;
		}

		private static List<LeafCursor> concat(FieldAssembler key, FieldAssembler value)
		{
			List<LeafCursor> cursors = new ArrayList<>(key.cursors());
			if (value != null)
				cursors.addAll(value.cursors());
			return cursors;
		}

		@Override
		Pair<Value, Value> readElement()
		{
			Value k = key.read();
			Value v = value == null ? Value.nullValue() : value.read();
			return new ImmutablePair<>(k, v);
		}

		@Override
		Value build(List<Pair<Value, Value>> entries)
		{
			return Value.map(entries);
		}
	}

	private static class GroupAssembler extends FieldAssembler
	{
		private final Map<String, FieldAssembler> fields;

		GroupAssembler(Map<String, FieldAssembler> fields)
		{
			super(collectCursors(fields));
			this.fields = fields;
		}

		private static List<LeafCursor> collectCursors(Map<String, FieldAssembler> fields)
		{
			List<LeafCursor> cursors = new ArrayList<>();
			for (FieldAssembler field : fields.values())
				cursors.addAll(field.cursors());
			return cursors;
		}

		@Override
		Value read()
		{
			Map<String, Value> values = new LinkedHashMap<>();
			fields.forEach((name, field) -> values.put(name, field.read()));
			return Value.group(values);
		}
	}
}
