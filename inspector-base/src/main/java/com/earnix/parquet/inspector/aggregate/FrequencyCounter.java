package com.earnix.parquet.inspector.aggregate;

import com.earnix.parquet.inspector.schema.GroupNode;
import com.earnix.parquet.inspector.schema.InvalidColumnException;
import com.earnix.parquet.inspector.schema.LeafNode;
import com.earnix.parquet.inspector.schema.SchemaNode;
import com.earnix.parquet.inspector.schema.SchemaNodes;
import com.earnix.parquet.inspector.value.Value;
import com.earnix.parquet.inspector.value.ValueFormatter;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Counts the distinct formatted values of leaf columns over a stream of rows. Every occurrence of a leaf in a row is
 * counted: a leaf under repeated fields occurs once per element, and once as {@code null} when the leaf or one of
 * its ancestors is null. An empty list holds no occurrence.
 */
public class FrequencyCounter
{
	private static final Logger LOG = LoggerFactory.getLogger(FrequencyCounter.class);

	private static final Comparator<FrequencyEntry> RANK_ORDER = Comparator
			.comparingLong(FrequencyEntry::getCount).reversed()
			.thenComparing(entry -> StringUtils.unwrap(entry.getValue(), '"'))
			.thenComparing(FrequencyEntry::getValue);

	private final GroupNode schema;
	private final Map<LeafNode, Map<String, Long>> counts = new LinkedHashMap<>();
	private long rowsCounted = 0;

	/**
	 * Resolve the columns to count. No row is needed, so invalid columns fail before anything is read.
	 *
	 * @param schema      the root of the schema of the rows
	 * @param columnPaths dotted paths of leaf columns, matched ignoring case
	 * @throws InvalidColumnException if a path does not exist or names a group
	 */
	public FrequencyCounter(GroupNode schema, List<String> columnPaths)
	{
		if (columnPaths.isEmpty())
			throw new IllegalArgumentException("At least one column is required");
		this.schema = schema;
		for (String path : columnPaths)
			counts.putIfAbsent(SchemaNodes.resolveLeaf(schema, path), new HashMap<>());
	}

	/**
	 * @return the schema restricted to the top level fields holding the counted columns, enough to assemble the
	 * 		rows this counter needs
	 */
	public GroupNode getProjection()
	{
		List<SchemaNode> fields = new ArrayList<>();
		for (SchemaNode field : schema.getChildren())
		{
			for (LeafNode leaf : counts.keySet())
			{
				if (leaf.getPath().get(0).equals(field.getName()))
				{
					fields.add(field);
					break;
				}
			}
		}
		return schema.project(fields);
	}

	/**
	 * Count the occurrences of the columns in a row
	 *
	 * @param row a row of the schema, or of its projection
	 */
	public void add(Value.GroupValue row)
	{
		for (Map.Entry<LeafNode, Map<String, Long>> column : counts.entrySet())
		{
			List<Value> occurrences = new ArrayList<>();
			LeafNode leaf = column.getKey();
			collectInstance(schema, row, leaf.getPath(), 0, occurrences);
			for (Value occurrence : occurrences)
				column.getValue().merge(ValueFormatter.format(occurrence), 1L, Long::sum);
		}
		rowsCounted++;
	}

	/**
	 * Count all the remaining rows of a stream
	 *
	 * @param rows the rows
	 * @return this counter
	 */
	public FrequencyCounter addAll(Iterator<Value.GroupValue> rows)
	{
		while (rows.hasNext())
			add(rows.next());
		return this;
	}

	public long getRowsCounted()
	{
		return rowsCounted;
	}

	/**
	 * @return for every column, in the order they were requested, its values by descending count. Ties are ordered
	 * 		by the value text without string quotes, then by the value text itself.
	 */
	public List<ColumnFrequencies> getResult()
	{
		List<ColumnFrequencies> result = new ArrayList<>(counts.size());
		for (Map.Entry<LeafNode, Map<String, Long>> column : counts.entrySet())
		{
			List<FrequencyEntry> entries = new ArrayList<>(column.getValue().size());
			column.getValue().forEach((value, count) -> entries.add(new FrequencyEntry(value, count)));
			entries.sort(RANK_ORDER);
			result.add(new ColumnFrequencies(column.getKey().getDottedPath(), entries));
			LOG.debug("Column {} has {} distinct values in {} rows", column.getKey().getDottedPath(),
					entries.size(), rowsCounted);
		}
		return result;
	}

	/**
	 * Count the distinct values of leaf columns over a stream of rows
	 *
	 * @param rows        the rows
	 * @param schema      the root of the schema of the rows
	 * @param columnPaths dotted paths of leaf columns, matched ignoring case
	 * @return the ranked values of every column
	 * @throws InvalidColumnException if a path does not exist or names a group, before any row is read
	 */
	public static List<ColumnFrequencies> countFrequencies(Iterator<Value.GroupValue> rows, GroupNode schema,
			List<String> columnPaths)
	{
		return new FrequencyCounter(schema, columnPaths).addAll(rows).getResult();
	}

	/**
	 * @param node  a field on the path to the leaf
	 * @param value the value of the field, a list when the field is repeated
	 * @param path  the path of the leaf
	 * @param index the index in the path of the step below the field
	 */
	private static void collectField(SchemaNode node, Value value, List<String> path, int index, List<Value> out)
	{
		if (node.isRepeated())
		{
			for (Value element : ((Value.ListValue) value).getElements())
				collectInstance(node, element, path, index, out);
		}
		else if (value instanceof Value.Null)
		{
			out.add(value);
		}
		else
		{
			collectInstance(node, value, path, index, out);
		}
	}

	private static void collectInstance(SchemaNode node, Value value, List<String> path, int index, List<Value> out)
	{
		if (node.isLeaf())
		{
			out.add(value);
			return;
		}

		GroupNode group = (GroupNode) node;
		if (group.isList())
		{
			SchemaNode repeated = group.getChildren().get(0);
			SchemaNode element = group.getListElement();
			for (Value item : ((Value.ListValue) value).getElements())
			{
				if (element == repeated)
					collectInstance(repeated, item, path, index + 1, out);
				else
					collectField(element, item, path, index + 2, out);
			}
		}
		else if (group.isMap())
		{
			SchemaNode target = group.getMapKeyValue().getChild(path.get(index + 1));
			boolean key = target == group.getMapKey();
			for (Pair<Value, Value> entry : ((Value.MapValue) value).getEntries())
				collectField(target, key ? entry.getKey() : entry.getValue(), path, index + 2, out);
		}
		else
		{
			SchemaNode child = group.getChild(path.get(index));
			collectField(child, ((Value.GroupValue) value).get(child.getName()), path, index + 1, out);
		}
	}
}
