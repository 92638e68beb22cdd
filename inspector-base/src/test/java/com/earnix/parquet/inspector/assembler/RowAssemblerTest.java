package com.earnix.parquet.inspector.assembler;

import com.earnix.parquet.inspector.schema.GroupNode;
import com.earnix.parquet.inspector.schema.LeafNode;
import com.earnix.parquet.inspector.schema.SchemaNodes;
import com.earnix.parquet.inspector.value.Value;
import com.earnix.parquet.inspector.value.ValueFormatter;
import org.apache.parquet.schema.MessageTypeParser;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

public class RowAssemblerTest
{
	private static final String USER_SCHEMA = "message user { required binary name (UTF8); "
			+ "optional binary favorite_color (UTF8); "
			+ "required group favorite_numbers (LIST) { repeated int32 array; } }";

	private static final String DOCUMENT_SCHEMA = "message Document { required int64 DocId; "
			+ "optional group Links { repeated int64 Backward; repeated int64 Forward; } "
			+ "repeated group Name { repeated group Language { required binary Code (UTF8); "
			+ "optional binary Country (UTF8); } optional binary Url (UTF8); } }";

	@Test
	public void testListWithNullAndEmptyList()
	{
		GroupNode root = schema(USER_SCHEMA);
		Map<LeafNode, TripleCursor> cursors = new HashMap<>();
		cursors.put(leaf(root, "name"), new ListTripleCursor().add("Alyssa", 0, 0).add("Ben", 0, 0));
		cursors.put(leaf(root, "favorite_color"), new ListTripleCursor().add(null, 0, 0).add("red", 0, 1));
		cursors.put(leaf(root, "favorite_numbers.array"),
				new ListTripleCursor().add(3, 0, 1).add(9, 1, 1).add(15, 1, 1).add(20, 1, 1).add(null, 0, 0));

		List<String> rows = assembleAndFormat(root, cursors, 2);
		assertEquals(List.of("{name: \"Alyssa\", favorite_color: null, favorite_numbers: [3, 9, 15, 20]}",
				"{name: \"Ben\", favorite_color: \"red\", favorite_numbers: []}"), rows);
	}

	@Test
	public void testRowsKeepSchemaFieldOrder()
	{
		GroupNode root = schema(USER_SCHEMA);
		Map<LeafNode, TripleCursor> cursors = new HashMap<>();
		cursors.put(leaf(root, "name"), new ListTripleCursor().add("Ben", 0, 0));
		cursors.put(leaf(root, "favorite_color"), new ListTripleCursor().add("red", 0, 1));
		cursors.put(leaf(root, "favorite_numbers.array"), new ListTripleCursor().add(null, 0, 0));

		Value.GroupValue row = RowAssembler.assemble(root, cursors, 0, 1).next();
		assertEquals(List.of("name", "favorite_color", "favorite_numbers"), new ArrayList<>(row.getFields().keySet()));
		Assert.assertTrue(row.get("favorite_numbers") instanceof Value.ListValue);
	}

	@Test
	public void testDremelDocuments()
	{
		GroupNode root = schema(DOCUMENT_SCHEMA);
		Map<LeafNode, TripleCursor> cursors = new HashMap<>();
		cursors.put(leaf(root, "DocId"), new ListTripleCursor().add(10L, 0, 0).add(20L, 0, 0));
		cursors.put(leaf(root, "Links.Backward"),
				new ListTripleCursor().add(null, 0, 1).add(10L, 0, 2).add(30L, 1, 2));
		cursors.put(leaf(root, "Links.Forward"),
				new ListTripleCursor().add(20L, 0, 2).add(40L, 1, 2).add(60L, 1, 2).add(80L, 0, 2));
		cursors.put(leaf(root, "Name.Language.Code"), new ListTripleCursor().add("en-us", 0, 2).add("en", 2, 2)
				.add(null, 1, 1).add("en-gb", 1, 2).add(null, 0, 1));
		cursors.put(leaf(root, "Name.Language.Country"), new ListTripleCursor().add("us", 0, 3).add(null, 2, 2)
				.add(null, 1, 1).add("gb", 1, 3).add(null, 0, 1));
		cursors.put(leaf(root, "Name.Url"),
				new ListTripleCursor().add("http://A", 0, 2).add("http://B", 1, 2).add(null, 1, 1)
						.add("http://C", 0, 2));

		List<String> rows = assembleAndFormat(root, cursors, 2);
		assertEquals("{DocId: 10, Links: {Backward: [], Forward: [20, 40, 60]}, Name: ["
				+ "{Language: [{Code: \"en-us\", Country: \"us\"}, {Code: \"en\", Country: null}], Url: \"http://A\"}, "
				+ "{Language: [], Url: \"http://B\"}, "
				+ "{Language: [{Code: \"en-gb\", Country: \"gb\"}], Url: null}]}", rows.get(0));
		assertEquals("{DocId: 20, Links: {Backward: [10, 30], Forward: [80]}, Name: ["
				+ "{Language: [], Url: \"http://C\"}]}", rows.get(1));
	}

	@Test
	public void testThreeLevelListWithNullElements()
	{
		GroupNode root = schema("message m { optional group tags (LIST) { repeated group list { "
				+ "optional binary element (UTF8); } } }");
		Map<LeafNode, TripleCursor> cursors = new HashMap<>();
		cursors.put(leaf(root, "tags.list.element"), new ListTripleCursor().add(null, 0, 0).add(null, 0, 1)
				.add("a", 0, 3).add(null, 1, 2).add("b", 1, 3));

		assertEquals(List.of("{tags: null}", "{tags: []}", "{tags: [\"a\", null, \"b\"]}"),
				assembleAndFormat(root, cursors, 3));
	}

	@Test
	public void testTwoLevelListOfGroups()
	{
		GroupNode root = schema("message m { optional group points (LIST) { repeated group array { "
				+ "required int32 x; required int32 y; } } }");
		Map<LeafNode, TripleCursor> cursors = new HashMap<>();
		cursors.put(leaf(root, "points.array.x"), new ListTripleCursor().add(1, 0, 2).add(3, 1, 2));
		cursors.put(leaf(root, "points.array.y"), new ListTripleCursor().add(2, 0, 2).add(4, 1, 2));

		assertEquals(List.of("{points: [{x: 1, y: 2}, {x: 3, y: 4}]}"), assembleAndFormat(root, cursors, 1));
	}

	@Test
	public void testRepeatedFieldWithoutListAnnotation()
	{
		GroupNode root = schema("message m { repeated int32 numbers; }");
		Map<LeafNode, TripleCursor> cursors = new HashMap<>();
		cursors.put(leaf(root, "numbers"),
				new ListTripleCursor().add(1, 0, 1).add(2, 1, 1).add(null, 0, 0).add(7, 0, 1));

		assertEquals(List.of("{numbers: [1, 2]}", "{numbers: []}", "{numbers: [7]}"),
				assembleAndFormat(root, cursors, 3));
	}

	@Test
	public void testMap()
	{
		GroupNode root = schema("message m { required group props (MAP) { repeated group key_value { "
				+ "required binary key (UTF8); optional int32 value; } } }");
		Map<LeafNode, TripleCursor> cursors = new HashMap<>();
		cursors.put(leaf(root, "props.key_value.key"),
				new ListTripleCursor().add("a", 0, 1).add("b", 1, 1).add(null, 0, 0));
		cursors.put(leaf(root, "props.key_value.value"),
				new ListTripleCursor().add(1, 0, 2).add(null, 1, 1).add(null, 0, 0));

		List<Value.GroupValue> rows = assemble(root, cursors, 2);
		Assert.assertTrue(rows.get(0).get("props") instanceof Value.MapValue);
		assertEquals("{props: {\"a\" -> 1, \"b\" -> null}}", ValueFormatter.format(rows.get(0)));
		assertEquals("{props: {}}", ValueFormatter.format(rows.get(1)));
	}

	@Test
	public void testProjectedRoot()
	{
		GroupNode root = schema(USER_SCHEMA);
		GroupNode projection = SchemaNodes.selectFields(root, List.of("FAVORITE_COLOR"));
		Map<LeafNode, TripleCursor> cursors = new HashMap<>();
		cursors.put(leaf(root, "favorite_color"), new ListTripleCursor().add(null, 0, 0).add("red", 0, 1));

		assertEquals(List.of("{favorite_color: null}", "{favorite_color: \"red\"}"),
				assembleAndFormat(projection, cursors, 2));
	}

	@Test
	public void testRootWithoutColumns()
	{
		GroupNode projection = schema(USER_SCHEMA).project(Collections.emptyList());
		assertEquals(List.of("{}", "{}"), assembleAndFormat(projection, Collections.emptyMap(), 2));
	}

	@Test
	public void testEmptyRowGroup()
	{
		GroupNode root = schema("message m { required int32 a; }");
		Map<LeafNode, TripleCursor> cursors = new HashMap<>();
		cursors.put(leaf(root, "a"), new ListTripleCursor());
		Assert.assertFalse(RowAssembler.assemble(root, cursors, 0, 0).hasNext());
	}

	@Test
	public void testRepetitionLevelAboveMaximum()
	{
		GroupNode root = schema(USER_SCHEMA);
		Map<LeafNode, TripleCursor> cursors = userCursors(root);
		cursors.put(leaf(root, "name"), new ListTripleCursor().add("Alyssa", 0, 0).add("Ben", 1, 0));

		AssemblyException ex = assertThrows(AssemblyException.class,
				() -> assembleAndFormat(root, cursors, 2, 3));
		assertEquals(3, ex.getRowGroup());
		Assert.assertTrue(ex.getMessage(), ex.getMessage().startsWith("Row group 3: column name: repetition level 1"));
	}

	@Test
	public void testDefinitionLevelAboveMaximum()
	{
		GroupNode root = schema(USER_SCHEMA);
		Map<LeafNode, TripleCursor> cursors = userCursors(root);
		cursors.put(leaf(root, "favorite_color"), new ListTripleCursor().add(null, 0, 0).add("red", 0, 2));

		AssemblyException ex = assertThrows(AssemblyException.class, () -> assembleAndFormat(root, cursors, 2, 1));
		assertEquals(1, ex.getRowGroup());
		Assert.assertTrue(ex.getMessage(), ex.getMessage().contains("definition level 2"));
	}

	@Test
	public void testRowNotStartingAtRepetitionLevelZero()
	{
		GroupNode root = schema(USER_SCHEMA);
		Map<LeafNode, TripleCursor> cursors = userCursors(root);
		cursors.put(leaf(root, "favorite_numbers.array"),
				new ListTripleCursor().add(3, 1, 1).add(null, 0, 0));

		AssemblyException ex = assertThrows(AssemblyException.class, () -> assembleAndFormat(root, cursors, 2));
		Assert.assertTrue(ex.getMessage(), ex.getMessage().contains("starts at repetition level 1"));
	}

	@Test
	public void testRequiredLeafWithoutValue()
	{
		GroupNode root = schema("message m { optional group a { required int32 b; required int32 c; } }");
		Map<LeafNode, TripleCursor> cursors = new HashMap<>();
		cursors.put(leaf(root, "a.b"), new ListTripleCursor().add(1, 0, 1));
		cursors.put(leaf(root, "a.c"), new ListTripleCursor().add(null, 0, 0));

		AssemblyException ex = assertThrows(AssemblyException.class, () -> assembleAndFormat(root, cursors, 1));
		Assert.assertTrue(ex.getMessage(), ex.getMessage().contains("column a.c"));
	}

	@Test
	public void testSiblingsOutOfStep()
	{
		GroupNode root = schema("message m { optional group a { required int32 b; required int32 c; } }");
		Map<LeafNode, TripleCursor> cursors = new HashMap<>();
		cursors.put(leaf(root, "a.b"), new ListTripleCursor().add(null, 0, 0));
		cursors.put(leaf(root, "a.c"), new ListTripleCursor().add(5, 0, 1));

		AssemblyException ex = assertThrows(AssemblyException.class, () -> assembleAndFormat(root, cursors, 1));
		Assert.assertTrue(ex.getMessage(), ex.getMessage().contains("out of step"));
	}

	@Test
	public void testFewerValuesThanRows()
	{
		GroupNode root = schema(USER_SCHEMA);
		Map<LeafNode, TripleCursor> cursors = userCursors(root);

		AssemblyException ex = assertThrows(AssemblyException.class, () -> assembleAndFormat(root, cursors, 3));
		Assert.assertTrue(ex.getMessage(), ex.getMessage().contains("ran out of values after 2 of 3 rows"));
	}

	@Test
	public void testMoreValuesThanRows()
	{
		GroupNode root = schema(USER_SCHEMA);
		Map<LeafNode, TripleCursor> cursors = userCursors(root);

		Iterator<Value.GroupValue> rows = RowAssembler.assemble(root, cursors, 0, 1);
		AssemblyException ex = assertThrows(AssemblyException.class, rows::next);
		Assert.assertTrue(ex.getMessage(), ex.getMessage().contains("values left over"));
	}

	@Test
	public void testMissingCursor()
	{
		GroupNode root = schema(USER_SCHEMA);
		Map<LeafNode, TripleCursor> cursors = userCursors(root);
		cursors.remove(leaf(root, "favorite_color"));

		AssemblyException ex = assertThrows(AssemblyException.class,
				() -> RowAssembler.assemble(root, cursors, 5, 2));
		assertEquals(5, ex.getRowGroup());
	}

	private static Map<LeafNode, TripleCursor> userCursors(GroupNode root)
	{
		Map<LeafNode, TripleCursor> cursors = new HashMap<>();
		cursors.put(leaf(root, "name"), new ListTripleCursor().add("Alyssa", 0, 0).add("Ben", 0, 0));
		cursors.put(leaf(root, "favorite_color"), new ListTripleCursor().add(null, 0, 0).add("red", 0, 1));
		cursors.put(leaf(root, "favorite_numbers.array"),
				new ListTripleCursor().add(3, 0, 1).add(null, 0, 0));
		return cursors;
	}

	private static List<Value.GroupValue> assemble(GroupNode root, Map<LeafNode, TripleCursor> cursors,
			long rowCount)
	{
		List<Value.GroupValue> rows = new ArrayList<>();
		RowAssembler.assemble(root, cursors, 0, rowCount).forEachRemaining(rows::add);
		assertEquals(rowCount, rows.size());
		return rows;
	}

	private static List<String> assembleAndFormat(GroupNode root, Map<LeafNode, TripleCursor> cursors, long rowCount)
	{
		return assembleAndFormat(root, cursors, rowCount, 0);
	}

	private static List<String> assembleAndFormat(GroupNode root, Map<LeafNode, TripleCursor> cursors, long rowCount,
			int rowGroup)
	{
		List<String> rows = new ArrayList<>();
		RowAssembler.assemble(root, cursors, rowGroup, rowCount)
				.forEachRemaining(row -> rows.add(ValueFormatter.format(row)));
		return rows;
	}

	private static GroupNode schema(String schema)
	{
		return SchemaNodes.fromMessageType(MessageTypeParser.parseMessageType(schema));
	}

	private static LeafNode leaf(GroupNode root, String path)
	{
		return SchemaNodes.resolveLeaf(root, path);
	}
}
