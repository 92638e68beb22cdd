package com.earnix.parquet.inspector.cli;

import com.earnix.parquet.inspector.schema.GroupNode;
import com.earnix.parquet.inspector.schema.SchemaNode;
import com.earnix.parquet.inspector.value.Value;
import com.earnix.parquet.inspector.value.ValueFormatter;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns rows into table cells, one per top level field
 */
class RowCells
{
	private RowCells()
	{
	}

	static List<String> headers(GroupNode schema)
	{
		List<String> headers = new ArrayList<>(schema.getChildren().size());
		for (SchemaNode field : schema.getChildren())
			headers.add(field.getName());
		return headers;
	}

	static List<String> cells(Value.GroupValue row)
	{
		List<String> cells = new ArrayList<>(row.getFields().size());
		for (Value field : row.getFields().values())
			cells.add(ValueFormatter.format(field));
		return cells;
	}

	static List<List<String>> cells(Iterable<Value.GroupValue> rows)
	{
		List<List<String>> cells = new ArrayList<>();
		for (Value.GroupValue row : rows)
			cells.add(cells(row));
		return cells;
	}
}
