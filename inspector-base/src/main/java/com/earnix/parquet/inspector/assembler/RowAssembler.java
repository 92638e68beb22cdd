package com.earnix.parquet.inspector.assembler;

import com.earnix.parquet.inspector.schema.GroupNode;
import com.earnix.parquet.inspector.schema.LeafNode;
import com.earnix.parquet.inspector.value.Value;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Rebuilds the nested rows of one row group from the striped (value, repetition level, definition level) triples of
 * its leaf columns.
 */
public class RowAssembler
{
	private RowAssembler()
	{
	}

	/**
	 * Assemble the rows of a row group. Rows are assembled lazily, as the returned iterator is consumed.
	 *
	 * @param root          the schema of the rows. Projected roots produce rows with the projected fields only.
	 * @param cursors       a cursor for every leaf below the root, positioned on its first triple
	 * @param rowGroupIndex the index of the row group, reported in assembly errors
	 * @param rowCount      the number of rows the row group declares
	 * @return the rows, in storage order
	 * @throws AssemblyException when a leaf has no cursor or the triples of the leaves do not fit the schema
	 */
	public static Iterator<Value.GroupValue> assemble(GroupNode root, Map<LeafNode, ? extends TripleCursor> cursors,
			int rowGroupIndex, long rowCount)
	{
		List<LeafNode> leaves = root.getLeaves();
		Map<LeafNode, LeafCursor> leafCursors = new LinkedHashMap<>();
		for (LeafNode leaf : leaves)
		{
			TripleCursor cursor = cursors.get(leaf);
			if (cursor == null)
				throw new AssemblyException(rowGroupIndex, "no values for column " + leaf.getDottedPath());
			leafCursors.put(leaf, new LeafCursor(leaf, cursor, rowGroupIndex));
		}
		FieldAssemblers.FieldAssembler assembler = FieldAssemblers.forRoot(root, leafCursors);
		return new RowIterator(assembler, leafCursors.values(), rowCount);
	}

	private static class RowIterator implements Iterator<Value.GroupValue>
	{
		private final FieldAssemblers.FieldAssembler assembler;
		private final Iterable<LeafCursor> cursors;
		private final long rowCount;
		private long rowsRead = 0;

		RowIterator(FieldAssemblers.FieldAssembler assembler, Iterable<LeafCursor> cursors, long rowCount)
		{
			this.assembler = assembler;
			this.cursors = cursors;
			this.rowCount = rowCount;
			if (rowCount == 0)
				checkExhausted();
		}

		@Override
		public boolean hasNext()
		{
			return rowsRead < rowCount;
		}

		@Override
		public Value.GroupValue next()
		{
			if (!hasNext())
				throw new NoSuchElementException();
			for (LeafCursor cursor : cursors)
			{
				if (cursor.isExhausted())
					throw cursor.fail("ran out of values after " + rowsRead + " of " + rowCount + " rows");
				if (cursor.repetitionLevel() != 0)
				{
					throw cursor.fail("row " + rowsRead + " starts at repetition level " + cursor.repetitionLevel()
							+ " instead of 0");
				}
			}
			Value.GroupValue row = (Value.GroupValue) assembler.read();
			rowsRead++;
			if (rowsRead == rowCount)
				checkExhausted();
			return row;
		}

		private void checkExhausted()
		{
			for (LeafCursor cursor : cursors)
			{
				if (!cursor.isExhausted())
					throw cursor.fail("values left over after the last of " + rowCount + " rows");
			}
		}
	}
}
