package com.earnix.parquet.inspector.assembler;

import com.earnix.parquet.inspector.schema.LeafNode;

/**
 * Wraps the cursor of a leaf and checks every triple it lands on against the levels of the leaf. An exhausted cursor
 * reports level 0, so repeated readers stop at the end of the column.
 */
class LeafCursor
{
	private final LeafNode leaf;
	private final TripleCursor cursor;
	private final int rowGroup;

	LeafCursor(LeafNode leaf, TripleCursor cursor, int rowGroup)
	{
		this.leaf = leaf;
		this.cursor = cursor;
		this.rowGroup = rowGroup;
		validateLevels();
	}

	LeafNode getLeaf()
	{
		return leaf;
	}

	boolean isExhausted()
	{
		return !cursor.hasCurrent();
	}

	int repetitionLevel()
	{
		return cursor.hasCurrent() ? cursor.getRepetitionLevel() : 0;
	}

	int definitionLevel()
	{
		return cursor.hasCurrent() ? cursor.getDefinitionLevel() : 0;
	}

	/**
	 * @return the value of the current triple, which must be defined, then move to the next triple
	 */
	Object readValue()
	{
		requireCurrent();
		if (cursor.getDefinitionLevel() != leaf.getMaxDefinitionLevel())
		{
			throw fail("expected a value at definition level " + leaf.getMaxDefinitionLevel() + " but found level "
					+ cursor.getDefinitionLevel());
		}
		Object value = cursor.getValue();
		advance();
		return value;
	}

	/**
	 * Consume the current triple, which stands for a null or an empty list at or above the given definition level
	 *
	 * @param maxDefinitionLevel the highest definition level the null slot may have
	 */
	void skipNull(int maxDefinitionLevel)
	{
		requireCurrent();
		if (cursor.getDefinitionLevel() > maxDefinitionLevel)
		{
			throw fail("expected a null at definition level " + maxDefinitionLevel + " or below but found level "
					+ cursor.getDefinitionLevel() + ", sibling columns are out of step");
		}
		advance();
	}

	private void advance()
	{
		cursor.advance();
		validateLevels();
	}

	private void requireCurrent()
	{
		if (!cursor.hasCurrent())
			throw fail("column has no more values");
	}

	private void validateLevels()
	{
		if (!cursor.hasCurrent())
			return;
		int rep = cursor.getRepetitionLevel();
		int def = cursor.getDefinitionLevel();
		if (rep < 0 || rep > leaf.getMaxRepetitionLevel())
			throw fail("repetition level " + rep + " outside of [0, " + leaf.getMaxRepetitionLevel() + "]");
		if (def < 0 || def > leaf.getMaxDefinitionLevel())
			throw fail("definition level " + def + " outside of [0, " + leaf.getMaxDefinitionLevel() + "]");
	}

	AssemblyException fail(String message)
	{
		return new AssemblyException(rowGroup, "column " + leaf.getDottedPath() + ": " + message);
	}
}
