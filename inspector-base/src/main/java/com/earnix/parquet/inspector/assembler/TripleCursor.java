package com.earnix.parquet.inspector.assembler;

/**
 * A forward cursor over the (value, repetition level, definition level) triples of one leaf column in one row group.
 * A cursor starts positioned on the first triple.
 */
public interface TripleCursor
{
	/**
	 * @return whether the cursor is positioned on a triple, false once all triples were consumed
	 */
	boolean hasCurrent();

	int getRepetitionLevel();

	int getDefinitionLevel();

	/**
	 * @return the payload of the current triple. Only valid when the definition level is the column maximum.
	 */
	Object getValue();

	/**
	 * Move to the next triple
	 */
	void advance();
}
