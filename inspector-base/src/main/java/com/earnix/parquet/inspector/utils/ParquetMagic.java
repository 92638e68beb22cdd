package com.earnix.parquet.inspector.utils;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * The "PAR1" magic that opens and closes every parquet file, and the trailer that precedes the closing magic
 */
public final class ParquetMagic
{
	private static final byte[] MAGIC = "PAR1".getBytes(StandardCharsets.US_ASCII);

	public static final int MAGIC_LEN = MAGIC.length;

	/**
	 * Length of the trailer: the little endian footer length followed by the magic
	 */
	public static final int TRAILER_LEN = Integer.BYTES + MAGIC_LEN;

	private ParquetMagic()
	{
	}

	/**
	 * Consume the next {@link #MAGIC_LEN} bytes of the buffer and compare them to the magic
	 *
	 * @param buf the buffer, positioned where the magic is expected
	 * @return false if the bytes differ or the buffer is too short
	 */
	public static boolean matches(ByteBuffer buf)
	{
		if (buf.remaining() < MAGIC_LEN)
			return false;
		boolean matches = true;
		for (byte expected : MAGIC)
			matches &= buf.get() == expected;
		return matches;
	}

	public static byte[] magic()
	{
		return MAGIC.clone();
	}

	/**
	 * @param footerLen the length of the serialized footer
	 * @return the trailer that ends a file with such a footer
	 */
	public static byte[] trailer(int footerLen)
	{
		return ByteBuffer.allocate(TRAILER_LEN).order(ByteOrder.LITTLE_ENDIAN).putInt(footerLen).put(MAGIC).array();
	}
}
