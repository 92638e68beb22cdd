package com.earnix.parquet.inspector.reader.chunk.internal;

import com.earnix.parquet.inspector.reader.MetadataException;
import com.github.luben.zstd.Zstd;
import org.apache.commons.io.IOUtils;
import org.apache.parquet.format.CompressionCodec;
import org.xerial.snappy.Snappy;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.zip.GZIPInputStream;

/**
 * Inflates the stored bytes of a page. The result must have exactly the uncompressed size of the page header.
 */
@FunctionalInterface
interface PageDecompressor
{
	byte[] inflate(byte[] stored, int uncompressedLen) throws IOException;

	default byte[] decompress(byte[] stored, int uncompressedLen) throws IOException
	{
		// an empty section stays empty whatever the codec
		if (stored.length == 0)
			return ColumnChunkPageDecoder.checkLength(stored, uncompressedLen);
		return ColumnChunkPageDecoder.checkLength(inflate(stored, uncompressedLen), uncompressedLen);
	}

	/**
	 * @param codec the codec of the column chunk
	 * @return the decompressor for the codec
	 * @throws MetadataException if the codec is not supported
	 */
	static PageDecompressor forCodec(CompressionCodec codec)
	{
		switch (codec)
		{
			case UNCOMPRESSED:
				return (stored, uncompressedLen) -> stored;
			case SNAPPY:
				return (stored, uncompressedLen) -> Snappy.uncompress(stored);
			case GZIP:
				return PageDecompressor::gunzip;
			case ZSTD:
				return PageDecompressor::unzstd;
			default:
				throw new MetadataException("Unsupported compression codec " + codec);
		}
	}

	private static byte[] gunzip(byte[] stored, int uncompressedLen) throws IOException
	{
		try (InputStream gzip = new GZIPInputStream(new ByteArrayInputStream(stored)))
		{
			return IOUtils.toByteArray(gzip);
		}
	}

	private static byte[] unzstd(byte[] stored, int uncompressedLen) throws IOException
	{
		byte[] out = new byte[uncompressedLen];
		long code = Zstd.decompress(out, stored);
		if (Zstd.isError(code))
			throw new IOException("zstd decompression failed: " + Zstd.getErrorName(code));
		return out;
	}
}
