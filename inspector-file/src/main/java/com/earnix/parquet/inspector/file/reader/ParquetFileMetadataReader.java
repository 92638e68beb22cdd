package com.earnix.parquet.inspector.file.reader;

import com.earnix.parquet.inspector.reader.MetadataException;
import com.earnix.parquet.inspector.reader.ParquetMetadataUtils;
import com.earnix.parquet.inspector.utils.ParquetMagic;
import org.apache.commons.io.IOUtils;
import org.apache.commons.io.input.BoundedInputStream;
import org.apache.parquet.format.FileMetaData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Path;

/**
 * Reads the footer of a local parquet file
 */
public class ParquetFileMetadataReader
{
	private static final Logger LOG = LoggerFactory.getLogger(ParquetFileMetadataReader.class);

	private static final int MIN_FILE_LEN = ParquetMagic.MAGIC_LEN
			+ ParquetMagic.TRAILER_LEN;

	/**
	 * Validate the magic at both ends of the file and decode the footer
	 *
	 * @param path the parquet file
	 * @return the footer metadata
	 * @throws IOException       on failure to read the file
	 * @throws MetadataException if the file is not a parquet file or its footer cannot be decoded
	 */
	public static FileMetaData readFileMetadata(Path path) throws IOException
	{
		try (FileChannel fc = FileChannel.open(path))
		{
			LOG.debug("Reading footer of {}", path);
			return readFileMetadata(fc);
		}
	}

	static FileMetaData readFileMetadata(FileChannel fc) throws IOException
	{
		long fileSize = fc.size();
		if (fileSize < MIN_FILE_LEN)
			throw new MetadataException("Invalid Parquet file. Size is smaller than footer");

		ByteBuffer trailer = ByteBuffer.allocate(ParquetMagic.TRAILER_LEN);
		fc.position(fileSize - ParquetMagic.TRAILER_LEN);
		IOUtils.readFully(fc, trailer);
		trailer.flip();
		int footerLen = ParquetMetadataUtils.readFooterLength(trailer, fileSize);

		ByteBuffer head = ByteBuffer.allocate(ParquetMagic.MAGIC_LEN);
		fc.position(0L);
		IOUtils.readFully(fc, head);
		head.flip();
		if (!ParquetMagic.matches(head))
			throw new MetadataException("Invalid Parquet file. Magic bytes not found at the start of the file");

		long footerStart = fileSize - ParquetMagic.TRAILER_LEN - footerLen;
		LOG.debug("Footer is {} bytes starting at {}", footerLen, footerStart);
		fc.position(footerStart);
		InputStream is = BoundedInputStream.builder().setInputStream(Channels.newInputStream(fc))
				.setMaxCount(footerLen).setPropagateClose(false).get();
		return ParquetMetadataUtils.readFileMetaData(is);
	}
}
