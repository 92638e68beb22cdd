package com.earnix.parquet.inspector.file.reader;

import com.earnix.parquet.inspector.reader.ParquetByteSource;
import org.apache.commons.io.input.BoundedInputStream;
import org.apache.parquet.format.FileMetaData;

import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Path;

/**
 * A {@link ParquetByteSource} over a local file. Every range is read through its own channel.
 */
public class ParquetFileByteSource implements ParquetByteSource
{
	private final Path path;

	public ParquetFileByteSource(Path path)
	{
		this.path = path;
	}

	@Override
	public FileMetaData readFooter() throws IOException
	{
		return ParquetFileMetadataReader.readFileMetadata(path);
	}

	/**
	 * @throws IOException on failure to open the file, or if the file ends before the range does
	 */
	@Override
	public InputStream openRange(long startOffset, long numBytesToRead) throws IOException
	{
		FileChannel fc = FileChannel.open(path);
		try
		{
			long fileLen = fc.size();
			if (fileLen < startOffset)
			{
				throw new IOException(
						"File " + path + " ends before startOffset: " + startOffset + " size: " + fileLen);
			}
			if (fileLen - startOffset < numBytesToRead)
			{
				throw new IOException(
						"File " + path + " ends before end offset: " + startOffset + " len: " + numBytesToRead
								+ " size: " + fileLen);
			}
			fc.position(startOffset);
			// closing the returned stream closes the channel
			return BoundedInputStream.builder().setInputStream(Channels.newInputStream(fc)).setMaxCount(numBytesToRead)
					.get();
		}
		catch (IOException | RuntimeException ex)
		{
			fc.close();
			throw ex;
		}
	}

	@Override
	public String describe()
	{
		return path.toString();
	}

	public Path getPath()
	{
		return path;
	}
}
