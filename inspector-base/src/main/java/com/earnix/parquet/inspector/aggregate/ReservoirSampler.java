package com.earnix.parquet.inspector.aggregate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Random;

/**
 * Uniform sampling of a stream of unknown length in a single pass (Vitter's Algorithm R)
 */
public class ReservoirSampler
{
	private static final Logger LOG = LoggerFactory.getLogger(ReservoirSampler.class);

	private ReservoirSampler()
	{
	}

	/**
	 * Draw a uniform sample without replacement. The i-th item (counting from 1) fills slot i-1 while the reservoir
	 * is not full, afterwards it replaces slot j-1 when j drawn uniformly from [1, i] is at most k.
	 *
	 * @param items  the stream to sample. It is consumed entirely, unless k is 0.
	 * @param k      the sample size
	 * @param random the source of randomness. Use a seeded instance for a reproducible sample.
	 * @param <T>    the item type
	 * @return min(k, n) items in reservoir slot order, which is not the stream order
	 * @throws InvalidSampleSizeException if k is negative, before the stream is read
	 */
	public static <T> List<T> sample(Iterator<T> items, int k, Random random)
	{
		if (k < 0)
			throw new InvalidSampleSizeException(k);
		List<T> reservoir = new ArrayList<>(Math.min(k, 1024));
		if (k == 0)
			return reservoir;

		long i = 0;
		while (items.hasNext())
		{
			T item = items.next();
			i++;
			if (i <= k)
			{
				reservoir.add(item);
			}
			else
			{
				long j = random.nextLong(i) + 1;
				if (j <= k)
					reservoir.set((int) (j - 1), item);
			}
		}
		LOG.debug("Sampled {} of {} items", reservoir.size(), i);
		return reservoir;
	}
}
