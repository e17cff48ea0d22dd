package com.jeffdisher.delve.worldgen;

import java.util.List;

import com.jeffdisher.delve.config.IValueTransformer.RunLengthPair;
import com.jeffdisher.delve.config.TabListReader;


/**
 * Expands a run-length encoded vault layer into one symbol per cell, in row-major order.
 */
public class RunLengthDecoder
{
	/**
	 * Decodes the pairs, walking the cells in row-major order:  each cell takes the symbol of the current pair and
	 * consumes one of its count, moving to the next pair once the count reaches zero.
	 *
	 * @param pairs The encoded layer.
	 * @param width The width of the vault.
	 * @param height The height of the vault.
	 * @return The symbols, width*height of them.
	 * @throws TabListReader.TabListException The pairs don't cover exactly width*height cells.
	 */
	public static char[] decode(List<RunLengthPair> pairs, int width, int height) throws TabListReader.TabListException
	{
		char[] cells = new char[width * height];
		int pairIndex = 0;
		int remaining = pairs.isEmpty() ? 0 : pairs.get(0).count();
		for (int i = 0; i < cells.length; ++i)
		{
			if (0 == remaining)
			{
				pairIndex += 1;
				if (pairIndex >= pairs.size())
				{
					throw new TabListReader.TabListException("Layer ends after " + i + " of " + cells.length + " cells");
				}
				remaining = pairs.get(pairIndex).count();
			}
			cells[i] = pairs.get(pairIndex).symbol();
			remaining -= 1;
		}
		if ((remaining > 0) || (pairIndex < (pairs.size() - 1)))
		{
			throw new TabListReader.TabListException("Layer has more than " + cells.length + " cells");
		}
		return cells;
	}
}
