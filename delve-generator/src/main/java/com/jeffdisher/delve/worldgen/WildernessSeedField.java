package com.jeffdisher.delve.worldgen;

import com.jeffdisher.delve.utils.Assert;


/**
 * Stores the hashed-mode starting values for one wilderness region.  Each region corner is hashed from the corner's
 * own wilderness coordinate so the 2 regions sharing an edge also share its corner heights, which keeps the terrain
 * roughly tileable.  The interior is hashed from the region coordinate.
 */
public class WildernessSeedField
{
	/**
	 * A factory to create the seed field of the region at wildX/wildY with the given wilderness seed.
	 *
	 * @param seed The seed for the wilderness.
	 * @param wildX The wilderness column of the region.
	 * @param wildY The wilderness row of the region.
	 * @return The seeds for this region.
	 */
	public static WildernessSeedField buildForRegion(int seed, int wildX, int wildY)
	{
		int[][] corners = new int[2][2];
		for (int y = 0; y <= 1; ++y)
		{
			for (int x = 0; x <= 1; ++x)
			{
				corners[y][x] = _cornerHash(seed, wildX + x, wildY + y);
			}
		}
		return new WildernessSeedField(corners, _levelHash(seed, wildX, wildY));
	}

	private static int _cornerHash(int seed, int x, int y)
	{
		// These are not good hashes but they are stable, which is all a revisited region needs.
		return (x - y) ^ ((x + seed) & y);
	}

	private static int _levelHash(int seed, int x, int y)
	{
		return (y - x) ^ (y & (x + seed));
	}


	private final int[][] _corners;
	/**
	 * The starting value for everything generated inside the region.
	 */
	public final int levelSeed;

	private WildernessSeedField(int[][] corners, int levelSeed)
	{
		Assert.assertTrue(2 == corners.length);
		_corners = corners;
		this.levelSeed = levelSeed;
	}

	/**
	 * @param relX 0 for the left corners, 1 for the right.
	 * @param relY 0 for the top corners, 1 for the bottom.
	 * @return The starting value for that corner's height.
	 */
	public int getCorner(int relX, int relY)
	{
		return _corners[relY][relX];
	}
}
