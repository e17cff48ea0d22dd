package com.jeffdisher.delve.worldgen;

import com.jeffdisher.delve.data.CaveGrid;
import com.jeffdisher.delve.types.CellFlags;
import com.jeffdisher.delve.types.Feature;


/**
 * Veins and streams carved through an already-connected level.
 * Mineral streamers only replace granite.  Hazard streamers wander through anything which isn't protected, permanent
 * or a staircase (or, if they don't kill walls, anything which isn't open ground or a door).
 */
public class Streamers
{
	public static final int MINERAL_DENSITY = 5;
	public static final int MINERAL_RANGE = 2;
	public static final int HAZARD_DENSITY = 8;
	public static final int HAZARD_RANGE = 1;
	/**
	 * Streamers stop on leaving the level, which a wandering one might take a while to do.
	 */
	public static final int STEP_LIMIT = 10_000;
	public static final int NEARBY_ATTEMPTS = 100;

	private static final int[][] COMPASS = new int[][] {
			{-1, -1}, {-1, 0}, {-1, 1},
			{0, -1}, {0, 1},
			{1, -1}, {1, 0}, {1, 1},
	};

	/**
	 * Carves a straight vein of the given mineral through granite.
	 *
	 * @param vein MAGMA or QUARTZ.
	 * @param treasureChance 1 in this many vein cells shows its treasure.
	 * @param maxLength How many steps the streamer may take.
	 */
	public static void buildMineralStreamer(GenerationContext context, Feature vein, int treasureChance, int maxLength)
	{
		CaveGrid grid = context.grid;
		int y = context.random.range(1, grid.height - 2);
		int x = context.random.range(1, grid.width - 2);
		int[] dir = COMPASS[context.random.randomInt(COMPASS.length)];
		for (int length = 0; (length < maxLength) && grid.inBounds(y, x); ++length)
		{
			for (int i = 0; i < MINERAL_DENSITY; ++i)
			{
				int ty = context.random.spread(y, MINERAL_RANGE);
				int tx = context.random.spread(x, MINERAL_RANGE);
				if (grid.inBounds(ty, tx) && grid.getFeature(ty, tx).isGranite())
				{
					Feature feature = (0 == context.random.randomInt(treasureChance))
							? vein.withKnownTreasure()
							: vein
					;
					grid.setFeature(ty, tx, feature);
				}
			}
			y += dir[0];
			x += dir[1];
		}
	}

	/**
	 * Carves a stream of liquid, trees or fog.  Usually a wandering line, but 1 time in 5 the deep kinds form a pool
	 * instead.
	 *
	 * @param feature The feature to spread.
	 * @param killWalls True if the stream may replace walls and veins.
	 */
	public static void buildHazardStreamer(GenerationContext context, Feature feature, boolean killWalls)
	{
		CaveGrid grid = context.grid;
		int poolChance = context.random.roll(10);
		int y = context.random.spread(grid.height / 2, 10);
		int x = context.random.spread(grid.width / 2, 15);
		int[] dir = COMPASS[context.random.randomInt(COMPASS.length)];
		if (poolChance > 2)
		{
			for (int steps = 0; grid.inBounds(y, x) && (steps < STEP_LIMIT); ++steps)
			{
				for (int i = 0; i < (HAZARD_DENSITY + 1); ++i)
				{
					int ty = context.random.spread(y, HAZARD_RANGE);
					int tx = context.random.spread(x, HAZARD_RANGE);
					if (grid.inBounds(ty, tx) && _canReplace(grid, ty, tx, killWalls))
					{
						grid.setFeature(ty, tx, feature);
					}
				}
				y += dir[0];
				x += dir[1];
				if (1 == context.random.roll(20))
				{
					dir = COMPASS[context.random.randomInt(COMPASS.length)];
				}
			}
		}
		else if ((Feature.DEEP_WATER == feature) || (Feature.DEEP_LAVA == feature) || (Feature.CHAOS_FOG == feature))
		{
			buildPool(context, feature, y, x, 5 + context.random.roll(10));
		}
	}

	/**
	 * Fills a roughly round pool whose top-left corner is (y, x).
	 */
	public static void buildPool(GenerationContext context, Feature feature, int y, int x, int size)
	{
		CaveGrid grid = context.grid;
		int mid = size / 2;
		for (int i = 0; i < size; ++i)
		{
			for (int j = 0; j < size; ++j)
			{
				int ty = y + i;
				int tx = x + j;
				if (grid.inBounds(ty, tx) && isInsidePool(i, j, mid) && _canReplace(grid, ty, tx, true))
				{
					grid.setFeature(ty, tx, feature);
				}
			}
		}
	}

	/**
	 * The diamond-shaped inclusion test for a pool:  each corner of the square is cut off along a diagonal.
	 *
	 * @param i The row within the pool's square.
	 * @param j The column within the pool's square.
	 * @param mid Half the square's size.
	 * @return True if the cell is part of the pool.
	 */
	public static boolean isInsidePool(int i, int j, int mid)
	{
		boolean inside;
		if (i < mid)
		{
			if (j < mid)
			{
				inside = (i + j + 1) >= mid;
			}
			else
			{
				inside = j <= (mid + i);
			}
		}
		else if (j < mid)
		{
			inside = i <= (mid + j);
		}
		else
		{
			inside = (i + j) <= ((mid * 3) - 1);
		}
		return inside;
	}


	private static boolean _canReplace(CaveGrid grid, int y, int x, boolean killWalls)
	{
		Feature existing = grid.getFeature(y, x);
		boolean isBlocked = killWalls
				? existing.isPermanent()
				: existing.isWallOrVein()
		;
		return !grid.hasFlag(y, x, CellFlags.ICKY)
				&& !isBlocked
				&& !existing.isStairs()
		;
	}
}
