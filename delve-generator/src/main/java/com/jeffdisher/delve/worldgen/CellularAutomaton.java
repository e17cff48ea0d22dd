package com.jeffdisher.delve.worldgen;

import com.jeffdisher.delve.data.CaveGrid;
import com.jeffdisher.delve.types.Feature;


/**
 * The majority rule used to grow dark mazes:  a wall survives with at least 4 walls among its 8 neighbours and a floor
 * cell becomes wall with at least 5.  Cells beyond the edge of the grid count as wall.  Cells outside the region but
 * inside the grid count as whatever they are, so a region inside uniform terrain does not change.
 * A step reads the old state of every cell before writing any of them.
 */
public class CellularAutomaton
{
	public static final int WALL_SURVIVES = 4;
	public static final int FLOOR_FILLS = 5;

	/**
	 * Applies the rule to the inclusive region the given number of times.
	 */
	public static void run(CaveGrid grid, int y1, int x1, int y2, int x2, int iterations)
	{
		for (int i = 0; i < iterations; ++i)
		{
			step(grid, y1, x1, y2, x2);
		}
	}

	/**
	 * Applies the rule to the inclusive region once.  Only cells which change state are written:  new walls are
	 * WALL_EXTRA and new floors are FLOOR.
	 *
	 * @return The number of cells which changed.
	 */
	public static int step(CaveGrid grid, int y1, int x1, int y2, int x2)
	{
		int height = y2 - y1 + 1;
		int width = x2 - x1 + 1;
		boolean[][] next = new boolean[height][width];
		for (int y = y1; y <= y2; ++y)
		{
			for (int x = x1; x <= x2; ++x)
			{
				int walls = _countWallNeighbours(grid, y, x);
				next[y - y1][x - x1] = _isWall(grid, y, x)
						? (walls >= WALL_SURVIVES)
						: (walls >= FLOOR_FILLS)
				;
			}
		}
		int changed = 0;
		for (int y = y1; y <= y2; ++y)
		{
			for (int x = x1; x <= x2; ++x)
			{
				boolean wall = next[y - y1][x - x1];
				if (wall != _isWall(grid, y, x))
				{
					grid.setFeature(y, x, wall ? Feature.WALL_EXTRA : Feature.FLOOR);
					changed += 1;
				}
			}
		}
		return changed;
	}


	private static int _countWallNeighbours(CaveGrid grid, int y, int x)
	{
		int count = 0;
		for (int dy = -1; dy <= 1; ++dy)
		{
			for (int dx = -1; dx <= 1; ++dx)
			{
				if (((0 != dy) || (0 != dx)) && _isWall(grid, y + dy, x + dx))
				{
					count += 1;
				}
			}
		}
		return count;
	}

	private static boolean _isWall(CaveGrid grid, int y, int x)
	{
		return !grid.inBounds(y, x) || grid.getFeature(y, x).isWallOrVein();
	}
}
