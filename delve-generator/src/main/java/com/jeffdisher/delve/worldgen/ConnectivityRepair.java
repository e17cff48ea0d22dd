package com.jeffdisher.delve.worldgen;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;

import com.jeffdisher.delve.data.CaveGrid;
import com.jeffdisher.delve.types.CellFlags;
import com.jeffdisher.delve.types.Feature;
import com.jeffdisher.delve.types.Location;


/**
 * Joins the separate pockets of open ground within a region.  Pockets are found with a 4-way flood fill, then the
 * closest pair of cells between the first pocket and any other is joined with a stepped line of floor.  This repeats
 * until one pocket remains or the pass limit is reached.
 */
public class ConnectivityRepair
{
	public static final int PASS_LIMIT = 100;

	/**
	 * @return The number of passes used (0 if the region was already connected).
	 */
	public static int repair(CaveGrid grid, int y1, int x1, int y2, int x2)
	{
		int passes = 0;
		boolean done = false;
		while (!done && (passes < PASS_LIMIT))
		{
			int[][] labels = new int[y2 - y1 + 1][x2 - x1 + 1];
			int count = _label(grid, labels, y1, x1, y2, x2);
			if (count <= 1)
			{
				done = true;
			}
			else
			{
				List<Location> first = new ArrayList<>();
				List<Location> others = new ArrayList<>();
				for (int y = y1; y <= y2; ++y)
				{
					for (int x = x1; x <= x2; ++x)
					{
						int label = labels[y - y1][x - x1];
						if (1 == label)
						{
							first.add(new Location(y, x));
						}
						else if (label > 1)
						{
							others.add(new Location(y, x));
						}
					}
				}
				Location bestA = null;
				Location bestB = null;
				int bestDistance = Integer.MAX_VALUE;
				for (Location a : first)
				{
					for (Location b : others)
					{
						int dy = a.y() - b.y();
						int dx = a.x() - b.x();
						int distance = (dy * dy) + (dx * dx);
						if (distance < bestDistance)
						{
							bestDistance = distance;
							bestA = a;
							bestB = b;
						}
					}
				}
				_bridge(grid, bestA, bestB);
				passes += 1;
			}
		}
		return passes;
	}

	/**
	 * Counts the separate 4-connected pockets of open ground in the inclusive region.
	 */
	public static int countComponents(CaveGrid grid, int y1, int x1, int y2, int x2)
	{
		return _label(grid, new int[y2 - y1 + 1][x2 - x1 + 1], y1, x1, y2, x2);
	}


	private static int _label(CaveGrid grid, int[][] labels, int y1, int x1, int y2, int x2)
	{
		int next = 0;
		for (int y = y1; y <= y2; ++y)
		{
			for (int x = x1; x <= x2; ++x)
			{
				if (grid.isOpen(y, x) && (0 == labels[y - y1][x - x1]))
				{
					next += 1;
					Queue<Location> queue = new ArrayDeque<>();
					labels[y - y1][x - x1] = next;
					queue.add(new Location(y, x));
					while (!queue.isEmpty())
					{
						Location cell = queue.remove();
						int[][] steps = new int[][] { {1, 0}, {-1, 0}, {0, 1}, {0, -1} };
						for (int[] step : steps)
						{
							int ny = cell.y() + step[0];
							int nx = cell.x() + step[1];
							if ((ny >= y1) && (ny <= y2) && (nx >= x1) && (nx <= x2)
									&& (0 == labels[ny - y1][nx - x1])
									&& grid.isOpen(ny, nx)
							)
							{
								labels[ny - y1][nx - x1] = next;
								queue.add(new Location(ny, nx));
							}
						}
					}
				}
			}
		}
		return next;
	}

	private static void _bridge(CaveGrid grid, Location from, Location to)
	{
		// Step one axis at a time so the line is 4-connected.
		int y = from.y();
		int x = from.x();
		while ((y != to.y()) || (x != to.x()))
		{
			int dy = Math.abs(to.y() - y);
			int dx = Math.abs(to.x() - x);
			if (dy >= dx)
			{
				y += Integer.signum(to.y() - y);
			}
			else
			{
				x += Integer.signum(to.x() - x);
			}
			if (!grid.isOpen(y, x))
			{
				grid.setFeature(y, x, Feature.FLOOR);
				grid.addFlags(y, x, CellFlags.ROOM);
			}
		}
	}
}
