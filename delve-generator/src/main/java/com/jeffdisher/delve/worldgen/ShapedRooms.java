package com.jeffdisher.delve.worldgen;

import com.jeffdisher.delve.data.CaveGrid;
import com.jeffdisher.delve.types.CellFlags;
import com.jeffdisher.delve.types.Feature;
import com.jeffdisher.delve.types.Location;


/**
 * The rooms which are not built from rectangles:  circles, overlapping blobs and small cellular caverns.  They paint
 * their floor first and then wrap whatever they painted in outer wall.
 */
public class ShapedRooms
{
	public static final int CAVERN_SIZE = 22;
	public static final int CAVERN_WALL_PERCENT = 45;
	public static final int CAVERN_ITERATIONS = 4;

	public static boolean buildCircular(GenerationContext context, int yval, int xval)
	{
		CaveGrid grid = context.grid;
		boolean lit = RoomPainting.chooseLit(context);
		int radius = context.random.range(3, 7);
		for (int y = yval - radius; y <= yval + radius; ++y)
		{
			for (int x = xval - radius; x <= xval + radius; ++x)
			{
				if (grid.inBoundsFully(y, x) && (Location.distance(yval, xval, y, x) <= radius))
				{
					_paint(grid, y, x, lit);
				}
			}
		}
		RoomPainting.wallAroundFloor(grid, yval - radius - 1, xval - radius - 1, yval + radius + 1, xval + radius + 1);
		return true;
	}

	public static boolean buildComposite(GenerationContext context, int yval, int xval)
	{
		CaveGrid grid = context.grid;
		boolean lit = RoomPainting.chooseLit(context);
		int count = context.random.range(2, 3);
		for (int i = 0; i < count; ++i)
		{
			int height = context.random.range(3, 9);
			int width = context.random.range(3, 9);
			// The first rectangle always covers the centre so the tunnels can find the room.
			int offsetY = (0 == i) ? 0 : context.random.range(-4, 4);
			int offsetX = (0 == i) ? 0 : context.random.range(-4, 4);
			int y1 = yval + offsetY - (height / 2);
			int x1 = xval + offsetX - (width / 2);
			for (int y = y1; y <= y1 + height; ++y)
			{
				for (int x = x1; x <= x1 + width; ++x)
				{
					if (grid.inBoundsFully(y, x))
					{
						_paint(grid, y, x, lit);
					}
				}
			}
		}
		RoomPainting.wallAroundFloor(grid, yval - 15, xval - 15, yval + 15, xval + 15);
		return true;
	}

	public static boolean buildCavern(GenerationContext context, int yval, int xval)
	{
		CaveGrid grid = context.grid;
		boolean lit = RoomPainting.chooseLit(context);
		boolean[][] walls = new boolean[CAVERN_SIZE][CAVERN_SIZE];
		for (int y = 0; y < CAVERN_SIZE; ++y)
		{
			for (int x = 0; x < CAVERN_SIZE; ++x)
			{
				boolean isEdge = (0 == y) || (0 == x) || ((CAVERN_SIZE - 1) == y) || ((CAVERN_SIZE - 1) == x);
				walls[y][x] = isEdge || context.random.percent(CAVERN_WALL_PERCENT);
			}
		}
		for (int i = 0; i < CAVERN_ITERATIONS; ++i)
		{
			walls = _smooth(walls);
		}

		int y1 = yval - 10;
		int x1 = xval - 10;
		for (int y = 1; y <= 20; ++y)
		{
			for (int x = 1; x <= 20; ++x)
			{
				int gy = y1 + y - 1;
				int gx = x1 + x - 1;
				if (!walls[y][x] && grid.inBoundsFully(gy, gx))
				{
					_paint(grid, gy, gx, lit);
				}
			}
		}
		// Make sure the centre is open so the tunnels arrive somewhere.
		if (grid.inBoundsFully(yval, xval))
		{
			_paint(grid, yval, xval, lit);
		}
		RoomPainting.wallAroundFloor(grid, y1 - 1, x1 - 1, y1 + 21, x1 + 21);
		return true;
	}


	private static void _paint(CaveGrid grid, int y, int x, boolean lit)
	{
		grid.setFeature(y, x, Feature.FLOOR);
		grid.addFlags(y, x, lit ? (CellFlags.ROOM | CellFlags.GLOW) : CellFlags.ROOM);
	}

	private static boolean[][] _smooth(boolean[][] walls)
	{
		// The count includes the cell itself.  The edge never changes.
		boolean[][] next = new boolean[CAVERN_SIZE][CAVERN_SIZE];
		for (int y = 0; y < CAVERN_SIZE; ++y)
		{
			for (int x = 0; x < CAVERN_SIZE; ++x)
			{
				boolean isEdge = (0 == y) || (0 == x) || ((CAVERN_SIZE - 1) == y) || ((CAVERN_SIZE - 1) == x);
				if (isEdge)
				{
					next[y][x] = true;
				}
				else
				{
					int count = 0;
					for (int dy = -1; dy <= 1; ++dy)
					{
						for (int dx = -1; dx <= 1; ++dx)
						{
							if (walls[y + dy][x + dx])
							{
								count += 1;
							}
						}
					}
					next[y][x] = walls[y][x]
							? (count >= 4)
							: (count >= 5)
					;
				}
			}
		}
		return next;
	}
}
