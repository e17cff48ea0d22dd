package com.jeffdisher.delve.worldgen;

import com.jeffdisher.delve.data.CaveGrid;
import com.jeffdisher.delve.types.Feature;


/**
 * The plain rectangular rooms:  a single rectangle, or 2 overlapping ones.
 */
public class RectangularRooms
{
	public static boolean buildSimple(GenerationContext context, int yval, int xval)
	{
		CaveGrid grid = context.grid;
		boolean lit = RoomPainting.chooseLit(context);
		int y1 = yval - context.random.roll(4);
		int y2 = yval + context.random.roll(3);
		int x1 = xval - context.random.roll(11);
		int x2 = xval + context.random.roll(11);

		RoomPainting.paintFloor(grid, y1 - 1, x1 - 1, y2 + 1, x2 + 1, lit);
		RoomPainting.border(grid, y1 - 1, x1 - 1, y2 + 1, x2 + 1, Feature.WALL_OUTER);

		if (0 == context.random.randomInt(20))
		{
			// Pillars.
			for (int y = y1; y <= y2; y += 2)
			{
				for (int x = x1; x <= x2; x += 2)
				{
					grid.setFeature(y, x, Feature.WALL_INNER);
				}
			}
		}
		else if (0 == context.random.randomInt(50))
		{
			// Ragged edges.
			for (int y = y1 + 2; y <= y2 - 2; y += 2)
			{
				grid.setFeature(y, x1, Feature.WALL_INNER);
				grid.setFeature(y, x2, Feature.WALL_INNER);
			}
			for (int x = x1 + 2; x <= x2 - 2; x += 2)
			{
				grid.setFeature(y1, x, Feature.WALL_INNER);
				grid.setFeature(y2, x, Feature.WALL_INNER);
			}
		}

		if (context.random.percent(30) && (context.depth > 5))
		{
			PlacementHelpers.populateGuardPosts(context, y1, x1, y2, x2);
		}
		return true;
	}

	public static boolean buildOverlapping(GenerationContext context, int yval, int xval)
	{
		boolean lit = RoomPainting.chooseLit(context);
		int y1a = yval - context.random.roll(4);
		int y2a = yval + context.random.roll(3);
		int x1a = xval - context.random.roll(11);
		int x2a = xval + context.random.roll(10);

		int y1b = yval - context.random.roll(3);
		int y2b = yval + context.random.roll(4);
		int x1b = xval - context.random.roll(10);
		int x2b = xval + context.random.roll(11);

		paintOverlappingPair(context.grid, lit
				, y1a, x1a, y2a, x2a
				, y1b, x1b, y2b, x2b
		);
		return true;
	}

	/**
	 * Paints 2 overlapping rectangles as one room:  both floors, then both walls, then the interiors again so that
	 * neither wall cuts through the other rectangle.
	 */
	public static void paintOverlappingPair(CaveGrid grid, boolean lit
			, int y1a, int x1a, int y2a, int x2a
			, int y1b, int x1b, int y2b, int x2b
	)
	{
		RoomPainting.paintFloor(grid, y1a - 1, x1a - 1, y2a + 1, x2a + 1, lit);
		RoomPainting.paintFloor(grid, y1b - 1, x1b - 1, y2b + 1, x2b + 1, lit);
		RoomPainting.border(grid, y1a - 1, x1a - 1, y2a + 1, x2a + 1, Feature.WALL_OUTER);
		RoomPainting.border(grid, y1b - 1, x1b - 1, y2b + 1, x2b + 1, Feature.WALL_OUTER);
		RoomPainting.fill(grid, y1a, x1a, y2a, x2a, Feature.FLOOR);
		RoomPainting.fill(grid, y1b, x1b, y2b, x2b, Feature.FLOOR);
	}
}
