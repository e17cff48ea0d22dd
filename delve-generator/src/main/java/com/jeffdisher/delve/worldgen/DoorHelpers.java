package com.jeffdisher.delve.worldgen;

import com.jeffdisher.delve.data.CaveGrid;
import com.jeffdisher.delve.types.CellFlags;
import com.jeffdisher.delve.types.Feature;


/**
 * Door placement shared by the room builders, the tunnel carver and the junction pass.
 * Closed doors store their lock strength as the cell variant (0 is unlocked, 8 and above is jammed).
 */
public class DoorHelpers
{
	public static final int LOCK_STRENGTH_MAX = 7;
	public static final int JAMMED_BASE = 8;

	/**
	 * Places a random door:  open, broken, secret, closed, locked or jammed.
	 */
	public static void placeRandomDoor(GenerationContext context, int y, int x)
	{
		int roll = context.random.randomInt(1000);
		if (roll < 300)
		{
			context.grid.setFeature(y, x, Feature.OPEN);
		}
		else if (roll < 400)
		{
			context.grid.setFeature(y, x, Feature.BROKEN);
		}
		else if (roll < 600)
		{
			context.grid.setFeature(y, x, Feature.SECRET);
		}
		else if (roll < 900)
		{
			context.grid.setFeature(y, x, Feature.DOOR, 0);
		}
		else if (roll < 999)
		{
			context.grid.setFeature(y, x, Feature.DOOR, context.random.roll(LOCK_STRENGTH_MAX));
		}
		else
		{
			context.grid.setFeature(y, x, Feature.DOOR, JAMMED_BASE + context.random.randomInt(8));
		}
	}

	public static void placeLockedDoor(GenerationContext context, int y, int x)
	{
		context.grid.setFeature(y, x, Feature.DOOR, context.random.roll(LOCK_STRENGTH_MAX));
	}

	public static void placeSecretDoor(GenerationContext context, int y, int x)
	{
		context.grid.setFeature(y, x, Feature.SECRET);
	}

	/**
	 * Places a random door at a corridor junction, if the cell looks like a doorway (90% of the time).
	 */
	public static void tryDoor(GenerationContext context, int y, int x)
	{
		CaveGrid grid = context.grid;
		if (grid.inBoundsFully(y, x)
				&& !grid.getFeature(y, x).isWallOrVein()
				&& !grid.hasFlag(y, x, CellFlags.ROOM)
				&& context.random.percent(90)
				&& isPossibleDoorway(grid, y, x)
		)
		{
			placeRandomDoor(context, y, x);
		}
	}

	/**
	 * @return True if at least 2 cardinal neighbours are corridor and the cell sits between 2 walls.
	 */
	public static boolean isPossibleDoorway(CaveGrid grid, int y, int x)
	{
		boolean isDoorway = false;
		if (countAdjacentCorridors(grid, y, x) >= 2)
		{
			boolean verticalWalls = grid.getFeature(y - 1, x).isWallOrVein() && grid.getFeature(y + 1, x).isWallOrVein();
			boolean horizontalWalls = grid.getFeature(y, x - 1).isWallOrVein() && grid.getFeature(y, x + 1).isWallOrVein();
			isDoorway = verticalWalls || horizontalWalls;
		}
		return isDoorway;
	}

	/**
	 * Counts the cardinal neighbours which are open ground outside of any room.  The cell must be fully in bounds.
	 */
	public static int countAdjacentCorridors(CaveGrid grid, int y, int x)
	{
		int[][] offsets = new int[][] { {-1, 0}, {1, 0}, {0, -1}, {0, 1} };
		int count = 0;
		for (int[] offset : offsets)
		{
			int ny = y + offset[0];
			int nx = x + offset[1];
			if (grid.isOpen(ny, nx) && !grid.hasFlag(ny, nx, CellFlags.ROOM))
			{
				count += 1;
			}
		}
		return count;
	}
}
