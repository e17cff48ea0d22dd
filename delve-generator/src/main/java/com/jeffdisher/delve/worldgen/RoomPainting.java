package com.jeffdisher.delve.worldgen;

import com.jeffdisher.delve.data.CaveGrid;
import com.jeffdisher.delve.types.CellFlags;
import com.jeffdisher.delve.types.Feature;


/**
 * Rectangle painting shared by the room builders.  All rectangles are inclusive on every edge.
 */
public class RoomPainting
{
	/**
	 * Rooms are lit more often near the surface.
	 */
	public static boolean chooseLit(GenerationContext context)
	{
		return context.depth <= context.random.roll(25);
	}

	/**
	 * Paints floor over the rectangle, marking it as room (and lit, if requested).
	 */
	public static void paintFloor(CaveGrid grid, int y1, int x1, int y2, int x2, boolean lit)
	{
		int flags = lit
				? (CellFlags.ROOM | CellFlags.GLOW)
				: CellFlags.ROOM
		;
		for (int y = y1; y <= y2; ++y)
		{
			for (int x = x1; x <= x2; ++x)
			{
				grid.setFeature(y, x, Feature.FLOOR);
				grid.addFlags(y, x, flags);
			}
		}
	}

	/**
	 * Sets the feature of every cell in the rectangle, leaving flags alone.
	 */
	public static void fill(CaveGrid grid, int y1, int x1, int y2, int x2, Feature feature)
	{
		for (int y = y1; y <= y2; ++y)
		{
			for (int x = x1; x <= x2; ++x)
			{
				grid.setFeature(y, x, feature);
			}
		}
	}

	/**
	 * Sets the feature of the cells on the edge of the rectangle.
	 */
	public static void border(CaveGrid grid, int y1, int x1, int y2, int x2, Feature feature)
	{
		for (int y = y1; y <= y2; ++y)
		{
			grid.setFeature(y, x1, feature);
			grid.setFeature(y, x2, feature);
		}
		for (int x = x1; x <= x2; ++x)
		{
			grid.setFeature(y1, x, feature);
			grid.setFeature(y2, x, feature);
		}
	}

	/**
	 * Puts a secret door in the middle of one random side of the rectangle's edge.
	 */
	public static void secretDoorOnRandomSide(GenerationContext context, int y1, int x1, int y2, int x2, int yval, int xval)
	{
		switch (context.random.roll(4))
		{
		case 1:
			DoorHelpers.placeSecretDoor(context, y1, xval);
			break;
		case 2:
			DoorHelpers.placeSecretDoor(context, y2, xval);
			break;
		case 3:
			DoorHelpers.placeSecretDoor(context, yval, x1);
			break;
			default:
				DoorHelpers.placeSecretDoor(context, yval, x2);
		}
	}

	/**
	 * Turns any non-floor cell touching floor (including diagonally) within the rectangle into outer wall.  Used by
	 * the rooms whose shape is not a rectangle.
	 */
	public static void wallAroundFloor(CaveGrid grid, int y1, int x1, int y2, int x2)
	{
		for (int y = y1; y <= y2; ++y)
		{
			for (int x = x1; x <= x2; ++x)
			{
				if (grid.inBoundsFully(y, x) && (Feature.FLOOR != grid.getFeature(y, x)) && _touchesFloor(grid, y, x))
				{
					grid.setFeature(y, x, Feature.WALL_OUTER);
				}
			}
		}
	}


	private static boolean _touchesFloor(CaveGrid grid, int y, int x)
	{
		boolean touches = false;
		for (int dy = -1; !touches && (dy <= 1); ++dy)
		{
			for (int dx = -1; !touches && (dx <= 1); ++dx)
			{
				touches = (Feature.FLOOR == grid.getFeature(y + dy, x + dx));
			}
		}
		return touches;
	}
}
