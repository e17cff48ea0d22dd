package com.jeffdisher.delve.worldgen;

import com.jeffdisher.delve.data.CaveGrid;
import com.jeffdisher.delve.types.Feature;
import com.jeffdisher.delve.types.ObjectQuality;


/**
 * A cross-shaped room:  a tall thin rectangle over a short wide one, with an optional feature where they meet.
 */
public class CrossRoom
{
	public static boolean build(GenerationContext context, int yval, int xval)
	{
		CaveGrid grid = context.grid;
		boolean lit = RoomPainting.chooseLit(context);
		int wy = 1;
		int wx = 1;
		int dy = context.random.range(3, 4);
		int dx = context.random.range(3, 11);

		int y1a = yval - dy;
		int y2a = yval + dy;
		int x1a = xval - wx;
		int x2a = xval + wx;

		int y1b = yval - wy;
		int y2b = yval + wy;
		int x1b = xval - dx;
		int x2b = xval + dx;

		RectangularRooms.paintOverlappingPair(grid, lit
				, y1a, x1a, y2a, x2a
				, y1b, x1b, y2b, x2b
		);

		switch (context.random.randomInt(4))
		{
		case 1:
			// Solid pillar in the middle.
			RoomPainting.fill(grid, y1b, x1a, y2b, x2a, Feature.WALL_INNER);
			break;
		case 2:
			// Treasure vault in the middle.
			RoomPainting.border(grid, y1b, x1a, y2b, x2a, Feature.WALL_INNER);
			switch (context.random.randomInt(4))
			{
			case 0:
				DoorHelpers.placeSecretDoor(context, y1b, xval);
				break;
			case 1:
				DoorHelpers.placeSecretDoor(context, y2b, xval);
				break;
			case 2:
				DoorHelpers.placeSecretDoor(context, yval, x1a);
				break;
				default:
					DoorHelpers.placeSecretDoor(context, yval, x2a);
			}
			context.allocator.placeObject(grid, yval, xval, context.depth, ObjectQuality.PLAIN);
			PlacementHelpers.vaultMonster(context, yval, xval, IAllocationCollaborator.MON_SLEEP | IAllocationCollaborator.MON_HORDE);
			PlacementHelpers.vaultTraps(context, yval, xval, 4, 4, context.random.randomInt(3) + 2);
			break;
		case 3:
			if (0 == context.random.randomInt(3))
			{
				// Pinch the centre shut.
				for (int y = y1b; y <= y2b; ++y)
				{
					if (y != yval)
					{
						grid.setFeature(y, x1a - 1, Feature.WALL_INNER);
						grid.setFeature(y, x2a + 1, Feature.WALL_INNER);
					}
				}
				for (int x = x1a; x <= x2a; ++x)
				{
					if (x != xval)
					{
						grid.setFeature(y1b - 1, x, Feature.WALL_INNER);
						grid.setFeature(y2b + 1, x, Feature.WALL_INNER);
					}
				}
				if (0 == context.random.randomInt(3))
				{
					DoorHelpers.placeSecretDoor(context, yval, x1a - 1);
					DoorHelpers.placeSecretDoor(context, yval, x2a + 1);
					DoorHelpers.placeSecretDoor(context, y1b - 1, xval);
					DoorHelpers.placeSecretDoor(context, y2b + 1, xval);
				}
			}
			else if (0 == context.random.randomInt(3))
			{
				// A plus in the centre.
				grid.setFeature(yval, xval, Feature.WALL_INNER);
				grid.setFeature(y1b, xval, Feature.WALL_INNER);
				grid.setFeature(y2b, xval, Feature.WALL_INNER);
				grid.setFeature(yval, x1a, Feature.WALL_INNER);
				grid.setFeature(yval, x2a, Feature.WALL_INNER);
			}
			else if (0 == context.random.randomInt(3))
			{
				grid.setFeature(yval, xval, Feature.WALL_INNER);
			}
			break;
			default:
				// Plain cross.
				break;
		}
		return true;
	}
}
