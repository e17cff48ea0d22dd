package com.jeffdisher.delve.worldgen;

import com.jeffdisher.delve.data.CaveGrid;
import com.jeffdisher.delve.types.Feature;
import com.jeffdisher.delve.types.ObjectQuality;


/**
 * A large room holding an inner room, which is one of:
 * 1 - an empty inner room with a monster
 * 2 - a treasure vault nested in the inner room
 * 3 - inner pillars, sometimes with small side chambers
 * 4 - a checkerboard maze
 * 5 - 4 small rooms split by a cross
 */
public class LargeRoom
{
	private static final int GUARDS = IAllocationCollaborator.MON_SLEEP | IAllocationCollaborator.MON_HORDE;

	public static boolean build(GenerationContext context, int yval, int xval)
	{
		CaveGrid grid = context.grid;
		boolean lit = RoomPainting.chooseLit(context);
		int y1 = yval - 4;
		int y2 = yval + 4;
		int x1 = xval - 11;
		int x2 = xval + 11;
		RoomPainting.paintFloor(grid, y1 - 1, x1 - 1, y2 + 1, x2 + 1, lit);
		RoomPainting.border(grid, y1 - 1, x1 - 1, y2 + 1, x2 + 1, Feature.WALL_OUTER);

		// The inner room.
		y1 += 2;
		y2 -= 2;
		x1 += 2;
		x2 -= 2;
		RoomPainting.border(grid, y1 - 1, x1 - 1, y2 + 1, x2 + 1, Feature.WALL_INNER);

		switch (context.random.roll(5))
		{
		case 1:
			RoomPainting.secretDoorOnRandomSide(context, y1 - 1, x1 - 1, y2 + 1, x2 + 1, yval, xval);
			PlacementHelpers.vaultMonster(context, yval, xval, IAllocationCollaborator.MON_SLEEP);
			break;
		case 2:
			RoomPainting.secretDoorOnRandomSide(context, y1 - 1, x1 - 1, y2 + 1, x2 + 1, yval, xval);
			RoomPainting.border(grid, yval - 1, xval - 1, yval + 1, xval + 1, Feature.WALL_INNER);
			switch (context.random.roll(4))
			{
			case 1:
				DoorHelpers.placeLockedDoor(context, yval - 1, xval);
				break;
			case 2:
				DoorHelpers.placeLockedDoor(context, yval + 1, xval);
				break;
			case 3:
				DoorHelpers.placeLockedDoor(context, yval, xval - 1);
				break;
				default:
					DoorHelpers.placeLockedDoor(context, yval, xval + 1);
			}
			PlacementHelpers.vaultMonster(context, yval, xval, GUARDS);
			if (context.random.percent(80))
			{
				context.allocator.placeObject(grid, yval, xval, context.depth, ObjectQuality.PLAIN);
			}
			else
			{
				PlacementHelpers.placeRandomStairs(context, yval, xval);
			}
			PlacementHelpers.vaultTraps(context, yval, xval, 4, 10, 2 + context.random.roll(3));
			break;
		case 3:
			RoomPainting.secretDoorOnRandomSide(context, y1 - 1, x1 - 1, y2 + 1, x2 + 1, yval, xval);
			RoomPainting.fill(grid, yval - 1, xval - 1, yval + 1, xval + 1, Feature.WALL_INNER);
			if (0 == context.random.randomInt(2))
			{
				int shift = context.random.roll(2);
				RoomPainting.fill(grid, yval - 1, xval - 5 - shift, yval + 1, xval - 3 - shift, Feature.WALL_INNER);
				RoomPainting.fill(grid, yval - 1, xval + 3 + shift, yval + 1, xval + 5 + shift, Feature.WALL_INNER);
			}
			if (0 == context.random.randomInt(3))
			{
				// Side chambers.
				for (int x = xval - 5; x <= xval + 5; ++x)
				{
					grid.setFeature(yval - 1, x, Feature.WALL_INNER);
					grid.setFeature(yval + 1, x, Feature.WALL_INNER);
				}
				grid.setFeature(yval, xval - 5, Feature.WALL_INNER);
				grid.setFeature(yval, xval + 5, Feature.WALL_INNER);
				DoorHelpers.placeSecretDoor(context, yval - 3 + (context.random.roll(2) * 2), xval - 3);
				DoorHelpers.placeSecretDoor(context, yval - 3 + (context.random.roll(2) * 2), xval + 3);
				PlacementHelpers.vaultMonster(context, yval, xval - 2, GUARDS);
				PlacementHelpers.vaultMonster(context, yval, xval + 2, GUARDS);
				if (0 == context.random.randomInt(3))
				{
					context.allocator.placeObject(grid, yval, xval - 2, context.depth, ObjectQuality.PLAIN);
				}
				if (0 == context.random.randomInt(3))
				{
					context.allocator.placeObject(grid, yval, xval + 2, context.depth, ObjectQuality.PLAIN);
				}
			}
			break;
		case 4:
			RoomPainting.secretDoorOnRandomSide(context, y1 - 1, x1 - 1, y2 + 1, x2 + 1, yval, xval);
			for (int y = y1; y <= y2; ++y)
			{
				for (int x = x1; x <= x2; ++x)
				{
					if (0 != (0x1 & (x + y)))
					{
						grid.setFeature(y, x, Feature.WALL_INNER);
					}
				}
			}
			PlacementHelpers.vaultMonster(context, yval, xval - 5, GUARDS);
			PlacementHelpers.vaultMonster(context, yval, xval + 5, GUARDS);
			PlacementHelpers.vaultTraps(context, yval, xval - 3, 2, 8, context.random.roll(3));
			PlacementHelpers.vaultTraps(context, yval, xval + 3, 2, 8, context.random.roll(3));
			PlacementHelpers.vaultObjects(context, yval, xval, 3);
			break;
			default:
				for (int y = y1; y <= y2; ++y)
				{
					grid.setFeature(y, xval, Feature.WALL_INNER);
				}
				for (int x = x1; x <= x2; ++x)
				{
					grid.setFeature(yval, x, Feature.WALL_INNER);
				}
				if (context.random.percent(50))
				{
					int i = context.random.roll(10);
					DoorHelpers.placeSecretDoor(context, y1 - 1, xval - i);
					DoorHelpers.placeSecretDoor(context, y1 - 1, xval + i);
					DoorHelpers.placeSecretDoor(context, y2 + 1, xval - i);
					DoorHelpers.placeSecretDoor(context, y2 + 1, xval + i);
				}
				else
				{
					int i = context.random.roll(3);
					DoorHelpers.placeSecretDoor(context, yval + i, x1 - 1);
					DoorHelpers.placeSecretDoor(context, yval - i, x1 - 1);
					DoorHelpers.placeSecretDoor(context, yval + i, x2 + 1);
					DoorHelpers.placeSecretDoor(context, yval - i, x2 + 1);
				}
				PlacementHelpers.vaultObjects(context, yval, xval, 2 + context.random.roll(2));
				PlacementHelpers.vaultMonster(context, yval + 1, xval - 4, GUARDS);
				PlacementHelpers.vaultMonster(context, yval + 1, xval + 4, GUARDS);
				PlacementHelpers.vaultMonster(context, yval - 1, xval - 4, GUARDS);
				PlacementHelpers.vaultMonster(context, yval - 1, xval + 4, GUARDS);
		}
		return true;
	}
}
