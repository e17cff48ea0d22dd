package com.jeffdisher.delve.worldgen;

import com.jeffdisher.delve.data.CaveGrid;
import com.jeffdisher.delve.types.Feature;
import com.jeffdisher.delve.utils.GenerationRandom;


/**
 * Monster nests and pits:  a dark room whose inner room is packed with a themed collection of monsters.  Only one of
 * these is allowed per level.
 */
public class MonsterRooms
{
	public static final int RATING_BONUS = 10;

	public static boolean buildNest(GenerationContext context, int yval, int xval)
	{
		_build(context, yval, xval, IAllocationCollaborator.MON_PIT);
		return true;
	}

	public static boolean buildPit(GenerationContext context, int yval, int xval)
	{
		_build(context, yval, xval, IAllocationCollaborator.MON_PIT | IAllocationCollaborator.MON_GROUP);
		return true;
	}


	private static void _build(GenerationContext context, int yval, int xval, int monsterFlags)
	{
		// The contents are never part of a persistent level's hashed sequence.
		try (GenerationRandom.Scope scope = context.random.pushContinuous())
		{
			CaveGrid grid = context.grid;
			int y1 = yval - 4;
			int y2 = yval + 4;
			int x1 = xval - 11;
			int x2 = xval + 11;
			RoomPainting.paintFloor(grid, y1 - 1, x1 - 1, y2 + 1, x2 + 1, false);
			RoomPainting.border(grid, y1 - 1, x1 - 1, y2 + 1, x2 + 1, Feature.WALL_OUTER);

			y1 += 2;
			y2 -= 2;
			x1 += 2;
			x2 -= 2;
			RoomPainting.border(grid, y1 - 1, x1 - 1, y2 + 1, x2 + 1, Feature.WALL_INNER);
			RoomPainting.secretDoorOnRandomSide(context, y1 - 1, x1 - 1, y2 + 1, x2 + 1, yval, xval);

			context.allocator.placeMonster(grid, yval, xval, context.depth, monsterFlags);

			context.rating += RATING_BONUS;
			if ((context.depth <= 40) && (context.random.roll(context.depth * context.depth + 1) < 300))
			{
				context.goodItemFlag = true;
			}
		}
	}
}
