package com.jeffdisher.delve.worldgen;

import com.jeffdisher.delve.data.CaveGrid;
import com.jeffdisher.delve.types.CellFlags;
import com.jeffdisher.delve.types.CoverTier;
import com.jeffdisher.delve.types.Feature;
import com.jeffdisher.delve.types.GuardPostType;
import com.jeffdisher.delve.types.PatrolType;


/**
 * Rooms built around monster behaviour.  The monsters placed here are registered with the patrol collaborator and the
 * scenery with the cover collaborator but no behaviour is run during generation.
 */
public class TacticalRooms
{
	public static final int BOULDER_DURABILITY = 50;
	public static final int PILLAR_DURABILITY = 100;

	/**
	 * A lit hall with 2 guards in opposite corners, a patrolling monster in the middle and 4 pieces of cover.
	 */
	public static boolean buildGuardPost(GenerationContext context, int yval, int xval)
	{
		CaveGrid grid = context.grid;
		int y1 = yval - 3;
		int y2 = yval + 3;
		int x1 = xval - 9;
		int x2 = xval + 9;
		RoomPainting.paintFloor(grid, y1 - 1, x1 - 1, y2 + 1, x2 + 1, true);
		RoomPainting.border(grid, y1 - 1, x1 - 1, y2 + 1, x2 + 1, Feature.WALL_OUTER);

		PlacementHelpers.placeGuard(context, y1 + 1, x1 + 1, GuardPostType.HIGH_GROUND);
		PlacementHelpers.placeGuard(context, y2 - 1, x2 - 1, GuardPostType.HIGH_GROUND);
		PlacementHelpers.placePatrol(context, yval, xval, PatrolType.CIRCUIT, IAllocationCollaborator.MON_SLEEP);

		PlacementHelpers.placeCover(context, y1 + 2, x1 + 2, Feature.BOULDER, CoverTier.MEDIUM, BOULDER_DURABILITY);
		PlacementHelpers.placeCover(context, y2 - 2, x2 - 2, Feature.BOULDER, CoverTier.MEDIUM, BOULDER_DURABILITY);
		PlacementHelpers.placeCover(context, y1 + 2, x2 - 2, Feature.STONE_PILLAR, CoverTier.HEAVY, PILLAR_DURABILITY);
		PlacementHelpers.placeCover(context, y2 - 2, x1 + 2, Feature.STONE_PILLAR, CoverTier.HEAVY, PILLAR_DURABILITY);
		return true;
	}

	/**
	 * A wide corridor of tall grass with a clear path down the middle.  Hidden monsters wait in the grass on either
	 * edge.
	 */
	public static boolean buildAmbushCorridor(GenerationContext context, int yval, int xval)
	{
		CaveGrid grid = context.grid;
		int y1 = yval - 2;
		int y2 = yval + 2;
		int x1 = xval - 11;
		int x2 = xval + 11;
		for (int y = y1; y <= y2; ++y)
		{
			for (int x = x1; x <= x2; ++x)
			{
				Feature feature = (yval == y)
						? Feature.FLOOR
						: Feature.TALL_GRASS
				;
				grid.setFeature(y, x, feature);
				grid.addFlags(y, x, CellFlags.ROOM);
			}
		}
		for (int x = x1 - 1; x <= x2 + 1; ++x)
		{
			grid.setFeature(y1 - 1, x, Feature.WALL_OUTER);
			grid.setFeature(y2 + 1, x, Feature.WALL_OUTER);
		}

		int ambushers = 2 + context.random.randomInt(3);
		for (int i = 0; i < ambushers; ++i)
		{
			int y = (0 == context.random.randomInt(2)) ? y1 : y2;
			int x = x1 + 2 + context.random.randomInt(x2 - x1 - 3);
			if (grid.isEmpty(y, x))
			{
				int monster = context.allocator.placeMonster(grid, y, x, context.depth, IAllocationCollaborator.MON_SLEEP | IAllocationCollaborator.MON_HIDE);
				if (CaveGrid.NO_ENTITY != monster)
				{
					context.patrols.registerPatrol(monster, PatrolType.STATIONARY, y, x);
				}
			}
		}
		return true;
	}
}
