package com.jeffdisher.delve.worldgen;

import com.jeffdisher.delve.data.CaveGrid;
import com.jeffdisher.delve.types.CellFlags;
import com.jeffdisher.delve.types.CoverTier;
import com.jeffdisher.delve.types.Feature;
import com.jeffdisher.delve.types.Location;


/**
 * The last dressing applied to a dungeon level once its monsters and objects are in place:  scenery, small rewards,
 * extra traps and destructible cover.
 */
public class FeaturePopulator
{
	public static final int SEARCH_ATTEMPTS = 1000;
	public static final int RUIN_ATTEMPTS = 100;
	public static final int RUIN_SIZE = 20;
	public static final int RUIN_PERCENT = 5;
	public static final int CARTOGRAPHER_PERCENT = 40;
	public static final int COVER_ROOM_PERCENT = 50;
	public static final int CRATE_DURABILITY = 20;

	/**
	 * Places the scenery features:  an occasional ancient ruin, glowing tiles, fountains, a cartographer's desk and
	 * heroic remains in dead ends.
	 */
	public static void populateFeatures(GenerationContext context)
	{
		CaveGrid grid = context.grid;
		if ((context.depth > 0) && context.random.percent(RUIN_PERCENT))
		{
			placeAncientRuin(context);
		}
		if (context.depth > 0)
		{
			int tiles = context.random.range(3, 8);
			for (int i = 0; i < tiles; ++i)
			{
				Location spot = _findNaked(context, false, 0);
				if (null != spot)
				{
					grid.setFeature(spot.y(), spot.x(), Feature.GLOWING_TILE);
				}
			}
		}
		int fountains = context.random.range(2, 5);
		for (int i = 0; i < fountains; ++i)
		{
			Location spot = _findCleanRoomCell(context);
			if (null != spot)
			{
				grid.setFeature(spot.y(), spot.x(), Feature.FOUNTAIN);
			}
		}
		if (context.random.percent(CARTOGRAPHER_PERCENT))
		{
			Location spot = _findCleanRoomCell(context);
			if (null != spot)
			{
				grid.setFeature(spot.y(), spot.x(), Feature.CARTOGRAPHER_DESK);
			}
		}
		int remains = context.random.range(1, 3);
		for (int i = 0; i < remains; ++i)
		{
			Location spot = _findNaked(context, false, 3);
			if (null != spot)
			{
				grid.setFeature(spot.y(), spot.x(), Feature.HEROIC_REMAINS);
			}
		}
	}

	/**
	 * Half of the rooms get a few pieces of destructible cover near their centre.
	 */
	public static void populateCover(GenerationContext context)
	{
		CaveGrid grid = context.grid;
		for (Location centre : context.centres)
		{
			if (context.random.percent(COVER_ROOM_PERCENT))
			{
				int count = 2 + context.random.randomInt(4);
				for (int j = 0; j < count; ++j)
				{
					int y = context.random.spread(centre.y(), 4);
					int x = context.random.spread(centre.x(), 4);
					if (grid.inBounds(y, x) && grid.isNaked(y, x))
					{
						int roll = context.random.randomInt(100);
						if (roll < 30)
						{
							PlacementHelpers.placeCover(context, y, x, Feature.CRATE, CoverTier.LIGHT, CRATE_DURABILITY);
						}
						else if (roll < 50)
						{
							PlacementHelpers.placeCover(context, y, x, Feature.BARREL, CoverTier.LIGHT, CRATE_DURABILITY);
						}
						else if (roll < 70)
						{
							PlacementHelpers.placeCover(context, y, x, Feature.STONE_PILLAR, CoverTier.HEAVY, TacticalRooms.PILLAR_DURABILITY);
						}
						else
						{
							PlacementHelpers.placeCover(context, y, x, Feature.BOULDER, CoverTier.MEDIUM, TacticalRooms.BOULDER_DURABILITY);
						}
					}
				}
			}
		}
	}

	/**
	 * Lays a 20x20 field of rubble crossed by 2 clear streets, with a few ruined doorways, somewhere which doesn't
	 * touch a room, permanent rock, a staircase, the player or anything already placed.
	 *
	 * @return True if a ruin was placed.
	 */
	public static boolean placeAncientRuin(GenerationContext context)
	{
		CaveGrid grid = context.grid;
		boolean placed = false;
		for (int tries = 0; !placed && (tries < RUIN_ATTEMPTS); ++tries)
		{
			int y = context.random.range(10, grid.height - 30);
			int x = context.random.range(10, grid.width - 30);
			if (_isRuinSiteClear(grid, y, x))
			{
				for (int dy = 0; dy < RUIN_SIZE; ++dy)
				{
					for (int dx = 0; dx < RUIN_SIZE; ++dx)
					{
						Feature feature = context.random.percent(70)
								? Feature.RUBBLE
								: Feature.FLOOR
						;
						grid.setFeature(y + dy, x + dx, feature);
						// Marked as room so stairs stay away.
						grid.addFlags(y + dy, x + dx, CellFlags.ROOM);
					}
				}
				for (int d = 0; d < RUIN_SIZE; ++d)
				{
					grid.setFeature(y + d, x + (RUIN_SIZE / 2), Feature.FLOOR);
					grid.setFeature(y + (RUIN_SIZE / 2), x + d, Feature.FLOOR);
				}
				int doors = context.random.range(1, 3);
				for (int i = 0; i < doors; ++i)
				{
					for (int d = 0; d < 100; ++d)
					{
						int ty = context.random.range(y + 1, y + RUIN_SIZE - 2);
						int tx = context.random.range(x + 1, x + RUIN_SIZE - 2);
						if (Feature.RUBBLE == grid.getFeature(ty, tx))
						{
							grid.setFeature(ty, tx, Feature.RUIN_DOOR);
							break;
						}
					}
				}
				placed = true;
			}
		}
		return placed;
	}

	/**
	 * Each neighbour of a recorded corridor junction becomes a trap with the given chance.
	 */
	public static void placeTrapsNearDoors(GenerationContext context, int chance)
	{
		for (Location spot : context.doorCandidates)
		{
			_trapAround(context, spot.y(), spot.x(), chance);
		}
	}

	/**
	 * Each neighbour of a chest becomes a trap with the given chance.
	 */
	public static void placeTrapsNearChests(GenerationContext context, int chance)
	{
		CaveGrid grid = context.grid;
		for (int y = 0; y < grid.height; ++y)
		{
			for (int x = 0; x < grid.width; ++x)
			{
				int object = grid.getObject(y, x);
				if ((CaveGrid.NO_ENTITY != object) && context.allocator.isChest(object))
				{
					_trapAround(context, y, x, chance);
				}
			}
		}
	}


	private static void _trapAround(GenerationContext context, int y, int x, int chance)
	{
		for (int dy = -1; dy <= 1; ++dy)
		{
			for (int dx = -1; dx <= 1; ++dx)
			{
				if (((0 != dy) || (0 != dx)) && context.random.percent(chance))
				{
					PlacementHelpers.placeTrap(context, y + dy, x + dx);
				}
			}
		}
	}

	private static Location _findNaked(GenerationContext context, boolean requireRoom, int minWalls)
	{
		CaveGrid grid = context.grid;
		Location found = null;
		for (int i = 0; (null == found) && (i < SEARCH_ATTEMPTS); ++i)
		{
			int y = context.random.range(1, grid.height - 2);
			int x = context.random.range(1, grid.width - 2);
			if (grid.isNaked(y, x)
					&& (!requireRoom || grid.hasFlag(y, x, CellFlags.ROOM))
					&& (grid.countAdjacentRock(y, x) >= minWalls)
			)
			{
				found = new Location(y, x);
			}
		}
		return found;
	}

	private static Location _findCleanRoomCell(GenerationContext context)
	{
		CaveGrid grid = context.grid;
		Location found = null;
		for (int i = 0; (null == found) && (i < SEARCH_ATTEMPTS); ++i)
		{
			int y = context.random.randomInt(grid.height);
			int x = context.random.randomInt(grid.width);
			if (grid.isClean(y, x) && grid.hasFlag(y, x, CellFlags.ROOM))
			{
				found = new Location(y, x);
			}
		}
		return found;
	}

	private static boolean _isRuinSiteClear(CaveGrid grid, int y, int x)
	{
		boolean isClear = true;
		for (int dy = 0; isClear && (dy < RUIN_SIZE); ++dy)
		{
			for (int dx = 0; isClear && (dx < RUIN_SIZE); ++dx)
			{
				int ty = y + dy;
				int tx = x + dx;
				if (!grid.inBoundsFully(ty, tx))
				{
					isClear = false;
				}
				else
				{
					Feature feature = grid.getFeature(ty, tx);
					boolean isPlayer = grid.hasPlayer() && (ty == grid.getPlayerY()) && (tx == grid.getPlayerX());
					// The ruin runs after stairs and inhabitants are placed so it must not bury any of them.
					isClear = !feature.isPermanent()
							&& !feature.isStairs()
							&& (Feature.DREAM_EXIT != feature)
							&& (Feature.SHAFT != feature)
							&& (Feature.QUEST_ENTER != feature)
							&& (Feature.QUEST_EXIT != feature)
							&& !grid.hasFlag(ty, tx, CellFlags.ROOM)
							&& !isPlayer
							&& (CaveGrid.NO_ENTITY == grid.getMonster(ty, tx))
							&& (CaveGrid.NO_ENTITY == grid.getObject(ty, tx))
					;
				}
			}
		}
		return isClear;
	}
}
