package com.jeffdisher.delve.worldgen;

import java.util.ArrayList;
import java.util.List;

import com.jeffdisher.delve.data.CaveGrid;
import com.jeffdisher.delve.types.AllocationSet;
import com.jeffdisher.delve.types.AllocationType;
import com.jeffdisher.delve.types.CellFlags;
import com.jeffdisher.delve.types.CoverTier;
import com.jeffdisher.delve.types.Elevation;
import com.jeffdisher.delve.types.Feature;
import com.jeffdisher.delve.types.GenerationMode;
import com.jeffdisher.delve.types.GuardPostType;
import com.jeffdisher.delve.types.Location;
import com.jeffdisher.delve.types.ObjectQuality;
import com.jeffdisher.delve.types.PatrolType;


/**
 * The small placement routines shared by room builders, sectors and level builders.  All of them search a bounded
 * number of times and quietly give up if they find nowhere suitable.
 */
public class PlacementHelpers
{
	public static final int ALLOCATION_ATTEMPTS = 10_000;
	public static final int STAIR_ATTEMPTS_PER_WALL_COUNT = 3000;
	public static final int ALTAR_ATTEMPTS = 100;
	public static final int SCATTER_ATTEMPTS = 1000;
	public static final int GUARD_POST_ATTEMPTS = 100;

	/**
	 * Places num plain objects near (y, x), each on a clean cell.
	 */
	public static void vaultObjects(GenerationContext context, int y, int x, int num)
	{
		CaveGrid grid = context.grid;
		for (int n = 0; n < num; ++n)
		{
			for (int i = 0; i < 11; ++i)
			{
				int ty = context.random.spread(y, 2);
				int tx = context.random.spread(x, 3);
				if (grid.inBounds(ty, tx) && grid.isClean(ty, tx))
				{
					context.allocator.placeObject(grid, ty, tx, context.depth, ObjectQuality.PLAIN);
					break;
				}
			}
		}
	}

	/**
	 * Places num traps within (yd, xd) of (y, x), each on a naked cell.
	 */
	public static void vaultTraps(GenerationContext context, int y, int x, int yd, int xd, int num)
	{
		for (int n = 0; n < num; ++n)
		{
			for (int i = 0; i < 6; ++i)
			{
				int ty = context.random.spread(y, yd);
				int tx = context.random.spread(x, xd);
				if (context.grid.inBounds(ty, tx) && context.grid.isNaked(ty, tx))
				{
					placeTrap(context, ty, tx);
					break;
				}
			}
		}
	}

	/**
	 * Places a monster, slightly out of depth, at (y, x) if it is empty.
	 */
	public static void vaultMonster(GenerationContext context, int y, int x, int flags)
	{
		if (context.grid.inBounds(y, x) && context.grid.isEmpty(y, x))
		{
			context.allocator.placeMonster(context.grid, y, x, context.depth + 2, flags);
		}
	}

	/**
	 * Places a trap on a naked cell.
	 *
	 * @return True if the trap was placed.
	 */
	public static boolean placeTrap(GenerationContext context, int y, int x)
	{
		boolean placed = false;
		if (context.grid.inBounds(y, x) && context.grid.isNaked(y, x))
		{
			context.grid.setFeature(y, x, Feature.TRAP, context.allocator.chooseTrapKind(context.depth));
			placed = true;
		}
		return placed;
	}

	/**
	 * Places an altar to a deity whose rarity suits the depth.  Rarer deities need deeper levels.
	 */
	public static void placeAltar(GenerationContext context, int y, int x)
	{
		int[] rarities = context.allocator.getDeityRarities();
		if (rarities.length > 0)
		{
			for (int i = 0; i < ALTAR_ATTEMPTS; ++i)
			{
				int deity = context.random.randomInt(rarities.length);
				int rarity = rarities[deity] % 4;
				if ((context.depth >= context.random.normal(rarity * 10, 3)) && (0 == context.random.randomInt(rarity)))
				{
					context.grid.setFeature(y, x, Feature.ALTAR, deity);
					break;
				}
			}
		}
	}

	/**
	 * Places an up or down staircase on a clean cell, whichever the depth allows.
	 */
	public static void placeRandomStairs(GenerationContext context, int y, int x)
	{
		if (context.grid.isClean(y, x))
		{
			Feature stairs;
			if (0 == context.depth)
			{
				stairs = _downFeature(context);
			}
			else if (context.request.mode().isSpecial() || (context.depth >= (context.config.maxDepth - 1)))
			{
				stairs = Feature.LESS;
			}
			else
			{
				stairs = (0 == context.random.randomInt(2)) ? Feature.LESS : Feature.MORE;
			}
			context.grid.setFeature(y, x, stairs);
		}
	}

	/**
	 * Places num staircases on naked cells with at least walls adjacent rock cells, relaxing the wall requirement
	 * whenever a search fails.
	 *
	 * @param stairs LESS or MORE (the depth may override it).
	 * @param num How many to place.
	 * @param walls How many adjacent rock cells to start requiring.
	 * @param forceRoom True if only room cells may be used.
	 */
	public static void allocStairs(GenerationContext context, Feature stairs, int num, int walls, boolean forceRoom)
	{
		CaveGrid grid = context.grid;
		boolean isDream = (GenerationMode.DREAM == context.request.mode());
		int count = num;
		Feature toPlace = stairs;
		if (isDream)
		{
			if (Feature.LESS == stairs)
			{
				count = 0;
			}
			else
			{
				count = 1;
				toPlace = Feature.DREAM_EXIT;
			}
		}
		int requiredWalls = walls;
		for (int i = 0; (i < count) && (requiredWalls >= 0); ++i)
		{
			boolean placed = false;
			while (!placed && (requiredWalls >= 0))
			{
				for (int j = 0; !placed && (j < STAIR_ATTEMPTS_PER_WALL_COUNT); ++j)
				{
					int y = context.random.range(1, grid.height - 2);
					int x = context.random.range(1, grid.width - 2);
					if (grid.isNaked(y, x)
							&& (!forceRoom || grid.hasFlag(y, x, CellFlags.ROOM))
							&& (grid.countAdjacentRock(y, x) >= requiredWalls)
					)
					{
						Feature feature;
						if (isDream)
						{
							feature = toPlace;
						}
						else if (0 == context.depth)
						{
							feature = _downFeature(context);
						}
						else if ((GenerationMode.QUEST == context.request.mode()) || (context.depth >= (context.config.maxDepth - 1)))
						{
							feature = Feature.LESS;
						}
						else
						{
							feature = toPlace;
						}
						grid.setFeature(y, x, feature);
						placed = true;
					}
				}
				if (!placed)
				{
					requiredWalls -= 1;
				}
			}
		}
	}

	/**
	 * Allocates num things of the given type on random naked cells within the allocation set.
	 */
	public static void allocObject(GenerationContext context, AllocationSet set, AllocationType type, int num)
	{
		CaveGrid grid = context.grid;
		for (int n = 0; n < num; ++n)
		{
			for (int i = 0; i < ALLOCATION_ATTEMPTS; ++i)
			{
				int y = context.random.randomInt(grid.height);
				int x = context.random.randomInt(grid.width);
				if (grid.isNaked(y, x) && set.allows(grid.hasFlag(y, x, CellFlags.ROOM)))
				{
					switch (type)
					{
					case RUBBLE:
						grid.setFeature(y, x, Feature.RUBBLE);
						break;
					case TRAP:
						placeTrap(context, y, x);
						break;
					case OBJECT:
						context.allocator.placeObject(grid, y, x, context.depth, ObjectQuality.PLAIN);
						break;
					case ALTAR:
						placeAltar(context, y, x);
						break;
					}
					break;
				}
			}
		}
	}

	/**
	 * Places a random monster, at the current depth, on an empty cell more than minDistance from the player (the
	 * distance is ignored if the player hasn't been placed).
	 *
	 * @return True if a monster was placed.
	 */
	public static boolean allocMonster(GenerationContext context, int minDistance, int flags)
	{
		CaveGrid grid = context.grid;
		boolean found = false;
		boolean placed = false;
		for (int i = 0; !found && (i < ALLOCATION_ATTEMPTS); ++i)
		{
			int y = context.random.randomInt(grid.height);
			int x = context.random.randomInt(grid.width);
			if (grid.isEmpty(y, x)
					&& (!grid.hasPlayer() || (Location.distance(y, x, grid.getPlayerY(), grid.getPlayerX()) > minDistance))
			)
			{
				// A failed placement still ends the search:  the table is full or nothing suits this level.
				found = true;
				placed = (CaveGrid.NO_ENTITY != context.allocator.placeMonster(grid, y, x, context.depth, flags));
			}
		}
		return placed;
	}

	/**
	 * Places a good object or a pile of gold on a random naked cell.
	 */
	public static void allocReward(GenerationContext context, boolean isGold)
	{
		CaveGrid grid = context.grid;
		for (int i = 0; i < SCATTER_ATTEMPTS; ++i)
		{
			int y = context.random.randomInt(grid.height);
			int x = context.random.randomInt(grid.width);
			if (grid.isNaked(y, x))
			{
				if (isGold)
				{
					context.allocator.placeGold(grid, y, x, context.depth);
				}
				else
				{
					context.allocator.placeObject(grid, y, x, context.depth, ObjectQuality.GOOD);
				}
				break;
			}
		}
	}

	/**
	 * Picks a random in-bounds cell within distance d of (y, x).
	 *
	 * @return The cell, or (y, x) itself if none was found.
	 */
	public static Location scatter(GenerationContext context, int y, int x, int d)
	{
		Location found = new Location(y, x);
		for (int i = 0; i < SCATTER_ATTEMPTS; ++i)
		{
			int ty = context.random.spread(y, d);
			int tx = context.random.spread(x, d);
			if (context.grid.inBounds(ty, tx) && (Location.distance(y, x, ty, tx) <= d))
			{
				found = new Location(ty, tx);
				break;
			}
		}
		return found;
	}

	/**
	 * @return The first start staircase in row-major order, or the centre of the level if there is none.
	 */
	public static Location findGenerationOrigin(GenerationContext context)
	{
		CaveGrid grid = context.grid;
		Feature start = getStartFeature(context);
		Location origin = null;
		for (int y = 0; (null == origin) && (y < grid.height); ++y)
		{
			for (int x = 0; (null == origin) && (x < grid.width); ++x)
			{
				if (start == grid.getFeature(y, x))
				{
					origin = new Location(y, x);
				}
			}
		}
		if (null == origin)
		{
			origin = new Location(grid.height / 2, grid.width / 2);
		}
		return origin;
	}

	/**
	 * Places the player on a random free start staircase, or on a random naked unprotected cell if there is none.
	 *
	 * @return True if the player was placed.
	 */
	public static boolean newPlayerSpot(GenerationContext context)
	{
		CaveGrid grid = context.grid;
		Feature startFeature = getStartFeature(context);
		List<Location> stairs = new ArrayList<>();
		for (int y = 0; y < grid.height; ++y)
		{
			for (int x = 0; x < grid.width; ++x)
			{
				if ((startFeature == grid.getFeature(y, x))
						&& (CaveGrid.NO_ENTITY == grid.getMonster(y, x))
						&& (CaveGrid.NO_ENTITY == grid.getObject(y, x))
				)
				{
					stairs.add(new Location(y, x));
				}
			}
		}
		boolean placed = false;
		if (!stairs.isEmpty())
		{
			Location spot = stairs.get(context.random.randomInt(stairs.size()));
			grid.setPlayer(spot.y(), spot.x());
			placed = true;
		}
		for (int i = 0; !placed && (i < ALLOCATION_ATTEMPTS); ++i)
		{
			int y = context.random.range(1, grid.height - 2);
			int x = context.random.range(1, grid.width - 2);
			if (grid.isNaked(y, x) && !grid.hasFlag(y, x, CellFlags.ICKY))
			{
				grid.setPlayer(y, x);
				placed = true;
			}
		}
		return placed;
	}

	/**
	 * Places the player near where they stood in the neighbouring region, searching further out on each failure.
	 *
	 * @return True if the player was placed.
	 */
	public static boolean oldPlayerSpot(GenerationContext context, int y, int x)
	{
		CaveGrid grid = context.grid;
		boolean placed = false;
		for (int d = 4; !placed && (d < SCATTER_ATTEMPTS); ++d)
		{
			Location spot = scatter(context, y, x, d / 5);
			if (grid.isNaked(spot.y(), spot.x()) && !grid.hasFlag(spot.y(), spot.x(), CellFlags.ICKY))
			{
				grid.setPlayer(spot.y(), spot.x());
				placed = true;
			}
		}
		if (!placed)
		{
			placed = newPlayerSpot(context);
		}
		return placed;
	}

	/**
	 * @return The staircase the player arrives on:  down at the surface (a shaft in the wilderness), up elsewhere.
	 */
	public static Feature getStartFeature(GenerationContext context)
	{
		return (0 == context.depth)
				? _downFeature(context)
				: Feature.LESS
		;
	}

	/**
	 * Places a single guard in the room, preferring to watch a door or hold high ground.
	 */
	public static void populateGuardPosts(GenerationContext context, int y1, int x1, int y2, int x2)
	{
		CaveGrid grid = context.grid;
		for (int i = 0; i < GUARD_POST_ATTEMPTS; ++i)
		{
			int y = y1 + context.random.randomInt(y2 - y1);
			int x = x1 + context.random.randomInt(x2 - x1);
			if (grid.inBoundsFully(y, x) && (Feature.FLOOR == grid.getFeature(y, x)))
			{
				GuardPostType post;
				if (context.random.percent(50) && _isNextToDoor(grid, y, x))
				{
					post = GuardPostType.DOOR;
				}
				else if (grid.getElevation(y, x).isAbove(Elevation.GROUND) && context.random.percent(60))
				{
					post = GuardPostType.HIGH_GROUND;
				}
				else
				{
					post = GuardPostType.ROOM;
				}
				placeGuard(context, y, x, post);
				break;
			}
		}
	}

	/**
	 * Places a sleeping monster and registers it as guarding its cell.
	 */
	public static void placeGuard(GenerationContext context, int y, int x, GuardPostType post)
	{
		if (context.grid.isEmpty(y, x))
		{
			int monster = context.allocator.placeMonster(context.grid, y, x, context.depth, IAllocationCollaborator.MON_SLEEP);
			if (CaveGrid.NO_ENTITY != monster)
			{
				context.patrols.registerGuardPost(monster, post, y, x);
			}
		}
	}

	/**
	 * Places a monster and registers a patrol around its starting cell.
	 */
	public static void placePatrol(GenerationContext context, int y, int x, PatrolType patrol, int flags)
	{
		if (context.grid.isEmpty(y, x))
		{
			int monster = context.allocator.placeMonster(context.grid, y, x, context.depth, flags);
			if (CaveGrid.NO_ENTITY != monster)
			{
				context.patrols.registerPatrol(monster, patrol, y, x);
			}
		}
	}

	/**
	 * Paints a piece of destructible scenery and registers it as cover.
	 */
	public static void placeCover(GenerationContext context, int y, int x, Feature feature, CoverTier tier, int durability)
	{
		context.grid.setFeature(y, x, feature);
		context.cover.registerCover(y, x, tier, durability, feature);
	}


	private static Feature _downFeature(GenerationContext context)
	{
		return (GenerationMode.WILDERNESS == context.request.mode())
				? Feature.SHAFT
				: Feature.MORE
		;
	}

	private static boolean _isNextToDoor(CaveGrid grid, int y, int x)
	{
		boolean found = false;
		for (int dy = -1; !found && (dy <= 1); ++dy)
		{
			for (int dx = -1; !found && (dx <= 1); ++dx)
			{
				Feature feature = grid.getFeature(y + dy, x + dx);
				found = (Feature.DOOR == feature) || (Feature.SECRET == feature);
			}
		}
		return found;
	}
}
