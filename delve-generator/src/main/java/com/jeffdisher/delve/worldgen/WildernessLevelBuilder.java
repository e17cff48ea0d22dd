package com.jeffdisher.delve.worldgen;

import com.jeffdisher.delve.data.CaveGrid;
import com.jeffdisher.delve.types.AllocationSet;
import com.jeffdisher.delve.types.AllocationType;
import com.jeffdisher.delve.types.CellFlags;
import com.jeffdisher.delve.types.Feature;
import com.jeffdisher.delve.types.Location;
import com.jeffdisher.delve.utils.GenerationRandom;


/**
 * Builds a wilderness region (or the town, which is the region at the wilderness origin with the town vault).
 * The terrain is a plasma height field mapped through a terrain tier table.  Everything structural (heights, the
 * shaft, where the vaults go) is generated in hashed mode from the region's seeds so a revisited region comes back
 * the same.  Vault contents and the inhabitants change on every visit.
 */
public class WildernessLevelBuilder implements ILevelBuilder
{
	/**
	 * Game turns per half day/night cycle, divided by 10.
	 */
	public static final long DAWN_INTERVAL = 10_000L;
	public static final int TERRAIN_TIERS = 22;
	public static final int ROUGHNESS = 1;
	public static final int SHAFT_PERCENT = 30;
	public static final int WATERY_REGION_PERCENT = 30;
	public static final int DAY_MONSTERS = 4;
	public static final int NIGHT_MONSTERS = 8;
	public static final int ROOM_OBJECTS = 100;
	public static final int ROOM_ALTARS = 3;
	public static final int SCATTERED_OBJECTS = 50;
	public static final int SCHOLAR_ATTEMPTS = 1000;
	public static final int SCHOLAR_MARGIN = 20;

	/**
	 * @return True if the given game turn falls in the daylight half of the cycle.
	 */
	public static boolean isDaytime(long turn)
	{
		long cycle = 10L * DAWN_INTERVAL;
		return (turn % cycle) < (cycle / 2);
	}

	/**
	 * Paints the plasma terrain of the region at (wildX, wildY) over the whole grid, with an unseen border.
	 */
	public static void paintTerrain(GenerationContext context, int wildX, int wildY)
	{
		CaveGrid grid = context.grid;
		GenerationRandom random = context.random;
		WildernessSeedField seeds = WildernessSeedField.buildForRegion(context.config.wildernessSeed, wildX, wildY);
		int bottom = grid.height - 2;
		int right = grid.width - 2;
		int[][] heights = new int[grid.height][grid.width];
		heights[1][1] = _cornerHeight(random, seeds.getCorner(0, 0));
		heights[bottom][1] = _cornerHeight(random, seeds.getCorner(0, 1));
		heights[1][right] = _cornerHeight(random, seeds.getCorner(1, 0));
		heights[bottom][right] = _cornerHeight(random, seeds.getCorner(1, 1));

		try (GenerationRandom.Scope scope = random.pushHashed(seeds.levelSeed))
		{
			Feature[] tiers = random.percent(WATERY_REGION_PERCENT)
					? PlasmaTerrain.WATERY_TIERS
					: PlasmaTerrain.NORMAL_TIERS
			;
			PlasmaTerrain.fill(random, heights, 1, 1, bottom, right, TERRAIN_TIERS - 1, ROUGHNESS);
			for (int y = 1; y <= bottom; ++y)
			{
				for (int x = 1; x <= right; ++x)
				{
					grid.setFeature(y, x, PlasmaTerrain.toTerrain(tiers, heights[y][x], TERRAIN_TIERS - 1));
					if (context.daytime)
					{
						grid.addFlags(y, x, CellFlags.GLOW);
					}
					// Open ground counts as room so stairs and objects treat the whole region alike.
					if (grid.isOpen(y, x))
					{
						grid.addFlags(y, x, CellFlags.ROOM);
					}
				}
			}
		}
		RoomPainting.border(grid, 0, 0, grid.height - 1, grid.width - 1, Feature.UNSEEN);
	}

	private static int _cornerHeight(GenerationRandom random, int seed)
	{
		try (GenerationRandom.Scope scope = random.pushHashed(seed))
		{
			return random.randomInt(TERRAIN_TIERS);
		}
	}


	private final boolean _isTown;

	/**
	 * @param isTown True to build the town (town vault, scholar, no wandering monsters).
	 */
	public WildernessLevelBuilder(boolean isTown)
	{
		_isTown = isTown;
	}

	@Override
	public void build(GenerationContext context)
	{
		CaveGrid grid = context.grid;
		LevelRequest request = context.request;
		context.daytime = isDaytime(request.turn());
		context.background = Feature.GRASS;
		paintTerrain(context, request.wildX(), request.wildY());

		WildernessSeedField seeds = WildernessSeedField.buildForRegion(context.config.wildernessSeed, request.wildX(), request.wildY());
		// The shaft and vault positions are hashed from a value derived from the region so they come back the same.
		try (GenerationRandom.Scope scope = context.random.pushHashed(~seeds.levelSeed))
		{
			if (context.random.percent(SHAFT_PERCENT))
			{
				PlacementHelpers.allocStairs(context, Feature.SHAFT, 1, 0, false);
			}
			_placeVaults(context);
		}

		// The inhabitants are never hashed.
		try (GenerationRandom.Scope scope = context.random.pushContinuous())
		{
			Location previous = request.previousPlayer();
			if (null != previous)
			{
				PlacementHelpers.oldPlayerSpot(context, previous.y(), previous.x());
			}
			else if (!grid.hasPlayer())
			{
				PlacementHelpers.newPlayerSpot(context);
			}

			if (_isTown)
			{
				_placeScholar(context);
			}
			boolean isTownRegion = (0 == context.depth) && (0 == request.wildX()) && (0 == request.wildY());
			if (!isTownRegion)
			{
				_populateMonsters(context);
			}
			PlacementHelpers.allocObject(context, AllocationSet.ROOM, AllocationType.OBJECT, context.random.normal(ROOM_OBJECTS, 3));
			PlacementHelpers.allocObject(context, AllocationSet.ROOM, AllocationType.ALTAR, context.random.normal(ROOM_ALTARS, 3));
			PlacementHelpers.allocObject(context, AllocationSet.ROOM, AllocationType.OBJECT, context.random.normal(SCATTERED_OBJECTS, 3));
		}
	}


	private void _placeVaults(GenerationContext context)
	{
		CaveGrid grid = context.grid;
		int number = 1;
		if (context.depth > 0)
		{
			number = Math.abs(context.random.normal(0, 1));
			if (0 == number)
			{
				number = 1;
			}
		}
		// The player only starts at a vault's marker when they aren't walking in from a neighbouring region.
		context.allowVaultPlayerStart = (null == context.request.previousPlayer());
		for (int i = 0; i < number; ++i)
		{
			VaultRecord vault = _pickVault(context);
			if (null != vault)
			{
				context.rating += vault.rating;
				int y = context.random.range((vault.height / 2) + 1, grid.height - (vault.height / 2) - 1);
				int x = context.random.range((vault.width / 2) + 1, grid.width - (vault.width / 2) - 1);
				VaultStamper.stamp(context, y, x, vault);
			}
			else
			{
				System.err.println("WARNING:  No wilderness vault available for depth " + context.depth);
			}
		}
	}

	private VaultRecord _pickVault(GenerationContext context)
	{
		VaultRecord vault;
		if (_isTown)
		{
			String name = context.request.vaultName();
			vault = (null != name)
					? context.vaults.getByName(name)
					: context.vaults.getFirst(VaultType.TOWN)
			;
		}
		else
		{
			VaultType type = (context.depth > 0)
					? VaultType.WILDERNESS
					: VaultType.TOWN
			;
			vault = context.vaults.pickRandom(context.random, type);
		}
		return vault;
	}

	private static void _placeScholar(GenerationContext context)
	{
		CaveGrid grid = context.grid;
		int race = context.allocator.getScholarRace();
		for (int i = 0; i < SCHOLAR_ATTEMPTS; ++i)
		{
			int y = context.random.range(SCHOLAR_MARGIN, grid.height - SCHOLAR_MARGIN);
			int x = context.random.range(SCHOLAR_MARGIN, grid.width - SCHOLAR_MARGIN);
			if (grid.inBounds(y, x) && grid.isOpen(y, x) && grid.isNaked(y, x))
			{
				context.allocator.placeMonsterRace(grid, y, x, race, IAllocationCollaborator.MON_JUST_ONE);
				break;
			}
		}
	}

	private static void _populateMonsters(GenerationContext context)
	{
		int k = Math.max(2, Math.min(10, context.depth / 3));
		int base = context.daytime
				? DAY_MONSTERS
				: NIGHT_MONSTERS
		;
		int monsters = base + context.random.roll(4) + k;
		for (int i = 0; i < monsters; ++i)
		{
			PlacementHelpers.allocMonster(context, 0, 0);
		}
		// Aquatic monsters are all nocturnal so they use the night count whatever the time.
		int aquatic = NIGHT_MONSTERS + context.random.roll(4) + k;
		for (int i = 0; i < aquatic; ++i)
		{
			PlacementHelpers.allocMonster(context, 0, IAllocationCollaborator.MON_AQUATIC);
		}
	}
}
