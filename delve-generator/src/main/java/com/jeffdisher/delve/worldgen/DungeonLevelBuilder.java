package com.jeffdisher.delve.worldgen;

import java.util.Collections;
import java.util.List;

import com.jeffdisher.delve.data.BlockOccupancy;
import com.jeffdisher.delve.data.CaveGrid;
import com.jeffdisher.delve.types.AllocationSet;
import com.jeffdisher.delve.types.AllocationType;
import com.jeffdisher.delve.types.CellFlags;
import com.jeffdisher.delve.types.Feature;
import com.jeffdisher.delve.types.Location;
import com.jeffdisher.delve.types.SectorType;
import com.jeffdisher.delve.utils.GenerationRandom;


/**
 * Builds an ordinary dungeon level (also used for dream levels, which only differ in their stairs).
 * The general design includes the following key points:
 * -an optional "open" background replaces the granite fill (lit floor, flooded, fogged or a mixed rubble-field)
 * -2x2-block sectors are rolled and built first, then rooms are tried at random blocks of the remaining ruins
 * -room centres are shuffled and chained together with tunnels, plus some extra random connections
 * -mineral veins, an optional destruction pass and hazard streams are layered over the connected level
 * -stairs, the player, monsters, objects, traps and scenery are placed last
 */
public class DungeonLevelBuilder implements ILevelBuilder
{
	public static final int ROOM_ATTEMPTS = 400;
	public static final int UNUSUAL_ROOM_CHANCE = 200;
	public static final int DESTROYED_CHANCE = 15;
	public static final int OPEN_LEVEL_PERCENT = 10;
	public static final int THEMED_VAULT_PERCENT = 70;
	public static final int RARE_THEMED_VAULT_PERCENT = 10;
	public static final int WINDING_TUNNEL_PERCENT = 75;
	public static final int EXTRA_TUNNEL_PERCENT = 40;
	public static final int MAGMA_STREAMERS = 3;
	public static final int MAGMA_TREASURE_CHANCE = 90;
	public static final int QUARTZ_STREAMERS = 2;
	public static final int QUARTZ_TREASURE_CHANCE = 40;
	public static final int STANDARD_AREA = 64 * 64;
	public static final int MIN_MONSTERS = 14;
	public static final int UNCROWDED_MONSTER_BONUS = 100;
	public static final int GOOD_ITEMS = 6;
	public static final int GOLD_PILES = 50;
	public static final int ROOM_OBJECTS = 100;
	public static final int ROOM_ALTARS = 3;
	public static final int SCATTERED_OBJECTS = 50;
	public static final int DOOR_TRAP_PERCENT = 20;
	public static final int CHEST_TRAP_PERCENT = 40;

	private final RoomPlacer _placer;

	public DungeonLevelBuilder(RoomRegistry registry)
	{
		_placer = new RoomPlacer(registry);
	}

	@Override
	public void build(GenerationContext context)
	{
		CaveGrid grid = context.grid;
		boolean litLevel = _chooseBackground(context);
		_fillBackground(context);
		boolean destroyed = (context.depth > 10) && (0 == context.random.randomInt(DESTROYED_CHANCE));

		SectorGenerator.assignSectors(context);
		SectorGenerator.buildSectors(context);
		_buildRooms(context, destroyed);
		_permanentBorder(grid);
		_connectRooms(context);

		int scale = _areaScale(grid);
		if (Feature.WALL_EXTRA == context.background)
		{
			TunnelCarver.placeJunctionDoors(context);
			for (int i = 0; i < (MAGMA_STREAMERS * scale); ++i)
			{
				Streamers.buildMineralStreamer(context, Feature.MAGMA, MAGMA_TREASURE_CHANCE, 32 + context.random.roll(32));
			}
			for (int i = 0; i < (QUARTZ_STREAMERS * scale); ++i)
			{
				Streamers.buildMineralStreamer(context, Feature.QUARTZ, QUARTZ_TREASURE_CHANCE, 32 + context.random.roll(32));
			}
		}
		if (destroyed)
		{
			LevelDestroyer.destroy(context);
		}
		_buildHazardStreamers(context);

		boolean forceRoom = (Feature.FOG == context.background) || (Feature.CHAOS_FOG == context.background);
		PlacementHelpers.allocStairs(context, Feature.MORE, context.random.range(1, 3), 3, forceRoom);
		PlacementHelpers.allocStairs(context, Feature.LESS, context.random.range(1, 2), 3, forceRoom);
		context.generationOrigin = PlacementHelpers.findGenerationOrigin(context);
		PlacementHelpers.newPlayerSpot(context);

		// A seeded dungeon keeps its layout but its inhabitants change on every visit.
		try (GenerationRandom.Scope scope = context.random.pushContinuous())
		{
			_populate(context, scale);
		}

		if (litLevel)
		{
			for (int y = 0; y < grid.height; ++y)
			{
				for (int x = 0; x < grid.width; ++x)
				{
					// Room floors keep their own lighting.
					if (!grid.hasFlag(y, x, CellFlags.ROOM) || (Feature.FLOOR != grid.getFeature(y, x)))
					{
						grid.addFlags(y, x, CellFlags.GLOW);
					}
				}
			}
		}
	}


	private boolean _chooseBackground(GenerationContext context)
	{
		boolean lit = false;
		context.background = Feature.WALL_EXTRA;
		if (context.config.allowWeirdLevels)
		{
			int chance = context.config.rareWeirdness
					? (OPEN_LEVEL_PERCENT / 2)
					: OPEN_LEVEL_PERCENT
			;
			if (context.random.percent(chance))
			{
				context.background = Feature.FLOOR;
				lit = true;
			}
			else if (context.random.percent(chance))
			{
				context.background = Feature.SHALLOW_WATER;
				lit = true;
			}
			else if (context.random.percent(chance))
			{
				context.background = Feature.CHAOS_FOG;
			}
			else if (context.random.percent(chance))
			{
				// NONE means a random mix, mostly floor.
				context.background = Feature.NONE;
				lit = true;
			}
			else if (context.random.percent(chance))
			{
				context.background = Feature.FOG;
			}
		}
		return lit;
	}

	private void _fillBackground(GenerationContext context)
	{
		CaveGrid grid = context.grid;
		if (Feature.NONE == context.background)
		{
			for (int y = 0; y < grid.height; ++y)
			{
				for (int x = 0; x < grid.width; ++x)
				{
					int pick = (x + y + context.random.roll(12)) % 12;
					Feature feature;
					if (pick <= 8)
					{
						feature = Feature.FLOOR;
					}
					else if (9 == pick)
					{
						feature = Feature.WALL_EXTRA;
					}
					else if (10 == pick)
					{
						feature = Feature.QUARTZ;
					}
					else
					{
						feature = Feature.MAGMA;
					}
					grid.setFeature(y, x, feature);
				}
			}
		}
		else
		{
			RoomPainting.fill(grid, 0, 0, grid.height - 1, grid.width - 1, context.background);
		}
	}

	private void _buildRooms(GenerationContext context, boolean destroyed)
	{
		BlockOccupancy blocks = context.blocks;
		int depth = context.depth;
		for (int i = 0; i < ROOM_ATTEMPTS; ++i)
		{
			int by = context.random.randomInt(blocks.rows);
			int bx = context.random.randomInt(blocks.columns);
			if (SectorType.RUINS != context.blockSectors[by][bx])
			{
				continue;
			}
			if (context.config.alignRooms)
			{
				// Slide rooms onto every third block column.
				if (0 == (bx % 3))
				{
					bx += 1;
				}
				if (2 == (bx % 3))
				{
					bx -= 1;
				}
			}
			if (destroyed)
			{
				_placer.placeRoom(context, by, bx, RoomRegistry.SIMPLE);
				continue;
			}

			if (context.config.allowWeirdLevels)
			{
				int chance = context.config.rareWeirdness
						? RARE_THEMED_VAULT_PERCENT
						: THEMED_VAULT_PERCENT
				;
				if (context.random.percent(chance) && _placer.placeRoom(context, by, bx, RoomRegistry.THEMED_VAULT))
				{
					continue;
				}
			}

			if (context.random.randomInt(UNUSUAL_ROOM_CHANCE) < depth)
			{
				int k = context.random.randomInt(100);
				if ((context.random.randomInt(UNUSUAL_ROOM_CHANCE) < depth) && _buildVeryUnusualRoom(context, by, bx, k))
				{
					continue;
				}
				if ((k < 25) && _placer.placeRoom(context, by, bx, RoomRegistry.LARGE))
				{
					continue;
				}
				if ((k < 50) && _placer.placeRoom(context, by, bx, RoomRegistry.CROSS))
				{
					continue;
				}
				// The shaped rooms take a share of the overlapping rooms on weird levels.
				if (context.config.allowWeirdLevels && (k >= 85) && _placer.placeRoom(context, by, bx, RoomRegistry.CIRCULAR + (k % 3)))
				{
					continue;
				}
				if (_placer.placeRoom(context, by, bx, RoomRegistry.OVERLAPPING))
				{
					continue;
				}
			}
			_placer.placeRoom(context, by, bx, RoomRegistry.SIMPLE);
		}
	}

	private boolean _buildVeryUnusualRoom(GenerationContext context, int by, int bx, int k)
	{
		int depth = context.depth;
		return ((k < 5) && (depth >= 10) && _placer.placeRoom(context, by, bx, RoomRegistry.GUARD_POST))
				|| ((k < 10) && (depth >= 15) && _placer.placeRoom(context, by, bx, RoomRegistry.AMBUSH_CORRIDOR))
				|| ((k < 20) && (depth >= 30) && _placer.placeRoom(context, by, bx, RoomRegistry.FOLLY))
				|| ((k < 20) && (depth >= 40) && _placer.placeRoom(context, by, bx, RoomRegistry.SANCTUM))
				|| ((k < 20) && _placer.placeRoom(context, by, bx, RoomRegistry.GREATER_VAULT))
				|| ((k < 25) && _placer.placeRoom(context, by, bx, RoomRegistry.LESSER_VAULT))
				|| ((k < 50) && _placer.placeRoom(context, by, bx, RoomRegistry.PIT))
				|| ((k < 80) && _placer.placeRoom(context, by, bx, RoomRegistry.NEST))
		;
	}

	private static void _permanentBorder(CaveGrid grid)
	{
		RoomPainting.border(grid, 0, 0, grid.height - 1, grid.width - 1, Feature.PERM_SOLID);
	}

	private static void _connectRooms(GenerationContext context)
	{
		List<Location> centres = context.centres;
		if (!centres.isEmpty())
		{
			for (int i = 0; i < centres.size(); ++i)
			{
				Collections.swap(centres, context.random.randomInt(centres.size()), context.random.randomInt(centres.size()));
			}
			// Start by connecting the first room to the last.
			Location previous = centres.get(centres.size() - 1);
			for (Location centre : centres)
			{
				if (context.random.percent(WINDING_TUNNEL_PERCENT))
				{
					TunnelCarver.carveWinding(context, centre.y(), centre.x(), previous.y(), previous.x());
				}
				else
				{
					TunnelCarver.carveDirected(context, centre.y(), centre.x(), previous.y(), previous.x());
				}
				previous = centre;
			}
			for (int i = 0; i < centres.size(); ++i)
			{
				if (context.random.percent(EXTRA_TUNNEL_PERCENT))
				{
					int target = context.random.randomInt(centres.size());
					if (target != i)
					{
						Location from = centres.get(i);
						Location to = centres.get(target);
						TunnelCarver.carveWinding(context, from.y(), from.x(), to.y(), to.x());
					}
				}
			}
		}
	}

	private static void _buildHazardStreamers(GenerationContext context)
	{
		int depth = context.depth;
		if ((depth <= 2) && (context.random.roll(20) > 15))
		{
			_streams(context, Feature.TREES, context.random.roll(QUARTZ_STREAMERS), true);
		}
		if ((depth <= 19) && (context.random.roll(20) > 15))
		{
			_streams(context, Feature.SHALLOW_WATER, context.random.roll(QUARTZ_STREAMERS - 1), false);
			if (context.random.roll(20) > 15)
			{
				_streams(context, Feature.DEEP_WATER, context.random.roll(QUARTZ_STREAMERS), true);
			}
		}
		else if ((depth > 19) && (context.random.roll(20) > 15))
		{
			_streams(context, Feature.SHALLOW_LAVA, context.random.roll(QUARTZ_STREAMERS), false);
			if (context.random.roll(20) > 15)
			{
				_streams(context, Feature.DEEP_LAVA, context.random.roll(QUARTZ_STREAMERS - 1), true);
			}
		}
		else if (context.random.roll(10) > 7)
		{
			_streams(context, Feature.CHAOS_FOG, context.random.roll(QUARTZ_STREAMERS), true);
		}
		if (context.random.roll(10) > 7)
		{
			Streamers.buildHazardStreamer(context, Feature.OIL, false);
		}
		if (context.random.roll(10) > 7)
		{
			Streamers.buildHazardStreamer(context, Feature.ICE, false);
		}
		if (context.random.roll(10) > 7)
		{
			Streamers.buildHazardStreamer(context, Feature.ACID, false);
		}
	}

	private static void _streams(GenerationContext context, Feature feature, int count, boolean killWalls)
	{
		for (int i = 0; i < count; ++i)
		{
			Streamers.buildHazardStreamer(context, feature, killWalls);
		}
	}

	private static void _populate(GenerationContext context, int scale)
	{
		int k = Math.max(2, Math.min(10, context.depth / 3));
		int monsters = (MIN_MONSTERS + context.random.roll(8)) * 4;
		if (!context.crowded)
		{
			monsters += UNCROWDED_MONSTER_BONUS;
		}
		boolean flooded = (Feature.SHALLOW_WATER == context.background);
		for (int i = monsters + k; i > 0; --i)
		{
			if (flooded)
			{
				PlacementHelpers.allocMonster(context, 0, IAllocationCollaborator.MON_SLEEP | IAllocationCollaborator.MON_AQUATIC);
			}
			PlacementHelpers.allocMonster(context, 0, IAllocationCollaborator.MON_SLEEP);
		}

		for (int i = 0; i < GOOD_ITEMS; ++i)
		{
			PlacementHelpers.allocReward(context, false);
		}
		for (int i = 0; i < GOLD_PILES; ++i)
		{
			PlacementHelpers.allocReward(context, true);
		}

		int traps = (5 + context.random.randomInt(6)) * scale;
		PlacementHelpers.allocObject(context, AllocationSet.BOTH, AllocationType.TRAP, traps / 2);
		PlacementHelpers.allocObject(context, AllocationSet.CORRIDOR, AllocationType.TRAP, traps / 2);
		FeaturePopulator.placeTrapsNearDoors(context, DOOR_TRAP_PERCENT);
		FeaturePopulator.placeTrapsNearChests(context, CHEST_TRAP_PERCENT);

		PlacementHelpers.allocObject(context, AllocationSet.CORRIDOR, AllocationType.RUBBLE, context.random.roll(k));
		PlacementHelpers.allocObject(context, AllocationSet.ROOM, AllocationType.OBJECT, context.random.normal(ROOM_OBJECTS, 3));
		PlacementHelpers.allocObject(context, AllocationSet.ROOM, AllocationType.ALTAR, context.random.normal(ROOM_ALTARS, 3));
		PlacementHelpers.allocObject(context, AllocationSet.BOTH, AllocationType.OBJECT, context.random.normal(SCATTERED_OBJECTS, 3));

		FeaturePopulator.populateFeatures(context);
		FeaturePopulator.populateCover(context);
	}

	private static int _areaScale(CaveGrid grid)
	{
		int area = grid.height * grid.width;
		return Math.max(1, (area + STANDARD_AREA - 1) / STANDARD_AREA);
	}
}
