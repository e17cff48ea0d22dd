package com.jeffdisher.delve.worldgen;

import com.jeffdisher.delve.data.CaveGrid;
import com.jeffdisher.delve.types.CellFlags;
import com.jeffdisher.delve.types.Feature;
import com.jeffdisher.delve.types.GenerationMode;


/**
 * Builds the levels which are nothing more than a single vault on a fixed background:  stores, the arena and quest
 * levels.
 */
public class VaultLevelBuilder implements ILevelBuilder
{
	/**
	 * Quest levels with a wilderness background borrow the terrain of a random region within this distance of the
	 * origin.
	 */
	public static final int QUEST_WILD_RANGE = 100;

	/**
	 * Lights the level the way the town is lit:  everything in daylight, only the interesting cells at night, and
	 * the surroundings of every shop entrance always.
	 */
	public static void lightTown(CaveGrid grid, boolean daytime)
	{
		for (int y = 0; y < grid.height; ++y)
		{
			for (int x = 0; x < grid.width; ++x)
			{
				Feature feature = grid.getFeature(y, x);
				if (daytime || !_isBoring(feature))
				{
					grid.addFlags(y, x, CellFlags.GLOW);
				}
			}
		}
		for (int y = 0; y < grid.height; ++y)
		{
			for (int x = 0; x < grid.width; ++x)
			{
				Feature feature = grid.getFeature(y, x);
				if ((Feature.SHOP == feature) || (Feature.BUILDING == feature) || (Feature.STORE_EXIT == feature))
				{
					for (int dy = -1; dy <= 1; ++dy)
					{
						for (int dx = -1; dx <= 1; ++dx)
						{
							if (grid.inBounds(y + dy, x + dx))
							{
								grid.addFlags(y + dy, x + dx, CellFlags.GLOW);
							}
						}
					}
				}
			}
		}
	}

	private static boolean _isBoring(Feature feature)
	{
		return (Feature.FLOOR == feature)
				|| (Feature.INVIS == feature)
				|| (Feature.GRASS == feature)
				|| feature.isRock()
		;
	}


	@Override
	public void build(GenerationContext context)
	{
		GenerationMode mode = context.request.mode();
		switch (mode)
		{
		case STORE:
			_buildEnclosed(context, VaultType.STORE);
			break;
		case ARENA:
			_buildEnclosed(context, VaultType.ARENA);
			break;
		case QUEST:
			_buildQuest(context);
			break;
			default:
				throw new IllegalArgumentException("Not a vault level mode: " + mode);
		}
	}


	private static void _buildEnclosed(GenerationContext context, VaultType type)
	{
		CaveGrid grid = context.grid;
		context.daytime = WildernessLevelBuilder.isDaytime(context.request.turn());
		context.background = Feature.PERM_SOLID;
		grid.wipe(Feature.PERM_SOLID);

		VaultRecord vault = _chooseVault(context, type);
		if (null != vault)
		{
			// Top-left corner at (2, 2).
			VaultStamper.stamp(context, (vault.height / 2) + 2, (vault.width / 2) + 2, vault);
		}
		else
		{
			System.err.println("WARNING:  No " + type + " vault available");
		}
		lightTown(grid, context.daytime);
		if (!grid.hasPlayer())
		{
			PlacementHelpers.newPlayerSpot(context);
		}
	}

	private static void _buildQuest(GenerationContext context)
	{
		CaveGrid grid = context.grid;
		VaultRecord vault = _chooseVault(context, VaultType.QUEST);
		VaultRecord.Background background = (null != vault)
				? vault.background
				: VaultRecord.Background.PERM
		;
		switch (background)
		{
		case WILD:
		{
			context.background = Feature.GRASS;
			context.daytime = WildernessLevelBuilder.isDaytime(context.request.turn());
			int wildX = context.random.range(-QUEST_WILD_RANGE, QUEST_WILD_RANGE);
			int wildY = context.random.range(-QUEST_WILD_RANGE, QUEST_WILD_RANGE);
			WildernessLevelBuilder.paintTerrain(context, wildX, wildY);
			break;
		}
		case FOG:
			context.background = Feature.FOG;
			grid.wipe(Feature.FOG);
			RoomPainting.border(grid, 0, 0, grid.height - 1, grid.width - 1, Feature.PERM_SOLID);
			break;
			default:
				context.background = Feature.PERM_SOLID;
				grid.wipe(Feature.PERM_SOLID);
		}

		if (null != vault)
		{
			context.rating += vault.rating;
			int y = context.random.range((vault.height / 2) + 1, grid.height - (vault.height / 2) - 1);
			int x = context.random.range((vault.width / 2) + 1, grid.width - (vault.width / 2) - 1);
			VaultStamper.stamp(context, y, x, vault);
		}
		else
		{
			System.err.println("WARNING:  No quest vault available");
		}
		if (!grid.hasPlayer())
		{
			PlacementHelpers.newPlayerSpot(context);
		}
	}

	private static VaultRecord _chooseVault(GenerationContext context, VaultType type)
	{
		String name = context.request.vaultName();
		VaultRecord vault = (null != name)
				? context.vaults.getByName(name)
				: context.vaults.getFirst(type)
		;
		return vault;
	}
}
