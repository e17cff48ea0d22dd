package com.jeffdisher.delve.worldgen;

import com.jeffdisher.delve.data.CaveGrid;
import com.jeffdisher.delve.types.CellFlags;
import com.jeffdisher.delve.types.Feature;
import com.jeffdisher.delve.types.GenerationMode;
import com.jeffdisher.delve.types.ObjectQuality;
import com.jeffdisher.delve.utils.GenerationRandom;


/**
 * Stamps a decoded vault into the grid, centred on a cell.  The terrain layer is painted first, over the whole vault,
 * and then the contents layer places monsters, objects and the player.
 * In both layers, ' ' and '-' mean "leave the cell alone".
 */
public class VaultStamper
{
	/**
	 * The contents symbols which place an object of the matching display glyph.
	 */
	public static final String OBJECT_GLYPHS = "!\"$(),~'/=?[\\]_{|}";

	/**
	 * Stamps the vault.  The contents are always rolled from the continuous random stream, even inside a hashed
	 * wilderness region.
	 *
	 * @param context The generation context.
	 * @param yval The centre row.
	 * @param xval The centre column.
	 * @param vault The vault to stamp.
	 */
	public static void stamp(GenerationContext context, int yval, int xval, VaultRecord vault)
	{
		try (GenerationRandom.Scope scope = context.random.pushContinuous())
		{
			int top = yval - (vault.height / 2);
			int left = xval - (vault.width / 2);
			boolean townSymbols = vault.type.isTownKind();
			boolean wildSymbols = (VaultType.WILDERNESS == vault.type);
			int monsterFlags = IAllocationCollaborator.MON_SLEEP;
			if (VaultType.QUEST == vault.type)
			{
				monsterFlags |= IAllocationCollaborator.MON_QUEST;
			}

			for (int dy = 0; dy < vault.height; ++dy)
			{
				for (int dx = 0; dx < vault.width; ++dx)
				{
					char symbol = vault.getTerrain(dy, dx);
					if (_isPainted(symbol) && context.grid.inBounds(top + dy, left + dx))
					{
						_paintTerrain(context, vault, top + dy, left + dx, symbol, townSymbols || wildSymbols, townSymbols);
					}
				}
			}
			for (int dy = 0; dy < vault.height; ++dy)
			{
				for (int dx = 0; dx < vault.width; ++dx)
				{
					char symbol = vault.getContents(dy, dx);
					if (_isPainted(symbol) && context.grid.inBounds(top + dy, left + dx))
					{
						_placeContents(context, vault, top + dy, left + dx, symbol, townSymbols, monsterFlags);
					}
				}
			}
		}
	}


	private static boolean _isPainted(char symbol)
	{
		return (' ' != symbol) && ('-' != symbol);
	}

	private static void _paintTerrain(GenerationContext context, VaultRecord vault, int y, int x, char symbol, boolean isUnprotected, boolean townSymbols)
	{
		CaveGrid grid = context.grid;
		grid.setFeature(y, x, Feature.FLOOR);
		grid.addFlags(y, x, CellFlags.ROOM);
		if (!isUnprotected)
		{
			grid.addFlags(y, x, CellFlags.ICKY);
		}

		if ((symbol >= '0') && (symbol <= '7'))
		{
			grid.setFeature(y, x, Feature.SHOP, symbol - '0');
		}
		else if ((symbol >= 'a') && (symbol <= 'z'))
		{
			grid.setFeature(y, x, Feature.BUILDING, symbol - 'a');
		}
		else
		{
			switch (symbol)
			{
			case '%':
				grid.setFeature(y, x, Feature.WALL_OUTER);
				break;
			case '#':
				grid.setFeature(y, x, Feature.WALL_INNER);
				break;
			case ':':
				grid.setFeature(y, x, Feature.RUBBLE);
				break;
			case '&':
				grid.setFeature(y, x, Feature.MAGMA);
				break;
			case '$':
				grid.setFeature(y, x, Feature.QUARTZ);
				break;
			case 'X':
				grid.setFeature(y, x, Feature.PERM_INNER);
				break;
			case 'Q':
				grid.setFeature(y, x, Feature.QUEST_ENTER);
				break;
			case 'E':
				grid.setFeature(y, x, Feature.QUEST_EXIT);
				break;
			case '<':
				grid.setFeature(y, x, Feature.LESS);
				break;
			case '>':
				grid.setFeature(y, x, Feature.MORE);
				break;
			case 'O':
				PlacementHelpers.placeAltar(context, y, x);
				break;
			case 'A':
				grid.setFeature(y, x, Feature.GRASS);
				break;
			case 'B':
				grid.setFeature(y, x, Feature.SWAMP);
				break;
			case 'C':
				grid.setFeature(y, x, Feature.MUD);
				break;
			case 'H':
				grid.setFeature(y, x, Feature.SHRUB);
				break;
			case 'I':
				grid.setFeature(y, x, Feature.ROCKY_HILL);
				break;
			case 'V':
				grid.setFeature(y, x, Feature.SHALLOW_WATER);
				break;
			case 'W':
				grid.setFeature(y, x, Feature.DEEP_WATER);
				break;
			case 'J':
				grid.setFeature(y, x, Feature.FOG);
				break;
			case 'K':
				grid.setFeature(y, x, Feature.SHALLOW_LAVA);
				break;
			case 'L':
				grid.setFeature(y, x, Feature.DEEP_LAVA);
				break;
			case 'F':
				grid.setFeature(y, x, Feature.CHAOS_FOG);
				break;
			case ';':
				// Glyphs are always protected.
				grid.addFlags(y, x, CellFlags.ICKY);
				grid.setFeature(y, x, Feature.GLYPH);
				break;
			case 'Y':
				grid.setFeature(y, x, Feature.TREES);
				break;
			case 'M':
				grid.setFeature(y, x, Feature.MOUNTAIN);
				break;
			case '*':
				if (context.random.percent(50))
				{
					PlacementHelpers.placeTrap(context, y, x);
				}
				break;
			case '+':
				DoorHelpers.placeSecretDoor(context, y, x);
				break;
			case 'D':
				if (townSymbols)
				{
					grid.setFeature(y, x, Feature.DOOR, 0);
				}
				else
				{
					grid.setFeature(y, x, Feature.DOOR, context.random.roll(4));
				}
				break;
			case '^':
				PlacementHelpers.placeTrap(context, y, x);
				break;
			case 'G':
				int race = vault.getMonsterSlot(0);
				if (0 != race)
				{
					context.allocator.placeGenerator(grid, y, x, race);
				}
				break;
			case 'S':
				grid.setFeature(y, x, Feature.STORE_EXIT);
				break;
			case 'U':
				grid.setFeature(y, x, Feature.SHAFT);
				break;
				default:
					// Anything else is plain floor.
					break;
			}
		}
	}

	private static void _placeContents(GenerationContext context, VaultRecord vault, int y, int x, char symbol, boolean townSymbols, int monsterFlags)
	{
		CaveGrid grid = context.grid;
		IAllocationCollaborator allocator = context.allocator;
		int depth = context.depth;
		if ((symbol >= '0') && (symbol <= '9'))
		{
			int race = vault.getMonsterSlot(symbol - '0');
			if (0 != race)
			{
				allocator.placeMonsterRace(grid, y, x, race, monsterFlags);
			}
		}
		else if (Character.isLetter(symbol))
		{
			allocator.placeMonsterByGlyph(grid, y, x, symbol, depth, monsterFlags);
		}
		else if (OBJECT_GLYPHS.indexOf(symbol) >= 0)
		{
			allocator.placeObjectByGlyph(grid, y, x, symbol, depth);
		}
		else
		{
			switch (symbol)
			{
			case '*':
				if (context.random.percent(50))
				{
					allocator.placeObject(grid, y, x, depth, ObjectQuality.PLAIN);
				}
				break;
			case '.':
				if (context.random.percent(75))
				{
					allocator.placeObject(grid, y, x, depth, ObjectQuality.PLAIN);
				}
				else if (context.random.percent(80))
				{
					allocator.placeObject(grid, y, x, depth, ObjectQuality.GOOD);
				}
				else
				{
					allocator.placeObject(grid, y, x, depth, ObjectQuality.GREAT);
				}
				break;
			case '&':
				if (townSymbols)
				{
					allocator.placeMonsterRace(grid, y, x, context.request.arenaRace(), IAllocationCollaborator.MON_ARENA | IAllocationCollaborator.MON_JUST_ONE);
				}
				else
				{
					allocator.placeMonster(grid, y, x, depth + 5, monsterFlags);
				}
				break;
			case ';':
				allocator.placeMonster(grid, y, x, depth + 11, monsterFlags);
				break;
			case '#':
				allocator.placeMonster(grid, y, x, depth + 9, monsterFlags);
				allocator.placeObject(grid, y, x, depth + 7, ObjectQuality.GOOD);
				break;
			case '^':
				allocator.placeMonster(grid, y, x, depth + 40, monsterFlags);
				allocator.placeObject(grid, y, x, depth + 20, ObjectQuality.GREAT);
				break;
			case ':':
				if (context.random.percent(50))
				{
					allocator.placeMonster(grid, y, x, depth + 3, monsterFlags);
				}
				if (context.random.percent(50))
				{
					allocator.placeObject(grid, y, x, depth + 7, ObjectQuality.PLAIN);
				}
				break;
			case '@':
				if ((GenerationMode.WILDERNESS != context.request.mode()) || context.allowVaultPlayerStart)
				{
					grid.setPlayer(y, x);
				}
				break;
				default:
					// Unknown symbols place nothing.
					break;
			}
		}
	}
}
