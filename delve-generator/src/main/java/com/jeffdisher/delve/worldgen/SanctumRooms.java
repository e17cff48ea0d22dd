package com.jeffdisher.delve.worldgen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.jeffdisher.delve.data.CaveGrid;
import com.jeffdisher.delve.types.CellFlags;
import com.jeffdisher.delve.types.Feature;
import com.jeffdisher.delve.types.Location;
import com.jeffdisher.delve.types.ObjectQuality;


/**
 * The 2 deep "set piece" rooms:
 * -sanctum:  a lit hall split by a sealed arch, with a puzzle on the west side and a reward chamber on the east
 * -folly:  a lit hall packed with monsters, traps and great objects
 * Both are walled in permanent rock, so they are never used as a tunnel junction.
 */
public class SanctumRooms
{
	public static final int RUNE_SEARCH_ATTEMPTS = 100;
	public static final int FOLLY_MONSTERS = 20;
	public static final int FOLLY_TRAPS = 10;
	public static final int FOLLY_OBJECTS = 5;

	public static boolean buildSanctum(GenerationContext context, int yval, int xval)
	{
		CaveGrid grid = context.grid;
		int y1 = yval - 6;
		int y2 = yval + 6;
		int x1 = xval - 10;
		int x2 = xval + 10;
		boolean built = false;
		if (grid.inBoundsFully(y1, x1) && grid.inBoundsFully(y2, x2))
		{
			RoomPainting.paintFloor(grid, y1, x1, y2, x2, true);
			RoomPainting.border(grid, y1, x1, y2, x2, Feature.SANCTUM_WALL);
			// The only way in is through the puzzle side.
			grid.setFeature(yval, x1, Feature.DOOR, 0);

			// The reward chamber.
			RoomPainting.border(grid, yval - 2, xval - 3, yval + 2, xval + 3, Feature.WALL_INNER);
			grid.setFeature(yval, xval - 3, Feature.DOOR, 0);

			// The sealed arch divides the hall.
			int divider = xval - 4;
			for (int y = y1 + 1; y < y2; ++y)
			{
				grid.setFeature(y, divider, Feature.SANCTUM_WALL);
			}
			grid.setFeature(yval, divider, Feature.SANCTUM_DOOR);

			int puzzleX = x1 + ((divider - x1) / 2);
			context.puzzleSolution.clear();
			switch (context.random.randomInt(3))
			{
			case 0:
				_buildEchoLock(context, yval, puzzleX);
				break;
			case 1:
				_buildFlowConduit(context, yval, puzzleX);
				break;
				default:
					_buildMirrorAlignment(context, yval, puzzleX);
			}

			int rewardX = xval;
			switch (context.random.randomInt(5))
			{
			case 0:
			case 2:
				context.allocator.placeObject(grid, yval, rewardX, context.depth, ObjectQuality.GREAT);
				break;
			case 1:
				context.allocator.placeObject(grid, yval, rewardX, context.depth, ObjectQuality.GREAT);
				context.allocator.placeObject(grid, yval, rewardX + 1, context.depth, ObjectQuality.GREAT);
				break;
			case 3:
				context.allocator.placeObject(grid, yval, rewardX, context.depth, ObjectQuality.PLAIN);
				break;
				default:
					grid.setFeature(yval, rewardX, Feature.DREAM_PORTAL);
			}

			// The idol sells hints.
			grid.setFeature(y1 + 1, x1 + 1, Feature.WHISPERING_IDOL);
			built = true;
		}
		return built;
	}

	public static boolean buildFolly(GenerationContext context, int yval, int xval)
	{
		CaveGrid grid = context.grid;
		int y1 = yval - 10;
		int y2 = yval + 10;
		int x1 = xval - 20;
		int x2 = xval + 20;
		boolean built = false;
		if (grid.inBoundsFully(y1, x1) && grid.inBoundsFully(y2, x2))
		{
			RoomPainting.paintFloor(grid, y1, x1, y2, x2, true);
			RoomPainting.border(grid, y1, x1, y2, x2, Feature.FOLLY_WALL);
			grid.setFeature(yval, x1, Feature.DOOR, 0);

			for (int i = 0; i < FOLLY_MONSTERS; ++i)
			{
				int y = yval + context.random.range(-5, 5);
				int x = xval + context.random.range(-10, 10);
				if (grid.isEmpty(y, x))
				{
					context.allocator.placeMonster(grid, y, x, context.depth, IAllocationCollaborator.MON_PIT | IAllocationCollaborator.MON_HORDE);
				}
			}
			for (int i = 0; i < FOLLY_TRAPS; ++i)
			{
				PlacementHelpers.placeTrap(context, yval + context.random.range(-8, 8), xval + context.random.range(-15, 15));
			}
			for (int i = 0; i < FOLLY_OBJECTS; ++i)
			{
				int y = yval + context.random.range(-5, 5);
				int x = xval + context.random.range(-10, 10);
				if (grid.isClean(y, x))
				{
					context.allocator.placeObject(grid, y, x, context.depth, ObjectQuality.GREAT);
				}
			}
			built = true;
		}
		return built;
	}


	private static void _buildEchoLock(GenerationContext context, int y, int x)
	{
		// Between 3 and 5 runes, which must be touched in a random order.
		int runeCount = 3 + context.random.randomInt(3);
		List<Integer> placed = new ArrayList<>();
		for (int rune = 0; rune < runeCount; ++rune)
		{
			Location spot = _findCleanSpot(context, y, x);
			if (null != spot)
			{
				context.grid.setFeature(spot.y(), spot.x(), Feature.RUNE, rune);
				placed.add(rune);
			}
		}
		for (int i = 0; i < placed.size(); ++i)
		{
			Collections.swap(placed, i, context.random.randomInt(placed.size()));
		}
		context.puzzleSolution.addAll(placed);
	}

	private static void _buildFlowConduit(GenerationContext context, int y, int x)
	{
		Location left = _findCleanSpot(context, y, x);
		if (null != left)
		{
			context.grid.setFeature(left.y(), left.x(), Feature.LEVER_LEFT);
		}
		Location right = _findCleanSpot(context, y, x);
		if (null != right)
		{
			context.grid.setFeature(right.y(), right.x(), Feature.LEVER_RIGHT);
		}
		// The acid blocks the way until both levers are pulled.
		context.grid.setFeature(y, x - 1, Feature.FLOW_ACID);
		context.grid.setFeature(y, x + 1, Feature.FLOW_ACID);
	}

	private static void _buildMirrorAlignment(GenerationContext context, int y, int x)
	{
		context.grid.setFeature(y - 2, x, Feature.EMITTER);
		context.grid.setFeature(y + 2, x, Feature.CRYSTAL);
		context.grid.setFeature(y, x, Feature.MIRROR_PLATE);
	}

	private static Location _findCleanSpot(GenerationContext context, int y, int x)
	{
		Location found = null;
		for (int i = 0; (null == found) && (i < RUNE_SEARCH_ATTEMPTS); ++i)
		{
			int ty = context.random.spread(y, 3);
			int tx = context.random.spread(x, 3);
			if (context.grid.inBounds(ty, tx)
					&& context.grid.isClean(ty, tx)
					&& context.grid.hasFlag(ty, tx, CellFlags.ROOM)
			)
			{
				found = new Location(ty, tx);
			}
		}
		return found;
	}
}
