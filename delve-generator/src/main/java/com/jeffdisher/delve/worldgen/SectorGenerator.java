package com.jeffdisher.delve.worldgen;

import com.jeffdisher.delve.data.BlockOccupancy;
import com.jeffdisher.delve.data.CaveGrid;
import com.jeffdisher.delve.types.CellFlags;
import com.jeffdisher.delve.types.Elevation;
import com.jeffdisher.delve.types.Feature;
import com.jeffdisher.delve.types.Location;
import com.jeffdisher.delve.types.ObjectQuality;
import com.jeffdisher.delve.types.SectorType;


/**
 * Splits the block grid into 2x2-block sectors and builds the ones which are not left as ruins.
 * A sector reserves all 4 of its blocks (a 22x22 cell area).  Its terrain is painted inside a 1-cell margin so the
 * edge passes (slopes and walls) never reach outside the reservation.
 */
public class SectorGenerator
{
	public static final int SECTOR_BLOCKS = 2;
	public static final int SECTOR_SIZE = SECTOR_BLOCKS * BlockOccupancy.BLOCK_HEIGHT;
	public static final int CAVERN_MAX_HEIGHT = 100;
	public static final int DARK_WALL_PERCENT = 40;
	public static final int DARK_ITERATIONS = 4;
	public static final int SEARCH_ATTEMPTS = 1000;
	public static final int STREAM_STEP_LIMIT = 1000;

	/**
	 * Rolls a sector type for every complete 2x2 block region.  Regions at the ragged bottom or right edge (when the
	 * block grid has an odd size) are always ruins.
	 */
	public static void assignSectors(GenerationContext context)
	{
		BlockOccupancy blocks = context.blocks;
		int depth = context.depth;
		for (int by = 0; (by + 1) < blocks.rows; by += SECTOR_BLOCKS)
		{
			for (int bx = 0; (bx + 1) < blocks.columns; bx += SECTOR_BLOCKS)
			{
				int roll = context.random.randomInt(100);
				SectorType type;
				if (roll < (depth / 2))
				{
					type = SectorType.CAVERN;
				}
				else if (roll < 10)
				{
					type = SectorType.PLAZA;
				}
				else if (roll < 20)
				{
					type = SectorType.DARK;
				}
				else if (roll < (40 + (depth / 4)))
				{
					type = SectorType.HILL;
				}
				else if (roll < (45 + (depth / 5)))
				{
					type = SectorType.PIT;
				}
				else if (roll < (50 + (depth / 6)))
				{
					type = SectorType.CLIFF;
				}
				else
				{
					type = SectorType.RUINS;
				}
				context.blockSectors[by][bx] = type;
				context.blockSectors[by + 1][bx] = type;
				context.blockSectors[by][bx + 1] = type;
				context.blockSectors[by + 1][bx + 1] = type;
			}
		}
	}

	/**
	 * Builds every sector which isn't ruins, reserving its blocks and recording its centre for the tunnels.
	 */
	public static void buildSectors(GenerationContext context)
	{
		BlockOccupancy blocks = context.blocks;
		for (int by = 0; (by + 1) < blocks.rows; by += SECTOR_BLOCKS)
		{
			for (int bx = 0; (bx + 1) < blocks.columns; bx += SECTOR_BLOCKS)
			{
				SectorType type = context.blockSectors[by][bx];
				if ((SectorType.RUINS != type) && blocks.isFree(by, bx, by + 1, bx + 1))
				{
					buildSector(context, type, by, bx);
					blocks.reserve(by, bx, by + 1, bx + 1);
					context.centres.add(new Location((by * BlockOccupancy.BLOCK_HEIGHT) + BlockOccupancy.BLOCK_HEIGHT
							, (bx * BlockOccupancy.BLOCK_WIDTH) + BlockOccupancy.BLOCK_WIDTH
					));
				}
			}
		}
	}

	/**
	 * Builds a single sector whose top-left block is (by, bx).
	 */
	public static void buildSector(GenerationContext context, SectorType type, int by, int bx)
	{
		int top = (by * BlockOccupancy.BLOCK_HEIGHT) + 1;
		int left = (bx * BlockOccupancy.BLOCK_WIDTH) + 1;
		int bottom = top + SECTOR_SIZE - 3;
		int right = left + SECTOR_SIZE - 3;
		for (int y = top - 1; y <= bottom + 1; ++y)
		{
			for (int x = left - 1; x <= right + 1; ++x)
			{
				context.grid.setSector(y, x, type);
			}
		}
		switch (type)
		{
		case CAVERN:
			_buildCavern(context, top, left, bottom, right);
			break;
		case PLAZA:
			_buildPlaza(context, top, left, bottom, right);
			break;
		case DARK:
			_buildDark(context, top, left, bottom, right);
			break;
		case HILL:
			_buildHill(context, top, left, bottom, right);
			break;
		case PIT:
			_buildPit(context, top, left, bottom, right);
			break;
		case CLIFF:
			_buildCliff(context, top, left, bottom, right);
			break;
			default:
				// Ruins are left for the room builders.
				break;
		}
	}


	private static void _buildCavern(GenerationContext context, int top, int left, int bottom, int right)
	{
		CaveGrid grid = context.grid;
		int height = bottom - top + 1;
		int width = right - left + 1;
		int[][] field = new int[height][width];
		field[0][0] = context.random.randomInt(CAVERN_MAX_HEIGHT);
		field[height - 1][0] = context.random.randomInt(CAVERN_MAX_HEIGHT);
		field[0][width - 1] = context.random.randomInt(CAVERN_MAX_HEIGHT);
		field[height - 1][width - 1] = context.random.randomInt(CAVERN_MAX_HEIGHT);
		PlasmaTerrain.fill(context.random, field, 0, 0, height - 1, width - 1, CAVERN_MAX_HEIGHT, 1);
		for (int y = 0; y < height; ++y)
		{
			for (int x = 0; x < width; ++x)
			{
				if (field[y][x] > (CAVERN_MAX_HEIGHT / 2))
				{
					grid.setFeature(top + y, left + x, Feature.FLOOR);
					grid.addFlags(top + y, left + x, CellFlags.ROOM);
				}
				else
				{
					grid.setFeature(top + y, left + x, Feature.WALL_INNER);
				}
			}
		}
	}

	private static void _buildPlaza(GenerationContext context, int top, int left, int bottom, int right)
	{
		CaveGrid grid = context.grid;
		RoomPainting.paintFloor(grid, top, left, bottom, right, false);

		Feature hazard;
		switch (context.random.randomInt(3))
		{
		case 0:
			hazard = Feature.SHALLOW_LAVA;
			break;
		case 1:
			hazard = Feature.ACID;
			break;
			default:
				hazard = Feature.ICE;
		}

		int streams = 1 + context.random.randomInt(3);
		for (int i = 0; i < streams; ++i)
		{
			int y;
			int x;
			int endY;
			int endX;
			if (context.random.percent(50))
			{
				// North to south.
				y = top + 1;
				x = context.random.range(left + 1, right - 1);
				endY = bottom - 1;
				endX = context.random.range(left + 1, right - 1);
			}
			else
			{
				// West to east.
				y = context.random.range(top + 1, bottom - 1);
				x = left + 1;
				endY = context.random.range(top + 1, bottom - 1);
				endX = right - 1;
			}
			for (int steps = 0; ((y != endY) || (x != endX)) && (steps < STREAM_STEP_LIMIT); ++steps)
			{
				grid.setFeature(y, x, hazard);
				int dy = Integer.signum(endY - y);
				int dx = Integer.signum(endX - x);
				if (context.random.percent(30))
				{
					dy = context.random.range(-1, 1);
					dx = context.random.range(-1, 1);
				}
				int ny = y + dy;
				int nx = x + dx;
				if ((ny >= top) && (ny <= bottom) && (nx >= left) && (nx <= right))
				{
					y = ny;
					x = nx;
				}
			}
		}

		// 2 safe crossings.
		for (int i = 0; i < 2; ++i)
		{
			int by = context.random.range(top + 2, bottom - 2);
			int bx = context.random.range(left + 2, right - 2);
			RoomPainting.fill(grid, by - 1, bx - 1, by + 1, bx + 1, Feature.FLOOR);
		}
		ConnectivityRepair.repair(grid, top, left, bottom, right);
	}

	private static void _buildDark(GenerationContext context, int top, int left, int bottom, int right)
	{
		CaveGrid grid = context.grid;
		for (int y = top; y <= bottom; ++y)
		{
			for (int x = left; x <= right; ++x)
			{
				Feature feature = context.random.percent(DARK_WALL_PERCENT)
						? Feature.WALL_EXTRA
						: Feature.FLOOR
				;
				grid.setFeature(y, x, feature);
			}
		}
		CellularAutomaton.run(grid, top, left, bottom, right, DARK_ITERATIONS);
		ConnectivityRepair.repair(grid, top, left, bottom, right);
		// Only the open cells are part of the room so tunnels still dig through the maze walls.
		for (int y = top; y <= bottom; ++y)
		{
			for (int x = left; x <= right; ++x)
			{
				if (grid.isOpen(y, x))
				{
					grid.addFlags(y, x, CellFlags.ROOM);
				}
			}
		}

		// A single lit beacon rewards whoever finds it.
		for (int i = 0; i < SEARCH_ATTEMPTS; ++i)
		{
			int y = context.random.range(top + 1, bottom - 1);
			int x = context.random.range(left + 1, right - 1);
			if (Feature.FLOOR == grid.getFeature(y, x))
			{
				grid.setFeature(y, x, Feature.GLOWING_TILE);
				context.allocator.placeObject(grid, y, x, context.depth + 10, ObjectQuality.GREAT);
				break;
			}
		}
	}

	private static void _buildHill(GenerationContext context, int top, int left, int bottom, int right)
	{
		CaveGrid grid = context.grid;
		int cy = (top + bottom) / 2;
		int cx = (left + right) / 2;
		int radius = Math.max(bottom - top, right - left) / 2;
		for (int y = top; y <= bottom; ++y)
		{
			for (int x = left; x <= right; ++x)
			{
				int distance = Location.distance(cy, cx, y, x);
				if (distance < (radius / 3))
				{
					grid.setElevation(y, x, Elevation.HIGH);
					grid.setFeature(y, x, Feature.HILL_TOP);
					grid.addFlags(y, x, CellFlags.GLOW);
				}
				else if (distance < ((2 * radius) / 3))
				{
					grid.setElevation(y, x, Elevation.HILL);
					grid.setFeature(y, x, Feature.SLOPE_UP);
				}
				else
				{
					grid.setElevation(y, x, Elevation.GROUND);
					grid.setFeature(y, x, Feature.FLOOR);
				}
				grid.addFlags(y, x, CellFlags.ROOM);
			}
		}

		// Ground at the foot of the slope leads back down.
		for (int y = top; y <= bottom; ++y)
		{
			for (int x = left; x <= right; ++x)
			{
				if ((Elevation.GROUND == grid.getElevation(y, x))
						&& (Feature.FLOOR == grid.getFeature(y, x))
						&& _isNextToHigherGround(grid, y, x)
				)
				{
					grid.setFeature(y, x, Feature.SLOPE_DOWN);
				}
			}
		}
		_wallMargin(grid, top, left, bottom, right);

		if (context.random.percent(60))
		{
			int my = cy + context.random.randomInt(3) - 1;
			int mx = cx + context.random.randomInt(3) - 1;
			if (Elevation.HIGH == grid.getElevation(my, mx))
			{
				PlacementHelpers.vaultMonster(context, my, mx, IAllocationCollaborator.MON_SLEEP | IAllocationCollaborator.MON_GROUP);
			}
		}
	}

	private static void _buildPit(GenerationContext context, int top, int left, int bottom, int right)
	{
		CaveGrid grid = context.grid;
		int cy = (top + bottom) / 2;
		int cx = (left + right) / 2;
		for (int y = top; y <= bottom; ++y)
		{
			for (int x = left; x <= right; ++x)
			{
				if (Location.distance(cy, cx, y, x) < 3)
				{
					grid.setElevation(y, x, Elevation.LOW);
					grid.setFeature(y, x, Feature.PIT);
				}
				else
				{
					grid.setElevation(y, x, Elevation.GROUND);
					grid.setFeature(y, x, Feature.SLOPE_DOWN);
				}
				grid.addFlags(y, x, CellFlags.ROOM);
			}
		}

		int hazard = context.random.randomInt(3);
		for (int y = top + 2; y <= bottom - 2; ++y)
		{
			for (int x = left + 2; x <= right - 2; ++x)
			{
				if (Elevation.LOW == grid.getElevation(y, x))
				{
					if ((0 == hazard) && context.random.percent(30))
					{
						grid.setFeature(y, x, Feature.SHALLOW_WATER);
					}
					else if ((1 == hazard) && context.random.percent(15))
					{
						grid.setFeature(y, x, Feature.TRAP, context.allocator.chooseTrapKind(context.depth));
					}
					else if ((2 == hazard) && context.random.percent(20) && grid.isEmpty(y, x))
					{
						context.allocator.placeMonster(grid, y, x, context.depth, IAllocationCollaborator.MON_SLEEP);
					}
				}
			}
		}
		_wallMargin(grid, top, left, bottom, right);
	}

	private static void _buildCliff(GenerationContext context, int top, int left, int bottom, int right)
	{
		CaveGrid grid = context.grid;
		boolean isVertical = context.random.percent(50);
		boolean highFirst = context.random.percent(50);
		int cliff = isVertical
				? ((left + right) / 2)
				: ((top + bottom) / 2)
		;
		// The face is 2 cells wide:  the cliff line and the cell on the high side of it.
		int faceHigh = highFirst ? (cliff - 1) : (cliff + 1);
		int foot = highFirst ? (cliff + 1) : (cliff - 1);
		for (int y = top; y <= bottom; ++y)
		{
			for (int x = left; x <= right; ++x)
			{
				int across = isVertical ? x : y;
				boolean isHighSide = highFirst ? (across < faceHigh) : (across > faceHigh);
				if (isHighSide)
				{
					grid.setElevation(y, x, Elevation.HIGH);
					grid.setFeature(y, x, Feature.FLOOR);
				}
				else if ((across == faceHigh) || (across == cliff))
				{
					grid.setElevation(y, x, Elevation.HIGH);
					grid.setFeature(y, x, Feature.CLIFF_DOWN);
				}
				else if (across == foot)
				{
					grid.setElevation(y, x, Elevation.GROUND);
					grid.setFeature(y, x, Feature.CLIFF_UP);
				}
				else
				{
					grid.setElevation(y, x, Elevation.GROUND);
					grid.setFeature(y, x, Feature.FLOOR);
				}
				grid.addFlags(y, x, CellFlags.ROOM);
			}
		}

		// Ledges cut through the face.
		int ledges = 1 + context.random.randomInt(2);
		for (int i = 0; i < ledges; ++i)
		{
			if (isVertical)
			{
				int ly = top + 2 + context.random.randomInt(bottom - top - 3);
				_ledge(grid, ly, faceHigh);
				_ledge(grid, ly, cliff);
			}
			else
			{
				int lx = left + 3 + context.random.randomInt(right - left - 5);
				_ledge(grid, faceHigh, lx);
				_ledge(grid, cliff, lx);
			}
		}

		// Archers on the high side.
		if (context.random.percent(50))
		{
			for (int i = 0; i < 10; ++i)
			{
				int y = top + context.random.randomInt(bottom - top);
				int x = left + context.random.randomInt(right - left);
				if ((Elevation.HIGH == grid.getElevation(y, x)) && grid.isEmpty(y, x))
				{
					PlacementHelpers.vaultMonster(context, y, x, IAllocationCollaborator.MON_SLEEP);
					break;
				}
			}
		}
	}

	private static void _ledge(CaveGrid grid, int y, int x)
	{
		grid.setFeature(y, x, Feature.LEDGE);
		grid.setElevation(y, x, Elevation.HILL);
	}

	private static boolean _isNextToHigherGround(CaveGrid grid, int y, int x)
	{
		boolean found = false;
		for (int dy = -1; !found && (dy <= 1); ++dy)
		{
			for (int dx = -1; !found && (dx <= 1); ++dx)
			{
				if (grid.inBounds(y + dy, x + dx))
				{
					found = grid.getElevation(y + dy, x + dx).isAbove(Elevation.GROUND);
				}
			}
		}
		return found;
	}

	private static void _wallMargin(CaveGrid grid, int top, int left, int bottom, int right)
	{
		// The margin cells are the only ones touching the outside.
		for (int y = top - 1; y <= bottom + 1; ++y)
		{
			for (int x = left - 1; x <= right + 1; ++x)
			{
				boolean isMargin = (y < top) || (y > bottom) || (x < left) || (x > right);
				if (isMargin && !grid.isOpen(y, x))
				{
					grid.setFeature(y, x, Feature.WALL_OUTER);
				}
			}
		}
	}
}
