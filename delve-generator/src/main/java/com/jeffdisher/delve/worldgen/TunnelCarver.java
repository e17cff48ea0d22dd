package com.jeffdisher.delve.worldgen;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.jeffdisher.delve.data.CaveGrid;
import com.jeffdisher.delve.types.CellFlags;
import com.jeffdisher.delve.types.Feature;
import com.jeffdisher.delve.types.Location;


/**
 * Connects 2 room centres with a corridor.  Both algorithms walk the whole path first, recording what they would
 * change, and only write to the grid once the walk has finished.  A walk which gives up leaves the grid untouched.
 * Cells are classified as the walk enters them:
 * -permanent edges and solid walls can't be entered
 * -an outer room wall is "pierced" (it becomes an entrance)
 * -room interiors are crossed without change
 * -other rock becomes corridor
 * -anything else is existing corridor, where a door may later be placed
 */
public class TunnelCarver
{
	public static final int DIRECTED_STEP_LIMIT = 2000;
	public static final int WINDING_STEP_LIMIT = 20_000;
	public static final int CHANGE_DIRECTION_PERCENT = 30;
	public static final int RANDOM_DIRECTION_PERCENT = 10;
	public static final int CONTINUE_PERCENT = 15;
	public static final int ENTRANCE_DOOR_PERCENT = 25;
	public static final int WINDING_TOWARD_PERCENT = 60;
	/**
	 * How far (on either axis) a directed walk must get from its start before it may stop at an existing corridor.
	 */
	public static final int EARLY_STOP_DISTANCE = 10;

	private static final int[][] CARDINALS = new int[][] { {1, 0}, {-1, 0}, {0, 1}, {0, -1} };

	/**
	 * Carves a corridor which heads toward the target, turning now and then.  Piercing an outer wall turns the outer
	 * walls around the entrance solid so no other corridor can enter right beside it.  The walk may stop early when it
	 * runs into an existing corridor far enough from its start.
	 *
	 * @return True if the corridor was committed, false if the walk gave up (the grid is unchanged).
	 */
	public static boolean carveDirected(GenerationContext context, int y1, int x1, int y2, int x2)
	{
		CaveGrid grid = context.grid;
		_Walk walk = new _Walk();
		int y = y1;
		int x = x1;
		int[] dir = _correctDirection(context, y, x, y2, x2);
		boolean doorFlag = false;
		boolean finished = false;
		boolean gaveUp = false;
		int steps = 0;
		while (!finished && !gaveUp)
		{
			if ((y == y2) && (x == x2))
			{
				finished = true;
			}
			else if (steps > DIRECTED_STEP_LIMIT)
			{
				gaveUp = true;
			}
			else
			{
				steps += 1;
				if (context.random.percent(CHANGE_DIRECTION_PERCENT))
				{
					dir = _correctDirection(context, y, x, y2, x2);
					if (context.random.percent(RANDOM_DIRECTION_PERCENT))
					{
						dir = _randomDirection(context);
					}
				}
				int ty = y + dir[0];
				int tx = x + dir[1];
				int retries = 0;
				while (!grid.inBoundsFully(ty, tx))
				{
					dir = _correctDirection(context, y, x, y2, x2);
					// The corrected direction always points into the level so stop rolling random ones eventually.
					if ((retries < 100) && context.random.percent(RANDOM_DIRECTION_PERCENT))
					{
						dir = _randomDirection(context);
					}
					ty = y + dir[0];
					tx = x + dir[1];
					retries += 1;
				}

				Feature feature = walk.getFeature(grid, ty, tx);
				if (_isBlocked(feature))
				{
					// Try another step.
				}
				else if (Feature.WALL_OUTER == feature)
				{
					Feature beyond = walk.getFeature(grid, ty + dir[0], tx + dir[1]);
					if (!_isBlocked(beyond) && (Feature.WALL_OUTER != beyond))
					{
						y = ty;
						x = tx;
						walk.piercings.add(new Location(y, x));
						for (int dy = -1; dy <= 1; ++dy)
						{
							for (int dx = -1; dx <= 1; ++dx)
							{
								if (Feature.WALL_OUTER == walk.getFeature(grid, y + dy, x + dx))
								{
									walk.solid.add(new Location(y + dy, x + dx));
								}
							}
						}
					}
				}
				else if (grid.hasFlag(ty, tx, CellFlags.ROOM))
				{
					y = ty;
					x = tx;
				}
				else if (feature.isRock())
				{
					y = ty;
					x = tx;
					walk.tunnel.add(new Location(y, x));
					doorFlag = false;
				}
				else
				{
					y = ty;
					x = tx;
					if (!doorFlag)
					{
						walk.doors.add(new Location(y, x));
						doorFlag = true;
					}
					if (!context.random.percent(CONTINUE_PERCENT))
					{
						if ((Math.abs(y - y1) > EARLY_STOP_DISTANCE) || (Math.abs(x - x1) > EARLY_STOP_DISTANCE))
						{
							finished = true;
						}
					}
				}
			}
		}
		if (finished)
		{
			walk.commit(context);
		}
		return finished;
	}

	/**
	 * Carves a corridor which mostly heads toward the target but wanders randomly 40% of the time.  It does not make
	 * walls solid.  If it can't reach the target, it falls back to carveDirected().
	 *
	 * @return True if a corridor was committed.
	 */
	public static boolean carveWinding(GenerationContext context, int y1, int x1, int y2, int x2)
	{
		CaveGrid grid = context.grid;
		_Walk walk = new _Walk();
		int y = y1;
		int x = x1;
		boolean doorFlag = false;
		int steps = 0;
		while (((y != y2) || (x != x2)) && (steps < WINDING_STEP_LIMIT))
		{
			steps += 1;
			int[] dir;
			if (context.random.percent(WINDING_TOWARD_PERCENT))
			{
				dir = _correctDirection(context, y, x, y2, x2);
			}
			else
			{
				dir = _randomDirection(context);
			}
			int ty = y + dir[0];
			int tx = x + dir[1];
			if (grid.inBoundsFully(ty, tx))
			{
				Feature feature = walk.getFeature(grid, ty, tx);
				if (_isBlocked(feature))
				{
					// Try another step.
				}
				else if (Feature.WALL_OUTER == feature)
				{
					y = ty;
					x = tx;
					walk.piercings.add(new Location(y, x));
				}
				else if (grid.hasFlag(ty, tx, CellFlags.ROOM))
				{
					y = ty;
					x = tx;
				}
				else if (feature.isRock())
				{
					y = ty;
					x = tx;
					walk.tunnel.add(new Location(y, x));
					doorFlag = false;
				}
				else
				{
					y = ty;
					x = tx;
					if (!doorFlag)
					{
						walk.doors.add(new Location(y, x));
						doorFlag = true;
					}
				}
			}
		}

		boolean committed;
		if ((y == y2) && (x == x2))
		{
			walk.commit(context);
			committed = true;
		}
		else
		{
			committed = carveDirected(context, y1, x1, y2, x2);
		}
		return committed;
	}

	/**
	 * Places doors around the recorded corridor junctions.  Only makes sense when the level background is granite.
	 */
	public static void placeJunctionDoors(GenerationContext context)
	{
		for (Location spot : context.doorCandidates)
		{
			DoorHelpers.tryDoor(context, spot.y() - 1, spot.x());
			DoorHelpers.tryDoor(context, spot.y() + 1, spot.x());
			DoorHelpers.tryDoor(context, spot.y(), spot.x() - 1);
			DoorHelpers.tryDoor(context, spot.y(), spot.x() + 1);
		}
	}


	private static boolean _isBlocked(Feature feature)
	{
		return (Feature.PERM_SOLID == feature)
				|| (Feature.PERM_OUTER == feature)
				|| (Feature.WALL_SOLID == feature)
		;
	}

	private static int[] _correctDirection(GenerationContext context, int y1, int x1, int y2, int x2)
	{
		int dy = Integer.signum(y2 - y1);
		int dx = Integer.signum(x2 - x1);
		// Never move diagonally.
		if ((0 != dy) && (0 != dx))
		{
			if (context.random.percent(50))
			{
				dy = 0;
			}
			else
			{
				dx = 0;
			}
		}
		return new int[] { dy, dx };
	}

	private static int[] _randomDirection(GenerationContext context)
	{
		return CARDINALS[context.random.randomInt(CARDINALS.length)];
	}


	/**
	 * The changes a walk would make, held back until the walk succeeds.
	 */
	private static class _Walk
	{
		public final List<Location> tunnel = new ArrayList<>();
		public final List<Location> piercings = new ArrayList<>();
		public final List<Location> doors = new ArrayList<>();
		public final Set<Location> solid = new HashSet<>();

		public Feature getFeature(CaveGrid grid, int y, int x)
		{
			return solid.contains(new Location(y, x))
					? Feature.WALL_SOLID
					: grid.getFeature(y, x)
			;
		}

		public void commit(GenerationContext context)
		{
			CaveGrid grid = context.grid;
			for (Location spot : this.solid)
			{
				grid.setFeature(spot.y(), spot.x(), Feature.WALL_SOLID);
			}
			for (Location spot : this.tunnel)
			{
				grid.setFeature(spot.y(), spot.x(), Feature.FLOOR);
			}
			for (Location spot : this.piercings)
			{
				grid.setFeature(spot.y(), spot.x(), Feature.FLOOR);
				if (context.random.percent(ENTRANCE_DOOR_PERCENT))
				{
					DoorHelpers.placeRandomDoor(context, spot.y(), spot.x());
				}
			}
			context.doorCandidates.addAll(this.doors);
		}
	}
}
