package com.jeffdisher.delve.worldgen;

import java.util.ArrayList;
import java.util.List;

import com.jeffdisher.delve.data.CaveGrid;
import com.jeffdisher.delve.types.CellFlags;
import com.jeffdisher.delve.types.Feature;
import com.jeffdisher.delve.types.Location;


/**
 * Wrecks a level after it has been connected:  a few epicentres each turn everything within reach into a jumble of
 * granite, veins and floor.  Permanent rock survives.
 */
public class LevelDestroyer
{
	public static final int MAX_EPICENTRES = 5;
	public static final int RADIUS = 15;
	public static final int EDGE_MARGIN = 5;

	/**
	 * @return The epicentres used.
	 */
	public static List<Location> destroy(GenerationContext context)
	{
		CaveGrid grid = context.grid;
		List<Location> epicentres = new ArrayList<>();
		int count = context.random.roll(MAX_EPICENTRES);
		for (int n = 0; n < count; ++n)
		{
			int cy = context.random.range(EDGE_MARGIN, grid.height - 1 - EDGE_MARGIN);
			int cx = context.random.range(EDGE_MARGIN, grid.width - 1 - EDGE_MARGIN);
			epicentres.add(new Location(cy, cx));
			for (int y = cy - RADIUS; y <= cy + RADIUS; ++y)
			{
				for (int x = cx - RADIUS; x <= cx + RADIUS; ++x)
				{
					if (grid.inBoundsFully(y, x) && (Location.distance(cy, cx, y, x) <= RADIUS))
					{
						context.allocator.deleteMonster(grid, y, x);
						if (grid.isValid(y, x))
						{
							context.allocator.deleteObjects(grid, y, x);
							grid.setFeature(y, x, rubbleFor(context.random.randomInt(200)));
							grid.clearFlags(y, x, CellFlags.ROOM | CellFlags.ICKY | CellFlags.MARK | CellFlags.GLOW);
						}
					}
				}
			}
		}
		return epicentres;
	}

	/**
	 * Maps a roll out of 200 onto the debris left behind.
	 */
	public static Feature rubbleFor(int roll)
	{
		Feature feature;
		if (roll < 20)
		{
			feature = Feature.WALL_EXTRA;
		}
		else if (roll < 70)
		{
			feature = Feature.QUARTZ;
		}
		else if (roll < 100)
		{
			feature = Feature.MAGMA;
		}
		else
		{
			feature = Feature.FLOOR;
		}
		return feature;
	}
}
