package com.jeffdisher.delve.worldgen;

import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import com.jeffdisher.delve.data.CaveGrid;
import com.jeffdisher.delve.types.CellFlags;
import com.jeffdisher.delve.types.Feature;
import com.jeffdisher.delve.types.Location;


public class TestLevelDestroyer
{
	@Test
	public void rubbleBands() throws Throwable
	{
		Assert.assertEquals(Feature.WALL_EXTRA, LevelDestroyer.rubbleFor(0));
		Assert.assertEquals(Feature.WALL_EXTRA, LevelDestroyer.rubbleFor(19));
		Assert.assertEquals(Feature.QUARTZ, LevelDestroyer.rubbleFor(20));
		Assert.assertEquals(Feature.QUARTZ, LevelDestroyer.rubbleFor(69));
		Assert.assertEquals(Feature.MAGMA, LevelDestroyer.rubbleFor(70));
		Assert.assertEquals(Feature.MAGMA, LevelDestroyer.rubbleFor(99));
		Assert.assertEquals(Feature.FLOOR, LevelDestroyer.rubbleFor(100));
		Assert.assertEquals(Feature.FLOOR, LevelDestroyer.rubbleFor(199));
	}

	@Test
	public void destructionStaysWithinRadius() throws Throwable
	{
		for (long seed = 1L; seed <= 10L; ++seed)
		{
			CaveGrid grid = new CaveGrid(66, 198);
			grid.wipe(Feature.FLOOR);
			RoomPainting.border(grid, 0, 0, grid.height - 1, grid.width - 1, Feature.PERM_SOLID);
			for (int y = 1; y < grid.height - 1; ++y)
			{
				for (int x = 1; x < grid.width - 1; ++x)
				{
					grid.addFlags(y, x, CellFlags.ROOM | CellFlags.GLOW);
				}
			}
			GenerationContext context = ContextBuilder.dungeon(10).grid(grid).seed(seed).finish();
			List<Location> epicentres = LevelDestroyer.destroy(context);
			Assert.assertTrue(epicentres.size() >= 1);
			Assert.assertTrue(epicentres.size() <= LevelDestroyer.MAX_EPICENTRES);

			for (int y = 0; y < grid.height; ++y)
			{
				for (int x = 0; x < grid.width; ++x)
				{
					boolean inReach = false;
					for (Location centre : epicentres)
					{
						inReach = inReach || (Location.distance(centre.y(), centre.x(), y, x) <= LevelDestroyer.RADIUS);
					}
					Feature feature = grid.getFeature(y, x);
					if (!grid.inBoundsFully(y, x))
					{
						Assert.assertEquals(Feature.PERM_SOLID, feature);
					}
					else if (inReach)
					{
						Assert.assertTrue((Feature.WALL_EXTRA == feature)
								|| (Feature.QUARTZ == feature)
								|| (Feature.MAGMA == feature)
								|| (Feature.FLOOR == feature)
						);
						Assert.assertEquals(0, grid.getFlags(y, x));
					}
					else
					{
						Assert.assertEquals(Feature.FLOOR, feature);
						Assert.assertTrue(grid.hasFlag(y, x, CellFlags.ROOM));
					}
				}
			}
		}
	}

	@Test
	public void permanentRockSurvives() throws Throwable
	{
		CaveGrid grid = new CaveGrid(66, 198);
		grid.wipe(Feature.PERM_SOLID);
		String before = grid.render();
		GenerationContext context = ContextBuilder.dungeon(10).grid(grid).seed(5L).finish();
		LevelDestroyer.destroy(context);
		Assert.assertEquals(before, grid.render());
	}
}
