package com.jeffdisher.delve.worldgen;

import org.junit.Assert;
import org.junit.Test;

import com.jeffdisher.delve.data.CaveGrid;
import com.jeffdisher.delve.types.CellFlags;
import com.jeffdisher.delve.types.Feature;
import com.jeffdisher.delve.types.ObjectQuality;


public class TestFeaturePopulator
{
	@Test
	public void clearGroundTakesARuin() throws Throwable
	{
		for (long seed = 1L; seed <= 5L; ++seed)
		{
			CaveGrid grid = _corridorGrid();
			GenerationContext context = ContextBuilder.dungeon(5).grid(grid).seed(seed).finish();
			Assert.assertTrue(FeaturePopulator.placeAncientRuin(context));
			int ruined = 0;
			for (int y = 0; y < grid.height; ++y)
			{
				for (int x = 0; x < grid.width; ++x)
				{
					if (grid.hasFlag(y, x, CellFlags.ROOM))
					{
						ruined += 1;
					}
				}
			}
			Assert.assertEquals(FeaturePopulator.RUIN_SIZE * FeaturePopulator.RUIN_SIZE, ruined);
		}
	}

	@Test
	public void ruinNeverBuriesStairsOrInhabitants() throws Throwable
	{
		for (long seed = 1L; seed <= 5L; ++seed)
		{
			CaveGrid grid = _corridorGrid();
			GenerationContext context = ContextBuilder.dungeon(5).grid(grid).seed(seed).finish();
			// Every 20x20 site contains exactly one of these cells so every site is blocked by one of them.
			boolean up = true;
			for (int y = 20; y <= 40; y += 20)
			{
				for (int x = 20; x <= 180; x += 20)
				{
					grid.setFeature(y, x, up ? Feature.LESS : Feature.MORE);
					up = !up;
				}
			}
			grid.setFeature(20, 100, Feature.FLOOR);
			grid.setPlayer(20, 100);
			grid.setFeature(40, 100, Feature.FLOOR);
			Assert.assertNotEquals(CaveGrid.NO_ENTITY, context.allocator.placeMonsterRace(grid, 40, 100, 12, 0));
			grid.setFeature(20, 60, Feature.FLOOR);
			Assert.assertNotEquals(CaveGrid.NO_ENTITY, context.allocator.placeObject(grid, 20, 60, 5, ObjectQuality.PLAIN));
			grid.setFeature(40, 60, Feature.DREAM_EXIT);
			String before = grid.render();

			Assert.assertFalse(FeaturePopulator.placeAncientRuin(context));
			Assert.assertEquals(before, grid.render());
			Assert.assertEquals(Feature.LESS, grid.getFeature(20, 20));
			Assert.assertEquals(Feature.DREAM_EXIT, grid.getFeature(40, 60));
		}
	}


	private static CaveGrid _corridorGrid()
	{
		CaveGrid grid = new CaveGrid(66, 198);
		grid.wipe(Feature.FLOOR);
		RoomPainting.border(grid, 0, 0, grid.height - 1, grid.width - 1, Feature.PERM_SOLID);
		return grid;
	}
}
