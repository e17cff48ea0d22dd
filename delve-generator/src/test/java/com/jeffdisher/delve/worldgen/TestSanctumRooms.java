package com.jeffdisher.delve.worldgen;

import org.junit.Assert;
import org.junit.Test;

import com.jeffdisher.delve.data.CaveGrid;
import com.jeffdisher.delve.types.Feature;


public class TestSanctumRooms
{
	@Test
	public void sanctumHasSealedArch() throws Throwable
	{
		for (long seed = 1L; seed <= 10L; ++seed)
		{
			GenerationContext context = ContextBuilder.dungeon(50).seed(seed).finish();
			CaveGrid grid = context.grid;
			Assert.assertTrue(SanctumRooms.buildSanctum(context, 30, 90));
			Assert.assertEquals(Feature.SANCTUM_DOOR, grid.getFeature(30, 86));
			Assert.assertEquals(Feature.DOOR, grid.getFeature(30, 80));
			Assert.assertEquals(Feature.WHISPERING_IDOL, grid.getFeature(25, 81));

			// An echo lock's solution names every rune it placed.
			int runes = 0;
			for (int y = 24; y <= 36; ++y)
			{
				for (int x = 80; x <= 100; ++x)
				{
					if (Feature.RUNE == grid.getFeature(y, x))
					{
						runes += 1;
					}
				}
			}
			Assert.assertEquals(runes, context.puzzleSolution.size());
			Assert.assertTrue(runes <= 5);
		}
	}

	@Test
	public void sanctumNeedsRoom() throws Throwable
	{
		GenerationContext context = ContextBuilder.dungeon(50).seed(1L).finish();
		String before = context.grid.render();
		Assert.assertFalse(SanctumRooms.buildSanctum(context, 3, 90));
		Assert.assertFalse(SanctumRooms.buildFolly(context, 30, 5));
		Assert.assertEquals(before, context.grid.render());
	}

	@Test
	public void follyIsWalled() throws Throwable
	{
		GenerationContext context = ContextBuilder.dungeon(50).seed(4L).finish();
		CaveGrid grid = context.grid;
		Assert.assertTrue(SanctumRooms.buildFolly(context, 30, 90));
		Assert.assertEquals(Feature.FOLLY_WALL, grid.getFeature(20, 70));
		Assert.assertEquals(Feature.FOLLY_WALL, grid.getFeature(40, 110));
		Assert.assertEquals(Feature.DOOR, grid.getFeature(30, 70));
		Assert.assertTrue(context.allocator.getMonsterCount() > 0);
	}
}
