package com.jeffdisher.delve.worldgen;

import org.junit.Assert;
import org.junit.Test;

import com.jeffdisher.delve.types.Feature;
import com.jeffdisher.delve.utils.GenerationRandom;


public class TestPlasmaTerrain
{
	@Test
	public void valuesStayInRange() throws Throwable
	{
		int max = 21;
		for (long seed = 1L; seed <= 20L; ++seed)
		{
			for (int rough = 0; rough <= 5; ++rough)
			{
				GenerationRandom random = new GenerationRandom(seed);
				int[][] field = new int[33][65];
				field[0][0] = 0;
				field[32][0] = max;
				field[0][64] = max;
				field[32][64] = 0;
				PlasmaTerrain.fill(random, field, 0, 0, 32, 64, max, rough);
				for (int[] row : field)
				{
					for (int value : row)
					{
						Assert.assertTrue(value >= 0);
						Assert.assertTrue(value <= max);
					}
				}
			}
		}
	}

	@Test
	public void flatCornersStayFlatWithoutRoughness() throws Throwable
	{
		GenerationRandom random = new GenerationRandom(7L);
		int[][] field = new int[17][17];
		field[0][0] = 10;
		field[16][0] = 10;
		field[0][16] = 10;
		field[16][16] = 10;
		PlasmaTerrain.fill(random, field, 0, 0, 16, 16, 21, 0);
		for (int[] row : field)
		{
			for (int value : row)
			{
				Assert.assertEquals(10, value);
			}
		}
	}

	@Test
	public void terrainTiers() throws Throwable
	{
		Feature[] tiers = PlasmaTerrain.NORMAL_TIERS;
		Assert.assertEquals(tiers[0], PlasmaTerrain.toTerrain(tiers, 0, 21));
		Assert.assertEquals(tiers[tiers.length - 1], PlasmaTerrain.toTerrain(tiers, 21, 21));
		// Out-of-range heights are clamped onto the table.
		Assert.assertEquals(tiers[tiers.length - 1], PlasmaTerrain.toTerrain(tiers, 500, 21));
		Assert.assertEquals(tiers[0], PlasmaTerrain.toTerrain(tiers, 0, 0));
	}
}
