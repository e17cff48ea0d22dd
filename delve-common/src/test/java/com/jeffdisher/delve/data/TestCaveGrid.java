package com.jeffdisher.delve.data;

import org.junit.Assert;
import org.junit.Test;

import com.jeffdisher.delve.types.CellFlags;
import com.jeffdisher.delve.types.Elevation;
import com.jeffdisher.delve.types.Feature;
import com.jeffdisher.delve.types.SectorType;


public class TestCaveGrid
{
	@Test
	public void startsAsGranite() throws Throwable
	{
		CaveGrid grid = new CaveGrid(5, 7);
		for (int y = 0; y < grid.height; ++y)
		{
			for (int x = 0; x < grid.width; ++x)
			{
				Assert.assertEquals(Feature.WALL_EXTRA, grid.getFeature(y, x));
				Assert.assertEquals(0, grid.getFlags(y, x));
			}
		}
		Assert.assertFalse(grid.hasPlayer());
	}

	@Test
	public void bounds() throws Throwable
	{
		CaveGrid grid = new CaveGrid(5, 7);
		Assert.assertTrue(grid.inBounds(0, 0));
		Assert.assertTrue(grid.inBounds(4, 6));
		Assert.assertFalse(grid.inBounds(5, 0));
		Assert.assertFalse(grid.inBounds(0, -1));
		Assert.assertTrue(grid.inBoundsFully(1, 1));
		Assert.assertFalse(grid.inBoundsFully(0, 3));
		Assert.assertFalse(grid.inBoundsFully(3, 6));
	}

	@Test
	public void cellPredicates() throws Throwable
	{
		CaveGrid grid = new CaveGrid(5, 7);
		grid.setFeature(2, 2, Feature.FLOOR);
		grid.setFeature(2, 3, Feature.FLOOR);
		grid.setFeature(2, 4, Feature.TALL_GRASS);
		grid.setFeature(3, 4, Feature.GRASS);
		Assert.assertTrue(grid.isNaked(2, 2));
		Assert.assertTrue(grid.isClean(2, 2));
		Assert.assertTrue(grid.isEmpty(2, 4));
		Assert.assertFalse(grid.isNaked(2, 4));
		Assert.assertTrue(grid.isNaked(3, 4));

		grid.setObject(2, 2, 5);
		Assert.assertFalse(grid.isClean(2, 2));
		Assert.assertFalse(grid.isNaked(2, 2));
		Assert.assertTrue(grid.isEmpty(2, 2));

		grid.setMonster(2, 3, 6);
		Assert.assertTrue(grid.isClean(2, 3));
		Assert.assertFalse(grid.isEmpty(2, 3));

		grid.setPlayer(2, 4);
		Assert.assertTrue(grid.hasPlayer());
		Assert.assertFalse(grid.isEmpty(2, 4));
		Assert.assertEquals(2, grid.getPlayerY());
		Assert.assertEquals(4, grid.getPlayerX());
	}

	@Test
	public void flagsAndLayers() throws Throwable
	{
		CaveGrid grid = new CaveGrid(5, 7);
		grid.addFlags(1, 1, CellFlags.ROOM | CellFlags.GLOW);
		Assert.assertTrue(grid.hasFlag(1, 1, CellFlags.ROOM));
		Assert.assertFalse(grid.hasFlag(1, 1, CellFlags.ICKY));
		grid.clearFlags(1, 1, CellFlags.ROOM);
		Assert.assertEquals(CellFlags.GLOW, grid.getFlags(1, 1));

		grid.setFeature(1, 2, Feature.DOOR, 3);
		Assert.assertEquals(3, grid.getVariant(1, 2));
		grid.setFeature(1, 2, Feature.FLOOR);
		Assert.assertEquals(0, grid.getVariant(1, 2));

		grid.setElevation(3, 3, Elevation.HIGH);
		grid.setSector(3, 3, SectorType.HILL);
		Assert.assertEquals(Elevation.HIGH, grid.getElevation(3, 3));
		Assert.assertEquals(SectorType.HILL, grid.getSector(3, 3));

		grid.wipe(Feature.PERM_SOLID);
		Assert.assertEquals(Feature.PERM_SOLID, grid.getFeature(3, 3));
		Assert.assertEquals(Elevation.GROUND, grid.getElevation(3, 3));
		Assert.assertEquals(SectorType.RUINS, grid.getSector(3, 3));
		Assert.assertEquals(0, grid.getFlags(1, 1));
	}

	@Test
	public void adjacentRock() throws Throwable
	{
		CaveGrid grid = new CaveGrid(5, 7);
		grid.setFeature(2, 3, Feature.FLOOR);
		Assert.assertEquals(4, grid.countAdjacentRock(2, 3));
		grid.setFeature(2, 2, Feature.FLOOR);
		grid.setFeature(1, 3, Feature.MAGMA);
		// Veins are not rock.
		Assert.assertEquals(2, grid.countAdjacentRock(2, 3));
	}

	@Test
	public void render() throws Throwable
	{
		CaveGrid grid = new CaveGrid(3, 3);
		grid.setFeature(1, 1, Feature.FLOOR);
		grid.setPlayer(1, 1);
		Assert.assertEquals("###\n#@#\n###\n", grid.render());
	}

	@Test(expected=AssertionError.class)
	public void playerOutOfGrid() throws Throwable
	{
		CaveGrid grid = new CaveGrid(3, 3);
		grid.setPlayer(3, 0);
	}
}
