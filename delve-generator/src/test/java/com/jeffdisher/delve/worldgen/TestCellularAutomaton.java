package com.jeffdisher.delve.worldgen;

import org.junit.Assert;
import org.junit.Test;

import com.jeffdisher.delve.data.CaveGrid;
import com.jeffdisher.delve.types.Feature;


public class TestCellularAutomaton
{
	@Test
	public void uniformFloorIsStable() throws Throwable
	{
		CaveGrid grid = new CaveGrid(40, 40);
		grid.wipe(Feature.FLOOR);
		Assert.assertEquals(0, CellularAutomaton.step(grid, 10, 10, 20, 20));
		Assert.assertEquals(Feature.FLOOR, grid.getFeature(15, 15));
	}

	@Test
	public void uniformGraniteIsStable() throws Throwable
	{
		CaveGrid grid = new CaveGrid(40, 40);
		Assert.assertEquals(0, CellularAutomaton.step(grid, 0, 0, 39, 39));
		Assert.assertEquals(Feature.WALL_EXTRA, grid.getFeature(0, 0));
	}

	@Test
	public void lonelyWallErodes() throws Throwable
	{
		CaveGrid grid = new CaveGrid(20, 20);
		grid.wipe(Feature.FLOOR);
		grid.setFeature(10, 10, Feature.WALL_EXTRA);
		Assert.assertEquals(1, CellularAutomaton.step(grid, 5, 5, 15, 15));
		Assert.assertEquals(Feature.FLOOR, grid.getFeature(10, 10));
	}

	@Test
	public void surroundedFloorFills() throws Throwable
	{
		CaveGrid grid = new CaveGrid(20, 20);
		grid.setFeature(10, 10, Feature.FLOOR);
		Assert.assertEquals(1, CellularAutomaton.step(grid, 5, 5, 15, 15));
		Assert.assertEquals(Feature.WALL_EXTRA, grid.getFeature(10, 10));
	}

	@Test
	public void gridEdgeCountsAsWall() throws Throwable
	{
		// A corner floor cell sees 5 cells beyond the grid so it fills in.
		CaveGrid grid = new CaveGrid(10, 10);
		grid.wipe(Feature.FLOOR);
		Assert.assertEquals(1, CellularAutomaton.step(grid, 0, 0, 0, 0));
		Assert.assertEquals(Feature.WALL_EXTRA, grid.getFeature(0, 0));
	}
}
