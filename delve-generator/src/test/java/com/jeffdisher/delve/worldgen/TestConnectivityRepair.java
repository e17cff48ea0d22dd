package com.jeffdisher.delve.worldgen;

import org.junit.Assert;
import org.junit.Test;

import com.jeffdisher.delve.data.CaveGrid;
import com.jeffdisher.delve.types.Feature;


public class TestConnectivityRepair
{
	@Test
	public void joinsSeparatePockets() throws Throwable
	{
		CaveGrid grid = new CaveGrid(30, 60);
		RoomPainting.paintFloor(grid, 2, 2, 8, 10, false);
		RoomPainting.paintFloor(grid, 15, 40, 25, 50, false);
		grid.setFeature(27, 5, Feature.FLOOR);
		Assert.assertEquals(3, ConnectivityRepair.countComponents(grid, 0, 0, 29, 59));

		Assert.assertEquals(2, ConnectivityRepair.repair(grid, 0, 0, 29, 59));
		Assert.assertEquals(1, ConnectivityRepair.countComponents(grid, 0, 0, 29, 59));
	}

	@Test
	public void connectedRegionIsUntouched() throws Throwable
	{
		CaveGrid grid = new CaveGrid(30, 60);
		RoomPainting.paintFloor(grid, 2, 2, 8, 10, false);
		String before = grid.render();
		Assert.assertEquals(0, ConnectivityRepair.repair(grid, 0, 0, 29, 59));
		Assert.assertEquals(before, grid.render());
	}

	@Test
	public void onlyTheRegionIsCounted() throws Throwable
	{
		CaveGrid grid = new CaveGrid(30, 60);
		RoomPainting.paintFloor(grid, 2, 2, 8, 10, false);
		RoomPainting.paintFloor(grid, 15, 40, 25, 50, false);
		Assert.assertEquals(1, ConnectivityRepair.countComponents(grid, 0, 0, 12, 20));
		Assert.assertEquals(0, ConnectivityRepair.countComponents(grid, 0, 20, 12, 30));
	}
}
