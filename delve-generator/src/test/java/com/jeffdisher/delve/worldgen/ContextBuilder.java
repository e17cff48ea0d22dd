package com.jeffdisher.delve.worldgen;

import java.util.List;

import com.jeffdisher.delve.data.CaveGrid;
import com.jeffdisher.delve.entities.EntityLedger;
import com.jeffdisher.delve.types.GenerationMode;
import com.jeffdisher.delve.types.LevelConfig;
import com.jeffdisher.delve.utils.GenerationRandom;


/**
 * Builds the generation contexts used by the worldgen tests.
 */
public class ContextBuilder
{
	public static ContextBuilder dungeon(int depth)
	{
		return new ContextBuilder(LevelRequest.dungeon(GenerationMode.DUNGEON, depth, 50_000L));
	}

	public static ContextBuilder forRequest(LevelRequest request)
	{
		return new ContextBuilder(request);
	}


	private LevelRequest _request;
	private LevelConfig _config;
	private CaveGrid _grid;
	private long _seed;
	private VaultRegistry _vaults;

	private ContextBuilder(LevelRequest request)
	{
		_request = request;
		_config = new LevelConfig();
		_seed = 1L;
		_vaults = new VaultRegistry(List.of());
	}

	public ContextBuilder config(LevelConfig config)
	{
		_config = config;
		return this;
	}

	public ContextBuilder grid(CaveGrid grid)
	{
		_grid = grid;
		return this;
	}

	public ContextBuilder seed(long seed)
	{
		_seed = seed;
		return this;
	}

	public GenerationContext finish()
	{
		CaveGrid grid = (null != _grid)
				? _grid
				: new CaveGrid(_config.dungeonHeight, _config.dungeonWidth)
		;
		EntityLedger ledger = new EntityLedger(_config.maxMonsters, _config.maxObjects);
		return new GenerationContext(_config, grid, new GenerationRandom(_seed), ledger, ledger, ledger, _vaults, _request);
	}
}
