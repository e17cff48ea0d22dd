package com.jeffdisher.delve.worldgen;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.jeffdisher.delve.data.BlockOccupancy;
import com.jeffdisher.delve.data.CaveGrid;
import com.jeffdisher.delve.types.Feature;
import com.jeffdisher.delve.types.LevelConfig;
import com.jeffdisher.delve.types.Location;
import com.jeffdisher.delve.types.SectorType;
import com.jeffdisher.delve.utils.GenerationRandom;


/**
 * Everything a single generation attempt works on.  The grid, random source and collaborators are shared between
 * attempts while the scratch state (block occupancy, room centres, door candidates, rating) is created fresh for each
 * attempt and thrown away when it is accepted or rejected.
 */
public class GenerationContext
{
	public final LevelConfig config;
	public final CaveGrid grid;
	public final GenerationRandom random;
	public final IAllocationCollaborator allocator;
	public final ICoverCollaborator cover;
	public final IPatrolCollaborator patrols;
	public final VaultRegistry vaults;
	public final LevelRequest request;
	public final int depth;

	public final BlockOccupancy blocks;
	public final SectorType[][] blockSectors;
	public final List<Location> centres;
	public final List<Location> doorCandidates;
	public final List<Integer> puzzleSolution;

	// Mutable scratch state.
	public boolean crowded;
	public int rating;
	public boolean goodItemFlag;
	public Feature background;
	public boolean daytime;
	public Location generationOrigin;
	/**
	 * False when a wilderness vault must not move the player (they are crossing in from a neighbouring region).
	 */
	public boolean allowVaultPlayerStart;

	public GenerationContext(LevelConfig config
			, CaveGrid grid
			, GenerationRandom random
			, IAllocationCollaborator allocator
			, ICoverCollaborator cover
			, IPatrolCollaborator patrols
			, VaultRegistry vaults
			, LevelRequest request
	)
	{
		this.config = config;
		this.grid = grid;
		this.random = random;
		this.allocator = allocator;
		this.cover = cover;
		this.patrols = patrols;
		this.vaults = vaults;
		this.request = request;
		this.depth = request.depth();

		this.blocks = new BlockOccupancy(grid.height, grid.width);
		this.blockSectors = new SectorType[this.blocks.rows][this.blocks.columns];
		for (SectorType[] row : this.blockSectors)
		{
			Arrays.fill(row, SectorType.RUINS);
		}
		this.centres = new ArrayList<>();
		this.doorCandidates = new ArrayList<>();
		this.puzzleSolution = new ArrayList<>();

		this.crowded = false;
		this.rating = 0;
		this.goodItemFlag = false;
		this.background = Feature.WALL_EXTRA;
		this.daytime = true;
		this.generationOrigin = null;
		this.allowVaultPlayerStart = true;
	}
}
