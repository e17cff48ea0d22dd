package com.jeffdisher.delve.worldgen;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.jeffdisher.delve.data.CaveGrid;
import com.jeffdisher.delve.types.Feature;
import com.jeffdisher.delve.types.GenerationMode;
import com.jeffdisher.delve.types.LevelConfig;
import com.jeffdisher.delve.types.Location;
import com.jeffdisher.delve.utils.Assert;
import com.jeffdisher.delve.utils.GenerationRandom;


/**
 * The top of the generation pipeline.  Each call to generate() runs attempts until one is accepted:
 * -the grid, the entity tables, cover and patrols are reset
 * -the builder for the requested mode fills the grid
 * -the attempt is rated and turned into a level feeling
 * -the attempt is rejected if it overflowed an entity table or (when enabled) is too boring for its depth
 * Once an attempt is accepted, the monsters following the player are placed around them.
 */
public class LevelGenerator
{
	public static final int MERCHANT_MIN_DEPTH = 6;
	public static final int MERCHANT_MAX_DEPTH = 99;
	public static final int MERCHANT_ATTEMPTS = 1000;
	public static final int ANCIENT_ATTEMPTS = 100;
	public static final int ANCIENT_DISTANCE = 3;
	/**
	 * Arrivals are placed at increasing distances from the player, up to this one.
	 */
	public static final int ARRIVAL_MAX_DISTANCE = 9;
	/**
	 * A level entered this soon after the previous one gives no feeling.
	 */
	public static final long FEELING_DELAY_TURNS = 1000L;

	public static final String REASON_OBJECTS = "too many objects";
	public static final String REASON_MONSTERS = "too many monsters";
	public static final String REASON_BORING = "boring level";

	/**
	 * Maps a level's rating to its feeling.  The good-item flag, the surface and a recently entered level override
	 * the rating.
	 *
	 * @param context The attempt which was just built.
	 * @return The feeling (0 unknown, 1 special, then 2 through 10 from most to least interesting).
	 */
	public static int computeFeeling(GenerationContext context)
	{
		int rating = context.rating;
		int feeling;
		if (rating > 100)
		{
			feeling = 2;
		}
		else if (rating > 80)
		{
			feeling = 3;
		}
		else if (rating > 60)
		{
			feeling = 4;
		}
		else if (rating > 40)
		{
			feeling = 5;
		}
		else if (rating > 30)
		{
			feeling = 6;
		}
		else if (rating > 20)
		{
			feeling = 7;
		}
		else if (rating > 10)
		{
			feeling = 8;
		}
		else if (rating > 0)
		{
			feeling = 9;
		}
		else
		{
			feeling = 10;
		}

		if (context.goodItemFlag)
		{
			feeling = 1;
		}
		LevelRequest request = context.request;
		if ((request.turn() - request.lastLevelTurn()) < FEELING_DELAY_TURNS)
		{
			feeling = 0;
		}
		if (0 == context.depth)
		{
			feeling = 0;
		}
		return feeling;
	}


	private final LevelConfig _config;
	private final VaultRegistry _vaults;
	private final IAllocationCollaborator _allocator;
	private final ICoverCollaborator _cover;
	private final IPatrolCollaborator _patrols;
	private final Map<GenerationMode, ILevelBuilder> _builders;

	public LevelGenerator(LevelConfig config
			, RoomRegistry rooms
			, VaultRegistry vaults
			, IAllocationCollaborator allocator
			, ICoverCollaborator cover
			, IPatrolCollaborator patrols
	)
	{
		_config = config;
		_vaults = vaults;
		_allocator = allocator;
		_cover = cover;
		_patrols = patrols;

		DungeonLevelBuilder dungeon = new DungeonLevelBuilder(rooms);
		VaultLevelBuilder vaultLevel = new VaultLevelBuilder();
		_builders = new EnumMap<>(GenerationMode.class);
		_builders.put(GenerationMode.DUNGEON, dungeon);
		_builders.put(GenerationMode.DREAM, dungeon);
		_builders.put(GenerationMode.WILDERNESS, new WildernessLevelBuilder(false));
		_builders.put(GenerationMode.TOWN, new WildernessLevelBuilder(true));
		_builders.put(GenerationMode.STORE, vaultLevel);
		_builders.put(GenerationMode.ARENA, vaultLevel);
		_builders.put(GenerationMode.QUEST, vaultLevel);
		Assert.assertTrue(GenerationMode.values().length == _builders.size());
	}

	/**
	 * Generates a level, retrying until an attempt is accepted.
	 *
	 * @param request The level to generate.
	 * @param random The random source (left in the mode it was passed in).
	 * @return The accepted level.
	 */
	public GeneratedLevel generate(LevelRequest request, GenerationRandom random)
	{
		CaveGrid grid = new CaveGrid(_config.dungeonHeight, _config.dungeonWidth);
		_Accepted accepted;
		boolean isSeeded = (0 != _config.dungeonSeed) && (GenerationMode.DUNGEON == request.mode());
		if (isSeeded)
		{
			// A seeded dungeon level is the same every time it is entered.
			try (GenerationRandom.Scope scope = random.pushHashed(_config.dungeonSeed + request.depth()))
			{
				accepted = _runAttempts(grid, request, random);
			}
		}
		else
		{
			accepted = _runAttempts(grid, request, random);
		}

		GenerationContext context = accepted.context();
		try (GenerationRandom.Scope scope = random.pushContinuous())
		{
			_placeMerchant(context);
			_placeAncient(context);
			_placePursuer(context);
			_placeAmbush(context);
		}
		return new GeneratedLevel(grid
				, context.depth
				, accepted.feeling()
				, context.rating
				, accepted.attempts()
				, context.generationOrigin
				, Collections.unmodifiableList(context.puzzleSolution)
		);
	}


	private _Accepted _runAttempts(CaveGrid grid, LevelRequest request, GenerationRandom random)
	{
		ILevelBuilder builder = _builders.get(request.mode());
		_Accepted accepted = null;
		int attempts = 0;
		while (null == accepted)
		{
			attempts += 1;
			_allocator.wipe();
			_cover.resetCover();
			_patrols.resetPatrols();
			grid.wipe(Feature.WALL_EXTRA);
			GenerationContext context = new GenerationContext(_config, grid, random, _allocator, _cover, _patrols, _vaults, request);

			builder.build(context);
			if (null == context.generationOrigin)
			{
				context.generationOrigin = PlacementHelpers.findGenerationOrigin(context);
			}
			int feeling = computeFeeling(context);
			String reason = _rejectionReason(context, feeling, attempts);
			if (null == reason)
			{
				accepted = new _Accepted(context, feeling, attempts);
			}
			else
			{
				System.out.println("Generation restarted (" + reason + ")");
			}
		}
		return accepted;
	}

	private String _rejectionReason(GenerationContext context, int feeling, int attempts)
	{
		String reason = null;
		if (_allocator.getObjectCount() >= _config.maxObjects)
		{
			reason = REASON_OBJECTS;
		}
		else if (_allocator.getMonsterCount() >= _config.maxMonsters)
		{
			reason = REASON_MONSTERS;
		}
		else if (_config.rejectBoringLevels
				// After enough rejected attempts, we take whatever we get.
				&& (attempts <= _config.forcedAcceptAttempts)
				&& !context.request.mode().isSpecial()
				&& _config.isBoring(context.depth, feeling)
		)
		{
			reason = REASON_BORING;
		}
		return reason;
	}

	private void _placeMerchant(GenerationContext context)
	{
		CaveGrid grid = context.grid;
		if (!context.request.mode().isSpecial() && (context.depth >= MERCHANT_MIN_DEPTH) && (context.depth <= MERCHANT_MAX_DEPTH))
		{
			int race = _allocator.getMerchantRace();
			for (int i = 0; i < MERCHANT_ATTEMPTS; ++i)
			{
				int y = context.random.range(1, grid.height - 2);
				int x = context.random.range(1, grid.width - 2);
				if (grid.isNaked(y, x))
				{
					int existing = _allocator.findMonsterByRace(race);
					if (CaveGrid.NO_ENTITY != existing)
					{
						_allocator.moveMonster(grid, existing, y, x);
					}
					else if (CaveGrid.NO_ENTITY == _allocator.placeMonsterRace(grid, y, x, race, IAllocationCollaborator.MON_JUST_ONE))
					{
						_placeNear(context, y, x, race, IAllocationCollaborator.MON_JUST_ONE);
					}
					break;
				}
			}
		}
	}

	private void _placeAncient(GenerationContext context)
	{
		CaveGrid grid = context.grid;
		if (context.request.arrivals().ancientChasing() && grid.hasPlayer())
		{
			int race = _allocator.getAncientRace();
			for (int i = 0; i < ANCIENT_ATTEMPTS; ++i)
			{
				Location spot = PlacementHelpers.scatter(context, grid.getPlayerY(), grid.getPlayerX(), ANCIENT_DISTANCE);
				if (grid.isOpen(spot.y(), spot.x()) && grid.isEmpty(spot.y(), spot.x()))
				{
					int monster = _allocator.placeMonsterRace(grid, spot.y(), spot.x(), race, IAllocationCollaborator.MON_JUST_ONE);
					if (CaveGrid.NO_ENTITY != monster)
					{
						_allocator.enrageMonster(monster);
					}
					break;
				}
			}
		}
	}

	private void _placePursuer(GenerationContext context)
	{
		LevelRequest.Arrival pursuer = context.request.arrivals().pursuer();
		if ((null != pursuer) && context.grid.hasPlayer())
		{
			if (_placeArrival(context, pursuer))
			{
				System.out.println("You feel you are being pursued!");
			}
		}
	}

	private void _placeAmbush(GenerationContext context)
	{
		CaveGrid grid = context.grid;
		List<LevelRequest.Arrival> ambushers = context.request.arrivals().ambushers();
		if ((0 == context.depth) && !ambushers.isEmpty())
		{
			// The player is caught somewhere out in the open rather than on the stairs.
			boolean moved = false;
			for (int i = 0; !moved && (i < PlacementHelpers.ALLOCATION_ATTEMPTS); ++i)
			{
				int y = context.random.range(1, grid.height - 2);
				int x = context.random.range(1, grid.width - 2);
				if (grid.isNaked(y, x))
				{
					grid.setPlayer(y, x);
					moved = true;
				}
			}
			if (moved)
			{
				System.out.println("You are ambushed!");
				for (LevelRequest.Arrival ambusher : ambushers)
				{
					_placeArrival(context, ambusher);
				}
			}
		}
	}

	private boolean _placeArrival(GenerationContext context, LevelRequest.Arrival arrival)
	{
		CaveGrid grid = context.grid;
		int monster = CaveGrid.NO_ENTITY;
		for (int d = 1; (CaveGrid.NO_ENTITY == monster) && (d <= ARRIVAL_MAX_DISTANCE); ++d)
		{
			Location spot = PlacementHelpers.scatter(context, grid.getPlayerY(), grid.getPlayerX(), d);
			if (grid.isEmpty(spot.y(), spot.x()))
			{
				monster = _allocator.placeMonsterRace(grid, spot.y(), spot.x(), arrival.race(), 0);
			}
		}
		if (CaveGrid.NO_ENTITY != monster)
		{
			_allocator.setMonsterHealth(monster, arrival.hp(), arrival.maxHp());
		}
		return (CaveGrid.NO_ENTITY != monster);
	}

	private void _placeNear(GenerationContext context, int y, int x, int race, int flags)
	{
		CaveGrid grid = context.grid;
		int monster = CaveGrid.NO_ENTITY;
		for (int d = 1; (CaveGrid.NO_ENTITY == monster) && (d <= ARRIVAL_MAX_DISTANCE); ++d)
		{
			Location spot = PlacementHelpers.scatter(context, y, x, d);
			if (grid.isEmpty(spot.y(), spot.x()))
			{
				monster = _allocator.placeMonsterRace(grid, spot.y(), spot.x(), race, flags);
			}
		}
	}


	private static record _Accepted(GenerationContext context
			, int feeling
			, int attempts
	)
	{}
}
