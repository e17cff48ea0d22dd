package com.jeffdisher.delve.worldgen;

import com.jeffdisher.delve.types.Feature;
import com.jeffdisher.delve.utils.GenerationRandom;


/**
 * Midpoint displacement over a height field.  The caller sets the 4 corners of a rectangle and the rest is filled in
 * by recursively averaging and perturbing:  the centre from the 4 corners and each edge midpoint from its 2 corners
 * and the centre.  Every value is clamped to [0, maxValue].
 */
public class PlasmaTerrain
{
	/**
	 * The terrain tiers, lowest to highest, used to turn heights into wilderness terrain.
	 */
	public static final Feature[] NORMAL_TIERS = new Feature[] {
			Feature.DEEP_WATER, Feature.DEEP_WATER, Feature.DEEP_WATER, Feature.DEEP_WATER,
			Feature.SHALLOW_WATER, Feature.SHALLOW_WATER, Feature.SHALLOW_WATER, Feature.SHALLOW_WATER, Feature.SHALLOW_WATER,
			Feature.MUD, Feature.MUD,
			Feature.SWAMP, Feature.SWAMP,
			Feature.GRASS, Feature.GRASS, Feature.GRASS,
			Feature.SHRUB, Feature.SHRUB,
			Feature.TREES, Feature.TREES,
			Feature.ROCKY_HILL,
			Feature.MOUNTAIN,
	};
	/**
	 * The tiers used by wetter regions.
	 */
	public static final Feature[] WATERY_TIERS = new Feature[] {
			Feature.DEEP_WATER, Feature.DEEP_WATER, Feature.DEEP_WATER, Feature.DEEP_WATER, Feature.DEEP_WATER,
			Feature.DEEP_WATER, Feature.DEEP_WATER, Feature.DEEP_WATER, Feature.DEEP_WATER,
			Feature.SHALLOW_WATER, Feature.SHALLOW_WATER, Feature.SHALLOW_WATER, Feature.SHALLOW_WATER,
			Feature.MUD, Feature.MUD, Feature.MUD,
			Feature.SWAMP, Feature.SWAMP, Feature.SWAMP,
			Feature.GRASS, Feature.GRASS,
			Feature.SHRUB,
	};

	/**
	 * Fills in field between the corners (y1, x1) and (y2, x2), which must already be set.  The field is indexed
	 * [y][x].
	 *
	 * @param random The random source.
	 * @param field The height field.
	 * @param maxValue The largest value allowed.
	 * @param rough How far each computed value may be perturbed either way.
	 */
	public static void fill(GenerationRandom random, int[][] field, int y1, int x1, int y2, int x2, int maxValue, int rough)
	{
		if (((x2 - x1) > 1) || ((y2 - y1) > 1))
		{
			int xmid = ((x2 - x1) / 2) + x1;
			int ymid = ((y2 - y1) / 2) + y1;

			field[ymid][xmid] = _mid(random, field[y1][x1], field[y2][x1], field[y1][x2], field[y2][x2], maxValue, rough);
			int centre = field[ymid][xmid];
			field[y1][xmid] = _end(random, field[y1][x1], field[y1][x2], centre, maxValue, rough);
			field[ymid][x2] = _end(random, field[y1][x2], field[y2][x2], centre, maxValue, rough);
			field[y2][xmid] = _end(random, field[y2][x2], field[y2][x1], centre, maxValue, rough);
			field[ymid][x1] = _end(random, field[y2][x1], field[y1][x1], centre, maxValue, rough);

			fill(random, field, y1, x1, ymid, xmid, maxValue, rough);
			fill(random, field, y1, xmid, ymid, x2, maxValue, rough);
			fill(random, field, ymid, x1, y2, xmid, maxValue, rough);
			fill(random, field, ymid, xmid, y2, x2, maxValue, rough);
		}
	}

	/**
	 * Maps a height onto one of the terrain tier tables.
	 *
	 * @param tiers The table to use.
	 * @param height The height, in [0, maxValue].
	 * @param maxValue The largest height the field can hold.
	 * @return The terrain for that height.
	 */
	public static Feature toTerrain(Feature[] tiers, int height, int maxValue)
	{
		int index = (maxValue > 0)
				? (height * (tiers.length - 1)) / maxValue
				: 0
		;
		return tiers[Math.max(0, Math.min(tiers.length - 1, index))];
	}


	private static int _mid(GenerationRandom random, int a, int b, int c, int d, int maxValue, int rough)
	{
		int sum = a + b + c + d;
		int value = (sum / 4) + random.spread(0, rough);
		if ((sum % 4) > 1)
		{
			value += 1;
		}
		return _clamp(value, maxValue);
	}

	private static int _end(GenerationRandom random, int a, int b, int c, int maxValue, int rough)
	{
		int sum = a + b + c;
		int value = (sum / 3) + random.spread(0, rough);
		if (0 != (sum % 3))
		{
			value += 1;
		}
		return _clamp(value, maxValue);
	}

	private static int _clamp(int value, int maxValue)
	{
		return Math.max(0, Math.min(maxValue, value));
	}
}
