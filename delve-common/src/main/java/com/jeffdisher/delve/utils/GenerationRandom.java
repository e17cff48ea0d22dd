package com.jeffdisher.delve.utils;

import java.util.Random;


/**
 * The random source threaded through level generation.  It has 2 modes:
 * -continuous:  backed by a java.util.Random stream which is never replayed
 * -hashed:  a small linear congruential generator started from a given value, so the same value always produces the
 * same sequence (used for wilderness regions which must regenerate identically when revisited)
 * Mode changes are scoped:  pushHashed() and pushContinuous() return a Scope which puts back the previous mode and
 * hashed value when closed, so they are always used with try-with-resources.
 */
public class GenerationRandom
{
	private static final int LCG_MULTIPLIER = 1103515245;
	private static final int LCG_INCREMENT = 12345;

	private final Random _continuous;
	private boolean _isHashed;
	private int _hashValue;

	public GenerationRandom(long seed)
	{
		_continuous = new Random(seed);
		_isHashed = false;
		_hashValue = 0;
	}

	/**
	 * @param bound The exclusive upper bound.
	 * @return A value in [0, bound), or 0 if bound is not greater than 1.
	 */
	public int randomInt(int bound)
	{
		return (bound > 1)
				? _next(bound)
				: 0
		;
	}

	/**
	 * Rolls a die with the given number of sides.
	 * 
	 * @param sides The number of sides.
	 * @return A value in [1, sides] (always 1 if sides is not greater than 1).
	 */
	public int roll(int sides)
	{
		return 1 + randomInt(sides);
	}

	/**
	 * @param min The inclusive minimum.
	 * @param max The inclusive maximum.
	 * @return A value in [min, max].
	 */
	public int range(int min, int max)
	{
		return min + randomInt(1 + max - min);
	}

	/**
	 * @param centre The centre of the spread.
	 * @param distance How far from the centre the result may fall.
	 * @return A value in [centre - distance, centre + distance].
	 */
	public int spread(int centre, int distance)
	{
		return range(centre - distance, centre + distance);
	}

	/**
	 * @param chance The percentage chance, out of 100.
	 * @return True with the given percentage chance.
	 */
	public boolean percent(int chance)
	{
		return randomInt(100) < chance;
	}

	/**
	 * An approximately normal distribution, built from the sum of 12 uniform draws so that it consumes the stream the
	 * same way in both modes.
	 * 
	 * @param mean The mean.
	 * @param standard The standard deviation.
	 * @return A value around mean.
	 */
	public int normal(int mean, int standard)
	{
		int result = mean;
		if (standard > 0)
		{
			int sum = 0;
			for (int i = 0; i < 12; ++i)
			{
				sum += randomInt(10_000);
			}
			// Each draw has a mean of 4999.5 and the sum has a standard deviation of almost exactly 10000.
			double deviation = (double)(sum - 59_994) / 10_000.0;
			result = mean + (int) Math.round(deviation * standard);
		}
		return result;
	}

	/**
	 * Switches to hashed mode, starting from the given value, until the returned scope is closed.
	 * 
	 * @param value The starting value for the hashed sequence.
	 * @return The scope which restores the previous mode when closed.
	 */
	public Scope pushHashed(int value)
	{
		Scope scope = new Scope();
		_isHashed = true;
		_hashValue = value;
		return scope;
	}

	/**
	 * Switches to continuous mode until the returned scope is closed.  The hashed value is preserved, so a hashed
	 * sequence resumes exactly where it was interrupted.
	 * 
	 * @return The scope which restores the previous mode when closed.
	 */
	public Scope pushContinuous()
	{
		Scope scope = new Scope();
		_isHashed = false;
		return scope;
	}

	public boolean isHashed()
	{
		return _isHashed;
	}

	/**
	 * Used by tests:  Returns the current hashed-mode state.
	 * 
	 * @return The hashed value.
	 */
	public int test_getHashValue()
	{
		return _hashValue;
	}


	private int _next(int bound)
	{
		int value;
		if (_isHashed)
		{
			_hashValue = (LCG_MULTIPLIER * _hashValue) + LCG_INCREMENT;
			// Drop the weak low bits.
			value = (_hashValue >>> 4) % bound;
		}
		else
		{
			value = _continuous.nextInt(bound);
		}
		return value;
	}


	/**
	 * The saved state of a mode push.  Closing it restores the mode and hashed value which were active when it was
	 * created.  Scopes must be closed in reverse order of creation.
	 */
	public class Scope implements AutoCloseable
	{
		private final boolean _wasHashed;
		private final int _savedValue;
		private boolean _isClosed;
		
		private Scope()
		{
			_wasHashed = _isHashed;
			_savedValue = _hashValue;
		}
		
		@Override
		public void close()
		{
			Assert.assertTrue(!_isClosed);
			_isHashed = _wasHashed;
			_hashValue = _savedValue;
			_isClosed = true;
		}
	}
}
