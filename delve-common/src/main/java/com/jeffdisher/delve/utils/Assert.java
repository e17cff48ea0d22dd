package com.jeffdisher.delve.utils;


/**
 * Invariant checks used throughout generation.  A failure here is always a bug in the generator, never bad luck in the
 * random stream, so these throw AssertionError instead of anything a caller would be expected to handle.
 */
public class Assert
{
	public static void assertTrue(boolean flag)
	{
		if (!flag)
		{
			throw new AssertionError("Condition expected to be true");
		}
	}

	public static void assertInGrid(int height, int width, int y, int x)
	{
		if ((y < 0) || (y >= height) || (x < 0) || (x >= width))
		{
			throw new AssertionError("Location (" + y + ", " + x + ") outside of " + height + "x" + width + " grid");
		}
	}

	public static AssertionError unreachable()
	{
		throw new AssertionError("Code path unreachable");
	}

	public static AssertionError unexpected(Throwable t)
	{
		throw new AssertionError("Unexpected exception", t);
	}
}
