package com.jeffdisher.delve.utils;

import org.junit.Assert;
import org.junit.Test;


public class TestGenerationRandom
{
	@Test
	public void bounds() throws Throwable
	{
		GenerationRandom random = new GenerationRandom(1L);
		for (int i = 0; i < 1000; ++i)
		{
			int value = random.randomInt(7);
			Assert.assertTrue((value >= 0) && (value < 7));
			int roll = random.roll(6);
			Assert.assertTrue((roll >= 1) && (roll <= 6));
			int range = random.range(-3, 3);
			Assert.assertTrue((range >= -3) && (range <= 3));
			int spread = random.spread(10, 2);
			Assert.assertTrue((spread >= 8) && (spread <= 12));
		}
		Assert.assertEquals(0, random.randomInt(1));
		Assert.assertEquals(0, random.randomInt(0));
		Assert.assertEquals(5, random.normal(5, 0));
	}

	@Test
	public void hashedIsRepeatable() throws Throwable
	{
		GenerationRandom first = new GenerationRandom(1L);
		GenerationRandom second = new GenerationRandom(99L);
		int[] one = new int[20];
		int[] two = new int[20];
		try (GenerationRandom.Scope scope = first.pushHashed(1234))
		{
			for (int i = 0; i < one.length; ++i)
			{
				one[i] = first.randomInt(1000);
			}
		}
		try (GenerationRandom.Scope scope = second.pushHashed(1234))
		{
			for (int i = 0; i < two.length; ++i)
			{
				two[i] = second.randomInt(1000);
			}
		}
		Assert.assertArrayEquals(one, two);
	}

	@Test
	public void scopesRestore() throws Throwable
	{
		GenerationRandom random = new GenerationRandom(5L);
		Assert.assertFalse(random.isHashed());
		try (GenerationRandom.Scope outer = random.pushHashed(42))
		{
			Assert.assertTrue(random.isHashed());
			random.randomInt(100);
			int saved = random.test_getHashValue();
			try (GenerationRandom.Scope inner = random.pushContinuous())
			{
				Assert.assertFalse(random.isHashed());
				random.randomInt(100);
				// Continuous draws never advance the hashed sequence.
				Assert.assertEquals(saved, random.test_getHashValue());
			}
			Assert.assertTrue(random.isHashed());
			Assert.assertEquals(saved, random.test_getHashValue());
			try (GenerationRandom.Scope inner = random.pushHashed(7))
			{
				random.randomInt(100);
				Assert.assertNotEquals(saved, random.test_getHashValue());
			}
			Assert.assertEquals(saved, random.test_getHashValue());
		}
		Assert.assertFalse(random.isHashed());
	}

	@Test
	public void scopeRestoresOnException() throws Throwable
	{
		GenerationRandom random = new GenerationRandom(5L);
		try (GenerationRandom.Scope scope = random.pushHashed(42))
		{
			throw new IllegalStateException("expected");
		}
		catch (IllegalStateException e)
		{
			Assert.assertFalse(random.isHashed());
		}
	}

	@Test(expected=AssertionError.class)
	public void doubleClose() throws Throwable
	{
		GenerationRandom random = new GenerationRandom(5L);
		GenerationRandom.Scope scope = random.pushHashed(42);
		scope.close();
		scope.close();
	}

	@Test
	public void normalCentres() throws Throwable
	{
		GenerationRandom random = new GenerationRandom(3L);
		long sum = 0L;
		int count = 2000;
		for (int i = 0; i < count; ++i)
		{
			sum += random.normal(100, 3);
		}
		double mean = (double)sum / (double)count;
		Assert.assertTrue(Math.abs(mean - 100.0) < 1.0);
	}
}
