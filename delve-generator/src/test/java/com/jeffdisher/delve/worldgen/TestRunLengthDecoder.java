package com.jeffdisher.delve.worldgen;

import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import com.jeffdisher.delve.config.IValueTransformer.RunLengthPair;
import com.jeffdisher.delve.config.TabListReader;


public class TestRunLengthDecoder
{
	@Test
	public void rowMajor() throws Throwable
	{
		List<RunLengthPair> pairs = List.of(new RunLengthPair('#', 4)
				, new RunLengthPair('.', 1)
				, new RunLengthPair('+', 1)
		);
		char[] cells = RunLengthDecoder.decode(pairs, 3, 2);
		Assert.assertEquals("####.+", new String(cells));
	}

	@Test
	public void runCrossesRows() throws Throwable
	{
		List<RunLengthPair> pairs = List.of(new RunLengthPair('a', 5)
				, new RunLengthPair('b', 7)
		);
		char[] cells = RunLengthDecoder.decode(pairs, 4, 3);
		Assert.assertEquals("aaaaabbbbbbb", new String(cells));
	}

	@Test(expected=TabListReader.TabListException.class)
	public void tooShort() throws Throwable
	{
		RunLengthDecoder.decode(List.of(new RunLengthPair('#', 5)), 3, 2);
	}

	@Test(expected=TabListReader.TabListException.class)
	public void tooLong() throws Throwable
	{
		RunLengthDecoder.decode(List.of(new RunLengthPair('#', 7)), 3, 2);
	}

	@Test(expected=TabListReader.TabListException.class)
	public void extraPair() throws Throwable
	{
		RunLengthDecoder.decode(List.of(new RunLengthPair('#', 6), new RunLengthPair('.', 1)), 3, 2);
	}

	@Test(expected=TabListReader.TabListException.class)
	public void empty() throws Throwable
	{
		RunLengthDecoder.decode(List.of(), 3, 2);
	}
}
