package com.jeffdisher.delve.config;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.Assert;
import org.junit.Test;

import com.jeffdisher.delve.config.TabListReader.TabListException;


public class TestTabListReader
{
	@Test
	public void empty() throws Throwable
	{
		TabListReader.IParseCallbacks callbacks = new _FailingCallbacks();
		_readFile(callbacks, "\n");
	}

	@Test(expected=TabListException.class)
	public void malformed() throws Throwable
	{
		TabListReader.IParseCallbacks callbacks = new _FailingCallbacks();
		_readFile(callbacks, " this should fail \n");
	}

	@Test(expected=TabListException.class)
	public void orphanSubRecord() throws Throwable
	{
		TabListReader.IParseCallbacks callbacks = new _FailingCallbacks();
		_readFile(callbacks, "\twidth\t5\n");
	}

	@Test
	public void nameListWindows() throws Throwable
	{
		List<String> names = new ArrayList<>();
		TabListReader.IParseCallbacks callbacks = new _FailingCallbacks() {
			@Override
			public void startNewRecord(String name)
			{
				names.add(name);
			}
			@Override
			public void endRecord()
			{
			}
		};
		_readFile(callbacks, "# comment\r\nguard_cell\r\n\r\ntown\r\n");
		Assert.assertEquals(2, names.size());
		Assert.assertEquals("guard_cell", names.get(0));
		Assert.assertEquals("town", names.get(1));
	}

	@Test
	public void subRecordKeepsSpaces() throws Throwable
	{
		Map<String, List<String>> fields = new HashMap<>();
		TabListReader.IParseCallbacks callbacks = new _FailingCallbacks() {
			private List<String> _values;
			@Override
			public void startNewRecord(String name)
			{
				Assert.assertEquals("vault", name);
			}
			@Override
			public void handleParameter(String value)
			{
				Assert.assertNotNull(_values);
				_values.add(value);
			}
			@Override
			public void endRecord()
			{
				Assert.assertNull(_values);
			}
			@Override
			public void startSubRecord(String name) throws TabListException
			{
				Assert.assertNull(_values);
				_values = new ArrayList<>();
				fields.put(name, _values);
			}
			@Override
			public void endSubRecord() throws TabListException
			{
				_values = null;
			}
		};
		// A run of spaces is a real value in a vault layer so it must survive, even at the end of the line.
		_readFile(callbacks, "vault\n"
				+ "\tterrain\t%3\t 2\n"
				+ "\tcontents\t.1\t\t 4\n"
		);
		Assert.assertEquals(2, fields.size());
		Assert.assertEquals(List.of("%3", " 2"), fields.get("terrain"));
		Assert.assertEquals(List.of(".1", " 4"), fields.get("contents"));
	}

	@Test
	public void runLengthPairs() throws Throwable
	{
		IValueTransformer.RunLengthTransformer transformer = new IValueTransformer.RunLengthTransformer();
		IValueTransformer.RunLengthPair pair = transformer.transform("914");
		Assert.assertEquals('9', pair.symbol());
		Assert.assertEquals(14, pair.count());
		pair = transformer.transform(" 255");
		Assert.assertEquals(' ', pair.symbol());
		Assert.assertEquals(255, pair.count());
	}

	@Test(expected=TabListException.class)
	public void runLengthTooLong() throws Throwable
	{
		new IValueTransformer.RunLengthTransformer().transform("%256");
	}

	@Test(expected=TabListException.class)
	public void negativeInteger() throws Throwable
	{
		new IValueTransformer.IntegerTransformer("width").transform("-3");
	}


	private static void _readFile(TabListReader.IParseCallbacks callbacks, String content) throws IOException, TabListException
	{
		TabListReader.readEntireFile(callbacks, new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8)));
	}


	private static class _FailingCallbacks implements TabListReader.IParseCallbacks
	{
		// We just use this as a default implementation so we can fail on unexpected calls.
		@Override
		public void startNewRecord(String name)
		{
			Assert.fail();
		}
		@Override
		public void handleParameter(String value)
		{
			Assert.fail();
		}
		@Override
		public void endRecord()
		{
			Assert.fail();
		}
		@Override
		public void startSubRecord(String name) throws TabListException
		{
			Assert.fail();
		}
		@Override
		public void endSubRecord() throws TabListException
		{
			Assert.fail();
		}
	};
}
