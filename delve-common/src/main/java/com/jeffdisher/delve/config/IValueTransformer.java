package com.jeffdisher.delve.config;

import com.jeffdisher.delve.config.TabListReader.TabListException;


/**
 * Used to transform a string value into a specific type.
 * 
 * @param <T> The output type.
 */
public interface IValueTransformer<T>
{
	T transform(String value) throws TabListReader.TabListException;

	/**
	 * Decodes the given data as a non-negative Integer.
	 */
	public static class IntegerTransformer implements IValueTransformer<Integer>
	{
		private final String _name;
		public IntegerTransformer(String numberName)
		{
			_name = numberName;
		}
		@Override
		public Integer transform(String value) throws TabListException
		{
			try
			{
				int parsed = Integer.parseInt(value);
				if (parsed < 0)
				{
					throw new TabListReader.TabListException("Values for " + _name + " cannot be negative");
				}
				return parsed;
			}
			catch (NumberFormatException e)
			{
				throw new TabListReader.TabListException("Not a valid " + _name + ": \"" + value + "\"");
			}
		}
	}

	/**
	 * Decodes a single run-length pair written as the symbol followed by its decimal count ("%14", " 3", "914").
	 */
	public static class RunLengthTransformer implements IValueTransformer<RunLengthPair>
	{
		@Override
		public RunLengthPair transform(String value) throws TabListException
		{
			if (value.length() < 2)
			{
				throw new TabListReader.TabListException("Run-length pair needs a symbol and a count: \"" + value + "\"");
			}
			char symbol = value.charAt(0);
			int count;
			try
			{
				count = Integer.parseInt(value.substring(1));
			}
			catch (NumberFormatException e)
			{
				throw new TabListReader.TabListException("Not a valid run length: \"" + value + "\"");
			}
			if ((count <= 0) || (count > 255))
			{
				throw new TabListReader.TabListException("Run length must be in [1, 255]: \"" + value + "\"");
			}
			return new RunLengthPair(symbol, count);
		}
	}

	/**
	 * One (symbol, count) pair of a run-length encoded layer.
	 */
	public static record RunLengthPair(char symbol
			, int count
	)
	{}
}
