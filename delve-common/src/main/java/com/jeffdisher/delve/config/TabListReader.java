package com.jeffdisher.delve.config;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

import com.jeffdisher.delve.utils.Assert;


/**
 * A utility class for reading the "tab list" data files used to describe static generation data (vault templates).
 * This data format is designed to capture the bare minimum, while being human-editable and trivial to parse:
 * -each line is treated as a record where each field is delimited by tabs (since tabs don't appear in the middle of
 * textual statements, meaning no "quote" state machine is required)
 * -a line starting with a tab is a sub-record of the most recent record
 * -empty lines and lines starting with '#' are ignored
 */
public class TabListReader
{
	/**
	 * Parses a full tab list data file from the given stream, sending all parse events to the given callbacks object.
	 * Closes the stream on completion.
	 * 
	 * @param callbacks Will receive the parser events as the parse runs.
	 * @param stream The stream containing the data (will be closed when done).
	 * @throws IOException There was a problem reading the stream.
	 * @throws TabListException The data wasn't well-formed.
	 */
	public static void readEntireFile(IParseCallbacks callbacks, InputStream stream) throws IOException, TabListException
	{
		try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8)))
		{
			TabListReader parser = new TabListReader(callbacks);
			String line = reader.readLine();
			while (null != line)
			{
				parser._handleLine(line);
				line = reader.readLine();
			}
			parser._finish();
		}
	}


	private final IParseCallbacks _callbacks;
	private boolean _isInRecord;
	private int _lineNumber;

	private TabListReader(IParseCallbacks callbacks)
	{
		// We only want these instances to exist internally.
		_callbacks = callbacks;
	}

	private void _handleLine(String line) throws TabListException
	{
		_lineNumber += 1;
		// Skip empty lines or lines which start with '#' (comments).
		if ((line.length() > 0) && ('#' != line.charAt(0)))
		{
			// Keep trailing empty fields so that a run of spaces at the end of a line is still seen.
			String[] parts = line.split("\t", -1);
			Assert.assertTrue(parts.length > 0);
			
			boolean isSubRecord = (0 == parts[0].length());
			int startIndex = isSubRecord ? 1 : 0;
			if (startIndex >= parts.length)
			{
				throw new TabListException("Line " + _lineNumber + ": Empty sub-record");
			}
			
			// Note that the identifier is not allowed to begin/end in whitespace (just for sanity reasons).
			String identifier = parts[startIndex];
			if ((0 == identifier.length()) || (identifier.trim().length() < identifier.length()))
			{
				throw new TabListException("Line " + _lineNumber + ": Identifier edges cannot be whitespace");
			}
			
			if (isSubRecord)
			{
				if (!_isInRecord)
				{
					throw new TabListException("Line " + _lineNumber + ": Sub-record missing outer record");
				}
				_callbacks.startSubRecord(identifier);
				_sendParameters(parts, startIndex + 1);
				_callbacks.endSubRecord();
			}
			else
			{
				if (_isInRecord)
				{
					_callbacks.endRecord();
				}
				_callbacks.startNewRecord(identifier);
				_sendParameters(parts, startIndex + 1);
				_isInRecord = true;
			}
		}
	}

	private void _sendParameters(String[] parts, int start) throws TabListException
	{
		for (int i = start; i < parts.length; ++i)
		{
			// Empty fields only come from doubled or trailing tabs so they carry no data.
			if (parts[i].length() > 0)
			{
				_callbacks.handleParameter(parts[i]);
			}
		}
	}

	private void _finish() throws TabListException
	{
		if (_isInRecord)
		{
			_callbacks.endRecord();
			_isInRecord = false;
		}
	}


	/**
	 * The interface which receives callbacks from the parse operation.
	 */
	public interface IParseCallbacks
	{
		/**
		 * Called when a new record is encountered.
		 * 
		 * @param name The name of the record.
		 * @throws TabListException This callback was unexpected at this time or data was invalid.
		 */
		void startNewRecord(String name) throws TabListException;
		/**
		 * Called when a new parameter is encountered within a record or sub-record.
		 * 
		 * @param value The new value.
		 * @throws TabListException This callback was unexpected at this time or data was invalid.
		 */
		void handleParameter(String value) throws TabListException;
		/**
		 * Called when a record ends.
		 * 
		 * @throws TabListException This callback was unexpected at this time or data was invalid.
		 */
		void endRecord() throws TabListException;
		/**
		 * Called when a new sub-record is encountered within an existing record.
		 * 
		 * @param name The name of the sub-record.
		 * @throws TabListException This callback was unexpected at this time or data was invalid.
		 */
		void startSubRecord(String name) throws TabListException;
		/**
		 * Called when a sub-record ends.
		 * 
		 * @throws TabListException This callback was unexpected at this time or data was invalid.
		 */
		void endSubRecord() throws TabListException;
	}

	/**
	 * Used for logical errors within the tablist file.
	 */
	public static class TabListException extends Exception
	{
		private static final long serialVersionUID = 1L;
		public TabListException(String string)
		{
			super(string);
		}
	}
}
