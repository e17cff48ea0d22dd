package com.jeffdisher.delve.worldgen;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.jeffdisher.delve.config.IValueTransformer;
import com.jeffdisher.delve.config.TabListReader;
import com.jeffdisher.delve.config.TabListReader.TabListException;


/**
 * Loads vault templates from a tab list file.  Each vault is a record named after the vault, with these sub-records:
 * -type:  the numeric vault type tag (see VaultType)
 * -rating:  the rating bonus for stamping it
 * -width/height:  the dimensions
 * -terrain/contents:  the 2 run-length encoded layers, one "<symbol><count>" pair per field
 * -monsters:  (optional) the races of the digit monster slots
 * -background:  (optional) the quest level fill:  "perm", "wild" or "fog"
 * A layer may be split across several sub-records of the same name, which are concatenated.
 */
public class VaultTemplateLoader
{
	public static final String SUB_TYPE = "type";
	public static final String SUB_RATING = "rating";
	public static final String SUB_WIDTH = "width";
	public static final String SUB_HEIGHT = "height";
	public static final String SUB_TERRAIN = "terrain";
	public static final String SUB_CONTENTS = "contents";
	public static final String SUB_MONSTERS = "monsters";
	public static final String SUB_BACKGROUND = "background";

	/**
	 * Loads every vault in the stream (which is closed when done).
	 *
	 * @param stream The tab list data.
	 * @return The vaults, in file order.
	 * @throws IOException There was a problem reading the stream.
	 * @throws TabListException The data was malformed.
	 */
	public static List<VaultRecord> load(InputStream stream) throws IOException, TabListException
	{
		_Callbacks callbacks = new _Callbacks();
		TabListReader.readEntireFile(callbacks, stream);
		return callbacks.vaults;
	}


	private static class _Callbacks implements TabListReader.IParseCallbacks
	{
		private final IValueTransformer.IntegerTransformer _integers = new IValueTransformer.IntegerTransformer("number");
		private final IValueTransformer.RunLengthTransformer _runs = new IValueTransformer.RunLengthTransformer();
		private final Set<String> _names = new HashSet<>();
		public final List<VaultRecord> vaults = new ArrayList<>();

		private String _name;
		private String _subRecord;
		private List<String> _values;
		private VaultType _type;
		private int _rating;
		private int _width;
		private int _height;
		private List<IValueTransformer.RunLengthPair> _terrain;
		private List<IValueTransformer.RunLengthPair> _contents;
		private List<Integer> _monsters;
		private VaultRecord.Background _background;

		@Override
		public void startNewRecord(String name) throws TabListException
		{
			if (!_names.add(name))
			{
				throw new TabListException("Duplicate vault: \"" + name + "\"");
			}
			_name = name;
			_type = null;
			_rating = 0;
			_width = -1;
			_height = -1;
			_terrain = new ArrayList<>();
			_contents = new ArrayList<>();
			_monsters = new ArrayList<>();
			_background = VaultRecord.Background.PERM;
		}
		@Override
		public void handleParameter(String value) throws TabListException
		{
			if (null == _subRecord)
			{
				throw new TabListException("Vault \"" + _name + "\" takes no parameters");
			}
			_values.add(value);
		}
		@Override
		public void endRecord() throws TabListException
		{
			if (null == _type)
			{
				throw new TabListException("Vault \"" + _name + "\" missing " + SUB_TYPE);
			}
			if ((_width <= 0) || (_height <= 0))
			{
				throw new TabListException("Vault \"" + _name + "\" missing dimensions");
			}
			char[] terrain = RunLengthDecoder.decode(_terrain, _width, _height);
			char[] contents = RunLengthDecoder.decode(_contents, _width, _height);
			int[] monsters = new int[_monsters.size()];
			for (int i = 0; i < monsters.length; ++i)
			{
				monsters[i] = _monsters.get(i);
			}
			this.vaults.add(new VaultRecord(_name, _type, _rating, _width, _height, terrain, contents, monsters, _background));
			_name = null;
		}
		@Override
		public void startSubRecord(String name) throws TabListException
		{
			_subRecord = name;
			_values = new ArrayList<>();
		}
		@Override
		public void endSubRecord() throws TabListException
		{
			switch (_subRecord)
			{
			case SUB_TYPE:
				int tag = _single(_integers);
				_type = VaultType.fromTag(tag);
				if (null == _type)
				{
					throw new TabListException("Vault \"" + _name + "\" has unknown type " + tag);
				}
				break;
			case SUB_RATING:
				_rating = _single(_integers);
				break;
			case SUB_WIDTH:
				_width = _single(_integers);
				break;
			case SUB_HEIGHT:
				_height = _single(_integers);
				break;
			case SUB_TERRAIN:
				for (String value : _values)
				{
					_terrain.add(_runs.transform(value));
				}
				break;
			case SUB_CONTENTS:
				for (String value : _values)
				{
					_contents.add(_runs.transform(value));
				}
				break;
			case SUB_MONSTERS:
				for (String value : _values)
				{
					_monsters.add(_integers.transform(value));
				}
				break;
			case SUB_BACKGROUND:
				if (1 != _values.size())
				{
					throw new TabListException("Vault \"" + _name + "\" needs exactly 1 " + SUB_BACKGROUND);
				}
				try
				{
					_background = VaultRecord.Background.valueOf(_values.get(0).toUpperCase());
				}
				catch (IllegalArgumentException e)
				{
					throw new TabListException("Vault \"" + _name + "\" has unknown background \"" + _values.get(0) + "\"");
				}
				break;
				default:
					throw new TabListException("Unknown sub-record: \"" + _subRecord + "\" under \"" + _name + "\"");
			}
			_subRecord = null;
			_values = null;
		}
		private int _single(IValueTransformer.IntegerTransformer transformer) throws TabListException
		{
			if (1 != _values.size())
			{
				throw new TabListException("Vault \"" + _name + "\" needs exactly 1 value for " + _subRecord);
			}
			return transformer.transform(_values.get(0));
		}
	}
}
