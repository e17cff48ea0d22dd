package com.jeffdisher.delve.worldgen;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.jeffdisher.delve.config.TabListReader.TabListException;
import com.jeffdisher.delve.utils.GenerationRandom;


/**
 * The loaded vault table.
 */
public class VaultRegistry
{
	public static final String DEFAULT_RESOURCE = "vaults.tablist";
	/**
	 * How many random picks are made before giving up on finding a vault of a given type.
	 */
	public static final int PICK_ATTEMPTS = 1000;

	/**
	 * Loads the vaults bundled with the generator.
	 */
	public static VaultRegistry loadDefault() throws IOException, TabListException
	{
		ClassLoader loader = VaultRegistry.class.getClassLoader();
		InputStream stream = loader.getResourceAsStream(DEFAULT_RESOURCE);
		if (null == stream)
		{
			throw new IOException("Missing resource: " + DEFAULT_RESOURCE);
		}
		return new VaultRegistry(VaultTemplateLoader.load(stream));
	}


	private final List<VaultRecord> _vaults;

	public VaultRegistry(List<VaultRecord> vaults)
	{
		_vaults = Collections.unmodifiableList(new ArrayList<>(vaults));
	}

	public List<VaultRecord> getAll()
	{
		return _vaults;
	}

	/**
	 * @return The vault with the given name, or null if there isn't one.
	 */
	public VaultRecord getByName(String name)
	{
		VaultRecord match = null;
		for (VaultRecord vault : _vaults)
		{
			if (vault.name.equals(name))
			{
				match = vault;
				break;
			}
		}
		return match;
	}

	/**
	 * @return The first vault of the given type, or null if there isn't one.
	 */
	public VaultRecord getFirst(VaultType type)
	{
		VaultRecord match = null;
		for (VaultRecord vault : _vaults)
		{
			if (type == vault.type)
			{
				match = vault;
				break;
			}
		}
		return match;
	}

	/**
	 * Picks uniformly from the whole table until a vault of the requested type comes up.
	 *
	 * @param random The random source.
	 * @param type The required type.
	 * @return The vault, or null if none came up within PICK_ATTEMPTS tries.
	 */
	public VaultRecord pickRandom(GenerationRandom random, VaultType type)
	{
		VaultRecord match = null;
		if (!_vaults.isEmpty())
		{
			for (int i = 0; (null == match) && (i < PICK_ATTEMPTS); ++i)
			{
				VaultRecord candidate = _vaults.get(random.randomInt(_vaults.size()));
				if (type == candidate.type)
				{
					match = candidate;
				}
			}
		}
		return match;
	}
}
