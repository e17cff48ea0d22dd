package com.jeffdisher.delve.worldgen;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import com.jeffdisher.delve.config.TabListReader;
import com.jeffdisher.delve.utils.GenerationRandom;


public class TestVaultTemplateLoader
{
	@Test
	public void smallVault() throws Throwable
	{
		String data = "tiny\n"
				+ "\ttype\t7\n"
				+ "\trating\t12\n"
				+ "\twidth\t3\n"
				+ "\theight\t2\n"
				+ "\tterrain\t#4\n"
				+ "\tterrain\t.1\t+1\n"
				+ "\tcontents\t 5\t&1\n"
				+ "\tmonsters\t40\t41\n"
		;
		List<VaultRecord> vaults = VaultTemplateLoader.load(_stream(data));
		Assert.assertEquals(1, vaults.size());
		VaultRecord vault = vaults.get(0);
		Assert.assertEquals("tiny", vault.name);
		Assert.assertEquals(VaultType.LESSER, vault.type);
		Assert.assertEquals(12, vault.rating);
		Assert.assertEquals('#', vault.getTerrain(0, 2));
		Assert.assertEquals('.', vault.getTerrain(1, 1));
		Assert.assertEquals('+', vault.getTerrain(1, 2));
		Assert.assertEquals(' ', vault.getContents(1, 1));
		Assert.assertEquals('&', vault.getContents(1, 2));
		Assert.assertEquals(40, vault.getMonsterSlot(0));
		Assert.assertEquals(41, vault.getMonsterSlot(1));
		Assert.assertEquals(0, vault.getMonsterSlot(2));
		Assert.assertEquals(VaultRecord.Background.PERM, vault.background);
	}

	@Test
	public void questBackground() throws Throwable
	{
		String data = "misty\n"
				+ "\ttype\t99\n"
				+ "\twidth\t1\n"
				+ "\theight\t1\n"
				+ "\tterrain\t.1\n"
				+ "\tcontents\t 1\n"
				+ "\tbackground\tfog\n"
		;
		VaultRecord vault = VaultTemplateLoader.load(_stream(data)).get(0);
		Assert.assertEquals(VaultType.QUEST, vault.type);
		Assert.assertEquals(VaultRecord.Background.FOG, vault.background);
	}

	@Test(expected=TabListReader.TabListException.class)
	public void shortLayer() throws Throwable
	{
		String data = "broken\n"
				+ "\ttype\t7\n"
				+ "\twidth\t3\n"
				+ "\theight\t2\n"
				+ "\tterrain\t#5\n"
				+ "\tcontents\t 6\n"
		;
		VaultTemplateLoader.load(_stream(data));
	}

	@Test(expected=TabListReader.TabListException.class)
	public void unknownType() throws Throwable
	{
		String data = "broken\n"
				+ "\ttype\t42\n"
				+ "\twidth\t1\n"
				+ "\theight\t1\n"
				+ "\tterrain\t.1\n"
				+ "\tcontents\t 1\n"
		;
		VaultTemplateLoader.load(_stream(data));
	}

	@Test(expected=TabListReader.TabListException.class)
	public void duplicateName() throws Throwable
	{
		String one = "twin\n"
				+ "\ttype\t7\n"
				+ "\twidth\t1\n"
				+ "\theight\t1\n"
				+ "\tterrain\t.1\n"
				+ "\tcontents\t 1\n"
		;
		VaultTemplateLoader.load(_stream(one + one));
	}

	@Test
	public void bundledVaults() throws Throwable
	{
		VaultRegistry registry = VaultRegistry.loadDefault();
		Assert.assertEquals(12, registry.getAll().size());
		for (VaultType type : VaultType.values())
		{
			Assert.assertNotNull(type.toString(), registry.getFirst(type));
		}
		Assert.assertEquals(VaultType.TOWN, registry.getByName("town").type);
		Assert.assertEquals(VaultRecord.Background.WILD, registry.getByName("quest_hunting_grounds").background);
		Assert.assertNull(registry.getByName("missing"));

		GenerationRandom random = new GenerationRandom(9L);
		for (int i = 0; i < 20; ++i)
		{
			Assert.assertEquals(VaultType.WILDERNESS, registry.pickRandom(random, VaultType.WILDERNESS).type);
		}
	}

	@Test
	public void emptyRegistry() throws Throwable
	{
		VaultRegistry registry = new VaultRegistry(List.of());
		Assert.assertNull(registry.getFirst(VaultType.TOWN));
		Assert.assertNull(registry.pickRandom(new GenerationRandom(1L), VaultType.TOWN));
	}


	private static ByteArrayInputStream _stream(String data)
	{
		return new ByteArrayInputStream(data.getBytes(StandardCharsets.UTF_8));
	}
}
