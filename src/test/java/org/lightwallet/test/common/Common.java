package org.lightwallet.test.common;

import static org.junit.Assert.*;

import java.math.BigInteger;
import java.net.URL;
import java.util.HashMap;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.bitcoinj.core.ECKey;
import org.junit.After;
import org.lightwallet.repository.DataException;
import org.lightwallet.repository.RepositoryFactory;
import org.lightwallet.repository.RepositoryManager;
import org.lightwallet.repository.hsqldb.HSQLDBRepositoryFactory;
import org.lightwallet.settings.Settings;

public class Common {

	private static final Logger LOGGER = LogManager.getLogger(Common.class);

	public static final String testConnectionUrlMemory = "jdbc:hsqldb:mem:testdb";
	public static final String testSettingsFilename = "test-settings.json";

	static {
		// Load/check settings
		URL testSettingsUrl = Common.class.getClassLoader().getResource(testSettingsFilename);
		assertNotNull("Test settings JSON file not found", testSettingsUrl);
		Settings.fileInstance(testSettingsUrl.getPath());
	}

	// Deterministic test keys, indexed by name
	private static final Map<String, ECKey> testKeysByName = new HashMap<>();
	static {
		testKeysByName.put("alice", ECKey.fromPrivate(new BigInteger("a11ce", 16)));
		testKeysByName.put("bob", ECKey.fromPrivate(new BigInteger("b0b", 16)));
		testKeysByName.put("chloe", ECKey.fromPrivate(new BigInteger("c410e", 16)));
		testKeysByName.put("dilbert", ECKey.fromPrivate(new BigInteger("d11be47", 16)));
		// Same private key as alice but uncompressed public key, so a different address
		testKeysByName.put("alice-uncompressed", ECKey.fromPrivate(new BigInteger("a11ce", 16), false));
	}

	public static ECKey getTestKey(String name) {
		ECKey key = testKeysByName.get(name);
		assertNotNull("No such test key: " + name, key);
		return key;
	}

	/** Opens a fresh in-memory repository. Pair with {@link #closeRepository()}. */
	public static void setRepository() throws DataException {
		RepositoryManager.closeRepositoryFactory();

		RepositoryFactory repositoryFactory = new HSQLDBRepositoryFactory(testConnectionUrlMemory);
		RepositoryManager.setRepositoryFactory(repositoryFactory);
	}

	/** Closes repository, discarding in-memory database. */
	@After
	public void closeRepository() throws DataException {
		if (!RepositoryManager.isRepositoryAvailable())
			return;

		LOGGER.debug("Closing test repository");
		RepositoryManager.closeRepositoryFactory();
	}

}
