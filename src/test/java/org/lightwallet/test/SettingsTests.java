package org.lightwallet.test;

import static org.junit.Assert.*;

import java.net.URL;

import javax.xml.bind.UnmarshalException;

import org.junit.Test;
import org.lightwallet.account.WalletNet;
import org.lightwallet.settings.Settings;
import org.lightwallet.test.common.Common;

public class SettingsTests extends Common {

	@Test
	public void testTestSettings() {
		Settings settings = Settings.getInstance();

		assertEquals(WalletNet.REGTEST, settings.getNetwork());
		assertTrue(settings.isInMemoryRepository());
		assertTrue(settings.isPersistCoins());
		assertEquals(4, settings.getRepositoryConnectionPoolSize());
		assertNull(settings.getSlowQueryThreshold());
	}

	@Test
	public void testInvalidSettings() {
		URL invalidSettingsUrl = SettingsTests.class.getClassLoader().getResource("test-settings-invalid.json");
		assertNotNull(invalidSettingsUrl);

		try {
			Settings.fileInstance(invalidSettingsUrl.getPath());
			fail("Invalid settings should not load");
		} catch (RuntimeException e) {
			assertTrue(e.getCause() instanceof UnmarshalException);
		} finally {
			// Restore test settings for other tests
			Settings.fileInstance(SettingsTests.class.getClassLoader().getResource(testSettingsFilename).getPath());
		}
	}

	@Test
	public void testMissingSettingsFile() {
		try {
			Settings.fileInstance("no-such-settings.json");
			fail("Missing settings file should not load");
		} catch (RuntimeException e) {
			assertNotNull(e.getCause());
		} finally {
			Settings.fileInstance(SettingsTests.class.getClassLoader().getResource(testSettingsFilename).getPath());
		}
	}

}
