package org.lightwallet.test.controller;

import static org.junit.Assert.*;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.bitcoinj.core.ECKey;
import org.junit.Before;
import org.junit.Test;
import org.lightwallet.account.WalletNet;
import org.lightwallet.controller.WalletController;
import org.lightwallet.data.transaction.TransactionData;
import org.lightwallet.data.wallet.CoinData;
import org.lightwallet.repository.DataException;
import org.lightwallet.repository.Repository;
import org.lightwallet.repository.RepositoryManager;
import org.lightwallet.test.common.Common;
import org.lightwallet.test.common.TransactionUtils;
import org.lightwallet.transform.TransformationException;
import org.lightwallet.transform.script.OutputScriptTransformer;
import org.lightwallet.transform.transaction.TransactionTransformer;
import org.lightwallet.wallet.TransactionReport;
import org.lightwallet.wallet.TransactionReport.Outcome;
import org.lightwallet.wallet.UtxoRegistryListener;

public class WalletControllerTests extends Common {

	private ECKey alice;
	private ECKey bob;

	@Before
	public void beforeTest() throws DataException {
		Common.setRepository();

		this.alice = getTestKey("alice");
		this.bob = getTestKey("bob");
	}

	private WalletController startController() throws DataException {
		WalletController controller = new WalletController(WalletNet.REGTEST.getParams());
		controller.getKeyRegistry().addKey(this.alice);
		controller.start();
		return controller;
	}

	private byte[] buildPayment(byte[] previousTxHash, byte[] inputPublicKey, long value, byte[] outputScript) throws TransformationException {
		TransactionData.Input input = TransactionUtils.buildInput(previousTxHash, 0, TransactionUtils.buildScriptSig(inputPublicKey));
		TransactionData.Output output = new TransactionData.Output(value, outputScript);

		TransactionData transactionData = TransactionUtils.buildTransaction(Collections.singletonList(input), Collections.singletonList(output));
		return TransactionTransformer.toBytes(TransactionUtils.PARAMS, transactionData);
	}

	private static List<CoinData> getPersistedCoins() throws DataException {
		try (final Repository repository = RepositoryManager.getRepository()) {
			return repository.getCoinRepository().getAllCoins();
		}
	}

	@Test
	public void testReceiveThenSpendIsPersisted() throws DataException, TransformationException {
		WalletController controller = this.startController();

		byte[] incoming = buildPayment(TransactionUtils.randomTxHash(), this.bob.getPubKey(), 5000L,
				OutputScriptTransformer.buildPayToPubKeyHash(this.alice.getPubKeyHash()));

		TransactionReport receiveReport = controller.importTransaction(incoming);
		assertEquals(1, receiveReport.getAddedCoins().size());

		List<CoinData> persistedCoins = getPersistedCoins();
		assertEquals(1, persistedCoins.size());
		assertEquals(receiveReport.getAddedCoins().get(0), persistedCoins.get(0));

		// Alice spends it to bob
		byte[] outgoing = buildPayment(receiveReport.getTxHash(), this.alice.getPubKey(), 4000L,
				OutputScriptTransformer.buildPayToPubKeyHash(this.bob.getPubKeyHash()));

		TransactionReport spendReport = controller.importTransaction(outgoing);
		assertEquals(1, spendReport.getRemovedCoins().size());
		assertEquals(Outcome.NOT_OWNED, spendReport.getResults(TransactionReport.Direction.OUTPUT).get(0).getOutcome());

		assertTrue(getPersistedCoins().isEmpty());
		assertEquals(0, controller.getUtxoRegistry().getCoinCount());

		controller.shutdown();
		assertFalse(RepositoryManager.isRepositoryAvailable());
	}

	@Test
	public void testSpendOnOtherThreadIsPersistedAfterReceipt() throws DataException, TransformationException, InterruptedException {
		WalletController controller = new WalletController(WalletNet.REGTEST.getParams());
		controller.getKeyRegistry().addKey(this.alice);

		// Registered before repository mirror, so receipt reaches repository only once released
		CountDownLatch releaseLatch = new CountDownLatch(1);
		controller.getUtxoRegistry().addListener(new UtxoRegistryListener() {
			@Override
			public void coinAdded(CoinData coinData) {
				try {
					releaseLatch.await(10, TimeUnit.SECONDS);
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				}
			}

			@Override
			public void coinRemoved(CoinData coinData) {
			}
		});

		controller.start();

		byte[] incoming = buildPayment(TransactionUtils.randomTxHash(), this.bob.getPubKey(), 5000L,
				OutputScriptTransformer.buildPayToPubKeyHash(this.alice.getPubKeyHash()));
		byte[] incomingHash = TransactionTransformer.fromBytes(TransactionUtils.PARAMS, incoming).getHash();

		byte[] outgoing = buildPayment(incomingHash, this.alice.getPubKey(), 4000L,
				OutputScriptTransformer.buildPayToPubKeyHash(this.bob.getPubKeyHash()));

		AtomicReference<Exception> failure = new AtomicReference<>();

		Thread receiver = new Thread(() -> importOrRecord(controller, incoming, failure));
		receiver.start();
		waitForCoinCount(controller, 1);

		Thread spender = new Thread(() -> importOrRecord(controller, outgoing, failure));
		spender.start();
		waitForCoinCount(controller, 0);

		releaseLatch.countDown();
		receiver.join(10_000);
		spender.join(10_000);

		assertNull(failure.get());
		assertTrue("Spent coin should not be persisted", getPersistedCoins().isEmpty());
	}

	private static void importOrRecord(WalletController controller, byte[] transactionBytes, AtomicReference<Exception> failure) {
		try {
			controller.importTransaction(transactionBytes);
		} catch (TransformationException e) {
			failure.set(e);
		}
	}

	private static void waitForCoinCount(WalletController controller, int expectedCount) throws InterruptedException {
		long deadline = System.currentTimeMillis() + 10_000;

		while (controller.getUtxoRegistry().getCoinCount() != expectedCount) {
			assertTrue("Timed out waiting for coin count " + expectedCount, System.currentTimeMillis() < deadline);
			Thread.sleep(10);
		}
	}

	@Test
	public void testRestoreCoins() throws DataException, TransformationException {
		WalletController controller = this.startController();

		byte[] incoming = buildPayment(TransactionUtils.randomTxHash(), this.bob.getPubKey(), 7000L,
				OutputScriptTransformer.buildPayToPubKey(this.alice.getPubKey()));
		controller.importTransaction(incoming);

		controller.disablePersistence();

		// Second wallet picks up persisted coin
		WalletController restoredController = this.startController();

		List<CoinData> restoredCoins = restoredController.getUtxoRegistry().getCoins(this.alice.getPubKey());
		assertEquals(1, restoredCoins.size());
		assertEquals(7000L, restoredCoins.get(0).getValue());
		assertEquals(7000L, restoredController.getUtxoRegistry().getBalance(this.alice.getPubKey()));
	}

	@Test
	public void testPersistenceDisabled() throws DataException, TransformationException {
		WalletController controller = this.startController();
		controller.disablePersistence();

		byte[] incoming = buildPayment(TransactionUtils.randomTxHash(), this.bob.getPubKey(), 1000L,
				OutputScriptTransformer.buildPayToPubKeyHash(this.alice.getPubKeyHash()));
		controller.importTransaction(incoming);

		assertEquals(1, controller.getUtxoRegistry().getCoinCount());
		assertTrue(getPersistedCoins().isEmpty());
	}

	@Test
	public void testImportInvalidTransaction() throws DataException {
		WalletController controller = this.startController();

		try {
			controller.importTransaction(new byte[] { 0x01, 0x00, 0x00 });
			fail("Truncated transaction should not import");
		} catch (TransformationException e) {
			// expected
		}

		assertEquals(0, controller.getUtxoRegistry().getCoinCount());
	}

	@Test
	public void testFromSettings() {
		// Test settings select regtest
		WalletController controller = WalletController.fromSettings();
		assertEquals(WalletNet.REGTEST.getParams(), controller.getKeyRegistry().getParams());
	}

	@Test
	public void testRepositoryUrl() {
		// Test settings use in-memory repository
		assertEquals("jdbc:hsqldb:mem:wallet", WalletController.getRepositoryUrl());
	}

}
