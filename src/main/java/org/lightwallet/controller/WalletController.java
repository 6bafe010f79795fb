package org.lightwallet.controller;

import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.bitcoinj.core.NetworkParameters;
import org.lightwallet.account.WalletKeyRegistry;
import org.lightwallet.data.transaction.TransactionData;
import org.lightwallet.data.wallet.CoinData;
import org.lightwallet.repository.DataException;
import org.lightwallet.repository.Repository;
import org.lightwallet.repository.RepositoryFactory;
import org.lightwallet.repository.RepositoryManager;
import org.lightwallet.repository.hsqldb.HSQLDBRepositoryFactory;
import org.lightwallet.settings.Settings;
import org.lightwallet.transform.TransformationException;
import org.lightwallet.transform.transaction.TransactionTransformer;
import org.lightwallet.wallet.TransactionProcessor;
import org.lightwallet.wallet.TransactionReport;
import org.lightwallet.wallet.UtxoRegistry;

/**
 * Wallet context: one key registry, one coin registry and the processor that feeds it.
 * <p>
 * Typical use:
 * <pre>
 * WalletController controller = WalletController.fromSettings();
 * controller.start();
 * controller.getKeyRegistry().addKey(key);
 * TransactionReport report = controller.importTransaction(rawTransaction);
 * </pre>
 */
public class WalletController {

	private static final Logger LOGGER = LogManager.getLogger(WalletController.class);

	private static final String REPOSITORY_URL_PREFIX = "jdbc:hsqldb:file:";
	private static final String REPOSITORY_URL_SUFFIX = "/wallet;create=true;hsqldb.full_log_replay=true";
	private static final String MEMORY_REPOSITORY_URL = "jdbc:hsqldb:mem:wallet";

	private final WalletKeyRegistry keyRegistry;
	private final UtxoRegistry utxoRegistry;
	private final TransactionProcessor transactionProcessor;

	private RepositoryCoinMirror coinMirror = null;

	public WalletController(NetworkParameters params) {
		this.keyRegistry = new WalletKeyRegistry(params);
		this.utxoRegistry = new UtxoRegistry();
		this.transactionProcessor = new TransactionProcessor(this.keyRegistry, this.utxoRegistry);
	}

	public static WalletController fromSettings() {
		return new WalletController(Settings.getInstance().getNetwork().getParams());
	}

	public static String getRepositoryUrl() {
		Settings settings = Settings.getInstance();

		if (settings.isInMemoryRepository())
			return MEMORY_REPOSITORY_URL;

		return REPOSITORY_URL_PREFIX + settings.getRepositoryPath() + REPOSITORY_URL_SUFFIX;
	}

	// Lifecycle

	/**
	 * Opens repository, if configured and not already open, then restores persisted coins
	 * and starts mirroring coin changes.
	 */
	public void start() throws DataException {
		if (!Settings.getInstance().isPersistCoins()) {
			LOGGER.info("Coin persistence disabled");
			return;
		}

		if (!RepositoryManager.isRepositoryAvailable()) {
			LOGGER.info("Opening repository {}", getRepositoryUrl());

			RepositoryFactory repositoryFactory = new HSQLDBRepositoryFactory(getRepositoryUrl());
			RepositoryManager.setRepositoryFactory(repositoryFactory);
		}

		int coinCount = this.restoreCoins();
		LOGGER.info("Restored {} coin{} from repository", coinCount, coinCount != 1 ? "s" : "");

		this.enablePersistence();
	}

	public void shutdown() throws DataException {
		this.disablePersistence();

		RepositoryManager.closeRepositoryFactory();
	}

	public synchronized void enablePersistence() {
		if (this.coinMirror != null)
			return;

		this.coinMirror = new RepositoryCoinMirror();
		this.utxoRegistry.addListener(this.coinMirror);
	}

	public synchronized void disablePersistence() {
		if (this.coinMirror == null)
			return;

		this.utxoRegistry.removeListener(this.coinMirror);
		this.coinMirror = null;
	}

	/**
	 * Replaces in-memory coins with those in the repository.
	 *
	 * @return number of coins restored
	 */
	public int restoreCoins() throws DataException {
		try (final Repository repository = RepositoryManager.getRepository()) {
			List<CoinData> coins = repository.getCoinRepository().getAllCoins();

			this.utxoRegistry.restore(coins);

			return coins.size();
		}
	}

	// Transactions

	/**
	 * Decodes then processes raw transaction.
	 *
	 * @throws TransformationException if bytes are not a supported transaction serialization
	 */
	public TransactionReport importTransaction(byte[] transactionBytes) throws TransformationException {
		TransactionData transactionData = TransactionTransformer.fromBytes(this.keyRegistry.getParams(), transactionBytes);

		return this.processTransaction(transactionData);
	}

	public TransactionReport processTransaction(TransactionData transactionData) {
		TransactionReport report = this.transactionProcessor.process(transactionData);

		if (report.isRelevant())
			LOGGER.debug(() -> report.toString());

		return report;
	}

	// Getters

	public WalletKeyRegistry getKeyRegistry() {
		return this.keyRegistry;
	}

	public UtxoRegistry getUtxoRegistry() {
		return this.utxoRegistry;
	}

	public TransactionProcessor getTransactionProcessor() {
		return this.transactionProcessor;
	}

}
