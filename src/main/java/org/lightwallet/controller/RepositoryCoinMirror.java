package org.lightwallet.controller;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.lightwallet.data.wallet.CoinData;
import org.lightwallet.repository.DataException;
import org.lightwallet.repository.Repository;
import org.lightwallet.repository.RepositoryManager;
import org.lightwallet.wallet.UtxoRegistryListener;

/**
 * Copies coin registry changes into the repository, one repository session per change.
 * <p>
 * Registry notifications arrive in change order, so a spend is never written before its receipt.
 * Failures are logged only: the in-memory registry stays authoritative, and a failed save or delete
 * leaves that coin out of step in the repository.
 */
public class RepositoryCoinMirror implements UtxoRegistryListener {

	private static final Logger LOGGER = LogManager.getLogger(RepositoryCoinMirror.class);

	@Override
	public void coinAdded(CoinData coinData) {
		try (final Repository repository = RepositoryManager.getRepository()) {
			repository.getCoinRepository().save(coinData);
			repository.saveChanges();
		} catch (DataException e) {
			LOGGER.error(String.format("Unable to save coin %s to repository", coinData), e);
		}
	}

	@Override
	public void coinRemoved(CoinData coinData) {
		try (final Repository repository = RepositoryManager.getRepository()) {
			repository.getCoinRepository().delete(coinData);
			repository.saveChanges();
		} catch (DataException e) {
			LOGGER.error(String.format("Unable to delete coin %s from repository", coinData), e);
		}
	}

}
