package org.lightwallet.wallet;

import org.lightwallet.data.wallet.CoinData;

/**
 * Notified after successful registry changes.
 * <p>
 * Called outside the registry lock, one change at a time, in the order changes were made.
 * The calling thread may be a different thread that changed the registry concurrently.
 */
public interface UtxoRegistryListener {

	public void coinAdded(CoinData coinData);

	public void coinRemoved(CoinData coinData);

}
