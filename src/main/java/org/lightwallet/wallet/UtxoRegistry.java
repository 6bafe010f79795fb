package org.lightwallet.wallet;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.lightwallet.data.wallet.CoinData;
import org.lightwallet.utils.ByteArray;

import com.google.common.hash.HashCode;

/**
 * Unspent outputs owned by the wallet, keyed by owner address (serialized public key).
 * <p>
 * One lock guards every address's list. A wallet tracks few addresses and coins,
 * and holders never do I/O, so contention is bounded by a list scan.
 * <p>
 * Coin order within an address is <b>not</b> preserved across removals.
 * <p>
 * Listeners are called outside the registry lock, but always in the order the changes were made,
 * even when changes come from different threads. A change's notification has been delivered
 * by the time {@link #add} or {@link #remove} returns.
 */
public class UtxoRegistry {

	private static final Logger LOGGER = LogManager.getLogger(UtxoRegistry.class);

	private final Map<ByteArray, List<CoinData>> coinsByAddress = new HashMap<>();
	private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

	private final List<UtxoRegistryListener> listeners = new CopyOnWriteArrayList<>();

	// Pending notifications, queued under write lock so queue order is change order
	private final Queue<CoinEvent> pendingEvents = new ConcurrentLinkedQueue<>();
	private final ReentrantLock deliveryLock = new ReentrantLock();

	private static class CoinEvent {
		private final CoinData coinData;
		private final boolean isAdded;

		private CoinEvent(CoinData coinData, boolean isAdded) {
			this.coinData = coinData;
			this.isAdded = isAdded;
		}
	}

	public void addListener(UtxoRegistryListener listener) {
		this.listeners.add(listener);
	}

	public void removeListener(UtxoRegistryListener listener) {
		this.listeners.remove(listener);
	}

	/**
	 * Adds coin to <tt>address</tt>'s list.
	 * <p>
	 * If <tt>address</tt> already has a coin for the same output, it is replaced,
	 * so processing a transaction twice doesn't create duplicates.
	 */
	public void add(byte[] address, CoinData coinData) {
		ByteArray key = ByteArray.copyOf(address);
		boolean replaced = false;

		this.lock.writeLock().lock();
		try {
			List<CoinData> coins = this.coinsByAddress.computeIfAbsent(key, k -> new ArrayList<>());

			for (int i = 0; i < coins.size(); ++i)
				if (coins.get(i).isOutput(coinData.getTxHash(), coinData.getTxIndex())) {
					coins.set(i, coinData);
					replaced = true;
					break;
				}

			if (!replaced)
				coins.add(coinData);

			this.pendingEvents.add(new CoinEvent(coinData, true));
		} finally {
			this.lock.writeLock().unlock();
		}

		if (replaced)
			LOGGER.debug("Replaced existing coin {} for address {}", coinData, key);

		this.deliverEvents();
	}

	/**
	 * Removes coin matching <tt>txHash</tt> and <tt>txIndex</tt> from <tt>address</tt>'s list.
	 * <p>
	 * Removal moves the last coin into the vacated slot.
	 *
	 * @return removed coin
	 * @throws WalletException.CoinNotFoundException if no such coin, in which case nothing changes
	 */
	public CoinData remove(byte[] address, byte[] txHash, int txIndex) throws WalletException.CoinNotFoundException {
		CoinData removed = null;

		this.lock.writeLock().lock();
		try {
			List<CoinData> coins = this.coinsByAddress.get(ByteArray.wrap(address));

			if (coins != null)
				for (int i = 0; i < coins.size(); ++i)
					if (coins.get(i).isOutput(txHash, txIndex)) {
						removed = coins.get(i);

						int lastIndex = coins.size() - 1;
						coins.set(i, coins.get(lastIndex));
						coins.remove(lastIndex);

						this.pendingEvents.add(new CoinEvent(removed, false));
						break;
					}
		} finally {
			this.lock.writeLock().unlock();
		}

		if (removed == null)
			throw new WalletException.CoinNotFoundException(String.format("Coin %s:%s was not found",
					HashCode.fromBytes(txHash), Integer.toUnsignedString(txIndex)));

		this.deliverEvents();

		return removed;
	}

	/** Passes queued changes to listeners, oldest first. Whichever thread holds the delivery lock delivers for everyone. */
	private void deliverEvents() {
		this.deliveryLock.lock();
		try {
			CoinEvent event;
			while ((event = this.pendingEvents.poll()) != null)
				for (UtxoRegistryListener listener : this.listeners)
					if (event.isAdded)
						listener.coinAdded(event.coinData);
					else
						listener.coinRemoved(event.coinData);
		} finally {
			this.deliveryLock.unlock();
		}
	}

	/** Replaces all registry content with passed coins, e.g. from repository at start-up. Listeners are not notified. */
	public void restore(Collection<CoinData> coins) {
		this.lock.writeLock().lock();
		try {
			this.coinsByAddress.clear();

			for (CoinData coinData : coins)
				this.coinsByAddress.computeIfAbsent(ByteArray.copyOf(coinData.getAddress()), k -> new ArrayList<>()).add(coinData);
		} finally {
			this.lock.writeLock().unlock();
		}
	}

	/** Returns copy of <tt>address</tt>'s coins, possibly empty. */
	public List<CoinData> getCoins(byte[] address) {
		this.lock.readLock().lock();
		try {
			List<CoinData> coins = this.coinsByAddress.get(ByteArray.wrap(address));
			if (coins == null)
				return new ArrayList<>();

			return new ArrayList<>(coins);
		} finally {
			this.lock.readLock().unlock();
		}
	}

	/** Returns copy of <tt>address</tt>'s coins, smallest value first. */
	public List<CoinData> getCoinsByValue(byte[] address) {
		List<CoinData> coins = getCoins(address);
		coins.sort(CoinData.VALUE_ORDER);
		return coins;
	}

	public int getCoinCount(byte[] address) {
		this.lock.readLock().lock();
		try {
			List<CoinData> coins = this.coinsByAddress.get(ByteArray.wrap(address));
			return coins == null ? 0 : coins.size();
		} finally {
			this.lock.readLock().unlock();
		}
	}

	public int getCoinCount() {
		this.lock.readLock().lock();
		try {
			return this.coinsByAddress.values().stream().mapToInt(List::size).sum();
		} finally {
			this.lock.readLock().unlock();
		}
	}

	/**
	 * Sum of <tt>address</tt>'s coin values, to be treated as unsigned.
	 *
	 * @throws ArithmeticException if sum exceeds unsigned 64 bits
	 */
	public long getBalance(byte[] address) {
		this.lock.readLock().lock();
		try {
			List<CoinData> coins = this.coinsByAddress.get(ByteArray.wrap(address));
			if (coins == null)
				return 0L;

			long balance = 0L;
			for (CoinData coinData : coins) {
				long newBalance = balance + coinData.getValue();

				if (Long.compareUnsigned(newBalance, balance) < 0)
					throw new ArithmeticException("Balance overflows unsigned 64 bits");

				balance = newBalance;
			}

			return balance;
		} finally {
			this.lock.readLock().unlock();
		}
	}

	/** Addresses that have, or have had, coins. */
	public List<byte[]> getAddresses() {
		this.lock.readLock().lock();
		try {
			return this.coinsByAddress.keySet().stream().map(key -> key.value.clone()).collect(Collectors.toList());
		} finally {
			this.lock.readLock().unlock();
		}
	}

	public List<CoinData> getAllCoins() {
		this.lock.readLock().lock();
		try {
			return this.coinsByAddress.values().stream().flatMap(List::stream).collect(Collectors.toList());
		} finally {
			this.lock.readLock().unlock();
		}
	}

}
