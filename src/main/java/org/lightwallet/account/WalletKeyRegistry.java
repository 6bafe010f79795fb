package org.lightwallet.account;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.LegacyAddress;
import org.bitcoinj.core.NetworkParameters;
import org.lightwallet.utils.ByteArray;
import org.lightwallet.wallet.WalletException;

/**
 * In-memory {@link KeyRegistry}.
 * <p>
 * Keys are indexed both by serialized public key and by HASH160,
 * with both indexes updated under the same lock.
 */
public class WalletKeyRegistry implements KeyRegistry {

	private static final Logger LOGGER = LogManager.getLogger(WalletKeyRegistry.class);

	private final NetworkParameters params;

	private final Map<ByteArray, ECKey> keysByPublicKey = new HashMap<>();
	private final Map<ByteArray, ECKey> keysByPublicKeyHash = new HashMap<>();
	private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

	public WalletKeyRegistry(NetworkParameters params) {
		this.params = params;
	}

	public NetworkParameters getParams() {
		return this.params;
	}

	/** Adds key to the wallet. Only the public part is needed. */
	public void addKey(ECKey key) {
		this.lock.writeLock().lock();
		try {
			this.keysByPublicKey.put(ByteArray.copyOf(key.getPubKey()), key);
			this.keysByPublicKeyHash.put(ByteArray.copyOf(key.getPubKeyHash()), key);
		} finally {
			this.lock.writeLock().unlock();
		}

		LOGGER.debug("Added key for address {}", () -> this.toAddress(key));
	}

	/** @return true if key was present */
	public boolean removeKey(ECKey key) {
		this.lock.writeLock().lock();
		try {
			if (this.keysByPublicKey.remove(ByteArray.wrap(key.getPubKey())) == null)
				return false;

			this.keysByPublicKeyHash.remove(ByteArray.wrap(key.getPubKeyHash()));
			return true;
		} finally {
			this.lock.writeLock().unlock();
		}
	}

	public List<ECKey> getKeys() {
		this.lock.readLock().lock();
		try {
			return new ArrayList<>(this.keysByPublicKey.values());
		} finally {
			this.lock.readLock().unlock();
		}
	}

	@Override
	public ECKey parsePublicKey(byte[] publicKey) throws WalletException.KeyFormatException {
		if (!ECKey.isPubKeyCanonical(publicKey))
			throw new WalletException.KeyFormatException(String.format("Public key has unexpected length %d or prefix", publicKey.length));

		try {
			return ECKey.fromPublicOnly(publicKey);
		} catch (IllegalArgumentException e) {
			throw new WalletException.KeyFormatException("Invalid public key", e);
		}
	}

	@Override
	public byte[] serialize(ECKey key) {
		return key.getPubKey();
	}

	@Override
	public String toAddress(ECKey key) {
		return LegacyAddress.fromKey(this.params, key).toString();
	}

	@Override
	public boolean isOwned(ECKey key) {
		this.lock.readLock().lock();
		try {
			return this.keysByPublicKey.containsKey(ByteArray.wrap(key.getPubKey()));
		} finally {
			this.lock.readLock().unlock();
		}
	}

	@Override
	public ECKey getKeyByPubKeyHash(byte[] publicKeyHash) {
		this.lock.readLock().lock();
		try {
			return this.keysByPublicKeyHash.get(ByteArray.wrap(publicKeyHash));
		} finally {
			this.lock.readLock().unlock();
		}
	}

}
