package org.lightwallet.account;

import org.bitcoinj.core.ECKey;
import org.lightwallet.wallet.WalletException;

/**
 * Which public keys belong to the wallet.
 * <p>
 * Implementations must keep {@link #getKeyByPubKeyHash(byte[])} consistent with {@link #isOwned(ECKey)}:
 * a hash lookup succeeds exactly for HASH160s of owned keys.
 */
public interface KeyRegistry {

	/**
	 * Parses serialized (compressed or uncompressed) public key.
	 *
	 * @throws WalletException.KeyFormatException if bytes aren't a valid curve point
	 */
	public ECKey parsePublicKey(byte[] publicKey) throws WalletException.KeyFormatException;

	public byte[] serialize(ECKey key);

	/** Returns Base58 display address. */
	public String toAddress(ECKey key);

	public boolean isOwned(ECKey key);

	/**
	 * Returns owned key whose HASH160 matches <tt>publicKeyHash</tt>.
	 *
	 * @return key, or null if not found
	 */
	public ECKey getKeyByPubKeyHash(byte[] publicKeyHash);

}
