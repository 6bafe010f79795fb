package org.lightwallet.data.wallet;

import java.util.Arrays;
import java.util.Comparator;

import org.lightwallet.data.script.ScriptType;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.hash.HashCode;

/**
 * Spendable output owned by the wallet.
 * <p>
 * Snapshot of the originating output, never modified once created.
 * Byte arrays are copied in and out.
 */
public class CoinData {

	/** Ascending order of (unsigned) value, for coin selection. */
	public static final Comparator<CoinData> VALUE_ORDER = (a, b) -> Long.compareUnsigned(a.value, b.value);

	/** Serialized public key of owner */
	private final byte[] address;
	private final byte[] txHash;
	// Unsigned 32-bit
	private final int txIndex;
	// Unsigned 64-bit
	private final long value;
	private final ScriptType type;

	@JsonCreator
	public CoinData(@JsonProperty("address") byte[] address, @JsonProperty("txHash") byte[] txHash,
			@JsonProperty("txIndex") int txIndex, @JsonProperty("value") long value, @JsonProperty("type") ScriptType type) {
		this.address = address.clone();
		this.txHash = txHash.clone();
		this.txIndex = txIndex;
		this.value = value;
		this.type = type;
	}

	public byte[] getAddress() {
		return this.address.clone();
	}

	public byte[] getTxHash() {
		return this.txHash.clone();
	}

	public int getTxIndex() {
		return this.txIndex;
	}

	public long getValue() {
		return this.value;
	}

	public ScriptType getType() {
		return this.type;
	}

	/** Returns whether this coin was created by output <tt>txIndex</tt> of transaction <tt>txHash</tt>. */
	public boolean isOutput(byte[] txHash, int txIndex) {
		return this.txIndex == txIndex && Arrays.equals(this.txHash, txHash);
	}

	@Override
	public boolean equals(Object other) {
		if (other == this)
			return true;

		if (!(other instanceof CoinData))
			return false;

		CoinData otherCoin = (CoinData) other;

		return Arrays.equals(this.address, otherCoin.address)
				&& this.isOutput(otherCoin.txHash, otherCoin.txIndex)
				&& this.value == otherCoin.value
				&& this.type == otherCoin.type;
	}

	@Override
	public int hashCode() {
		return 31 * Arrays.hashCode(this.txHash) + this.txIndex;
	}

	@Override
	public String toString() {
		return String.format("%s:%s, value %s, %s", HashCode.fromBytes(this.txHash),
				Integer.toUnsignedString(this.txIndex), Long.toUnsignedString(this.value), this.type.name());
	}

}
