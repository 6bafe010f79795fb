package org.lightwallet.wallet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.lightwallet.data.wallet.CoinData;

import com.google.common.hash.HashCode;

/** What processing a transaction did, item by item. */
public class TransactionReport {

	public enum Direction {
		INPUT, OUTPUT;
	}

	public enum Outcome {
		/** Input spent one of our coins */
		SPENT(false),
		/** Output became one of our coins */
		RECEIVED(false),
		COINBASE(false),
		DECODE_ERROR(true),
		UNSUPPORTED_FORMAT(true),
		NOT_OWNED(true),
		COIN_NOT_FOUND(true),
		/** Output matched neither template */
		UNRECOGNIZED(true);

		public final boolean isSkipped;

		Outcome(boolean isSkipped) {
			this.isSkipped = isSkipped;
		}
	}

	public static class ItemResult {
		private final Direction direction;
		private final int index;
		private final Outcome outcome;
		private final String message;

		public ItemResult(Direction direction, int index, Outcome outcome, String message) {
			this.direction = direction;
			this.index = index;
			this.outcome = outcome;
			this.message = message;
		}

		public Direction getDirection() {
			return this.direction;
		}

		public int getIndex() {
			return this.index;
		}

		public Outcome getOutcome() {
			return this.outcome;
		}

		/** @return reason for skipping, or null */
		public String getMessage() {
			return this.message;
		}

		@Override
		public String toString() {
			if (this.message == null)
				return String.format("%s %d: %s", this.direction.name().toLowerCase(), this.index, this.outcome.name());

			return String.format("%s %d: %s (%s)", this.direction.name().toLowerCase(), this.index, this.outcome.name(), this.message);
		}
	}

	private final byte[] txHash;
	private final List<ItemResult> results = new ArrayList<>();
	private final List<CoinData> addedCoins = new ArrayList<>();
	private final List<CoinData> removedCoins = new ArrayList<>();

	public TransactionReport(byte[] txHash) {
		this.txHash = txHash;
	}

	void addResult(Direction direction, int index, Outcome outcome, String message) {
		this.results.add(new ItemResult(direction, index, outcome, message));
	}

	void coinAdded(int index, CoinData coinData) {
		this.addedCoins.add(coinData);
		this.addResult(Direction.OUTPUT, index, Outcome.RECEIVED, null);
	}

	void coinRemoved(int index, CoinData coinData) {
		this.removedCoins.add(coinData);
		this.addResult(Direction.INPUT, index, Outcome.SPENT, null);
	}

	public byte[] getTxHash() {
		return this.txHash;
	}

	public List<ItemResult> getResults() {
		return Collections.unmodifiableList(this.results);
	}

	public List<ItemResult> getResults(Direction direction) {
		return this.results.stream().filter(result -> result.direction == direction).collect(Collectors.toList());
	}

	/** Skipped inputs and outputs, with reasons. Coinbase inputs are not included. */
	public List<ItemResult> getDiagnostics() {
		return this.results.stream().filter(result -> result.outcome.isSkipped).collect(Collectors.toList());
	}

	public List<CoinData> getAddedCoins() {
		return Collections.unmodifiableList(this.addedCoins);
	}

	public List<CoinData> getRemovedCoins() {
		return Collections.unmodifiableList(this.removedCoins);
	}

	/** Whether any of our coins were created or spent. */
	public boolean isRelevant() {
		return !this.addedCoins.isEmpty() || !this.removedCoins.isEmpty();
	}

	@Override
	public String toString() {
		return String.format("tx %s: %d received, %d spent, %d skipped", HashCode.fromBytes(this.txHash),
				this.addedCoins.size(), this.removedCoins.size(), this.getDiagnostics().size());
	}

}
