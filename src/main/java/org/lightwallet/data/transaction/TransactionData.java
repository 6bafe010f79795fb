package org.lightwallet.data.transaction;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import com.google.common.hash.HashCode;
import com.google.common.io.BaseEncoding;

/**
 * Decoded Bitcoin-family transaction, as far as the wallet needs it.
 * <p>
 * Immutable: byte arrays are copied in and out. Hash is null for transactions built locally and not yet serialized.
 */
public class TransactionData {

	public static final int HASH_LENGTH = 32;

	/** Previous-output index used by coinbase inputs. */
	public static final int COINBASE_INDEX = 0xffffffff;

	private static final byte[] ZERO_HASH = new byte[HASH_LENGTH];

	public static class Input {
		private final byte[] outputTxHash;
		// Unsigned 32-bit
		private final int outputIndex;
		private final byte[] script;
		private final int sequence;

		public Input(byte[] outputTxHash, int outputIndex, byte[] script, int sequence) {
			this.outputTxHash = outputTxHash.clone();
			this.outputIndex = outputIndex;
			this.script = script.clone();
			this.sequence = sequence;
		}

		public byte[] getOutputTxHash() {
			return this.outputTxHash.clone();
		}

		public int getOutputIndex() {
			return this.outputIndex;
		}

		public byte[] getScript() {
			return this.script.clone();
		}

		public int getSequence() {
			return this.sequence;
		}

		/** Coinbase inputs reference an all-zero hash at index 0xffffffff. */
		public boolean isCoinbase() {
			return this.outputIndex == COINBASE_INDEX && Arrays.equals(this.outputTxHash, ZERO_HASH);
		}

		@Override
		public String toString() {
			return String.format("{output %s:%s, sequence %s, script %s}",
					HashCode.fromBytes(this.outputTxHash), Integer.toUnsignedString(this.outputIndex),
					Integer.toUnsignedString(this.sequence), BaseEncoding.base16().lowerCase().encode(this.script));
		}
	}

	public static class Output {
		// Unsigned 64-bit
		private final long value;
		private final byte[] script;

		public Output(long value, byte[] script) {
			this.value = value;
			this.script = script.clone();
		}

		public long getValue() {
			return this.value;
		}

		public byte[] getScript() {
			return this.script.clone();
		}

		@Override
		public String toString() {
			return String.format("{value %s, script %s}", Long.toUnsignedString(this.value), BaseEncoding.base16().lowerCase().encode(this.script));
		}
	}

	private final byte[] hash;
	private final int version;
	private final List<Input> inputs;
	private final List<Output> outputs;
	private final int lockTime;

	public TransactionData(byte[] hash, int version, List<Input> inputs, List<Output> outputs, int lockTime) {
		this.hash = hash == null ? null : hash.clone();
		this.version = version;
		this.inputs = Collections.unmodifiableList(inputs);
		this.outputs = Collections.unmodifiableList(outputs);
		this.lockTime = lockTime;
	}

	public byte[] getHash() {
		return this.hash == null ? null : this.hash.clone();
	}

	public int getVersion() {
		return this.version;
	}

	public List<Input> getInputs() {
		return this.inputs;
	}

	public List<Output> getOutputs() {
		return this.outputs;
	}

	public int getLockTime() {
		return this.lockTime;
	}

	@Override
	public String toString() {
		return String.format("hash %s, version %d, locktime %s\n"
				+ "\tinputs: [%s]\n"
				+ "\toutputs: [%s]\n",
				this.hash == null ? "(none)" : HashCode.fromBytes(this.hash).toString(),
				this.version,
				Integer.toUnsignedString(this.lockTime),
				this.inputs.stream().map(Input::toString).collect(Collectors.joining(",\n\t\t")),
				this.outputs.stream().map(Output::toString).collect(Collectors.joining(",\n\t\t")));
	}

}
