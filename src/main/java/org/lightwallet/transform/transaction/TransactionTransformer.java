package org.lightwallet.transform.transaction;

import java.util.ArrayList;
import java.util.List;

import org.bitcoinj.core.Coin;
import org.bitcoinj.core.NetworkParameters;
import org.bitcoinj.core.ProtocolException;
import org.bitcoinj.core.Sha256Hash;
import org.bitcoinj.core.Transaction;
import org.bitcoinj.core.TransactionInput;
import org.bitcoinj.core.TransactionOutPoint;
import org.bitcoinj.core.TransactionOutput;
import org.lightwallet.data.transaction.TransactionData;
import org.lightwallet.transform.TransformationException;

/**
 * Converts between legacy (pre-segwit) Bitcoin-family transaction serialization and {@link TransactionData},
 * using bitcoinj for the wire format.
 * <p>
 * Hashes are kept in internal byte order, i.e. the order inputs use to reference previous outputs,
 * which is the reverse of the usual display order.
 */
public class TransactionTransformer {

	public static final int MAX_SCRIPT_SIZE = 10_000;

	private static final int VERSION_LENGTH = 4;

	private TransactionTransformer() {
	}

	public static TransactionData fromBytes(NetworkParameters params, byte[] bytes) throws TransformationException {
		if (bytes == null)
			throw new TransformationException("No transaction data");

		if (bytes.length > VERSION_LENGTH && bytes[VERSION_LENGTH] == 0)
			// Either an empty input list or segwit marker
			throw new TransformationException("Transactions without inputs, or with witness data, are not supported");

		Transaction transaction;
		try {
			transaction = new Transaction(params, bytes);
		} catch (ProtocolException | IllegalArgumentException | NegativeArraySizeException e) {
			// bitcoinj reports malformed counts and lengths with unchecked exceptions
			throw new TransformationException("Unable to decode transaction: " + e.getMessage(), e);
		}

		if (transaction.getMessageSize() != bytes.length)
			throw new TransformationException(String.format("Transaction has %d unconsumed trailing bytes", bytes.length - transaction.getMessageSize()));

		List<TransactionData.Input> inputs = new ArrayList<>();
		for (TransactionInput input : transaction.getInputs()) {
			byte[] script = checkScriptSize(input.getScriptBytes());
			TransactionOutPoint outPoint = input.getOutpoint();

			inputs.add(new TransactionData.Input(outPoint.getHash().getReversedBytes(), (int) outPoint.getIndex(),
					script, (int) input.getSequenceNumber()));
		}

		List<TransactionData.Output> outputs = new ArrayList<>();
		for (TransactionOutput output : transaction.getOutputs())
			outputs.add(new TransactionData.Output(output.getValue().value, checkScriptSize(output.getScriptBytes())));

		byte[] hash = transaction.getTxId().getReversedBytes();

		return new TransactionData(hash, (int) transaction.getVersion(), inputs, outputs, (int) transaction.getLockTime());
	}

	/**
	 * Serializes transaction. The transaction's hash is not used.
	 *
	 * @throws TransformationException if an output value isn't acceptable to bitcoinj, e.g. above the network's money supply
	 */
	public static byte[] toBytes(NetworkParameters params, TransactionData transactionData) throws TransformationException {
		Transaction transaction = new Transaction(params);
		transaction.setVersion(transactionData.getVersion());

		try {
			for (TransactionData.Input input : transactionData.getInputs()) {
				TransactionOutPoint outPoint = new TransactionOutPoint(params, Integer.toUnsignedLong(input.getOutputIndex()),
						Sha256Hash.wrapReversed(input.getOutputTxHash()));

				TransactionInput transactionInput = new TransactionInput(params, null, input.getScript(), outPoint);
				transactionInput.setSequenceNumber(Integer.toUnsignedLong(input.getSequence()));
				transaction.addInput(transactionInput);
			}

			for (TransactionData.Output output : transactionData.getOutputs())
				transaction.addOutput(new TransactionOutput(params, null, Coin.valueOf(output.getValue()), output.getScript()));
		} catch (IllegalArgumentException e) {
			throw new TransformationException("Unable to serialize transaction: " + e.getMessage(), e);
		}

		transaction.setLockTime(Integer.toUnsignedLong(transactionData.getLockTime()));

		return transaction.bitcoinSerialize();
	}

	private static byte[] checkScriptSize(byte[] script) throws TransformationException {
		if (script.length > MAX_SCRIPT_SIZE)
			throw new TransformationException(String.format("Script length %d exceeds maximum %d", script.length, MAX_SCRIPT_SIZE));

		return script;
	}

}
