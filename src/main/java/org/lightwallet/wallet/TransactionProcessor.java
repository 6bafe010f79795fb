package org.lightwallet.wallet;

import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.bitcoinj.core.ECKey;
import org.lightwallet.account.KeyRegistry;
import org.lightwallet.data.script.PubKeyHashScriptData;
import org.lightwallet.data.script.PubKeyScriptData;
import org.lightwallet.data.script.ScriptSigTailData;
import org.lightwallet.data.script.ScriptType;
import org.lightwallet.data.transaction.TransactionData;
import org.lightwallet.data.wallet.CoinData;
import org.lightwallet.transform.TransformationException;
import org.lightwallet.transform.UnsupportedFormatException;
import org.lightwallet.transform.script.OutputScriptTransformer;
import org.lightwallet.transform.script.ScriptReader;
import org.lightwallet.transform.script.ScriptSigTransformer;
import org.lightwallet.wallet.TransactionReport.Direction;
import org.lightwallet.wallet.TransactionReport.Outcome;

import com.google.common.hash.HashCode;

/**
 * Applies a transaction to the {@link UtxoRegistry}.
 * <p>
 * Inputs whose signature script reveals one of our keys retire the coin they spend.
 * Outputs paying one of our keys, directly or by HASH160, become new coins.
 * <p>
 * Each input and output is handled independently: a failure skips that item only,
 * is logged and recorded in the returned {@link TransactionReport}.
 * Safe to call from multiple threads sharing one registry.
 */
public class TransactionProcessor {

	private static final Logger LOGGER = LogManager.getLogger(TransactionProcessor.class);

	private final KeyRegistry keyRegistry;
	private final UtxoRegistry utxoRegistry;

	public TransactionProcessor(KeyRegistry keyRegistry, UtxoRegistry utxoRegistry) {
		this.keyRegistry = keyRegistry;
		this.utxoRegistry = utxoRegistry;
	}

	public KeyRegistry getKeyRegistry() {
		return this.keyRegistry;
	}

	public UtxoRegistry getUtxoRegistry() {
		return this.utxoRegistry;
	}

	public TransactionReport process(TransactionData transactionData) {
		TransactionReport report = new TransactionReport(transactionData.getHash());

		List<TransactionData.Input> inputs = transactionData.getInputs();
		for (int i = 0; i < inputs.size(); ++i)
			processInput(report, i, inputs.get(i));

		List<TransactionData.Output> outputs = transactionData.getOutputs();
		for (int i = 0; i < outputs.size(); ++i)
			processOutput(report, transactionData.getHash(), i, outputs.get(i));

		return report;
	}

	private void processInput(TransactionReport report, int index, TransactionData.Input input) {
		if (input.isCoinbase()) {
			report.addResult(Direction.INPUT, index, Outcome.COINBASE, null);
			return;
		}

		ScriptSigTailData tailData;
		try {
			ScriptReader reader = new ScriptReader(input.getScript());
			ScriptSigTransformer.headerFromReader(reader);
			tailData = ScriptSigTransformer.tailFromReader(reader);
		} catch (UnsupportedFormatException e) {
			skip(report, Direction.INPUT, index, Outcome.UNSUPPORTED_FORMAT, e.getMessage());
			return;
		} catch (TransformationException e) {
			skip(report, Direction.INPUT, index, Outcome.DECODE_ERROR, e.getMessage());
			return;
		}

		try {
			ScriptSigTransformer.validateTail(tailData);
		} catch (UnsupportedFormatException e) {
			skip(report, Direction.INPUT, index, Outcome.UNSUPPORTED_FORMAT, e.getMessage());
			return;
		}

		ECKey key;
		try {
			key = this.keyRegistry.parsePublicKey(tailData.getPublicKey());
		} catch (WalletException.KeyFormatException e) {
			skip(report, Direction.INPUT, index, Outcome.DECODE_ERROR, e.getMessage());
			return;
		}

		try {
			this.requireOwned(key, "Spending key");
		} catch (WalletException.NotOwnedException e) {
			skip(report, Direction.INPUT, index, Outcome.NOT_OWNED, e.getMessage());
			return;
		}

		try {
			CoinData removed = this.utxoRegistry.remove(this.keyRegistry.serialize(key), input.getOutputTxHash(), input.getOutputIndex());
			report.coinRemoved(index, removed);

			LOGGER.info("Spent coin {} from {}", removed, this.keyRegistry.toAddress(key));
		} catch (WalletException.CoinNotFoundException e) {
			skip(report, Direction.INPUT, index, Outcome.COIN_NOT_FOUND, e.getMessage());
		}
	}

	private void processOutput(TransactionReport report, byte[] txHash, int index, TransactionData.Output output) {
		byte[] script = output.getScript();

		// P2PKH first, P2PK only if P2PKH doesn't even fit structurally
		PubKeyHashScriptData hashScriptData = null;
		TransformationException hashException = null;
		try {
			hashScriptData = OutputScriptTransformer.fromPayToPubKeyHash(script);
		} catch (TransformationException e) {
			hashException = e;
		}

		ECKey key;
		ScriptType type;
		try {
			if (hashScriptData != null) {
				OutputScriptTransformer.validate(hashScriptData);

				type = ScriptType.P2PKH;
				key = this.requireKeyByPubKeyHash(hashScriptData.getPublicKeyHash());
			} else {
				PubKeyScriptData keyScriptData;
				try {
					keyScriptData = OutputScriptTransformer.fromPayToPubKey(script);
				} catch (TransformationException e) {
					skip(report, Direction.OUTPUT, index, Outcome.UNRECOGNIZED,
							String.format("Unsupported output script: %s; %s", hashException.getMessage(), e.getMessage()));
					return;
				}

				OutputScriptTransformer.validate(keyScriptData);

				type = ScriptType.P2PK;
				key = this.keyRegistry.parsePublicKey(keyScriptData.getPublicKey());
				this.requireOwned(key, "Recipient");
			}
		} catch (TransformationException | WalletException.KeyFormatException e) {
			skip(report, Direction.OUTPUT, index, Outcome.DECODE_ERROR, e.getMessage());
			return;
		} catch (WalletException.NotOwnedException e) {
			skip(report, Direction.OUTPUT, index, Outcome.NOT_OWNED, e.getMessage());
			return;
		}

		byte[] address = this.keyRegistry.serialize(key);
		CoinData coinData = new CoinData(address, txHash, index, output.getValue(), type);
		this.utxoRegistry.add(address, coinData);
		report.coinAdded(index, coinData);

		LOGGER.info("Received coin {} to {}", coinData, this.keyRegistry.toAddress(key));
	}

	private void requireOwned(ECKey key, String role) throws WalletException.NotOwnedException {
		if (!this.keyRegistry.isOwned(key))
			throw new WalletException.NotOwnedException(String.format("%s for %s is not ours", role, this.keyRegistry.toAddress(key)));
	}

	private ECKey requireKeyByPubKeyHash(byte[] publicKeyHash) throws WalletException.NotOwnedException {
		ECKey key = this.keyRegistry.getKeyByPubKeyHash(publicKeyHash);
		if (key == null)
			throw new WalletException.NotOwnedException(String.format("Public key hash %s is not ours", HashCode.fromBytes(publicKeyHash)));

		return key;
	}

	private static void skip(TransactionReport report, Direction direction, int index, Outcome outcome, String message) {
		LOGGER.debug("Skipping tx {} {} {}: {}", HashCode.fromBytes(report.getTxHash()), direction.name().toLowerCase(), index, message);

		report.addResult(direction, index, outcome, message);
	}

}
