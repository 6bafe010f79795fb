package org.lightwallet.test.transform;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.bitcoinj.core.Sha256Hash;
import org.junit.Test;
import org.lightwallet.data.transaction.TransactionData;
import org.lightwallet.test.common.Common;
import org.lightwallet.test.common.TransactionUtils;
import org.lightwallet.transform.TransformationException;
import org.lightwallet.transform.script.OutputScriptTransformer;
import org.lightwallet.transform.transaction.TransactionTransformer;

import com.google.common.hash.HashCode;

public class TransactionTransformerTests extends Common {

	// Genesis block coinbase transaction
	private static final String GENESIS_COINBASE_HEX = "01000000010000000000000000000000000000000000000000000000000000000000000000ffffffff"
			+ "4d04ffff001d0104455468652054696d65732030332f4a616e2f32303039204368616e63656c6c6f72206f6e206272696e6b206f66207365636f6e64206261696c6f757420666f722062616e6b73"
			+ "ffffffff0100f2052a01000000434104678afdb0fe5548271967f1a67130b7105cd6a828e03909a67962e0ea1f61deb649f6bc3f4cef38c4f35504e51ec112de5c384df7ba0b8d578a4c702b6bf11d5fac00000000";

	// 50 BTC, little-endian
	private static final String GENESIS_VALUE_HEX = "00f2052a01000000";

	// Internal byte order, i.e. reversed from usual display
	private static final String GENESIS_COINBASE_HASH = "3ba3edfd7a7b12b27ac72c3e67768f617fc81bc3888a51323a9fb8aa4b1e5e4a";

	@Test
	public void testGenesisCoinbase() throws TransformationException {
		byte[] bytes = HashCode.fromString(GENESIS_COINBASE_HEX).asBytes();

		TransactionData transactionData = TransactionTransformer.fromBytes(TransactionUtils.PARAMS, bytes);

		assertEquals(1, transactionData.getVersion());
		assertEquals(0, transactionData.getLockTime());
		assertEquals(GENESIS_COINBASE_HASH, HashCode.fromBytes(transactionData.getHash()).toString());

		assertEquals(1, transactionData.getInputs().size());
		assertTrue(transactionData.getInputs().get(0).isCoinbase());

		assertEquals(1, transactionData.getOutputs().size());
		TransactionData.Output output = transactionData.getOutputs().get(0);
		assertEquals(50_00000000L, output.getValue());
		// P2PK with uncompressed key
		assertEquals(67, output.getScript().length);

		assertArrayEquals(bytes, TransactionTransformer.toBytes(TransactionUtils.PARAMS, transactionData));
	}

	@Test
	public void testRoundTrip() throws TransformationException {
		byte[] outputTxHash = TransactionUtils.randomTxHash();
		byte[] scriptSig = TransactionUtils.buildScriptSig(getTestKey("alice").getPubKey());

		List<TransactionData.Input> inputs = Arrays.asList(TransactionUtils.buildInput(outputTxHash, 3, scriptSig),
				TransactionUtils.buildInput(outputTxHash, 0xfffffffe, new byte[0]));
		List<TransactionData.Output> outputs = Arrays.asList(
				new TransactionData.Output(12345L, OutputScriptTransformer.buildPayToPubKeyHash(getTestKey("bob").getPubKeyHash())),
				new TransactionData.Output(21_000_000_00000000L, OutputScriptTransformer.buildPayToPubKey(getTestKey("chloe").getPubKey())));

		TransactionData transactionData = TransactionUtils.buildTransaction(inputs, outputs);

		assertEquals(2, transactionData.getInputs().size());
		assertArrayEquals(outputTxHash, transactionData.getInputs().get(0).getOutputTxHash());
		assertEquals(3, transactionData.getInputs().get(0).getOutputIndex());
		assertArrayEquals(scriptSig, transactionData.getInputs().get(0).getScript());
		assertEquals(TransactionUtils.DEFAULT_SEQUENCE, transactionData.getInputs().get(0).getSequence());
		assertEquals(0xfffffffe, transactionData.getInputs().get(1).getOutputIndex());
		assertFalse(transactionData.getInputs().get(1).isCoinbase());

		assertEquals(2, transactionData.getOutputs().size());
		assertEquals(12345L, transactionData.getOutputs().get(0).getValue());
		assertEquals(21_000_000_00000000L, transactionData.getOutputs().get(1).getValue());

		byte[] bytes = TransactionTransformer.toBytes(TransactionUtils.PARAMS, transactionData);
		assertArrayEquals(Sha256Hash.hashTwice(bytes), transactionData.getHash());
	}

	@Test
	public void testUnsignedValue() throws TransformationException {
		// Genesis coinbase with output value bytes replaced by all-ones
		String hex = GENESIS_COINBASE_HEX.replace(GENESIS_VALUE_HEX, "ffffffffffffffff");
		assertNotEquals(GENESIS_COINBASE_HEX, hex);

		TransactionData transactionData = TransactionTransformer.fromBytes(TransactionUtils.PARAMS, HashCode.fromString(hex).asBytes());

		// Value is unsigned on the wire
		assertEquals("18446744073709551615", Long.toUnsignedString(transactionData.getOutputs().get(0).getValue()));
	}

	@Test
	public void testUnserializableValue() {
		byte[] script = OutputScriptTransformer.buildPayToPubKeyHash(getTestKey("bob").getPubKeyHash());

		TransactionData transactionData = new TransactionData(null, 1,
				Collections.singletonList(TransactionUtils.buildInput(TransactionUtils.randomTxHash(), 0, new byte[0])),
				Collections.singletonList(new TransactionData.Output(-2L, script)), 0);

		try {
			TransactionTransformer.toBytes(TransactionUtils.PARAMS, transactionData);
			fail("Negative output value should not serialize");
		} catch (TransformationException e) {
			// expected
		}
	}

	@Test
	public void testHashIsCopied() throws TransformationException {
		TransactionData transactionData = TransactionTransformer.fromBytes(TransactionUtils.PARAMS, HashCode.fromString(GENESIS_COINBASE_HEX).asBytes());

		transactionData.getHash()[0] ^= 0x01;
		transactionData.getOutputs().get(0).getScript()[0] ^= 0x01;

		assertEquals(GENESIS_COINBASE_HASH, HashCode.fromBytes(transactionData.getHash()).toString());
		// Push of 65-byte uncompressed key
		assertEquals(0x41, transactionData.getOutputs().get(0).getScript()[0]);
	}

	@Test
	public void testTruncated() {
		byte[] bytes = HashCode.fromString(GENESIS_COINBASE_HEX).asBytes();

		for (int length = 0; length < bytes.length; ++length)
			try {
				TransactionTransformer.fromBytes(TransactionUtils.PARAMS, Arrays.copyOf(bytes, length));
				fail("Transaction truncated to " + length + " bytes should not decode");
			} catch (TransformationException e) {
				// expected
			}
	}

	@Test
	public void testTrailingBytes() {
		byte[] bytes = HashCode.fromString(GENESIS_COINBASE_HEX).asBytes();

		try {
			TransactionTransformer.fromBytes(TransactionUtils.PARAMS, Arrays.copyOf(bytes, bytes.length + 1));
			fail("Trailing byte should not decode");
		} catch (TransformationException e) {
			// expected
		}
	}

	@Test
	public void testWitnessRejected() {
		byte[] bytes = HashCode.fromString(GENESIS_COINBASE_HEX).asBytes();

		// Insert segwit marker and flag after version
		byte[] witness = new byte[bytes.length + 2];
		System.arraycopy(bytes, 0, witness, 0, 4);
		witness[4] = 0x00;
		witness[5] = 0x01;
		System.arraycopy(bytes, 4, witness, 6, bytes.length - 4);

		try {
			TransactionTransformer.fromBytes(TransactionUtils.PARAMS, witness);
			fail("Witness serialization should not decode");
		} catch (TransformationException e) {
			// expected
		}
	}

	@Test
	public void testHugeCounts() {
		// Version 1, then input count 0xffffffff, then far too little data
		byte[] bytes = HashCode.fromString("01000000" + "feffffffff" + "00".repeat(64)).asBytes();

		try {
			TransactionTransformer.fromBytes(TransactionUtils.PARAMS, bytes);
			fail("Input count larger than data should not decode");
		} catch (TransformationException e) {
			// expected
		}
	}

	@Test
	public void testOversizedScript() throws TransformationException {
		byte[] script = new byte[TransactionTransformer.MAX_SCRIPT_SIZE + 1];

		TransactionData transactionData = new TransactionData(null, 1,
				Collections.singletonList(TransactionUtils.buildInput(TransactionUtils.randomTxHash(), 0, script)),
				Collections.emptyList(), 0);
		byte[] bytes = TransactionTransformer.toBytes(TransactionUtils.PARAMS, transactionData);

		try {
			TransactionTransformer.fromBytes(TransactionUtils.PARAMS, bytes);
			fail("Oversized script should not decode");
		} catch (TransformationException e) {
			// expected
		}
	}

}
