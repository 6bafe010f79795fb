package org.lightwallet.transform.script;

import static org.bitcoinj.script.ScriptOpCodes.OP_CHECKSIG;
import static org.bitcoinj.script.ScriptOpCodes.OP_DUP;
import static org.bitcoinj.script.ScriptOpCodes.OP_EQUALVERIFY;
import static org.bitcoinj.script.ScriptOpCodes.OP_HASH160;

import org.lightwallet.data.script.PubKeyHashScriptData;
import org.lightwallet.data.script.PubKeyScriptData;
import org.lightwallet.transform.TransformationException;

import com.google.common.primitives.Bytes;

/**
 * Output script templates.
 * <p>
 * Decoding is in two steps: <tt>from...</tt> only checks shape (field positions and lengths,
 * no trailing bytes) and <tt>validate</tt> then checks opcode values.
 */
public class OutputScriptTransformer {

	private OutputScriptTransformer() {
	}

	// Pay-to-public-key-hash

	public static PubKeyHashScriptData fromPayToPubKeyHash(byte[] script) throws TransformationException {
		ScriptReader reader = new ScriptReader(script);

		byte dup = reader.readByte();
		byte hash160 = reader.readByte();
		byte hashLength = reader.readByte();
		byte[] publicKeyHash = reader.readBytes(PubKeyHashScriptData.PUBLIC_KEY_HASH_LENGTH);
		byte equalVerify = reader.readByte();
		byte checkSig = reader.readByte();

		reader.assertExhausted();

		return new PubKeyHashScriptData(dup, hash160, hashLength, publicKeyHash, equalVerify, checkSig);
	}

	public static void validate(PubKeyHashScriptData scriptData) throws TransformationException {
		if (scriptData.getDup() != (byte) OP_DUP
				|| scriptData.getHash160() != (byte) OP_HASH160
				|| scriptData.getHashLength() != PubKeyHashScriptData.PUBLIC_KEY_HASH_LENGTH
				|| scriptData.getEqualVerify() != (byte) OP_EQUALVERIFY
				|| scriptData.getCheckSig() != (byte) OP_CHECKSIG)
			throw new TransformationException("Unsupported pay-to-public-key-hash script: unexpected opcode");
	}

	public static byte[] toBytes(PubKeyHashScriptData scriptData) {
		return Bytes.concat(
				new byte[] { scriptData.getDup(), scriptData.getHash160(), scriptData.getHashLength() },
				scriptData.getPublicKeyHash(),
				new byte[] { scriptData.getEqualVerify(), scriptData.getCheckSig() });
	}

	/** Returns standard P2PKH script bytes for given 20-byte HASH160. */
	public static byte[] buildPayToPubKeyHash(byte[] publicKeyHash) {
		return toBytes(new PubKeyHashScriptData((byte) OP_DUP, (byte) OP_HASH160, (byte) PubKeyHashScriptData.PUBLIC_KEY_HASH_LENGTH,
				publicKeyHash, (byte) OP_EQUALVERIFY, (byte) OP_CHECKSIG));
	}

	// Pay-to-public-key

	public static PubKeyScriptData fromPayToPubKey(byte[] script) throws TransformationException {
		ScriptReader reader = new ScriptReader(script);

		byte[] publicKey = reader.readSizedBytes();
		byte checkSig = reader.readByte();

		reader.assertExhausted();

		return new PubKeyScriptData(publicKey, checkSig);
	}

	public static void validate(PubKeyScriptData scriptData) throws TransformationException {
		if (scriptData.getCheckSig() != (byte) OP_CHECKSIG)
			throw new TransformationException(String.format("Unsupported pay-to-public-key script: expected OP_CHECKSIG, found 0x%02x", scriptData.getCheckSig()));
	}

	public static byte[] toBytes(PubKeyScriptData scriptData) {
		return Bytes.concat(
				new byte[] { (byte) scriptData.getPublicKey().length },
				scriptData.getPublicKey(),
				new byte[] { scriptData.getCheckSig() });
	}

	/** Returns standard P2PK script bytes for given serialized public key. */
	public static byte[] buildPayToPubKey(byte[] publicKey) {
		return toBytes(new PubKeyScriptData(publicKey, (byte) OP_CHECKSIG));
	}

}
