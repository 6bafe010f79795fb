package org.lightwallet.transform.script;

import org.lightwallet.data.script.ScriptSigHeaderData;
import org.lightwallet.data.script.ScriptSigTailData;
import org.lightwallet.transform.TransformationException;
import org.lightwallet.transform.UnsupportedFormatException;

import com.google.common.primitives.Bytes;

/**
 * Signature script template:
 * <pre>
 * &lt;sig length&gt; 0x30 &lt;r+s length&gt; 0x02 &lt;r length&gt; &lt;r&gt; 0x02 &lt;s length&gt; &lt;s&gt;   (header)
 * &lt;sighash type&gt; &lt;public key length&gt; &lt;public key&gt;                              (tail)
 * </pre>
 * Header and tail are decoded separately from the same {@link ScriptReader}.
 */
public class ScriptSigTransformer {

	public static final byte SEQUENCE_MARKER = 0x30;
	public static final byte INTEGER_MARKER = 0x02;
	public static final byte SIGHASH_ALL = 0x01;

	private ScriptSigTransformer() {
	}

	/**
	 * Decodes signature header, leaving <tt>reader</tt> positioned at the tail.
	 *
	 * @throws TransformationException if script is too short or a marker byte is wrong
	 * @throws UnsupportedFormatException if script ends right after the header (no public key)
	 */
	public static ScriptSigHeaderData headerFromReader(ScriptReader reader) throws TransformationException, UnsupportedFormatException {
		byte sigLength = reader.readByte();
		byte sequenceMarker = reader.readByte();
		byte rsLength = reader.readByte();
		byte rMarker = reader.readByte();
		byte[] r = reader.readSizedBytes();
		byte sMarker = reader.readByte();
		byte[] s = reader.readSizedBytes();

		if (reader.isExhausted())
			throw new UnsupportedFormatException("Old type of signature script without public key, ignoring");

		if (sequenceMarker != SEQUENCE_MARKER)
			throw new TransformationException(String.format("Unsupported signature script: expected 0x30 marker, found 0x%02x", sequenceMarker));

		if (rMarker != INTEGER_MARKER)
			throw new TransformationException(String.format("Unsupported signature script: expected 0x02 marker before R, found 0x%02x", rMarker));

		if (sMarker != INTEGER_MARKER)
			throw new TransformationException(String.format("Unsupported signature script: expected 0x02 marker before S, found 0x%02x", sMarker));

		return new ScriptSigHeaderData(sigLength, sequenceMarker, rsLength, rMarker, r, sMarker, s);
	}

	/**
	 * Decodes signature tail, which must consume the rest of the script.
	 */
	public static ScriptSigTailData tailFromReader(ScriptReader reader) throws TransformationException {
		byte sigHashType = reader.readByte();
		byte[] publicKey = reader.readSizedBytes();

		reader.assertExhausted();

		return new ScriptSigTailData(sigHashType, publicKey);
	}

	public static void validateTail(ScriptSigTailData tailData) throws UnsupportedFormatException {
		if (tailData.getSigHashType() != SIGHASH_ALL)
			throw new UnsupportedFormatException(String.format("Unsupported signature script: sighash type 0x%02x", tailData.getSigHashType()));
	}

	/** Convenience: header, tail and sighash validation in one go. */
	public static ScriptSigTailData fromBytes(byte[] script) throws TransformationException, UnsupportedFormatException {
		ScriptReader reader = new ScriptReader(script);

		headerFromReader(reader);
		ScriptSigTailData tailData = tailFromReader(reader);
		validateTail(tailData);

		return tailData;
	}

	public static byte[] toBytes(ScriptSigHeaderData headerData, ScriptSigTailData tailData) {
		return Bytes.concat(
				new byte[] { headerData.getSigLength(), headerData.getSequenceMarker(), headerData.getRsLength(), headerData.getRMarker(), (byte) headerData.getR().length },
				headerData.getR(),
				new byte[] { headerData.getSMarker(), (byte) headerData.getS().length },
				headerData.getS(),
				new byte[] { tailData.getSigHashType(), (byte) tailData.getPublicKey().length },
				tailData.getPublicKey());
	}

}
