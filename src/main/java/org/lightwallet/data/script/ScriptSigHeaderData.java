package org.lightwallet.data.script;

/**
 * DER-style signature envelope at the start of a signature script.
 * <p>
 * Marker bytes are kept as found so that callers can report which one was wrong.
 */
public class ScriptSigHeaderData {

	private final byte sigLength;
	private final byte sequenceMarker;
	private final byte rsLength;
	private final byte rMarker;
	private final byte[] r;
	private final byte sMarker;
	private final byte[] s;

	public ScriptSigHeaderData(byte sigLength, byte sequenceMarker, byte rsLength, byte rMarker, byte[] r, byte sMarker, byte[] s) {
		this.sigLength = sigLength;
		this.sequenceMarker = sequenceMarker;
		this.rsLength = rsLength;
		this.rMarker = rMarker;
		this.r = r;
		this.sMarker = sMarker;
		this.s = s;
	}

	public byte getSigLength() {
		return this.sigLength;
	}

	public byte getSequenceMarker() {
		return this.sequenceMarker;
	}

	public byte getRsLength() {
		return this.rsLength;
	}

	public byte getRMarker() {
		return this.rMarker;
	}

	public byte[] getR() {
		return this.r;
	}

	public byte getSMarker() {
		return this.sMarker;
	}

	public byte[] getS() {
		return this.s;
	}

}
