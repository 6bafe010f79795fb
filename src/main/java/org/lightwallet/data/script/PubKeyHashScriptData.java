package org.lightwallet.data.script;

/** Pay-to-public-key-hash output script: OP_DUP OP_HASH160 &lt;push 20&gt; &lt;hash&gt; OP_EQUALVERIFY OP_CHECKSIG */
public class PubKeyHashScriptData {

	public static final int PUBLIC_KEY_HASH_LENGTH = 20;

	private final byte dup;
	private final byte hash160;
	private final byte hashLength;
	private final byte[] publicKeyHash;
	private final byte equalVerify;
	private final byte checkSig;

	public PubKeyHashScriptData(byte dup, byte hash160, byte hashLength, byte[] publicKeyHash, byte equalVerify, byte checkSig) {
		this.dup = dup;
		this.hash160 = hash160;
		this.hashLength = hashLength;
		this.publicKeyHash = publicKeyHash;
		this.equalVerify = equalVerify;
		this.checkSig = checkSig;
	}

	public byte getDup() {
		return this.dup;
	}

	public byte getHash160() {
		return this.hash160;
	}

	public byte getHashLength() {
		return this.hashLength;
	}

	public byte[] getPublicKeyHash() {
		return this.publicKeyHash;
	}

	public byte getEqualVerify() {
		return this.equalVerify;
	}

	public byte getCheckSig() {
		return this.checkSig;
	}

}
