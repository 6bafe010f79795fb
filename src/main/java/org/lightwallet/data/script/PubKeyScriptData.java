package org.lightwallet.data.script;

/** Pay-to-public-key output script: &lt;push N&gt; &lt;public key&gt; OP_CHECKSIG */
public class PubKeyScriptData {

	private final byte[] publicKey;
	private final byte checkSig;

	public PubKeyScriptData(byte[] publicKey, byte checkSig) {
		this.publicKey = publicKey;
		this.checkSig = checkSig;
	}

	public byte[] getPublicKey() {
		return this.publicKey;
	}

	public byte getCheckSig() {
		return this.checkSig;
	}

}
