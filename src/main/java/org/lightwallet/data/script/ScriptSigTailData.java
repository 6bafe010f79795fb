package org.lightwallet.data.script;

public class ScriptSigTailData {

	private final byte sigHashType;
	private final byte[] publicKey;

	public ScriptSigTailData(byte sigHashType, byte[] publicKey) {
		this.sigHashType = sigHashType;
		this.publicKey = publicKey;
	}

	public byte getSigHashType() {
		return this.sigHashType;
	}

	public byte[] getPublicKey() {
		return this.publicKey;
	}

}
