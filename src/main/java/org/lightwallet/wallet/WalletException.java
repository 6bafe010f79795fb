package org.lightwallet.wallet;

@SuppressWarnings("serial")
public class WalletException extends Exception {

	public WalletException() {
		super();
	}

	public WalletException(String message) {
		super(message);
	}

	public WalletException(String message, Throwable cause) {
		super(message, cause);
	}

	/** Public key, or public key hash, isn't one of ours. */
	public static class NotOwnedException extends WalletException {
		public NotOwnedException(String message) {
			super(message);
		}
	}

	/** No coin matches requested (transaction hash, output index). */
	public static class CoinNotFoundException extends WalletException {
		public CoinNotFoundException(String message) {
			super(message);
		}
	}

	/** Bytes don't encode a valid public key. */
	public static class KeyFormatException extends WalletException {
		public KeyFormatException(String message) {
			super(message);
		}

		public KeyFormatException(String message, Throwable cause) {
			super(message, cause);
		}
	}

}
