package org.lightwallet.transform;

/**
 * Data that decodes cleanly but is a variant we deliberately don't handle,
 * e.g. a legacy signature script or a non-SIGHASH_ALL signature.
 * <p>
 * Callers treat this as "skip", never as corruption.
 */
@SuppressWarnings("serial")
public class UnsupportedFormatException extends Exception {

	public UnsupportedFormatException(String message) {
		super(message);
	}

}
