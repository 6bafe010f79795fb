package org.lightwallet.transform;

/** Malformed, truncated or over-long binary data. */
@SuppressWarnings("serial")
public class TransformationException extends Exception {

	public TransformationException() {
	}

	public TransformationException(String message) {
		super(message);
	}

	public TransformationException(String message, Throwable cause) {
		super(message, cause);
	}

	public TransformationException(Throwable cause) {
		super(cause);
	}

}
