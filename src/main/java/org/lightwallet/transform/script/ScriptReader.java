package org.lightwallet.transform.script;

import java.nio.ByteBuffer;

import org.lightwallet.transform.TransformationException;

/**
 * Forward-only cursor over script bytes.
 * <p>
 * Every read checks the remaining length first, so a short script
 * surfaces as {@link TransformationException} rather than <tt>BufferUnderflowException</tt>.
 */
public class ScriptReader {

	private final ByteBuffer byteBuffer;

	public ScriptReader(byte[] script) {
		this.byteBuffer = ByteBuffer.wrap(script);
	}

	public byte readByte() throws TransformationException {
		if (!this.byteBuffer.hasRemaining())
			throw new TransformationException(String.format("Script too short: expected byte at offset %d", this.byteBuffer.position()));

		return this.byteBuffer.get();
	}

	public byte[] readBytes(int length) throws TransformationException {
		if (this.byteBuffer.remaining() < length)
			throw new TransformationException(String.format("Script too short: expected %d bytes at offset %d, only %d remaining",
					length, this.byteBuffer.position(), this.byteBuffer.remaining()));

		byte[] bytes = new byte[length];
		this.byteBuffer.get(bytes);
		return bytes;
	}

	/** Reads an unsigned length byte, then that many bytes. */
	public byte[] readSizedBytes() throws TransformationException {
		int length = readByte() & 0xff;
		return readBytes(length);
	}

	public int remaining() {
		return this.byteBuffer.remaining();
	}

	public boolean isExhausted() {
		return !this.byteBuffer.hasRemaining();
	}

	public void assertExhausted() throws TransformationException {
		if (this.byteBuffer.hasRemaining())
			throw new TransformationException(String.format("Script has %d unconsumed trailing bytes", this.byteBuffer.remaining()));
	}

}
