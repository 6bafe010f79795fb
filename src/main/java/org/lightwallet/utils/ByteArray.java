package org.lightwallet.utils;

import java.util.Arrays;
import java.util.Objects;

import com.google.common.io.BaseEncoding;

/**
 * Value-semantics wrapper around <tt>byte[]</tt>, suitable for use as a map key.
 * <p>
 * Wrapped arrays must not be modified afterwards, as the hash is cached.
 */
public class ByteArray implements Comparable<ByteArray> {

	private int hash;
	public final byte[] value;

	private ByteArray(byte[] value) {
		this.value = value;
	}

	public static ByteArray wrap(byte[] value) {
		return new ByteArray(Objects.requireNonNull(value));
	}

	public static ByteArray copyOf(byte[] value) {
		return new ByteArray(Arrays.copyOf(value, value.length));
	}

	public int length() {
		return this.value.length;
	}

	public boolean startsWith(byte[] prefix) {
		if (prefix.length > this.value.length)
			return false;

		return Arrays.equals(this.value, 0, prefix.length, prefix, 0, prefix.length);
	}

	@Override
	public boolean equals(Object other) {
		if (this == other)
			return true;

		if (!(other instanceof ByteArray))
			return false;

		return Arrays.equals(this.value, ((ByteArray) other).value);
	}

	@Override
	public int hashCode() {
		int h = this.hash;

		if (h == 0 && this.value.length > 0)
			this.hash = h = Arrays.hashCode(this.value);

		return h;
	}

	/** Unsigned, lexicographic ordering, i.e. the order an ordered key-value store iterates keys. */
	@Override
	public int compareTo(ByteArray other) {
		Objects.requireNonNull(other);
		return Arrays.compareUnsigned(this.value, other.value);
	}

	@Override
	public String toString() {
		return BaseEncoding.base16().lowerCase().encode(this.value);
	}

}
