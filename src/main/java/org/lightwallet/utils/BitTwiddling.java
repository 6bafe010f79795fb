package org.lightwallet.utils;

public class BitTwiddling {

	private BitTwiddling() {
	}

	/** Convert int to little-endian byte array */
	public static byte[] toLEByteArray(int value) {
		return new byte[] { (byte) (value), (byte) (value >> 8), (byte) (value >> 16), (byte) (value >> 24) };
	}

	/** Convert long to 8-byte little-endian byte array */
	public static byte[] toLEByteArray(long value) {
		byte[] bytes = new byte[8];

		for (int i = 0; i < 8; ++i)
			bytes[i] = (byte) (value >> (i * 8));

		return bytes;
	}

	/** Convert 8 little-endian bytes to long */
	public static long longFromLEBytes(byte[] bytes, int offset) {
		long value = 0;

		for (int i = 7; i >= 0; --i)
			value = (value << 8) | (bytes[offset + i] & 0xffL);

		return value;
	}

}
