package org.lightwallet.repository;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.lightwallet.utils.BitTwiddling;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Value and key encoding for {@link KeyValueRepository}.
 * <ul>
 * <li>byte[] as-is</li>
 * <li>String as UTF-8</li>
 * <li>Integer / Long as 8 bytes little-endian</li>
 * <li>anything else as JSON</li>
 * </ul>
 */
public class KeyValueEncoding {

	private static final ObjectMapper objectMapper = new ObjectMapper();

	private KeyValueEncoding() {
	}

	public static byte[] toBytes(Object value) throws DataException {
		if (value instanceof byte[])
			return (byte[]) value;

		if (value instanceof String)
			return ((String) value).getBytes(StandardCharsets.UTF_8);

		if (value instanceof Integer || value instanceof Long)
			return BitTwiddling.toLEByteArray(((Number) value).longValue());

		try {
			return objectMapper.writeValueAsBytes(value);
		} catch (JsonProcessingException e) {
			throw new DataException("Unable to encode value as JSON", e);
		}
	}

	/**
	 * Builds composite key by concatenating encoded components.
	 * <p>
	 * String components are followed by a NUL byte so they can be recovered as prefixes.
	 */
	public static byte[] toKey(Object... components) throws DataException {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();

		try {
			for (Object component : components) {
				bytes.write(toBytes(component));

				if (component instanceof String)
					bytes.write(0);
			}
		} catch (IOException e) {
			throw new DataException("Unable to build key", e);
		}

		return bytes.toByteArray();
	}

	public static <T> T fromBytes(byte[] bytes, Class<T> type) throws DataException {
		if (type == byte[].class)
			return type.cast(bytes);

		if (type == String.class)
			return type.cast(new String(bytes, StandardCharsets.UTF_8));

		if (type == Long.class || type == Integer.class) {
			if (bytes.length != 8)
				throw new DataException(String.format("Expected 8 bytes for integer value, found %d", bytes.length));

			long value = BitTwiddling.longFromLEBytes(bytes, 0);
			return type == Long.class ? type.cast(value) : type.cast((int) value);
		}

		try {
			return objectMapper.readValue(bytes, type);
		} catch (IOException e) {
			throw new DataException("Unable to decode JSON value as " + type.getSimpleName(), e);
		}
	}

	public static <T> T fromBytes(byte[] bytes, TypeReference<T> typeReference) throws DataException {
		try {
			return objectMapper.readValue(bytes, typeReference);
		} catch (IOException e) {
			throw new DataException("Unable to decode JSON value", e);
		}
	}

}
