package org.lightwallet.test;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

import org.junit.Before;
import org.junit.Test;
import org.lightwallet.utils.ByteArray;

public class ByteArrayTests {

	private static List<byte[]> testValues;

	@Before
	public void createTestValues() {
		Random random = new Random();

		testValues = new ArrayList<>();
		for (int i = 0; i < 5; ++i) {
			byte[] testValue = new byte[32];
			random.nextBytes(testValue);
			testValues.add(testValue);
		}
	}

	private static void fillMap(Map<ByteArray, String> map) {
		for (byte[] testValue : testValues)
			map.put(ByteArray.wrap(testValue), String.valueOf(map.size()));
	}

	private static byte[] dup(byte[] value) {
		return Arrays.copyOf(value, value.length);
	}

	@Test
	public void testSameWrappedContentValue() {
		// Different references, same content values
		byte[] testValue = testValues.get(0);
		ByteArray ba1 = ByteArray.wrap(testValue);
		ByteArray ba2 = ByteArray.wrap(dup(testValue));

		assertNotSame(ba1, ba2);
		assertEquals("ba1 not equal to ba2", ba1, ba2);
		assertEquals("hashCodes do not match", ba1.hashCode(), ba2.hashCode());
	}

	@Test
	public void testCopyIsDetached() {
		byte[] testValue = testValues.get(0);
		ByteArray copy = ByteArray.copyOf(testValue);
		ByteArray original = ByteArray.wrap(dup(testValue));

		testValue[0] ^= 0xff;

		assertEquals(original, copy);
	}

	@Test
	public void testHashMapContainsKey() {
		Map<ByteArray, String> testMap = new HashMap<>();
		fillMap(testMap);

		ByteArray ba = ByteArray.wrap(dup(testValues.get(3)));

		assertTrue("ByteArray not found in map", testMap.containsKey(ba));
		assertEquals("3", testMap.get(ba));
	}

	@Test
	public void testTreeMapContainsKey() {
		Map<ByteArray, String> testMap = new TreeMap<>();
		fillMap(testMap);

		ByteArray ba = ByteArray.wrap(dup(testValues.get(3)));

		assertTrue("ByteArray not found in map", testMap.containsKey(ba));
	}

	@Test
	public void testUnsignedOrdering() {
		ByteArray low = ByteArray.wrap(new byte[] { 0x01 });
		ByteArray high = ByteArray.wrap(new byte[] { (byte) 0x80 });
		ByteArray longer = ByteArray.wrap(new byte[] { 0x01, 0x00 });

		// 0x80 is negative as a signed byte but sorts after 0x01
		assertTrue(low.compareTo(high) < 0);
		assertTrue(high.compareTo(low) > 0);

		// Prefix sorts first
		assertTrue(low.compareTo(longer) < 0);
		assertEquals(0, low.compareTo(ByteArray.wrap(new byte[] { 0x01 })));
	}

	@Test
	public void testStartsWith() {
		ByteArray ba = ByteArray.wrap(new byte[] { 0x61, 0x00, 0x05 });

		assertTrue(ba.startsWith(new byte[0]));
		assertTrue(ba.startsWith(new byte[] { 0x61, 0x00 }));
		assertTrue(ba.startsWith(new byte[] { 0x61, 0x00, 0x05 }));
		assertFalse(ba.startsWith(new byte[] { 0x61, 0x01 }));
		assertFalse(ba.startsWith(new byte[] { 0x61, 0x00, 0x05, 0x00 }));
	}

	@Test
	public void testToString() {
		assertEquals("00ff10", ByteArray.wrap(new byte[] { 0x00, (byte) 0xff, 0x10 }).toString());
		assertEquals("", ByteArray.wrap(new byte[0]).toString());
	}

}
