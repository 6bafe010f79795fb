package org.lightwallet.data.script;

import static java.util.Arrays.stream;
import static java.util.stream.Collectors.toMap;

import java.util.Map;

/** Output script templates we recognise. <tt>value</tt> is the persisted type tag. */
public enum ScriptType {
	P2PKH(0),
	P2PK(1);

	public final int value;

	private static final Map<Integer, ScriptType> map = stream(ScriptType.values())
			.collect(toMap(type -> type.value, type -> type));

	ScriptType(int value) {
		this.value = value;
	}

	public static ScriptType valueOf(int value) {
		return map.get(value);
	}
}
