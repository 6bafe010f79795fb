package org.lightwallet.repository.hsqldb;

import java.nio.charset.StandardCharsets;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import org.lightwallet.repository.DataException;
import org.lightwallet.repository.KeyValueEncoding;
import org.lightwallet.repository.KeyValueRepository;
import org.lightwallet.utils.ByteArray;

import com.fasterxml.jackson.core.type.TypeReference;

/**
 * {@link KeyValueRepository} stored in HSQLDB tables <tt>KeyValueBuckets</tt> and <tt>KeyValues</tt>.
 * <p>
 * HSQLDB has no byte-prefix predicate for VARBINARY, so scans fetch a bucket's rows
 * and filter and order them here.
 */
public class HSQLDBKeyValueRepository implements KeyValueRepository {

	private static final TypeReference<TreeSet<String>> STRING_SET_TYPE = new TypeReference<TreeSet<String>>() {};

	protected HSQLDBRepository repository;

	public HSQLDBKeyValueRepository(HSQLDBRepository repository) {
		this.repository = repository;
	}

	@Override
	public <T> T get(String bucket, byte[] key, Class<T> type) throws DataException {
		return KeyValueEncoding.fromBytes(this.getBytes(bucket, key), type);
	}

	@Override
	public byte[] getBytes(String bucket, byte[] key) throws DataException {
		this.assertBucketExists(bucket);

		String sql = "SELECT kv_value FROM KeyValues WHERE bucket = ? AND kv_key = ?";

		try (ResultSet resultSet = this.repository.checkedExecute(sql, bucket, key)) {
			if (resultSet == null)
				throw new DataException("key not found");

			return resultSet.getBytes(1);
		} catch (SQLException e) {
			throw new DataException("Unable to fetch key-value from repository", e);
		}
	}

	@Override
	public void put(String bucket, byte[] key, Object value) throws DataException {
		byte[] valueBytes = KeyValueEncoding.toBytes(value);

		try {
			new HSQLDBSaver("KeyValueBuckets").bindKey("bucket", bucket).execute(this.repository);

			new HSQLDBSaver("KeyValues").bindKey("bucket", bucket).bindKey("kv_key", key)
					.bind("kv_value", valueBytes).execute(this.repository);
		} catch (SQLException e) {
			throw new DataException("Unable to save key-value into repository", e);
		}
	}

	@Override
	public void delete(String bucket, byte[] key) throws DataException {
		this.assertBucketExists(bucket);

		try {
			this.repository.delete("KeyValues", "bucket = ? AND kv_key = ?", bucket, key);
		} catch (SQLException e) {
			throw new DataException("Unable to delete key-value from repository", e);
		}
	}

	@Override
	public boolean hasKey(String bucket, byte[] key) throws DataException {
		try {
			return this.repository.exists("KeyValues", "bucket = ? AND kv_key = ?", bucket, key);
		} catch (SQLException e) {
			throw new DataException("Unable to check for key in repository", e);
		}
	}

	@Override
	public boolean bucketExists(String bucket) throws DataException {
		try {
			return this.repository.exists("KeyValueBuckets", "bucket = ?", bucket);
		} catch (SQLException e) {
			throw new DataException("Unable to check for bucket in repository", e);
		}
	}

	@Override
	public int count(String bucket, byte[] prefix) throws DataException {
		return this.scan(bucket, prefix).size();
	}

	@Override
	public List<String> getStrings(String bucket, byte[] prefix) throws DataException {
		List<String> strings = new ArrayList<>();

		for (byte[] value : this.scan(bucket, prefix).values())
			strings.add(new String(value, StandardCharsets.UTF_8));

		return strings;
	}

	@Override
	public <T> List<T> getValues(String bucket, byte[] prefix, Class<T> type) throws DataException {
		List<T> values = new ArrayList<>();

		for (byte[] value : this.scan(bucket, prefix).values())
			values.add(KeyValueEncoding.fromBytes(value, type));

		return values;
	}

	@Override
	public List<String> getKeyStrings(String bucket) throws DataException {
		List<String> keys = new ArrayList<>();

		for (ByteArray key : this.scan(bucket, new byte[0]).keySet())
			keys.add(new String(key.value, StandardCharsets.UTF_8));

		return keys;
	}

	@Override
	public List<String> getPrefixes(String bucket) throws DataException {
		List<String> prefixes = new ArrayList<>();
		byte[] lastPrefix = null;

		for (ByteArray key : this.scan(bucket, new byte[0]).keySet()) {
			// Keys sharing previous prefix are adjacent
			if (lastPrefix != null && key.startsWith(lastPrefix))
				continue;

			int nulIndex = indexOfNul(key.value);
			if (nulIndex == -1)
				throw new DataException("Key " + key + " does not have string prefix");

			prefixes.add(new String(key.value, 0, nulIndex, StandardCharsets.UTF_8));
			lastPrefix = Arrays.copyOf(key.value, nulIndex + 1);
		}

		return prefixes;
	}

	// Sets

	@Override
	public Set<String> getSet(String bucket, byte[] key) throws DataException {
		return KeyValueEncoding.fromBytes(this.getBytes(bucket, key), STRING_SET_TYPE);
	}

	@Override
	public void addToSet(String bucket, byte[] key, String member) throws DataException {
		Set<String> members = this.bucketExists(bucket) && this.hasKey(bucket, key) ? this.getSet(bucket, key) : new TreeSet<>();

		members.add(member);

		this.put(bucket, key, members);
	}

	@Override
	public void removeFromSet(String bucket, byte[] key, String member) throws DataException {
		Set<String> members = this.getSet(bucket, key);

		members.remove(member);

		if (members.isEmpty())
			this.delete(bucket, key);
		else
			this.put(bucket, key, members);
	}

	@Override
	public List<String> getSetMembers(String bucket, byte[] key) throws DataException {
		return new ArrayList<>(this.getSet(bucket, key));
	}

	@Override
	public boolean setContains(String bucket, byte[] key, String member) throws DataException {
		if (!this.hasKey(bucket, key))
			return false;

		return this.getSet(bucket, key).contains(member);
	}

	// Utilities

	private void assertBucketExists(String bucket) throws DataException {
		if (!this.bucketExists(bucket))
			throw new DataException("bucket not found " + bucket);
	}

	/** Returns bucket's entries whose keys start with <tt>prefix</tt>, in unsigned key order. */
	private Map<ByteArray, byte[]> scan(String bucket, byte[] prefix) throws DataException {
		this.assertBucketExists(bucket);

		Map<ByteArray, byte[]> entries = new TreeMap<>();

		String sql = "SELECT kv_key, kv_value FROM KeyValues WHERE bucket = ?";

		try (ResultSet resultSet = this.repository.checkedExecute(sql, bucket)) {
			if (resultSet == null)
				return entries;

			do {
				ByteArray key = ByteArray.wrap(resultSet.getBytes(1));

				if (key.startsWith(prefix))
					entries.put(key, resultSet.getBytes(2));
			} while (resultSet.next());
		} catch (SQLException e) {
			throw new DataException("Unable to fetch key-values from repository", e);
		}

		return entries;
	}

	private static int indexOfNul(byte[] bytes) {
		for (int i = 0; i < bytes.length; ++i)
			if (bytes[i] == 0)
				return i;

		return -1;
	}

}
