package org.lightwallet.repository;

import java.util.List;
import java.util.Set;

/**
 * Ordered key-value store, partitioned into named buckets.
 * <p>
 * Keys are raw bytes, usually built with {@link KeyValueEncoding#toKey(Object...)}.
 * Values are encoded with {@link KeyValueEncoding#toBytes(Object)}.
 * Scans visit keys in unsigned lexicographic order.
 */
public interface KeyValueRepository {

	/**
	 * Returns decoded value.
	 *
	 * @throws DataException if bucket or key not found, or value can't be decoded as <tt>type</tt>
	 */
	public <T> T get(String bucket, byte[] key, Class<T> type) throws DataException;

	/** Returns raw value bytes. */
	public byte[] getBytes(String bucket, byte[] key) throws DataException;

	/** Stores value, creating bucket if necessary. */
	public void put(String bucket, byte[] key, Object value) throws DataException;

	/**
	 * Deletes key. Deleting an absent key does nothing.
	 *
	 * @throws DataException if bucket not found
	 */
	public void delete(String bucket, byte[] key) throws DataException;

	public boolean hasKey(String bucket, byte[] key) throws DataException;

	public boolean bucketExists(String bucket) throws DataException;

	/** Number of keys starting with <tt>prefix</tt>. */
	public int count(String bucket, byte[] prefix) throws DataException;

	/** Values, as strings, of keys starting with <tt>prefix</tt>. */
	public List<String> getStrings(String bucket, byte[] prefix) throws DataException;

	/** Values of keys starting with <tt>prefix</tt>, decoded as <tt>type</tt>. */
	public <T> List<T> getValues(String bucket, byte[] prefix, Class<T> type) throws DataException;

	/** All keys in bucket, as strings. */
	public List<String> getKeyStrings(String bucket) throws DataException;

	/**
	 * Distinct leading string components of keys in bucket.
	 *
	 * @throws DataException if a key has no NUL-terminated string prefix
	 */
	public List<String> getPrefixes(String bucket) throws DataException;

	// String sets stored as single values

	/** @throws DataException if bucket or key not found */
	public Set<String> getSet(String bucket, byte[] key) throws DataException;

	/** Adds member, creating set if necessary. */
	public void addToSet(String bucket, byte[] key, String member) throws DataException;

	/**
	 * Removes member. The key is deleted once its set is empty.
	 *
	 * @throws DataException if bucket or key not found
	 */
	public void removeFromSet(String bucket, byte[] key, String member) throws DataException;

	public List<String> getSetMembers(String bucket, byte[] key) throws DataException;

	/** Returns false, rather than throwing, if there is no such set. */
	public boolean setContains(String bucket, byte[] key, String member) throws DataException;

}
