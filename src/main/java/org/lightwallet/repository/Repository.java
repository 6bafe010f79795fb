package org.lightwallet.repository;

/**
 * One repository session.
 * <p>
 * Changes are only visible to other sessions after {@link #saveChanges()}.
 */
public interface Repository extends AutoCloseable {

	public KeyValueRepository getKeyValueRepository();

	public CoinRepository getCoinRepository();

	public void saveChanges() throws DataException;

	public void discardChanges() throws DataException;

	@Override
	public void close() throws DataException;

}
