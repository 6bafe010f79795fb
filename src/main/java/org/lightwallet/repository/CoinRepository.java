package org.lightwallet.repository;

import java.util.List;

import org.lightwallet.data.wallet.CoinData;

public interface CoinRepository {

	public static final String BUCKET = "coin";

	/** Saves coin, replacing any with the same owner and output. */
	public void save(CoinData coinData) throws DataException;

	public void delete(CoinData coinData) throws DataException;

	/** Returns <tt>address</tt>'s coins, possibly empty. */
	public List<CoinData> getCoins(byte[] address) throws DataException;

	public List<CoinData> getAllCoins() throws DataException;

}
