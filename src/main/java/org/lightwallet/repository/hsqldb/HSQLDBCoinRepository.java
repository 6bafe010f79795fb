package org.lightwallet.repository.hsqldb;

import java.util.ArrayList;
import java.util.List;

import org.lightwallet.data.wallet.CoinData;
import org.lightwallet.repository.CoinRepository;
import org.lightwallet.repository.DataException;
import org.lightwallet.repository.KeyValueRepository;
import org.lightwallet.utils.BitTwiddling;

import com.google.common.primitives.Bytes;

/**
 * Coins stored as JSON in key-value bucket {@link CoinRepository#BUCKET}.
 * <p>
 * Key is address length, address, transaction hash, then output index (little-endian),
 * so an address's coins share a key prefix.
 */
public class HSQLDBCoinRepository implements CoinRepository {

	protected HSQLDBRepository repository;

	public HSQLDBCoinRepository(HSQLDBRepository repository) {
		this.repository = repository;
	}

	@Override
	public void save(CoinData coinData) throws DataException {
		this.getKeyValueRepository().put(BUCKET, coinKey(coinData), coinData);
	}

	@Override
	public void delete(CoinData coinData) throws DataException {
		KeyValueRepository keyValueRepository = this.getKeyValueRepository();

		if (!keyValueRepository.bucketExists(BUCKET))
			return;

		keyValueRepository.delete(BUCKET, coinKey(coinData));
	}

	@Override
	public List<CoinData> getCoins(byte[] address) throws DataException {
		KeyValueRepository keyValueRepository = this.getKeyValueRepository();

		if (!keyValueRepository.bucketExists(BUCKET))
			return new ArrayList<>();

		return keyValueRepository.getValues(BUCKET, addressPrefix(address), CoinData.class);
	}

	@Override
	public List<CoinData> getAllCoins() throws DataException {
		KeyValueRepository keyValueRepository = this.getKeyValueRepository();

		if (!keyValueRepository.bucketExists(BUCKET))
			return new ArrayList<>();

		return keyValueRepository.getValues(BUCKET, new byte[0], CoinData.class);
	}

	private KeyValueRepository getKeyValueRepository() {
		return this.repository.getKeyValueRepository();
	}

	private static byte[] addressPrefix(byte[] address) {
		return Bytes.concat(new byte[] { (byte) address.length }, address);
	}

	private static byte[] coinKey(CoinData coinData) {
		return Bytes.concat(addressPrefix(coinData.getAddress()), coinData.getTxHash(), BitTwiddling.toLEByteArray(coinData.getTxIndex()));
	}

}
