package org.lightwallet.account;

import org.bitcoinj.core.NetworkParameters;
import org.bitcoinj.params.MainNetParams;
import org.bitcoinj.params.RegTestParams;
import org.bitcoinj.params.TestNet3Params;

/** Networks we can derive display addresses for. */
public enum WalletNet {
	MAIN {
		@Override
		public NetworkParameters getParams() {
			return MainNetParams.get();
		}
	},
	TEST3 {
		@Override
		public NetworkParameters getParams() {
			return TestNet3Params.get();
		}
	},
	REGTEST {
		@Override
		public NetworkParameters getParams() {
			return RegTestParams.get();
		}
	};

	public abstract NetworkParameters getParams();
}
