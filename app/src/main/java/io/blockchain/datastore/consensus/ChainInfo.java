package io.blockchain.datastore.consensus;

/**
 * Static chain parameters the datastore needs.
 *
 * @param name          chain name, written to the datastore log header
 * @param network       network name (standard, testnet, devnet)
 * @param maturityDelay blocks after which a block is considered final
 */
public record ChainInfo(String name, String network, int maturityDelay) {

    public static final int DEFAULT_MATURITY_DELAY = 144;

    public ChainInfo {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("chain name is required");
        }
        if (maturityDelay <= 0) {
            throw new IllegalArgumentException("maturityDelay must be > 0");
        }
    }

    public static ChainInfo defaultLocal() {
        return new ChainInfo("java-blockchain", "devnet", DEFAULT_MATURITY_DELAY);
    }

    public ChainInfo withMaturityDelay(int delay) {
        return new ChainInfo(name, network, delay);
    }
}
