package io.blockchain.datastore.protocol;

import java.util.List;

/**
 * Block = header + list of transactions.
 * The id is derived from the header only, transactions are carried as-is.
 */
public final class Block {
    private final BlockHeader header;
    private final List<Transaction> transactions;
    private final BlockId id;

    public Block(BlockHeader header, List<Transaction> txs) {
        this.header = header;
        this.transactions = txs != null ? List.copyOf(txs) : List.of();
        basicValidate();
        this.id = header.id();
    }

    public BlockHeader header() { return header; }
    public List<Transaction> transactions() { return transactions; }
    public BlockId id() { return id; }
    public long timestamp() { return header.timestamp(); }

    public void basicValidate() {
        if (header == null) throw new IllegalArgumentException("missing header");
        if (transactions.size() > 1_000_000) throw new IllegalArgumentException("too many txs"); // sanity cap
    }

    @Override public String toString() {
        return "Block{height=" + header.height() + ", txs=" + transactions.size() + "}";
    }
}
