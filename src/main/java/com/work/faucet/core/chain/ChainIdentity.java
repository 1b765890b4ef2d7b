package com.work.faucet.core.chain;

/**
 * 启动时获取一次的 chainId，进程生命周期内不可变。
 */
public final class ChainIdentity {

    private final long chainId;

    public ChainIdentity(long chainId) {
        if (chainId <= 0) {
            throw new IllegalArgumentException("chainId 必须大于0");
        }
        this.chainId = chainId;
    }

    public long getChainId() {
        return chainId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChainIdentity)) return false;
        return chainId == ((ChainIdentity) o).chainId;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(chainId);
    }

    @Override
    public String toString() {
        return "ChainIdentity{" + chainId + "}";
    }
}
