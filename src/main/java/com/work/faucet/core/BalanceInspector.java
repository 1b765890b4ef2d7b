package com.work.faucet.core;

import com.work.faucet.core.chain.LedgerCallExecutor;
import com.work.faucet.core.chain.LedgerClient;
import com.work.faucet.core.chain.LedgerOperation;
import com.work.faucet.core.signer.FaucetAccount;

import java.math.BigInteger;

import static com.work.faucet.core.support.ValidationUtils.requireNonNull;

/**
 * 查询出账账户当前余额（只读，仅用于启动日志）。
 */
public class BalanceInspector {

    private final LedgerClient ledger;
    private final LedgerCallExecutor calls;
    private final FaucetAccount account;

    public BalanceInspector(LedgerClient ledger, LedgerCallExecutor calls, FaucetAccount account) {
        this.ledger = requireNonNull(ledger, "ledger");
        this.calls = requireNonNull(calls, "calls");
        this.account = requireNonNull(account, "account");
    }

    /**
     * @throws com.work.faucet.core.exception.LedgerQueryException 节点无法应答
     */
    public BigInteger getBalance() {
        return calls.call(LedgerOperation.BALANCE, () -> ledger.getBalance(account.getAddress()));
    }
}
