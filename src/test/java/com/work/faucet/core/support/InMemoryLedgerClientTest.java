package com.work.faucet.core.support;

import com.work.faucet.core.chain.ChainIdentity;
import com.work.faucet.core.model.PendingTransfer;
import com.work.faucet.core.model.SignedTransfer;
import com.work.faucet.core.signer.FaucetAccount;
import com.work.faucet.core.signer.TransferSigner;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class InMemoryLedgerClientTest {

    private static final BigInteger GAS_COST = InMemoryLedgerClient.TRANSFER_GAS.multiply(InMemoryLedgerClient.DEFAULT_GAS_PRICE);

    private final FaucetAccount account = FaucetAccount.fromPrivateKeyHex(TestAccounts.FAUCET_KEY);

    private SignedTransfer sign(long chainId, long nonce, BigInteger value) {
        TransferSigner signer = new TransferSigner(account, new ChainIdentity(chainId));
        return signer.sign(new PendingTransfer(BigInteger.valueOf(nonce), TestAccounts.RECIPIENT, value,
                InMemoryLedgerClient.DEFAULT_GAS_PRICE, InMemoryLedgerClient.TRANSFER_GAS, chainId));
    }

    @Test
    public void accepted_transfer_moves_funds_and_advances_nonce() {
        InMemoryLedgerClient ledger = new InMemoryLedgerClient(1337L);
        ledger.credit(account.getAddress(), BigInteger.TEN.pow(18));

        SignedTransfer tx = sign(1337L, 0, BigInteger.valueOf(1000));
        assertEquals(tx.getTxHash(), ledger.submitTransaction(tx.getRawHex()));

        assertEquals(BigInteger.ONE, ledger.getPendingNonce(account.getChecksumAddress()));
        assertEquals(BigInteger.valueOf(1000), ledger.getBalance(TestAccounts.RECIPIENT));
        assertEquals(BigInteger.TEN.pow(18).subtract(BigInteger.valueOf(1000)).subtract(GAS_COST),
                ledger.getBalance(account.getAddress()));
        assertEquals(1, ledger.getAcceptedTransactions().size());
    }

    @Test
    public void reused_or_skipped_nonce_is_rejected() {
        InMemoryLedgerClient ledger = new InMemoryLedgerClient(1337L);
        ledger.credit(account.getAddress(), BigInteger.TEN.pow(18));
        ledger.submitTransaction(sign(1337L, 0, BigInteger.ONE).getRawHex());

        IllegalStateException low = assertThrows(IllegalStateException.class,
                () -> ledger.submitTransaction(sign(1337L, 0, BigInteger.TWO).getRawHex()));
        assertTrue(low.getMessage().startsWith("nonce too low"));

        IllegalStateException high = assertThrows(IllegalStateException.class,
                () -> ledger.submitTransaction(sign(1337L, 5, BigInteger.ONE).getRawHex()));
        assertTrue(high.getMessage().startsWith("nonce too high"));
    }

    @Test
    public void transaction_for_another_chain_is_rejected() {
        InMemoryLedgerClient ledger = new InMemoryLedgerClient(1337L);
        ledger.credit(account.getAddress(), BigInteger.TEN.pow(18));
        assertThrows(IllegalStateException.class,
                () -> ledger.submitTransaction(sign(1L, 0, BigInteger.ONE).getRawHex()));
        assertEquals(BigInteger.ZERO, ledger.getPendingNonce(account.getAddress()));
    }

    @Test
    public void underfunded_transfer_is_rejected() {
        InMemoryLedgerClient ledger = new InMemoryLedgerClient(1337L);
        ledger.credit(account.getAddress(), BigInteger.valueOf(1000));
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> ledger.submitTransaction(sign(1337L, 0, BigInteger.valueOf(1000)).getRawHex()));
        assertTrue(e.getMessage().startsWith("insufficient funds"));
        assertTrue(ledger.getAcceptedTransactions().isEmpty());
    }
}
