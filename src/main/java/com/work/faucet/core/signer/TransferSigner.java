package com.work.faucet.core.signer;

import com.work.faucet.core.chain.ChainIdentity;
import com.work.faucet.core.exception.SigningException;
import com.work.faucet.core.model.PendingTransfer;
import com.work.faucet.core.model.SignedTransfer;
import org.web3j.crypto.Hash;
import org.web3j.crypto.TransactionEncoder;
import org.web3j.utils.Numeric;

import static com.work.faucet.core.support.ValidationUtils.requireNonNull;

/**
 * EIP-155 签名：把 sender、nonce、value、gas 参数与 chainId 绑定进同一个签名。
 */
public class TransferSigner {

    private final FaucetAccount account;
    private final ChainIdentity chainIdentity;

    public TransferSigner(FaucetAccount account, ChainIdentity chainIdentity) {
        this.account = requireNonNull(account, "account");
        this.chainIdentity = requireNonNull(chainIdentity, "chainIdentity");
    }

    public FaucetAccount getAccount() {
        return account;
    }

    public ChainIdentity getChainIdentity() {
        return chainIdentity;
    }

    /**
     * @throws SigningException 凭据损坏或交易字段无法编码
     */
    public SignedTransfer sign(PendingTransfer transfer) {
        requireNonNull(transfer, "transfer");
        if (transfer.getChainId() != chainIdentity.getChainId()) {
            throw new SigningException("failed to sign transaction: chainId " + transfer.getChainId()
                    + " does not match " + chainIdentity.getChainId(), null);
        }
        try {
            byte[] signed = TransactionEncoder.signMessage(transfer.toRawTransaction(),
                    chainIdentity.getChainId(), account.credentials());
            String rawHex = Numeric.toHexString(signed);
            return new SignedTransfer(transfer, rawHex, Hash.sha3(rawHex));
        } catch (RuntimeException e) {
            throw new SigningException("failed to sign transaction: " + e.getMessage(), e);
        }
    }
}
