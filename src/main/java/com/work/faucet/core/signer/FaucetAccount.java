package com.work.faucet.core.signer;

import com.work.faucet.core.exception.FaucetConfigurationException;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;

import java.math.BigInteger;
import java.util.regex.Pattern;

/**
 * 水龙头出账账户：私钥凭据 + 派生地址。进程内唯一，启动后不可变。
 * <p>
 * 私钥只保存在 {@link Credentials} 中，不对外暴露、不参与 toString，也不写日志。
 */
public final class FaucetAccount {

    private static final Pattern KEY_PATTERN = Pattern.compile("^[0-9a-fA-F]{64}$");

    private final Credentials credentials;
    private final String address;

    private FaucetAccount(Credentials credentials) {
        this.credentials = credentials;
        this.address = credentials.getAddress();
    }

    /**
     * 从 64 位十六进制私钥（不带 0x 前缀）构造账户。
     *
     * @throws FaucetConfigurationException 私钥缺失、格式非法或不在 secp256k1 有效范围内
     */
    public static FaucetAccount fromPrivateKeyHex(String privateKeyHex) {
        if (privateKeyHex == null || privateKeyHex.trim().isEmpty()) {
            throw new FaucetConfigurationException("PRIVATE_KEY environment variable is required");
        }
        String hex = privateKeyHex.trim();
        if (!KEY_PATTERN.matcher(hex).matches()) {
            throw new FaucetConfigurationException("invalid private key: expected 64 hex characters without 0x prefix");
        }
        BigInteger key = new BigInteger(hex, 16);
        if (key.signum() == 0 || key.compareTo(Sign.CURVE_PARAMS.getN()) >= 0) {
            throw new FaucetConfigurationException("invalid private key: out of secp256k1 range");
        }
        return new FaucetAccount(Credentials.create(ECKeyPair.create(key)));
    }

    /**
     * 小写 0x 地址。
     */
    public String getAddress() {
        return address;
    }

    /**
     * EIP-55 校验和格式地址，用于日志展示。
     */
    public String getChecksumAddress() {
        return Keys.toChecksumAddress(address);
    }

    Credentials credentials() {
        return credentials;
    }

    @Override
    public String toString() {
        return "FaucetAccount{address=" + getChecksumAddress() + "}";
    }
}
