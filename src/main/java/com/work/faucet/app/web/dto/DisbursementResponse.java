package com.work.faucet.app.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 统一响应体：tx_hash 仅在成功时出现。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DisbursementResponse {

    private final boolean success;
    private final String message;
    @JsonProperty("tx_hash")
    private final String txHash;

    private DisbursementResponse(boolean success, String message, String txHash) {
        this.success = success;
        this.message = message;
        this.txHash = txHash;
    }

    public static DisbursementResponse success(String txHash) {
        return new DisbursementResponse(true, "Tokens sent successfully!", txHash);
    }

    public static DisbursementResponse fail(String message) {
        return new DisbursementResponse(false, message, null);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getMessage() {
        return message;
    }

    public String getTxHash() {
        return txHash;
    }
}
