package com.work.faucet.app.web.dto;

import javax.validation.constraints.NotBlank;

/**
 * 领取请求体，仅包含收款地址。
 */
public class DisbursementRequest {

    @NotBlank(message = "address 不能为空")
    private String address;

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }
}
