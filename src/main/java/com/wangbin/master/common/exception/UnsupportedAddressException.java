package com.wangbin.master.common.exception;

import lombok.Getter;

/**
 * 语法正确但区域/宽度组合不受支持的地址
 */
@Getter
public class UnsupportedAddressException extends MasterException {

    private final String address;

    public UnsupportedAddressException(String address, String reason) {
        super(ErrorCode.UNSUPPORTED_ADDRESS, "不支持的IEC地址 '" + address + "': " + reason);
        this.address = address;
    }
}
