package com.wangbin.master.common.exception;

import lombok.Getter;

/**
 * IEC地址语法错误
 */
@Getter
public class AddressParseException extends MasterException {

    private final String address;

    public AddressParseException(String address, String reason) {
        super(ErrorCode.ADDRESS_PARSE_ERROR, "IEC地址格式错误 '" + address + "': " + reason);
        this.address = address;
    }
}
