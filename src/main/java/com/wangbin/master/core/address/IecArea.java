package com.wangbin.master.core.address;

import lombok.Getter;

/**
 * PLC存储区
 */
@Getter
public enum IecArea {
    INPUT('I', "输入区"),
    OUTPUT('Q', "输出区"),
    MEMORY('M', "内部存储区");

    private final char code;
    private final String description;

    IecArea(char code, String description) {
        this.code = code;
        this.description = description;
    }

    public static IecArea fromCode(char code) {
        for (IecArea area : values()) {
            if (area.code == code) {
                return area;
            }
        }
        return null;
    }
}
