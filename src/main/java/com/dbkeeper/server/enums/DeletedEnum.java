package com.dbkeeper.server.enums;

import lombok.Getter;

@Getter
public enum DeletedEnum {

    NOT_DELETED(0),

    DELETED(1),
    ;

    private final int code;

    DeletedEnum(int code) {
        this.code = code;
    }
}
