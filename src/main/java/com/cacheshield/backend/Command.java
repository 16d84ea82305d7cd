package com.cacheshield.backend;

/**
 * 后端命令，拦截器链按命令区分处理
 */
public enum Command {

    GET("get"),
    GET_MANY("get_many"),
    SET("set"),
    SET_MANY("set_many"),
    INCR("incr"),
    EXPIRE("expire"),
    GET_EXPIRE("get_expire"),
    DELETE("delete"),
    DELETE_MANY("delete_many"),
    DELETE_MATCH("delete_match"),
    DELETE_IF_VALUE("delete_if_value"),
    REPLACE_IF_VALUE("replace_if_value"),
    SCAN("scan"),
    EXISTS("exists"),
    GET_KEYS_COUNT("get_keys_count"),
    PING("ping"),
    CLEAR("clear"),
    GET_BITS("get_bits"),
    SET_BITS("set_bits"),
    SET_ADD("set_add"),
    SET_REMOVE("set_remove"),
    SET_POP("set_pop");

    private final String code;

    Command(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
