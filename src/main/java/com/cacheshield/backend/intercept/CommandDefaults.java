package com.cacheshield.backend.intercept;

import com.cacheshield.backend.Command;
import com.cacheshield.constant.CacheConstants;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * 命令被跳过（禁用或安全模式吞掉异常）时返回的默认结果
 * 读命令表现为未命中，写命令表现为未写入
 */
public final class CommandDefaults {

    private CommandDefaults() {}

    public static Object absent(Command command, Object[] args) {
        return switch (command) {
            case GET, PING, SET_MANY, CLEAR, SET_BITS, SET_ADD, SET_REMOVE -> null;
            case GET_MANY -> nulls(((List<?>) args[0]).size());
            case SET, EXPIRE, DELETE, DELETE_IF_VALUE, REPLACE_IF_VALUE, EXISTS -> Boolean.FALSE;
            case INCR, DELETE_MANY, DELETE_MATCH, GET_KEYS_COUNT -> 0L;
            case GET_EXPIRE -> CacheConstants.NOT_EXIST;
            case SCAN -> Stream.empty();
            case GET_BITS -> new boolean[((long[]) args[1]).length];
            case SET_POP -> Set.of();
        };
    }

    private static List<Object> nulls(int size) {
        return new ArrayList<>(Collections.nCopies(size, null));
    }
}
