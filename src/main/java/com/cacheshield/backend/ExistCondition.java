package com.cacheshield.backend;

/**
 * 条件写入：锁与计数的基础原语
 */
public enum ExistCondition {

    /** 无条件写入 */
    ANY,

    /** 仅当 Key 已存在时写入（SET XX） */
    MUST_EXIST,

    /** 仅当 Key 不存在时写入（SET NX） */
    MUST_NOT_EXIST;

    /**
     * 根据 Key 当前是否存在判断是否允许写入
     */
    public boolean permits(boolean exists) {
        return switch (this) {
            case ANY -> true;
            case MUST_EXIST -> exists;
            case MUST_NOT_EXIST -> !exists;
        };
    }
}
