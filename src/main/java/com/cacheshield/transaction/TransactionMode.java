package com.cacheshield.transaction;

/**
 * 事务隔离模式
 */
public enum TransactionMode {

    /** 立即生效，回滚只撤销本事务的修改，事务之间不加锁 */
    FAST,

    /** 首次触碰 Key 时加行级锁，持有到事务结束 */
    LOCKED,

    /** 整个事务持有进程级全局锁 */
    SERIALIZABLE
}
