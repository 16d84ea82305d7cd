package com.cacheshield.transaction;

/**
 * 在事务作用域内执行的回调
 */
@FunctionalInterface
public interface TransactionCallback<T> {

    T doInTransaction(Transaction transaction);
}
