package com.ragsync.store;

@FunctionalInterface
public interface TransactionWork<T> {
    T execute(StoreTransaction transaction);
}
