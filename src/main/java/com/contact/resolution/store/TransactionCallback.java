package com.contact.resolution.store;

@FunctionalInterface
public interface TransactionCallback<T> {

    T doInTransaction(StoreTransaction tx);
}
