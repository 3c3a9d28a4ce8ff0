package com.tradesim.model;

public enum TransactionKind {
    TRADE,
    DEPOSIT,
    WITHDRAWAL
}
