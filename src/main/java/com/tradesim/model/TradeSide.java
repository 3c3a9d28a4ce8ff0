package com.tradesim.model;

public enum TradeSide {
    BUY,
    SELL
}
