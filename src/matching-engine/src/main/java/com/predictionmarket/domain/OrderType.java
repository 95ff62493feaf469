package com.predictionmarket.domain;

public enum OrderType {
    BUY,
    SELL
}
