package com.aegis.realworld.execution;

/** Direction of a simulated order. */
public enum OrderSide {
    BUY,
    SELL
}
