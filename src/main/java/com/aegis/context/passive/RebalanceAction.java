package com.aegis.context.passive;

/** Predicted index change for a stock. */
public enum RebalanceAction {
    ADD,
    DELETE,
    WEIGHT_UP,
    WEIGHT_DOWN
}
