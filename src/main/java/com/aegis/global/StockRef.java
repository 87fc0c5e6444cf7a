package com.aegis.global;

/** Korean stock identity passed to batch coupling analysis; sector may be null. */
public record StockRef(String code, String name, String sector) {
}
