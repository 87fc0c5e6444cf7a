package com.aegis.realworld.integrity;

/** Upstream provider a data point came from. */
public enum DataSource {
    YAHOO,
    KRX,
    DART
}
