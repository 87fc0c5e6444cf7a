package com.aegis.context.passive;

/** Index tracked by passive funds. */
public enum IndexType {
    MSCI_KOREA,
    KOSPI200,
    KOSPI100,
    KRX300,
    KOSDAQ150
}
