package com.aegis.context.sector;

import java.util.Locale;

/** Sector tag used by sector events. */
public enum SectorType {
    TECH,
    SEMICONDUCTOR,
    BIO_PHARMA,
    AUTO_EV,
    BATTERY,
    ENERGY,
    DEFENSE,
    ENTERTAINMENT,
    FINANCE,
    RETAIL;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
