package com.aegis.context.sector;

/** Kind of recurring sector event. */
public enum SectorEventType {
    CONFERENCE,
    EXHIBITION,
    EARNINGS,
    PRODUCT_LAUNCH,
    REGULATORY,
    SEASONAL
}
