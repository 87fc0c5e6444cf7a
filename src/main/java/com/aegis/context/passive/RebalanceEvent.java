package com.aegis.context.passive;

import java.time.LocalDate;

/**
 * Predicted index inclusion or removal.
 *
 * @param estimatedFlow expected passive flow in 100M KRW units, null when unknown
 * @param confidence    0..1
 */
public record RebalanceEvent(IndexType indexType,
                             String stockCode,
                             String stockName,
                             RebalanceAction action,
                             LocalDate announcementDate,
                             LocalDate effectiveDate,
                             Double estimatedFlow,
                             double confidence,
                             String source) {
}
