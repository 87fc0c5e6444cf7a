package com.aegis.global;

import java.util.List;

/** Link from a Korean stock or sector to the U.S. symbols and indices it follows. */
public record CouplingMapping(String krStockCode,
                              String krStockName,
                              List<String> usSymbols,
                              List<String> usIndices,
                              String sector,
                              CouplingStrength strength,
                              String description) {
    public CouplingMapping {
        usSymbols = List.copyOf(usSymbols);
        usIndices = List.copyOf(usIndices);
    }
}
