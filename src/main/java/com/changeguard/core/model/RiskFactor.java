package com.changeguard.core.model;

import java.io.Serializable;

/**
 * One contribution to a risk score.
 *
 * @param name        short factor identifier (e.g. "file-sensitivity")
 * @param impact      contribution on the 0-10 danger scale
 * @param description human-readable explanation of why the factor applies
 */
public record RiskFactor(
    String name,
    int impact,
    String description
) implements Serializable {

    public RiskFactor {
        if (impact < 0 || impact > 10) {
            throw new IllegalArgumentException("Risk factor impact out of range [0,10]: " + impact);
        }
    }
}
