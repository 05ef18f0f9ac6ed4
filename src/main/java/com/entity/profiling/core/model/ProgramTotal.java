package com.entity.profiling.core.model;

import java.math.BigDecimal;

/**
 * Obligations of one funding program within an entity's award summary.
 */
public record ProgramTotal(int recordCount, BigDecimal total) {

    public static final ProgramTotal ZERO = new ProgramTotal(0, BigDecimal.ZERO);

    public ProgramTotal add(BigDecimal amount) {
        return new ProgramTotal(recordCount + 1, total.add(amount));
    }
}
