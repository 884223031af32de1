package com.fixedincome.pricingengine.domain.model;

public enum Compounding {
    ANNUAL(1),
    SEMI(2),
    QUARTERLY(4),
    MONTHLY(12),
    CONTINUOUS(0);

    private final int periodsPerYear;

    Compounding(int periodsPerYear) {
        this.periodsPerYear = periodsPerYear;
    }

    public int periodsPerYear() {
        return periodsPerYear;
    }

    public boolean isContinuous() {
        return periodsPerYear == 0;
    }

    public static Compounding fromFrequency(int periodsPerYear) {
        for (Compounding c : values()) {
            if (c.periodsPerYear == periodsPerYear) return c;
        }
        throw new IllegalArgumentException("Unsupported compounding frequency: " + periodsPerYear);
    }
}
