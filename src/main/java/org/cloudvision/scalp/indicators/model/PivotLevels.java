package org.cloudvision.scalp.indicators.model;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Classic floor-trader pivots derived from a single bar.
 */
public class PivotLevels {
    private final BigDecimal pivot;
    private final BigDecimal r1;
    private final BigDecimal r2;
    private final BigDecimal r3;
    private final BigDecimal s1;
    private final BigDecimal s2;
    private final BigDecimal s3;

    public PivotLevels(BigDecimal pivot, BigDecimal r1, BigDecimal r2, BigDecimal r3,
                       BigDecimal s1, BigDecimal s2, BigDecimal s3) {
        this.pivot = pivot;
        this.r1 = r1;
        this.r2 = r2;
        this.r3 = r3;
        this.s1 = s1;
        this.s2 = s2;
        this.s3 = s3;
    }

    public static PivotLevels empty() {
        BigDecimal z = BigDecimal.ZERO;
        return new PivotLevels(z, z, z, z, z, z, z);
    }

    public BigDecimal getPivot() { return pivot; }
    public BigDecimal getR1() { return r1; }
    public BigDecimal getR2() { return r2; }
    public BigDecimal getR3() { return r3; }
    public BigDecimal getS1() { return s1; }
    public BigDecimal getS2() { return s2; }
    public BigDecimal getS3() { return s3; }

    /**
     * Levels ordered from lowest support to highest resistance.
     */
    public Map<String, BigDecimal> asLevels() {
        Map<String, BigDecimal> levels = new LinkedHashMap<>();
        levels.put("S3", s3);
        levels.put("S2", s2);
        levels.put("S1", s1);
        levels.put("P", pivot);
        levels.put("R1", r1);
        levels.put("R2", r2);
        levels.put("R3", r3);
        return levels;
    }
}
