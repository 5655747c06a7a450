package com.pipeline.alignment.core.impl;

/**
 * 增量构建的突发扩展策略。
 *
 * 参考通道在极短的经过时间内涌入大量点时（同一批次到达），最新时刻可能迟迟追不上下一网格时刻，
 * 增量构建就会一直空转。自上次产出行以来参考通道新增点数达到 minNewReferencePoints 时，
 * 越过水位线合成 min(maxExtensionRows, 新增点数 / minNewReferencePoints) 行。
 * minNewReferencePoints 小于等于0表示关闭。
 */
public final class BurstPolicy {

    private static final BurstPolicy DISABLED = new BurstPolicy(0, 0);

    private final int minNewReferencePoints;
    private final int maxExtensionRows;

    public BurstPolicy(int minNewReferencePoints, int maxExtensionRows) {
        this.minNewReferencePoints = minNewReferencePoints;
        this.maxExtensionRows = Math.max(0, maxExtensionRows);
    }

    public static BurstPolicy disabled() {
        return DISABLED;
    }

    public boolean isEnabled() {
        return minNewReferencePoints > 0 && maxExtensionRows > 0;
    }

    /**
     * @param newReferencePoints 自上次产出行以来参考通道新增的点数
     * @return 应越过水位线合成的行数；不满足条件时为0
     */
    public int extensionRows(long newReferencePoints) {
        if (!isEnabled() || newReferencePoints < minNewReferencePoints) {
            return 0;
        }
        long rows = newReferencePoints / minNewReferencePoints;
        return (int) Math.min(maxExtensionRows, rows);
    }

    public int getMinNewReferencePoints() { return minNewReferencePoints; }
    public int getMaxExtensionRows() { return maxExtensionRows; }

    @Override
    public String toString() {
        return "BurstPolicy{minNewReferencePoints=" + minNewReferencePoints
                + ", maxExtensionRows=" + maxExtensionRows + "}";
    }
}
