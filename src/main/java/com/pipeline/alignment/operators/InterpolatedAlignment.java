package com.pipeline.alignment.operators;

import com.pipeline.alignment.core.AlignmentStrategy;
import com.pipeline.alignment.model.AlignmentContext;
import com.pipeline.alignment.model.ChannelPolicy;
import com.pipeline.alignment.model.Point;
import com.pipeline.alignment.model.PointValue;
import com.pipeline.alignment.storage.LedgerSnapshot;

/**
 * 插值列对齐策略。
 *
 * 在容差窗口内查找网格时刻前后的两个点：
 * - 两侧都存在且均为数值：线性插值；两点时间几乎重合时直接取前一点
 * - 两侧都存在但非数值：取时间更近的一点，等距取前一点
 * - 只有一侧存在：直接取该点
 */
public class InterpolatedAlignment implements AlignmentStrategy {

    /** 两点时间差小于此值视为重合，避免除零 */
    private static final double COINCIDENT_EPSILON = 1e-9;

    @Override
    public PointValue resolve(LedgerSnapshot channel, AlignmentContext context) {
        if (channel == null || channel.isEmpty()) {
            return null;
        }
        double target = context.getTargetElapsed();
        LedgerSnapshot.Bracket bracket = channel.bracket(target, context.getSearchTolerance());
        if (bracket.isEmpty()) {
            return null;
        }

        Point before = bracket.getBefore();
        Point after = bracket.getAfter();
        if (!bracket.isComplete()) {
            return before != null ? before.getValue() : after.getValue();
        }

        PointValue v1 = before.getValue();
        PointValue v2 = after.getValue();
        if (v1.isNumeric() && v2.isNumeric()) {
            return interpolate(before, after, target);
        }

        double beforeDistance = target - before.getElapsed();
        double afterDistance = after.getElapsed() - target;
        return afterDistance < beforeDistance ? v2 : v1;
    }

    private PointValue interpolate(Point before, Point after, double target) {
        double t1 = before.getElapsed();
        double t2 = after.getElapsed();
        double y1 = before.getValue().asDouble();
        if (Math.abs(t2 - t1) < COINCIDENT_EPSILON) {
            return before.getValue();
        }
        double y2 = after.getValue().asDouble();
        double ratio = (target - t1) / (t2 - t1);
        return PointValue.ofNumber(y1 + ratio * (y2 - y1));
    }

    @Override
    public ChannelPolicy getPolicy() {
        return ChannelPolicy.INTERPOLATED;
    }
}
