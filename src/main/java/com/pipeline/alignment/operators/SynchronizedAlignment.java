package com.pipeline.alignment.operators;

import com.pipeline.alignment.core.AlignmentStrategy;
import com.pipeline.alignment.model.AlignmentContext;
import com.pipeline.alignment.model.ChannelPolicy;
import com.pipeline.alignment.model.Point;
import com.pipeline.alignment.model.PointValue;
import com.pipeline.alignment.storage.LedgerSnapshot;

/**
 * 同步列对齐策略。
 * 与参考通道同一帧到达的通道，按锚点的绝对时间戳精确匹配（默认容差 1 微秒）。
 * 没有锚点或没有匹配点时不出值，也不沿用。
 */
public class SynchronizedAlignment implements AlignmentStrategy {

    @Override
    public PointValue resolve(LedgerSnapshot channel, AlignmentContext context) {
        Point anchor = context.getAnchor();
        if (anchor == null || channel == null || channel.isEmpty()) {
            return null;
        }
        Point match = channel.matchTimestamp(anchor.getTimestamp(), context.getSyncToleranceNs());
        return match != null ? match.getValue() : null;
    }

    @Override
    public ChannelPolicy getPolicy() {
        return ChannelPolicy.SYNCHRONIZED;
    }
}
