package com.pipeline.alignment.operators;

import com.pipeline.alignment.core.AlignmentStrategy;
import com.pipeline.alignment.model.AlignmentContext;
import com.pipeline.alignment.model.ChannelPolicy;
import com.pipeline.alignment.model.Point;
import com.pipeline.alignment.model.PointValue;
import com.pipeline.alignment.storage.LedgerSnapshot;

/**
 * 异步列对齐策略：取容差窗口内经过时间最近的点，不插值。
 */
public class AsynchronousAlignment implements AlignmentStrategy {

    @Override
    public PointValue resolve(LedgerSnapshot channel, AlignmentContext context) {
        if (channel == null || channel.isEmpty()) {
            return null;
        }
        Point nearest = channel.nearest(context.getTargetElapsed(), context.getSearchTolerance());
        return nearest != null ? nearest.getValue() : null;
    }

    @Override
    public ChannelPolicy getPolicy() {
        return ChannelPolicy.ASYNCHRONOUS;
    }
}
