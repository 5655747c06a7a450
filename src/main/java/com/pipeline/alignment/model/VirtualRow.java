package com.pipeline.alignment.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 虚拟表中的一行：网格时刻（经过时间，秒）+ 按列定义顺序排列的单元格。
 * 单元格为null表示本行未解析出该列的值。
 */
public final class VirtualRow implements Serializable {
    /** 网格序号，自构建起单调递增，不受行裁剪影响 */
    private final long index;
    private final double timestamp;
    private final Map<String, PointValue> data;

    public VirtualRow(long index, double timestamp, LinkedHashMap<String, PointValue> data) {
        this.index = index;
        this.timestamp = timestamp;
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public long getIndex() { return index; }
    public double getTimestamp() { return timestamp; }
    public Map<String, PointValue> getData() { return data; }

    /** 指定列的值；未解析或列不存在时返回null */
    public PointValue get(String column) {
        return data.get(column);
    }

    public boolean isResolved(String column) {
        return data.get(column) != null;
    }

    @Override
    public String toString() {
        return "VirtualRow{index=" + index + ", timestamp=" + timestamp + ", data=" + data + "}";
    }
}
