package com.pipeline.alignment.core;

import com.pipeline.alignment.model.VirtualRow;

import java.util.List;

/**
 * 行持久化接收端 —— 持久化层实现此接口消费新生成的行。
 *
 * {@link #accept(List)} 正常返回即表示这些行已被持久化，
 * 此后虚拟表可以安全地裁剪它们；抛出异常则这些行会在下一轮重新投递。
 */
@FunctionalInterface
public interface RowSink {

    /**
     * 消费一批按时间顺序排列的新行。
     *
     * @param rows 新行，非空
     * @throws Exception 持久化失败
     */
    void accept(List<VirtualRow> rows) throws Exception;
}
