package com.pipeline.alignment.core;

import com.pipeline.alignment.model.BuildResult;
import com.pipeline.alignment.model.ColumnSpec;
import com.pipeline.alignment.model.FailureKind;
import com.pipeline.alignment.model.TableStatistics;
import com.pipeline.alignment.model.VirtualRow;

import java.util.List;

/**
 * 虚拟表接口 —— 将多个通道投影到同一规则时间网格上的合成表。
 *
 * 以参考通道决定时间范围，按采样率生成等间隔的行，
 * 每一列按其对齐策略（同步 / 插值 / 异步）从来源通道取值并经转换器输出。
 *
 * 状态流转：
 *   Empty --build--> Built --rebuild--> Built（追加新行） --clear--> Empty
 *
 * 调用约定：
 * - build/rebuild 为同步、有界耗时调用，不可重入，由单一轮询循环串行调用
 * - 可恢复的失败（参考通道未就绪、单元格转换失败）不抛出异常，通过返回值和诊断接收端反馈
 * - 结构性错误与配置错误不会留下部分构建的行
 */
public interface VirtualTable {

    /**
     * 完整构建。已构建状态下为空操作。
     *
     * @return 构建结果
     */
    BuildResult build();

    /**
     * 增量构建：只生成水位线之后的新行。尚未构建时委托给 {@link #build()}。
     * 已有的行不会被修改或重排。
     *
     * @return 构建结果
     */
    BuildResult rebuild();

    /**
     * 裁剪最旧的行，只保留最近的 keepLastN 行。
     * 调用方必须确认被裁剪的行已持久化。不影响构建状态与水位线。
     *
     * @param keepLastN 保留的行数
     * @return 被移除的行数
     */
    int pruneRows(int keepLastN);

    /**
     * 清空全部行并回到未构建状态。
     */
    void clear();

    // ==================== 配置 ====================

    /**
     * @return 参考通道标识
     */
    String referenceChannelId();

    /**
     * @return 采样率（Hz）
     */
    double samplingRate();

    /**
     * @return 列定义，按输出顺序
     */
    List<ColumnSpec> columns();

    // ==================== 读取 ====================

    /**
     * @return 按列定义顺序排列的列名
     */
    List<String> headers();

    /**
     * @return 当前全部行的不可变副本，按时间升序
     */
    List<VirtualRow> rows();

    /**
     * @return 网格序号不小于 gridIndex 的行，按时间升序
     */
    List<VirtualRow> rowsFrom(long gridIndex);

    /**
     * @return 当前保留的行数
     */
    int rowCount();

    /**
     * @param position 在当前保留行中的位置
     * @return 对应行；越界时返回null
     */
    VirtualRow rowAt(int position);

    /**
     * @param targetElapsed 目标时刻（秒）
     * @param tolerance     容差（秒）
     * @return 容差内时间最接近的行；没有则返回null
     */
    VirtualRow rowNearest(double targetElapsed, double tolerance);

    /**
     * @return 是否已完成首次构建
     */
    boolean isBuilt();

    /**
     * @return 水位线：最近一次生成的行的时间；尚未生成任何行时返回null
     */
    Double lastBuiltTime();

    /**
     * 下一次增量构建会读取的最早记录经过时间，早于它的点可以从存储中移除。
     *
     * @return 尚未构建时返回null；时间基已改为绝对时间戳推算时返回负无穷
     */
    Double retentionFloor();

    /**
     * @return 表统计信息
     */
    TableStatistics statistics();

    /**
     * @return 当前连续失败次数，成功后归零
     */
    int consecutiveFailures();

    /**
     * @return 累计失败次数
     */
    long totalFailures();

    /**
     * @return 最近一次失败的分类；从未失败时返回null
     */
    FailureKind lastFailure();
}
