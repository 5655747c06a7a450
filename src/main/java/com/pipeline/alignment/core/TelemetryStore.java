package com.pipeline.alignment.core;

import com.pipeline.alignment.model.Point;
import com.pipeline.alignment.model.StoreStatistics;
import com.pipeline.alignment.storage.ChannelLedger;

import java.util.List;
import java.util.Map;

/**
 * 遥测存储接口 —— 全部通道原始观测数据的内存账本。
 *
 * 按通道标识维护各自的 {@link ChannelLedger}，并持有会话级的全局参考时间戳，
 * 保证不同通道的经过时间（elapsed）在同一时间基上计算。
 *
 * 并发约定：
 * - 采集线程高频调用 {@link #addPoint(String, Object, long)}，这是唯一的写入入口
 * - 构建线程与持久化线程并发读取，所有读取都基于账本快照，不会观察到写入中途的状态
 */
public interface TelemetryStore {

    /**
     * 写入一个观测点。
     * 通道不存在时自动创建；首次遇到有效时间戳（大于0）时设定全局参考时间戳。
     * 无效时间戳不会报错，按通道自身的首个时间戳计算经过时间。
     *
     * @param channelId 通道标识
     * @param value     原始值（Number / Boolean / 文本 / null）
     * @param timestamp 绝对时间戳（纳秒）
     */
    void addPoint(String channelId, Object value, long timestamp);

    /**
     * 获取指定通道的账本。
     *
     * @param channelId 通道标识
     * @return 通道账本；未找到返回null
     */
    ChannelLedger ledger(String channelId);

    /**
     * @return 全部通道标识，按首次出现顺序排列
     */
    List<String> channelIds();

    /**
     * 对所有通道做就近查询。
     *
     * @param targetElapsed 目标经过时间（秒）
     * @param tolerance     容差（秒）
     * @return 通道标识到最近点的映射；容差内无数据的通道映射为null
     */
    Map<String, Point> snapshotAt(double targetElapsed, double tolerance);

    /**
     * 查询所有通道在经过时间区间内的数据点（闭区间）。
     *
     * @param startElapsed 起始经过时间（秒）
     * @param endElapsed   结束经过时间（秒）
     * @return 通道标识到数据点列表的映射
     */
    Map<String, List<Point>> pointsInRange(double startElapsed, double endElapsed);

    /**
     * 裁剪全部通道：先移除经过时间早于阈值的点，再按单通道上限截断最旧的点。
     *
     * @param minElapsed           保留的最早经过时间（秒）
     * @param maxPointsPerChannel  单通道最多保留点数
     * @return 通道标识到被移除点数的映射，只包含实际发生裁剪的通道
     */
    Map<String, Integer> prune(double minElapsed, int maxPointsPerChannel);

    /**
     * 同 {@link #prune(double, int)}，但按点数截断时不移除经过时间不早于 protectFromElapsed 的点。
     *
     * @param minElapsed           保留的最早经过时间（秒）
     * @param maxPointsPerChannel  单通道最多保留点数
     * @param protectFromElapsed   按点数截断时受保护的最早经过时间（秒）
     * @return 通道标识到被移除点数的映射，只包含实际发生裁剪的通道
     */
    Map<String, Integer> prune(double minElapsed, int maxPointsPerChannel, double protectFromElapsed);

    /**
     * @return 全局参考时间戳（纳秒）；尚未出现有效时间戳时返回null
     */
    Long globalFirstTimestamp();

    /**
     * @param channelId 通道标识
     * @return 该通道当前保留的点数；通道不存在时返回0
     */
    int channelCount(String channelId);

    /**
     * @return 全部通道当前保留的点数之和
     */
    long totalCount();

    /**
     * @return 汇总统计与逐通道统计
     */
    StoreStatistics statistics();

    /**
     * 清空全部通道与全局参考时间戳，并重置会话起点。
     */
    void clear();
}
