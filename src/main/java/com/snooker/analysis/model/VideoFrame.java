package com.snooker.analysis.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 视频帧数据模型
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VideoFrame implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * 会话ID（摄像头或视频文件标识）
     */
    private String sessionId;

    /**
     * 帧序号（在当前会话中单调递增）
     */
    private long frameNumber;

    /**
     * 时间戳（毫秒）
     */
    private long timestamp;

    /**
     * 帧数据（字节数组，JPEG编码）
     */
    private byte[] frameData;

    /**
     * 元数据
     */
    private FrameMetadata metadata;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FrameMetadata implements Serializable {
        private static final long serialVersionUID = 1L;

        /**
         * 分辨率宽度
         */
        private Integer width;

        /**
         * 分辨率高度
         */
        private Integer height;

        /**
         * 帧率
         */
        private Double fps;

        /**
         * 编码格式
         */
        private String codec;
    }
}
