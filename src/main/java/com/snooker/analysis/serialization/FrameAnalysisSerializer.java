package com.snooker.analysis.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.snooker.analysis.model.FrameAnalysis;
import com.snooker.analysis.model.VideoFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 分析结果与视频帧的 JSON 转换
 */
public final class FrameAnalysisSerializer {

    private static final Logger LOG = LoggerFactory.getLogger(FrameAnalysisSerializer.class);

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

    private FrameAnalysisSerializer() {
    }

    /**
     * 转换为 JSON，失败时返回 null
     */
    public static String toJson(FrameAnalysis analysis) {
        try {
            return objectMapper.writeValueAsString(analysis);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize analysis for session {} frame {}",
                    analysis.getSessionId(), analysis.getFrameNumber(), e);
            return null;
        }
    }

    public static FrameAnalysis fromJson(String json) throws JsonProcessingException {
        return objectMapper.readValue(json, FrameAnalysis.class);
    }

    public static String frameToJson(VideoFrame frame) throws JsonProcessingException {
        return objectMapper.writeValueAsString(frame);
    }
}
