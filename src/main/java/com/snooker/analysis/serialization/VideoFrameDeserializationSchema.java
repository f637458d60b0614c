package com.snooker.analysis.serialization;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.snooker.analysis.model.VideoFrame;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * VideoFrame反序列化器
 * 格式错误或缺少会话ID的消息返回 null，由 Flink 跳过
 */
public class VideoFrameDeserializationSchema implements DeserializationSchema<VideoFrame> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(VideoFrameDeserializationSchema.class);

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @Override
    public VideoFrame deserialize(byte[] message) throws IOException {
        if (message == null || message.length == 0) {
            return null;
        }
        try {
            VideoFrame frame = objectMapper.readValue(message, VideoFrame.class);
            if (frame.getSessionId() == null || frame.getFrameData() == null) {
                LOG.warn("Skipping frame message without session id or frame data");
                return null;
            }
            return frame;
        } catch (IOException e) {
            LOG.warn("Skipping malformed frame message ({} bytes): {}", message.length, e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(VideoFrame nextElement) {
        return false;
    }

    @Override
    public TypeInformation<VideoFrame> getProducedType() {
        return TypeInformation.of(VideoFrame.class);
    }
}
