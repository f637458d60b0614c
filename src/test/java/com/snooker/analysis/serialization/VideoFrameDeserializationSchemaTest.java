package com.snooker.analysis.serialization;

import com.snooker.analysis.model.VideoFrame;
import org.junit.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;

public class VideoFrameDeserializationSchemaTest {

    private final VideoFrameDeserializationSchema schema = new VideoFrameDeserializationSchema();

    @Test
    public void parsesProducerMessage() throws Exception {
        VideoFrame frame = VideoFrame.builder()
                .sessionId("table-2")
                .frameNumber(15)
                .timestamp(600)
                .frameData(new byte[]{1, 2, 3})
                .metadata(VideoFrame.FrameMetadata.builder().width(1280).height(720).fps(25.0).build())
                .build();
        byte[] message = FrameAnalysisSerializer.frameToJson(frame).getBytes(StandardCharsets.UTF_8);

        VideoFrame parsed = schema.deserialize(message);
        assertEquals("table-2", parsed.getSessionId());
        assertEquals(15, parsed.getFrameNumber());
        assertArrayEquals(new byte[]{1, 2, 3}, parsed.getFrameData());
        assertEquals(Integer.valueOf(1280), parsed.getMetadata().getWidth());
        assertFalse(schema.isEndOfStream(parsed));
    }

    @Test
    public void skipsMalformedMessages() throws Exception {
        assertNull(schema.deserialize(null));
        assertNull(schema.deserialize(new byte[0]));
        assertNull(schema.deserialize("not json".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    public void skipsFramesWithoutSession() throws Exception {
        assertNull(schema.deserialize("{\"frameNumber\":1,\"frameData\":\"AQI=\"}"
                .getBytes(StandardCharsets.UTF_8)));
        assertNull(schema.deserialize("{\"sessionId\":\"s\",\"frameNumber\":1}"
                .getBytes(StandardCharsets.UTF_8)));
    }
}
