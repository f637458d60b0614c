package com.snooker.analysis.mock;

import com.snooker.analysis.config.SnookerAnalysisConfig;
import com.snooker.analysis.model.VideoFrame;
import com.snooker.analysis.processor.VideoInputHandler;
import com.snooker.analysis.serialization.FrameAnalysisSerializer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Properties;

/**
 * 本地视频发送到Kafka帧主题，用于联调流处理任务
 * 功能：
 * 1. 逐帧读取本地视频文件或流地址
 * 2. 以会话ID为key发送到Kafka
 * 3. 可按原始帧率节流发送
 */
public class VideoFrameProducer implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(VideoFrameProducer.class);

    private final String topic;
    private final KafkaProducer<String, String> producer;

    public VideoFrameProducer(String bootstrapServers, String topic) {
        this.topic = topic;
        this.producer = new KafkaProducer<>(producerProperties(bootstrapServers));
        LOG.info("Kafka producer initialized: {}", bootstrapServers);
    }

    static Properties producerProperties(String bootstrapServers) {
        Properties props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.ACKS_CONFIG, "1");
        props.put(ProducerConfig.RETRIES_CONFIG, 3);
        props.put(ProducerConfig.BATCH_SIZE_CONFIG, 16384);
        props.put(ProducerConfig.LINGER_MS_CONFIG, 10);
        // 单帧JPEG可能超过默认的1MB
        props.put(ProducerConfig.MAX_REQUEST_SIZE_CONFIG, 8 * 1024 * 1024);
        props.put(ProducerConfig.BUFFER_MEMORY_CONFIG, 33554432);
        props.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, "snappy");
        return props;
    }

    /**
     * 发送整段视频
     *
     * @param realtime 是否按视频帧率节流
     * @return 发送的帧数
     */
    public long send(String source, String sessionId, double maxFps, boolean realtime) throws Exception {
        long sentFrames = 0;
        long startTime = System.currentTimeMillis();

        try (VideoInputHandler input = new VideoInputHandler(source, sessionId, maxFps)) {
            input.open();
            long frameInterval = (long) (1000 / input.getFps());

            Optional<VideoFrame> next;
            while ((next = input.nextFrame()).isPresent()) {
                long frameStartTime = System.currentTimeMillis();
                VideoFrame frame = next.get();

                String json = FrameAnalysisSerializer.frameToJson(frame);
                producer.send(new ProducerRecord<>(topic, sessionId, json), (metadata, exception) -> {
                    if (exception != null) {
                        LOG.error("Error sending frame: {}", exception.getMessage());
                    }
                });
                sentFrames++;

                if (sentFrames % 100 == 0) {
                    LOG.info("Session {}: Sent {} frames", sessionId, sentFrames);
                }

                if (realtime) {
                    long sleepTime = frameInterval - (System.currentTimeMillis() - frameStartTime);
                    if (sleepTime > 0) {
                        Thread.sleep(sleepTime);
                    }
                }
            }
        }

        producer.flush();
        long totalTime = Math.max(1, System.currentTimeMillis() - startTime);
        LOG.info("Session {} completed: {} frames in {}ms (avg {} fps)",
                sessionId, sentFrames, totalTime, String.format("%.1f", sentFrames * 1000.0 / totalTime));
        return sentFrames;
    }

    @Override
    public void close() {
        producer.flush();
        producer.close();
        LOG.info("Kafka producer closed");
    }

    /**
     * 参数：视频路径 [会话ID] [最大帧率] [是否实时]
     */
    public static void main(String[] args) {
        if (args.length < 1) {
            LOG.error("Usage: VideoFrameProducer <video> [sessionId] [maxFps] [realtime]");
            System.exit(1);
        }
        String source = args[0];
        String sessionId = args.length >= 2 ? args[1] : "table_001";
        double maxFps = args.length >= 3 ? Double.parseDouble(args[2]) : 0;
        boolean realtime = args.length < 4 || Boolean.parseBoolean(args[3]);

        SnookerAnalysisConfig config = SnookerAnalysisConfig.loadConfig();
        try (VideoFrameProducer producer = new VideoFrameProducer(
                config.getKafkaBootstrapServers(), config.getKafkaFrameTopic())) {
            producer.send(source, sessionId, maxFps, realtime);
        } catch (Exception e) {
            LOG.error("Error running video frame producer", e);
            System.exit(1);
        }
    }
}
