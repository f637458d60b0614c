package com.snooker.analysis;

import com.snooker.analysis.config.SnookerAnalysisConfig;
import com.snooker.analysis.function.FrameAnalysisFunction;
import com.snooker.analysis.model.VideoFrame;
import com.snooker.analysis.serialization.VideoFrameDeserializationSchema;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.api.common.restartstrategy.RestartStrategies;
import org.apache.flink.api.common.serialization.SimpleStringSchema;
import org.apache.flink.api.common.time.Time;
import org.apache.flink.connector.base.DeliveryGuarantee;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * 斯诺克分析流处理主任务
 * 功能：
 * 1. 从Kafka接收视频帧
 * 2. 按会话分区进行检测、标定和跟踪
 * 3. 将逐帧分析结果以JSON写回Kafka
 */
public class SnookerAnalysisJob {

    private static final Logger LOG = LoggerFactory.getLogger(SnookerAnalysisJob.class);

    public static void main(String[] args) throws Exception {

        // 1. 加载并校验配置，非法配置直接失败
        SnookerAnalysisConfig config = SnookerAnalysisConfig.loadConfig().validate();

        // 2. 创建执行环境
        StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
        configureEnvironment(env, config);

        // 3. 从Kafka读取视频帧
        DataStream<VideoFrame> frameStream = env
                .fromSource(createKafkaSource(config), WatermarkStrategy.noWatermarks(), "Kafka-Frame-Source")
                .name("frame-source")
                .uid("frame-source-uid");

        // 4. 按会话分区，逐帧分析
        DataStream<String> analysisStream = frameStream
                .keyBy(VideoFrame::getSessionId)
                .process(new FrameAnalysisFunction(config))
                .name("frame-analysis")
                .uid("frame-analysis-uid");

        // 5. 写回Kafka
        analysisStream
                .sinkTo(createKafkaSink(config))
                .name("analysis-sink")
                .uid("analysis-sink-uid");

        LOG.info("Starting Snooker Analysis Job...");
        env.execute("Snooker Analysis Job");
    }

    /**
     * 配置Flink执行环境
     */
    private static void configureEnvironment(StreamExecutionEnvironment env, SnookerAnalysisConfig config) {
        env.setParallelism(config.getJobParallelism());

        env.enableCheckpointing(60000, CheckpointingMode.EXACTLY_ONCE);
        env.getCheckpointConfig().setMinPauseBetweenCheckpoints(30000);
        env.getCheckpointConfig().setCheckpointTimeout(600000);
        env.getCheckpointConfig().setMaxConcurrentCheckpoints(1);

        env.setRestartStrategy(RestartStrategies.fixedDelayRestart(
                3,
                Time.of(10, TimeUnit.SECONDS)
        ));

        LOG.info("Flink environment configured, parallelism={}", config.getJobParallelism());
    }

    private static KafkaSource<VideoFrame> createKafkaSource(SnookerAnalysisConfig config) {
        return KafkaSource.<VideoFrame>builder()
                .setBootstrapServers(config.getKafkaBootstrapServers())
                .setTopics(config.getKafkaFrameTopic())
                .setGroupId(config.getKafkaGroupId())
                .setStartingOffsets(OffsetsInitializer.latest())
                .setValueOnlyDeserializer(new VideoFrameDeserializationSchema())
                .build();
    }

    private static KafkaSink<String> createKafkaSink(SnookerAnalysisConfig config) {
        return KafkaSink.<String>builder()
                .setBootstrapServers(config.getKafkaBootstrapServers())
                .setRecordSerializer(KafkaRecordSerializationSchema.builder()
                        .setTopic(config.getKafkaAnalysisTopic())
                        .setValueSerializationSchema(new SimpleStringSchema())
                        .build())
                .setDeliveryGuarantee(DeliveryGuarantee.AT_LEAST_ONCE)
                .build();
    }
}
