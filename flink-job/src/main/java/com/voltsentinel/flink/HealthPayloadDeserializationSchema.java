package com.voltsentinel.flink;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.voltsentinel.core.model.HealthPayload;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.metrics.Counter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.Objects;

/**
 * Flink {@link DeserializationSchema} that converts raw Kafka bytes into a
 * {@link HealthPayload}.
 * <p>
 * Every message must be a JSON object. Anything else is logged and dropped
 * by returning {@code null}, so one bad record cannot fail the pipeline. The
 * payload's {@code receivedAt} is stamped here and later serves as the
 * fallback timestamp.
 * </p>
 */
public class HealthPayloadDeserializationSchema implements DeserializationSchema<HealthPayload> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(HealthPayloadDeserializationSchema.class);

    private final Clock clock;

    private transient ObjectMapper mapper;
    private transient Counter malformedRecords;

    public HealthPayloadDeserializationSchema() {
        this(Clock.systemUTC());
    }

    HealthPayloadDeserializationSchema(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void open(InitializationContext context) {
        malformedRecords = context.getMetricGroup()
                .addGroup(MonitorMetrics.GROUP)
                .counter("malformed_records_total");
    }

    @Override
    public HealthPayload deserialize(byte[] message) throws IOException {
        if (message == null || message.length == 0) {
            return null;
        }
        try {
            JsonNode node = objectMapper().readTree(message);
            if (node == null || !node.isObject()) {
                LOG.warn("Skipping health message that is not a JSON object");
                countMalformed();
                return null;
            }
            HealthPayload payload = objectMapper().treeToValue(node, HealthPayload.class);
            payload.setReceivedAt(clock.instant());
            return payload;
        } catch (IOException e) {
            LOG.warn("Failed to deserialize health payload - skipping: {}", e.getMessage());
            countMalformed();
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(HealthPayload nextElement) {
        return false;
    }

    @Override
    public TypeInformation<HealthPayload> getProducedType() {
        return TypeInformation.of(HealthPayload.class);
    }

    private void countMalformed() {
        if (malformedRecords != null) {
            malformedRecords.inc();
        }
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        }
        return mapper;
    }
}
