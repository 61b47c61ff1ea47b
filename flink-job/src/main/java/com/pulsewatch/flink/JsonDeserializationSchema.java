package com.pulsewatch.flink;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Flink {@link DeserializationSchema} that reads JSON Kafka values into an
 * input record type.
 * <p>
 * Malformed messages are logged and dropped (returns {@code null}), so a
 * single bad record never fails the pipeline.
 * </p>
 *
 * @param <T> record type
 */
public class JsonDeserializationSchema<T> implements DeserializationSchema<T> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(JsonDeserializationSchema.class);

    private final Class<T> type;
    private transient ObjectMapper mapper;

    public JsonDeserializationSchema(Class<T> type) {
        this.type = Objects.requireNonNull(type, "type must not be null");
    }

    @Override
    public T deserialize(byte[] message) {
        if (message == null || message.length == 0) {
            return null;
        }
        try {
            return objectMapper().readValue(message, type);
        } catch (Exception e) {
            LOG.warn("Failed to deserialize {}, skipping: {}", type.getSimpleName(), e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(T nextElement) {
        return false;
    }

    @Override
    public TypeInformation<T> getProducedType() {
        return TypeInformation.of(type);
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
