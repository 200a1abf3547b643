package com.ocibiz.observability;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.event.KeyValuePair;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders each logging event as a single-line JSON object.
 * <p>
 * Field order is fixed: {@code timestamp}, {@code level}, {@code logger}, {@code message}, then
 * {@code request_id} when a correlation identifier was installed on the logging thread, then the
 * event's key/value pairs merged at the top level, then {@code exception} when the event carries
 * a throwable. Absent optional fields are omitted, never written as {@code null}.
 * <p>
 * Extra fields never overwrite the fixed fields; a colliding key is dropped. Values Jackson cannot
 * serialize are written as their {@code toString()}, and dropped if even that fails. Keys that look
 * like credentials are masked by the {@link SensitiveDataRedactor}.
 */
public class JsonLogLayout extends StructuredLayoutBase {

    public static final String FIELD_TIMESTAMP = "timestamp";
    public static final String FIELD_LEVEL = "level";
    public static final String FIELD_LOGGER = "logger";
    public static final String FIELD_MESSAGE = "message";
    public static final String FIELD_REQUEST_ID = CorrelationContextHolder.MDC_REQUEST_ID;
    public static final String FIELD_EXCEPTION = "exception";

    static final Set<String> RESERVED_FIELDS = Set.of(
            FIELD_TIMESTAMP, FIELD_LEVEL, FIELD_LOGGER, FIELD_MESSAGE, FIELD_REQUEST_ID, FIELD_EXCEPTION);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    private final SensitiveDataRedactor redactor;

    public JsonLogLayout() {
        this(Clock.systemUTC(), new SensitiveDataRedactor());
    }

    public JsonLogLayout(Clock clock, SensitiveDataRedactor redactor) {
        super(clock);
        if (redactor == null) {
            throw new IllegalArgumentException("redactor must not be null");
        }
        this.redactor = redactor;
    }

    @Override
    protected String format(ILoggingEvent event, Instant timestamp) {
        ObjectNode record = MAPPER.createObjectNode();
        record.put(FIELD_TIMESTAMP, formatTimestamp(timestamp));
        record.put(FIELD_LEVEL, levelLabel(event));
        record.put(FIELD_LOGGER, loggerName(event));
        record.put(FIELD_MESSAGE, event.getFormattedMessage());

        String requestId = requestId(event);
        if (requestId != null) {
            record.put(FIELD_REQUEST_ID, requestId);
        }

        mergeExtras(record, event.getKeyValuePairs());

        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            record.put(FIELD_EXCEPTION, ThrowableProxyUtil.asString(throwable).stripTrailing());
        }

        try {
            return MAPPER.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize log record", e);
        }
    }

    @Override
    protected String fallback(ILoggingEvent event, Instant timestamp) {
        ObjectNode record = MAPPER.createObjectNode();
        record.put(FIELD_TIMESTAMP, formatTimestamp(timestamp));
        record.put(FIELD_LEVEL, levelLabel(event));
        record.put(FIELD_LOGGER, loggerName(event));
        record.put(FIELD_MESSAGE, rawMessage(event));
        return record.toString();
    }

    private void mergeExtras(ObjectNode record, List<KeyValuePair> pairs) {
        if (pairs == null || pairs.isEmpty()) {
            return;
        }
        for (KeyValuePair pair : pairs) {
            if (pair == null || pair.key == null || RESERVED_FIELDS.contains(pair.key)) {
                continue;
            }
            if (redactor.isSensitive(pair.key)) {
                record.put(pair.key, SensitiveDataRedactor.REDACTED);
                continue;
            }
            JsonNode value = toJsonNode(pair.value);
            if (value != null) {
                record.set(pair.key, value);
            }
        }
    }

    private static JsonNode toJsonNode(Object value) {
        if (value == null) {
            return NullNode.getInstance();
        }
        try {
            return MAPPER.valueToTree(value);
        } catch (RuntimeException notSerializable) {
            try {
                return TextNode.valueOf(String.valueOf(value));
            } catch (RuntimeException brokenToString) {
                return null;
            }
        }
    }

    private static String requestId(ILoggingEvent event) {
        Map<String, String> mdc = event.getMDCPropertyMap();
        if (mdc == null) {
            return null;
        }
        String requestId = mdc.get(CorrelationContextHolder.MDC_REQUEST_ID);
        return requestId == null || requestId.isBlank() ? null : requestId;
    }

    private static String formatTimestamp(Instant timestamp) {
        return TIMESTAMP_FORMAT.format(timestamp.atOffset(ZoneOffset.UTC));
    }
}
