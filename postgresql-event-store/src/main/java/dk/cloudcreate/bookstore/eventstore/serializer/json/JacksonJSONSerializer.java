package dk.cloudcreate.bookstore.eventstore.serializer.json;

import com.fasterxml.jackson.annotation.*;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Strings.lenientFormat;

/**
 * Jackson based {@link JSONSerializer}.<br>
 * The default {@link ObjectMapper} serializes <b>fields</b> (not getters), so events, commands and documents can be plain classes
 * with private fields, a no-arg constructor and getters
 */
public class JacksonJSONSerializer implements JSONSerializer {
    private final ObjectMapper objectMapper;

    public JacksonJSONSerializer() {
        this(createDefaultObjectMapper());
    }

    public JacksonJSONSerializer(ObjectMapper objectMapper) {
        this.objectMapper = checkNotNull(objectMapper, "No objectMapper provided");
    }

    public static ObjectMapper createDefaultObjectMapper() {
        return new ObjectMapper().registerModule(new JavaTimeModule())
                                 .registerModule(new Jdk8Module())
                                 .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                                 .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                                 .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                                 .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE)
                                 .disable(MapperFeature.AUTO_DETECT_GETTERS)
                                 .disable(MapperFeature.AUTO_DETECT_IS_GETTERS)
                                 .disable(MapperFeature.AUTO_DETECT_SETTERS)
                                 .setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY)
                                 .setVisibility(PropertyAccessor.CREATOR, JsonAutoDetect.Visibility.ANY)
                                 .setSerializationInclusion(JsonInclude.Include.ALWAYS);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    @Override
    public String serialize(Object objectToSerialize) {
        checkNotNull(objectToSerialize, "No objectToSerialize provided");
        try {
            return objectMapper.writeValueAsString(objectToSerialize);
        } catch (JsonProcessingException e) {
            throw new JSONSerializationException(lenientFormat("Failed to serialize %s to JSON", objectToSerialize.getClass().getName()), e);
        }
    }

    @Override
    public <T> T deserialize(String json, Class<T> javaType) {
        checkNotNull(json, "No json provided");
        checkNotNull(javaType, "No javaType provided");
        try {
            return objectMapper.readValue(json, javaType);
        } catch (JsonProcessingException e) {
            throw new JSONDeserializationException(lenientFormat("Failed to deserialize JSON to %s", javaType.getName()), e);
        }
    }
}
