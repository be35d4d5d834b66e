package ru.dimension.pivot.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper.Builder;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import ru.dimension.pivot.model.config.DashboardConfig;
import ru.dimension.pivot.model.output.ExecuteDashboardResponse;

/**
 * Wire contract mapping: snake_case names, case-insensitive enums
 */
public final class JsonMapper {

  private static final ObjectMapper MAPPER = create();

  private JsonMapper() {}

  public static ObjectMapper get() {
    return MAPPER;
  }

  public static DashboardConfig readConfig(String json) throws JsonProcessingException {
    return MAPPER.readValue(json, DashboardConfig.class);
  }

  public static String writeResponse(ExecuteDashboardResponse response) throws JsonProcessingException {
    return MAPPER.writeValueAsString(response);
  }

  private static ObjectMapper create() {
    Builder builder = com.fasterxml.jackson.databind.json.JsonMapper.builder()
        .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
        .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .addModule(new JavaTimeModule());
    return builder.build();
  }
}
