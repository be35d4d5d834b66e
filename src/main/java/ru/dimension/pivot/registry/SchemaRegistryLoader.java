package ru.dimension.pivot.registry;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.log4j.Log4j2;
import ru.dimension.pivot.model.schema.DataSourceSchema;
import ru.dimension.pivot.model.schema.ReferenceTable;
import ru.dimension.pivot.util.JsonMapper;

/**
 * Builds the registry from a JSON document, once at process start
 */
@Log4j2
public final class SchemaRegistryLoader {

  private SchemaRegistryLoader() {}

  public static SchemaRegistry fromJson(InputStream inputStream) throws IOException {
    RegistryDocument document = JsonMapper.get().readValue(inputStream, RegistryDocument.class);
    return new SchemaRegistryImpl(document.getDataSources(), document.getReferenceTables());
  }

  public static SchemaRegistry fromClasspath(String resource) throws IOException {
    try (InputStream inputStream = SchemaRegistryLoader.class.getClassLoader().getResourceAsStream(resource)) {
      if (inputStream == null) {
        throw new IOException("Schema resource not found: " + resource);
      }
      log.info("Load schema registry from classpath: " + resource);
      return fromJson(inputStream);
    }
  }

  @Data
  @NoArgsConstructor
  static class RegistryDocument {

    @JsonProperty("data_sources")
    private List<DataSourceSchema> dataSources = new ArrayList<>();

    @JsonProperty("reference_tables")
    private List<ReferenceTable> referenceTables = new ArrayList<>();
  }
}
