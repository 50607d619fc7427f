package ca.gc.cra.dataflow.infrastructure.artifact;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.UUID;

/**
 * <strong>What:</strong> Shared JSON configuration for artifact payloads.
 * <p><strong>Why:</strong> Every storage adapter must render the same payload to the same bytes so stored
 * artifacts can be compared across runs.</p>
 * <p><strong>Thread-safety:</strong> The mapper is configured once and then only read.</p>
 *
 * @since 0.1.0
 */
public final class ArtifactJson {
  private static final ObjectMapper MAPPER = JsonMapper.builder()
      .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
      .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
      .enable(SerializationFeature.INDENT_OUTPUT)
      .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
      .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
      .addModule(new JavaTimeModule())
      .build();

  private ArtifactJson() {}

  /**
   * Returns the shared mapper.
   *
   * @return configured mapper
   */
  public static ObjectMapper mapper() {
    return MAPPER;
  }

  /**
   * Serializes an artifact payload.
   *
   * @param data payload; may be {@code null}
   * @return indented JSON text
   * @throws JsonProcessingException if the payload cannot be serialized
   */
  public static String write(Object data) throws JsonProcessingException {
    return MAPPER.writeValueAsString(data);
  }

  /**
   * Builds the relative storage key {@code <resourceRunId>/<step>/<artifact>}.
   *
   * @param resourceRunId resource run identifier
   * @param stepName step name
   * @param artifactName artifact name
   * @return storage key
   */
  public static String storageKey(UUID resourceRunId, String stepName, String artifactName) {
    return compact(resourceRunId) + "/" + stepName + "/" + artifactName;
  }

  static String compact(UUID id) {
    return id.toString().replace("-", "");
  }
}
