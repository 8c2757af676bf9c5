package se.alipsa.refbridge.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import se.alipsa.refbridge.data.RowBatch;
import se.alipsa.refbridge.serde.PageFormatException;
import se.alipsa.refbridge.serde.PrestoPageDeserializer;
import se.alipsa.refbridge.type.Type;
import se.alipsa.refbridge.type.TypeParser;

/** One JSON document of the Presto statement protocol. */
public final class ServerResponse {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final JsonNode response;

  private ServerResponse(JsonNode response) {
    this.response = response;
  }

  /**
   * Parse a response body.
   *
   * @param json
   *          the body text
   * @return the response
   * @throws ReferenceQueryException
   *           if the body is not a JSON object
   */
  public static ServerResponse parse(String json) throws ReferenceQueryException {
    JsonNode node;
    try {
      node = MAPPER.readTree(json);
    } catch (JsonProcessingException e) {
      throw new ReferenceQueryException("Malformed response from Presto: " + e.getOriginalMessage(), e);
    }
    if (node == null || !node.isObject()) {
      throw new ReferenceQueryException("Malformed response from Presto: expected a JSON object but got " + json);
    }
    return new ServerResponse(node);
  }

  /**
   * Fail if the engine reported an error.
   *
   * @throws ReferenceQueryException
   *           carrying the engine's error code and message
   */
  public void throwIfFailed() throws ReferenceQueryException {
    JsonNode error = response.get("error");
    if (error == null || error.isNull()) {
      return;
    }
    throw new ReferenceQueryException("Presto query failed: " + error.path("errorCode").asInt() + " "
        + error.path("message").asText());
  }

  public String queryId() {
    return response.path("id").asText();
  }

  public boolean queryCompleted() {
    JsonNode next = response.get("nextUri");
    return next == null || next.isNull();
  }

  public String nextUri() {
    return response.path("nextUri").asText();
  }

  /**
   * Decode the result pages carried by this response.
   *
   * @param deserializer
   *          the page decoder
   * @return one batch per {@code binaryData} entry, empty if there are none
   * @throws ReferenceQueryException
   *           if the column metadata or a page cannot be decoded
   */
  public List<RowBatch> queryResults(PrestoPageDeserializer deserializer) throws ReferenceQueryException {
    JsonNode binaryData = response.get("binaryData");
    if (binaryData == null || binaryData.isNull()) {
      return List.of();
    }
    Type rowType = rowType();
    List<RowBatch> batches = new ArrayList<>(binaryData.size());
    for (JsonNode encoded : binaryData) {
      try {
        batches.add(deserializer.decodePage(encoded.asText(), rowType));
      } catch (PageFormatException e) {
        throw new ReferenceQueryException("Failed to decode result page of query " + queryId() + ": "
            + e.getMessage(), e);
      }
    }
    return batches;
  }

  private Type rowType() throws ReferenceQueryException {
    JsonNode columns = response.get("columns");
    if (columns == null || !columns.isArray()) {
      throw new ReferenceQueryException("Response of query " + queryId() + " has data but no columns");
    }
    List<String> names = new ArrayList<>(columns.size());
    List<Type> types = new ArrayList<>(columns.size());
    for (JsonNode column : columns) {
      names.add(column.path("name").asText());
      try {
        types.add(TypeParser.parse(column.path("type").asText()));
      } catch (IllegalArgumentException e) {
        throw new ReferenceQueryException("Unsupported result column type: " + e.getMessage(), e);
      }
    }
    return Type.row(names, types);
  }
}
