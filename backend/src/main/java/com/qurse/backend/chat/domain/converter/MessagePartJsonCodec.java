package com.qurse.backend.chat.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.qurse.backend.chat.domain.MessagePart;
import java.io.IOException;
import java.util.Collections;
import java.util.List;

/** Maps a part sequence to and from the {@code jsonb} column that stores it. */
public final class MessagePartJsonCodec {

  private static final TypeReference<List<MessagePart>> TYPE = new TypeReference<>() {};
  private static final JsonMapper MAPPER =
      JsonMapper.builder()
          .findAndAddModules()
          .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
          .build();

  private MessagePartJsonCodec() {}

  public static JsonNode encode(List<MessagePart> parts) {
    if (parts == null) {
      return MAPPER.createArrayNode();
    }
    return MAPPER.valueToTree(parts);
  }

  public static List<MessagePart> decode(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return List.of();
    }
    try {
      List<MessagePart> parts = MAPPER.readerFor(TYPE).readValue(node);
      if (parts == null || parts.isEmpty()) {
        return List.of();
      }
      return Collections.unmodifiableList(parts);
    } catch (IOException exception) {
      throw new IllegalStateException("Failed to convert JSON to List<MessagePart>", exception);
    }
  }
}
