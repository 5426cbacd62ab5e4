/*
 * Copyright The tracestore Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.storage.postgres;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import zipkin2.internal.Nullable;

/**
 * Reads the {@code process_tags} column, a JSON object. Scalar values become strings; nested
 * objects and arrays are skipped.
 */
final class ProcessTags {
  static final JsonFactory JSON_FACTORY = new JsonFactory();

  static Map<String, String> parse(@Nullable String json) throws IOException {
    if (json == null || json.isEmpty()) return Collections.emptyMap();
    try (JsonParser parser = JSON_FACTORY.createParser(json)) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.VALUE_NULL) return Collections.emptyMap();
      if (token != JsonToken.START_OBJECT) {
        throw new IOException("Invalid process tags, expecting object, got: " + token);
      }
      Map<String, String> result = new LinkedHashMap<>();
      while (parser.nextToken() != JsonToken.END_OBJECT) {
        String key = parser.currentName();
        JsonToken value = parser.nextToken();
        if (value == null) throw new IOException("Invalid process tags, truncated at: " + key);
        if (value.isScalarValue() && value != JsonToken.VALUE_NULL) {
          result.put(key, parser.getText());
        } else {
          parser.skipChildren();
        }
      }
      return result;
    }
  }

  ProcessTags() {
  }
}
