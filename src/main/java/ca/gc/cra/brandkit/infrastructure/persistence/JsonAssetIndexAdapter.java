package ca.gc.cra.brandkit.infrastructure.persistence;

import ca.gc.cra.brandkit.application.port.AssetIndexPort;
import ca.gc.cra.brandkit.domain.asset.AssetRecord;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link AssetIndexPort} persisting {@code asset_registry.json} with the Jackson streaming API.
 *
 * <p>File layout, one object per stored filename:</p>
 * <pre>
 * {
 *   "logo.png" : {
 *     "asset_type" : "logo",
 *     "file_size" : 1024,
 *     "checksum" : "ab12...",
 *     "uploaded_at" : "2024-01-01T00:00:00Z",
 *     "metadata" : { }
 *   }
 * }
 * </pre>
 *
 * @since 0.1.0
 */
public final class JsonAssetIndexAdapter implements AssetIndexPort {
  private final JsonFactory factory = new JsonFactory();

  @Override
  public Map<String, AssetRecord> read(Path indexFile) throws IOException {
    Objects.requireNonNull(indexFile, "indexFile");
    Map<String, AssetRecord> records = new LinkedHashMap<>();
    try (InputStream in = Files.newInputStream(indexFile);
        JsonParser parser = factory.createParser(in)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        return records;
      }
      if (token != JsonToken.START_OBJECT) {
        throw new IOException("Asset index must be a JSON object: " + indexFile);
      }
      while (parser.nextToken() == JsonToken.FIELD_NAME) {
        String filename = parser.getCurrentName();
        JsonToken valueToken = parser.nextToken();
        Object value = readValue(parser, valueToken);
        if (!(value instanceof Map<?, ?> entry)) {
          throw new IOException("Asset index entry '" + filename + "' must be an object");
        }
        records.put(filename, toRecord(filename, entry));
      }
    } catch (NoSuchFileException ex) {
      return records;
    }
    return records;
  }

  @Override
  public void write(Path indexFile, Map<String, AssetRecord> records) throws IOException {
    Objects.requireNonNull(indexFile, "indexFile");
    Objects.requireNonNull(records, "records");
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (JsonGenerator gen = factory.createGenerator(out)) {
      gen.useDefaultPrettyPrinter();
      gen.writeStartObject();
      for (Map.Entry<String, AssetRecord> entry : records.entrySet()) {
        AssetRecord record = entry.getValue();
        gen.writeObjectFieldStart(entry.getKey());
        gen.writeStringField("asset_type", record.assetType());
        gen.writeNumberField("file_size", record.fileSize());
        gen.writeStringField("checksum", record.checksum());
        if (record.uploadedAt() == null) {
          gen.writeNullField("uploaded_at");
        } else {
          gen.writeStringField("uploaded_at", record.uploadedAt());
        }
        gen.writeFieldName("metadata");
        writeValue(gen, record.metadata());
        gen.writeEndObject();
      }
      gen.writeEndObject();
    }
    AtomicFiles.write(indexFile, out.toByteArray());
  }

  private static AssetRecord toRecord(String filename, Map<?, ?> entry) {
    Object size = entry.get("file_size");
    Map<String, Object> metadata = new LinkedHashMap<>();
    if (entry.get("metadata") instanceof Map<?, ?> raw) {
      raw.forEach((k, v) -> metadata.put(String.valueOf(k), v));
    }
    return new AssetRecord(
        filename,
        String.valueOf(Objects.requireNonNullElse(entry.get("asset_type"), "misc")),
        size instanceof Number n ? n.longValue() : 0L,
        String.valueOf(Objects.requireNonNullElse(entry.get("checksum"), "")),
        entry.get("uploaded_at") == null ? null : entry.get("uploaded_at").toString(),
        metadata);
  }

  private static Object readValue(JsonParser parser, JsonToken token) throws IOException {
    if (token == null) {
      throw new IOException("Unexpected end of asset index");
    }
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IOException("Unsupported JSON token: " + token);
    };
  }

  private static Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
      if (token != JsonToken.FIELD_NAME) {
        throw new IOException("Expected field name but found " + token);
      }
      String fieldName = parser.getCurrentName();
      map.put(fieldName, readValue(parser, parser.nextToken()));
    }
    return map;
  }

  private static List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
      list.add(readValue(parser, token));
    }
    return list;
  }

  private static void writeValue(JsonGenerator gen, Object value) throws IOException {
    if (value == null) {
      gen.writeNull();
    } else if (value instanceof Map<?, ?> map) {
      gen.writeStartObject();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        gen.writeFieldName(String.valueOf(entry.getKey()));
        writeValue(gen, entry.getValue());
      }
      gen.writeEndObject();
    } else if (value instanceof Iterable<?> items) {
      gen.writeStartArray();
      for (Object item : items) {
        writeValue(gen, item);
      }
      gen.writeEndArray();
    } else if (value instanceof Boolean b) {
      gen.writeBoolean(b);
    } else if (value instanceof Integer || value instanceof Long || value instanceof Short) {
      gen.writeNumber(((Number) value).longValue());
    } else if (value instanceof Number n) {
      gen.writeNumber(n.doubleValue());
    } else {
      gen.writeString(value.toString());
    }
  }
}
