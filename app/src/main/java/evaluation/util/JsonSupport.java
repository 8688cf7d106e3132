package evaluation.util;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import evaluation.core.ParameterValue;
import evaluation.core.payload.AlgorithmFamily;
import evaluation.core.payload.RawPayload;
import java.io.IOException;
import java.lang.reflect.Type;
import java.math.BigDecimal;

/**
 * Gson configuration shared by every file the pipeline reads or writes. Field names are written in
 * snake case, NaN metrics are allowed, and solver payloads are tagged with their family.
 */
public final class JsonSupport {
  private static final String FAMILY = "family";
  private static final String DATA = "data";

  private static final Gson COMPACT = builder().create();
  private static final Gson PRETTY = builder().setPrettyPrinting().create();

  private JsonSupport() {}

  /** Single-line output, used for append-only archive lines. */
  public static Gson compact() {
    return COMPACT;
  }

  public static Gson pretty() {
    return PRETTY;
  }

  private static GsonBuilder builder() {
    return new GsonBuilder()
        .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
        .serializeSpecialFloatingPointValues()
        .disableHtmlEscaping()
        .registerTypeAdapter(ParameterValue.class, new ParameterValueAdapter().nullSafe())
        .registerTypeAdapter(RawPayload.class, new RawPayloadAdapter());
  }

  private static final class ParameterValueAdapter extends TypeAdapter<ParameterValue> {
    @Override
    public void write(JsonWriter out, ParameterValue value) throws IOException {
      switch (value.kind()) {
        case NUMBER -> out.value(value.asDecimal());
        case BOOLEAN -> out.value(value.asBoolean());
        case STRING -> out.value(value.asString());
      }
    }

    @Override
    public ParameterValue read(JsonReader in) throws IOException {
      JsonToken token = in.peek();
      return switch (token) {
        case NUMBER -> ParameterValue.of(new BigDecimal(in.nextString()));
        case BOOLEAN -> ParameterValue.of(in.nextBoolean());
        case STRING -> ParameterValue.of(in.nextString());
        default ->
            throw new JsonParseException(
                "Expected a scalar parameter value but found " + token + " at " + in.getPath());
      };
    }
  }

  private static final class RawPayloadAdapter
      implements JsonSerializer<RawPayload>, JsonDeserializer<RawPayload> {

    @Override
    public JsonElement serialize(
        RawPayload payload, Type typeOfSrc, JsonSerializationContext context) {
      JsonObject wrapper = new JsonObject();
      wrapper.addProperty(FAMILY, payload.family().name());
      wrapper.add(DATA, context.serialize(payload, payload.getClass()));
      return wrapper;
    }

    @Override
    public RawPayload deserialize(
        JsonElement json, Type typeOfT, JsonDeserializationContext context) {
      if (!json.isJsonObject()) {
        throw new JsonParseException("Payload must be an object: " + json);
      }
      JsonObject wrapper = json.getAsJsonObject();
      if (!wrapper.has(FAMILY) || !wrapper.has(DATA)) {
        throw new JsonParseException("Payload lacks '" + FAMILY + "' or '" + DATA + "': " + json);
      }
      AlgorithmFamily family;
      try {
        family = AlgorithmFamily.valueOf(wrapper.get(FAMILY).getAsString());
      } catch (IllegalArgumentException ex) {
        throw new JsonParseException("Unknown payload family: " + wrapper.get(FAMILY), ex);
      }
      return context.deserialize(wrapper.get(DATA), family.payloadType());
    }
  }
}
