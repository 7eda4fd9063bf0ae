package org.dballot.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import org.dballot.identity.Identity;

import java.io.IOException;

/**
 * Converts between Java objects and JSON using one shared Gson instance.
 * <p>
 * {@link Identity} values are written as plain strings.
 */
public class ConversionUtil {

    private static final Gson gson = new GsonBuilder()
            .registerTypeAdapter(Identity.class, new IdentityAdapter())
            .disableHtmlEscaping()
            .create();

    public static Gson gson() {
        return gson;
    }

    /**
     * Converts any Java object into its JSON string representation.
     *
     * @param object The object to serialize.
     * @return The JSON string representation of the object, or {@code null} for null input.
     */
    public static String toJson(Object object) {
        if (object == null) {
            return null;
        }
        return gson.toJson(object);
    }

    /**
     * Converts a JSON string into an object of the specified class type.
     *
     * @return An instance of the specified class type, or {@code null} if input is empty.
     * @throws JsonParseException if the input is not valid JSON for {@code tClass}
     */
    public static <T> T fromJson(String jsonString, Class<T> tClass) {
        if (jsonString == null || jsonString.isBlank() || tClass == null) {
            return null;
        }
        return gson.fromJson(jsonString, tClass);
    }

    private static final class IdentityAdapter extends TypeAdapter<Identity> {
        @Override
        public void write(JsonWriter out, Identity value) throws IOException {
            if (value == null) {
                out.nullValue();
                return;
            }
            out.value(value.value());
        }

        @Override
        public Identity read(JsonReader in) throws IOException {
            if (in.peek() == JsonToken.NULL) {
                in.nextNull();
                return null;
            }
            try {
                return Identity.of(in.nextString());
            } catch (IllegalArgumentException e) {
                throw new JsonParseException(e.getMessage(), e);
            }
        }
    }
}
