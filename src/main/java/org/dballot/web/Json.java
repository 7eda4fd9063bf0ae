package org.dballot.web;

import com.google.gson.JsonParseException;
import org.dballot.util.ConversionUtil;

public class Json {

    public static <T> T body(String body, Class<T> cls) {
        T obj;
        try {
            obj = ConversionUtil.fromJson(body, cls);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid JSON");
        }
        if (obj == null) throw new IllegalArgumentException("Invalid JSON");
        return obj;
    }
}
