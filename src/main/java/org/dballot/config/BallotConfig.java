package org.dballot.config;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.Strictness;
import com.google.gson.stream.JsonReader;
import org.dballot.identity.Identity;
import org.dballot.proposal.LabelPolicy;
import org.dballot.store.BallotStore;
import org.dballot.store.InMemoryBallotStore;
import org.dballot.store.SqliteBallotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Ballot configuration read from a JSON file.
 * <p>
 * Values missing from the file fall back to the classpath defaults in
 * {@value FileNames#DEFAULT_CONFIG_RESOURCE}. The file is parsed leniently, so comments
 * and unquoted keys are accepted.
 */
public class BallotConfig {

    private static final Logger log = LoggerFactory.getLogger(BallotConfig.class);

    public enum StorageType {MEMORY, SQLITE}

    private final List<String> proposals;
    private final Identity administrator;
    private final LabelPolicy labelPolicy;
    private final StorageType storage;
    private final String dbFile;
    private final String host;
    private final int port;
    private final long signatureWindowSeconds;

    private BallotConfig(JsonObject json) {
        this.proposals = readProposals(json);
        this.administrator = readAdministrator(json);
        this.labelPolicy = LabelPolicy.valueOf(string(json, ConfigKey.LABEL_POLICY).toUpperCase(Locale.ROOT));
        this.storage = StorageType.valueOf(string(json, ConfigKey.STORAGE).toUpperCase(Locale.ROOT));
        this.dbFile = string(json, ConfigKey.DB_FILE);
        this.host = string(json, ConfigKey.HOST);
        this.port = required(json, ConfigKey.PORT).getAsInt();
        this.signatureWindowSeconds = required(json, ConfigKey.SIGNATURE_WINDOW_SECONDS).getAsLong();

        if (port < 0 || port > 65535)
            throw new IllegalArgumentException("Invalid port: " + port);
        if (signatureWindowSeconds <= 0)
            throw new IllegalArgumentException("signatureWindowSeconds must be > 0");
    }

    /**
     * Loads {@value FileNames#CONFIG_FILE} from the working directory if present, else the defaults.
     */
    public static BallotConfig load() {
        Path local = Path.of(FileNames.CONFIG_FILE);
        return Files.exists(local) ? load(local) : defaults();
    }

    public static BallotConfig load(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            log.info("[BallotConfig] Loading " + path.toAbsolutePath());
            return fromReader(reader);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config " + path + ": " + e.getMessage(), e);
        }
    }

    public static BallotConfig defaults() {
        return new BallotConfig(readDefaults());
    }

    public static BallotConfig fromReader(Reader reader) {
        JsonObject merged = readDefaults();
        parse(reader).entrySet().forEach(e -> merged.add(e.getKey(), e.getValue()));
        return new BallotConfig(merged);
    }

    private static JsonObject readDefaults() {
        InputStream in = BallotConfig.class.getResourceAsStream(FileNames.DEFAULT_CONFIG_RESOURCE);
        if (in == null)
            throw new IllegalStateException("Missing classpath resource " + FileNames.DEFAULT_CONFIG_RESOURCE);
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return parse(reader);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read default config: " + e.getMessage(), e);
        }
    }

    private static JsonObject parse(Reader reader) {
        JsonReader jsonReader = new JsonReader(reader);
        jsonReader.setStrictness(Strictness.LENIENT);
        try {
            JsonElement element = JsonParser.parseReader(jsonReader);
            if (!element.isJsonObject())
                throw new IllegalArgumentException("Config must be a JSON object");
            return element.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed config: " + e.getMessage(), e);
        }
    }

    private static JsonElement required(JsonObject json, ConfigKey key) {
        JsonElement value = json.get(key.key());
        if (value == null || value.isJsonNull())
            throw new IllegalArgumentException("Missing config key: " + key);
        return value;
    }

    private static String string(JsonObject json, ConfigKey key) {
        return required(json, key).getAsString();
    }

    private static List<String> readProposals(JsonObject json) {
        JsonElement element = required(json, ConfigKey.PROPOSALS);
        if (!element.isJsonArray())
            throw new IllegalArgumentException(ConfigKey.PROPOSALS + " must be an array");
        JsonArray array = element.getAsJsonArray();
        List<String> names = new ArrayList<>(array.size());
        array.forEach(e -> names.add(e.getAsString()));
        return Collections.unmodifiableList(names);
    }

    private static Identity readAdministrator(JsonObject json) {
        JsonElement element = json.get(ConfigKey.ADMINISTRATOR.key());
        if (element == null || element.isJsonNull() || element.getAsString().isBlank())
            return null;
        return Identity.of(element.getAsString());
    }

    /**
     * Opens the configured store.
     */
    public BallotStore openStore() {
        return switch (storage) {
            case MEMORY -> new InMemoryBallotStore();
            case SQLITE -> new SqliteBallotStore(dbFile);
        };
    }

    public List<String> getProposals() {
        return proposals;
    }

    /**
     * @return the configured administrator, or null when none is set
     */
    public Identity getAdministrator() {
        return administrator;
    }

    public LabelPolicy getLabelPolicy() {
        return labelPolicy;
    }

    public StorageType getStorage() {
        return storage;
    }

    public String getDbFile() {
        return dbFile;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public long getSignatureWindowSeconds() {
        return signatureWindowSeconds;
    }

    @Override
    public String toString() {
        return "BallotConfig{" +
                "proposals=" + proposals +
                ", administrator=" + administrator +
                ", labelPolicy=" + labelPolicy +
                ", storage=" + storage +
                ", dbFile='" + dbFile + '\'' +
                ", host='" + host + '\'' +
                ", port=" + port +
                ", signatureWindowSeconds=" + signatureWindowSeconds +
                '}';
    }
}
