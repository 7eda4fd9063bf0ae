package org.dballot.config;

/**
 * Keys of the JSON configuration file.
 */
public enum ConfigKey {

    PROPOSALS("proposals"),
    ADMINISTRATOR("administrator"),
    LABEL_POLICY("labelPolicy"),
    STORAGE("storage"),
    DB_FILE("dbFile"),
    HOST("host"),
    PORT("port"),
    SIGNATURE_WINDOW_SECONDS("signatureWindowSeconds");

    private final String key;

    ConfigKey(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    @Override
    public String toString() {
        return key;
    }
}
