package org.dballot.config;

public final class FileNames {

    public static final String CONFIG_FILE = "ballot.json";
    public static final String DEFAULT_CONFIG_RESOURCE = "/ballot-default.json";

    private FileNames() {
    }
}
