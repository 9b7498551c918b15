package com.streamclient.common.configuration;

/**
 * Kind of client a configuration is resolved for
 */
public enum ClientType {
    CONSUMER("consumers"),
    PRODUCER("producers");

    private final String section;

    ClientType(String section) {
        this.section = section;
    }

    /**
     * Name of the configuration section holding group and instance settings
     */
    public String getSection() {
        return section;
    }
}
