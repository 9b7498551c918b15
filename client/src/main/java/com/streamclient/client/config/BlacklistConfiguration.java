package com.streamclient.client.config;

import io.micronaut.context.annotation.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties("messaging.blacklist")
public class BlacklistConfiguration {
    private List<String> topics = new ArrayList<>();
    private List<String> patterns = new ArrayList<>();  // regular expressions, matched against the whole name

    public List<String> getTopics() {
        return topics;
    }

    public void setTopics(List<String> topics) {
        this.topics = topics;
    }

    public List<String> getPatterns() {
        return patterns;
    }

    public void setPatterns(List<String> patterns) {
        this.patterns = patterns;
    }
}
