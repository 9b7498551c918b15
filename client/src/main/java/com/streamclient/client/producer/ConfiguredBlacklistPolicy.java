package com.streamclient.client.producer;

import com.streamclient.client.config.BlacklistConfiguration;
import com.streamclient.common.api.BlacklistPolicy;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Blacklist made of the Kafka internal topics plus configured names and patterns
 */
@Singleton
public class ConfiguredBlacklistPolicy implements BlacklistPolicy {
    private static final Logger log = LoggerFactory.getLogger(ConfiguredBlacklistPolicy.class);

    static final List<String> INTERNAL_TOPICS = List.of("__consumer_offsets", "__transaction_state");

    private final Set<String> topics = new HashSet<>(INTERNAL_TOPICS);
    private final List<Pattern> patterns = new ArrayList<>();

    public ConfiguredBlacklistPolicy(BlacklistConfiguration configuration) {
        if (configuration.getTopics() != null) {
            topics.addAll(configuration.getTopics());
        }
        if (configuration.getPatterns() != null) {
            for (String pattern : configuration.getPatterns()) {
                patterns.add(Pattern.compile(pattern));
            }
        }
        log.info("Topic blacklist: {} name(s), {} pattern(s)", topics.size(), patterns.size());
    }

    @Override
    public boolean isBlacklisted(String topic) {
        if (topics.contains(topic)) {
            return true;
        }
        for (Pattern pattern : patterns) {
            if (pattern.matcher(topic).matches()) {
                return true;
            }
        }
        return false;
    }
}
