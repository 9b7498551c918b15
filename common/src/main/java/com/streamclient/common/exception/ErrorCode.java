package com.streamclient.common.exception;

/**
 * Error codes for the messaging client.
 * Organized by category with structured codes for monitoring and alerting.
 */
public enum ErrorCode {

    // ==================== CONSUMER ERRORS (3xxx) ====================
    CONSUMER_EMPTY_POLL(3001, "CONSUMER", "No message available in this poll cycle", true),
    CONSUMER_SUBSCRIPTION_FAILED(3002, "CONSUMER", "Consumer subscription failed", false),
    CONSUMER_POLL_FAILED(3003, "CONSUMER", "Polling the broker failed", false),
    CONSUMER_OFFSET_COMMIT_FAILED(3004, "CONSUMER", "Offset commit failed", false),
    CONSUMER_MESSAGE_RECOVERABLE(3005, "CONSUMER", "Message processing failed transiently", true),

    // ==================== PRODUCER ERRORS (4xxx) ====================
    PRODUCER_TOPIC_BLACKLISTED(4001, "PRODUCER", "Topic is blacklisted for publishing", false),
    PRODUCER_PUBLISH_FAILED(4002, "PRODUCER", "Failed to publish message", true),
    PRODUCER_FLUSH_FAILED(4003, "PRODUCER", "Producer flush did not complete in time", true),
    PRODUCER_NOT_FOUND(4004, "PRODUCER", "No producer supports the given data", false),

    // ==================== CONFIGURATION ERRORS (5xxx) ====================
    CONFIGURATION_UNKNOWN_OPTION(5001, "CONFIGURATION", "Unknown configuration option", false),
    CONFIGURATION_INVALID_VALUE(5002, "CONFIGURATION", "Invalid configuration value", false),
    CONFIGURATION_MISSING_VALUE(5003, "CONFIGURATION", "Required configuration value missing", false),
    CONFIGURATION_UNKNOWN_DECODER(5004, "CONFIGURATION", "Unknown decoder", false),

    // ==================== VALIDATION ERRORS (8xxx) ====================
    VALIDATION_INVALID_MESSAGE(8001, "VALIDATION", "Message failed validation", false),
    VALIDATION_DECODING_FAILED(8002, "VALIDATION", "Message payload could not be decoded", false),
    VALIDATION_BROKER_ERROR_RECORD(8003, "VALIDATION", "Broker returned an error record", false),

    // ==================== UNKNOWN/GENERIC ERRORS (9999) ====================
    UNKNOWN_ERROR(9999, "UNKNOWN", "Unknown error occurred", false);

    private final int code;
    private final String category;
    private final String description;
    private final boolean retriable;

    ErrorCode(int code, String category, String description, boolean retriable) {
        this.code = code;
        this.category = category;
        this.description = description;
        this.retriable = retriable;
    }

    public int getCode() {
        return code;
    }

    public String getCategory() {
        return category;
    }

    public String getDescription() {
        return description;
    }

    public boolean isRetriable() {
        return retriable;
    }

    /**
     * Get ErrorCode by numeric code
     */
    public static ErrorCode fromCode(int code) {
        for (ErrorCode errorCode : values()) {
            if (errorCode.code == code) {
                return errorCode;
            }
        }
        return UNKNOWN_ERROR;
    }

    public boolean isCategory(String category) {
        return this.category.equalsIgnoreCase(category);
    }
}
