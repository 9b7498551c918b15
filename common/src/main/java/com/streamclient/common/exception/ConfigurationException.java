package com.streamclient.common.exception;

/**
 * Invalid, missing or unknown configuration option.
 */
public class ConfigurationException extends MessagingException {

    public ConfigurationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public ConfigurationException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public static ConfigurationException unknownOption(String clientName, String option) {
        ConfigurationException ex = new ConfigurationException(
                ErrorCode.CONFIGURATION_UNKNOWN_OPTION,
                String.format("Unknown option '%s' for %s", option, clientName));
        ex.withContext("client", clientName);
        ex.withContext("option", option);
        return ex;
    }

    public static ConfigurationException invalidValue(String clientName, String option, Object value, String reason) {
        ConfigurationException ex = new ConfigurationException(
                ErrorCode.CONFIGURATION_INVALID_VALUE,
                String.format("Invalid value '%s' for option '%s' of %s: %s", value, option, clientName, reason));
        ex.withContext("client", clientName);
        ex.withContext("option", option);
        return ex;
    }

    public static ConfigurationException missingValue(String clientName, String option) {
        ConfigurationException ex = new ConfigurationException(
                ErrorCode.CONFIGURATION_MISSING_VALUE,
                String.format("Option '%s' of %s must not be empty", option, clientName));
        ex.withContext("client", clientName);
        ex.withContext("option", option);
        return ex;
    }

    public static ConfigurationException unknownDecoder(String clientName, String decoder) {
        ConfigurationException ex = new ConfigurationException(
                ErrorCode.CONFIGURATION_UNKNOWN_DECODER,
                String.format("Unknown decoder '%s' configured for %s", decoder, clientName));
        ex.withContext("client", clientName);
        ex.withContext("decoder", decoder);
        return ex;
    }
}
