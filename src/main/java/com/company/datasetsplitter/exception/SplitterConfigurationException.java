package com.company.datasetsplitter.exception;

public class SplitterConfigurationException extends SplitterException {
    private final String configProperty;

    public SplitterConfigurationException(String message, String configProperty) {
        super(message);
        this.configProperty = configProperty;
    }

    public SplitterConfigurationException(String message, String configProperty, Throwable cause) {
        super(message, cause);
        this.configProperty = configProperty;
    }

    public String getConfigProperty() {
        return configProperty;
    }
}
