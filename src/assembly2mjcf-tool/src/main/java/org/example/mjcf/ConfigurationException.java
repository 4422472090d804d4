package org.example.mjcf;

/** The input cannot be exported as given: no usable root, bad or empty assembly. */
public class ConfigurationException extends ExportException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String kind() {
        return "configuration";
    }
}
