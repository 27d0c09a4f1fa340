package no.cantara.kcr.error;

/** Thrown when engine configuration is missing, unreadable or out of range. */
public class ConfigurationException extends IllegalArgumentException {
    public ConfigurationException(String msg) { super(msg); }

    public ConfigurationException(String msg, Throwable cause) { super(msg, cause); }
}
