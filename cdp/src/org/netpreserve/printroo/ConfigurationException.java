package org.netpreserve.printroo;

/**
 * An invalid directory, argument or size passed to the converter or browser setup.
 */
public class ConfigurationException extends IllegalArgumentException {
    public ConfigurationException(String message) {
        super(message);
    }
}
