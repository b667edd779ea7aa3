package com.bincfa.config;

/**
 * Raised when the configuration cannot yield a meaningful initial state.
 * Analysis must not go on once this is thrown.
 */
public class IllegalConfigurationException extends RuntimeException {
    private final String registerName;

    public IllegalConfigurationException(String message) {
        this(message, null, null);
    }

    public IllegalConfigurationException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public IllegalConfigurationException(String message, String registerName, Throwable cause) {
        super(message, cause);
        this.registerName = registerName;
    }

    public static IllegalConfigurationException forRegister(String registerName, String message) {
        return new IllegalConfigurationException(message, registerName, null);
    }

    /**
     * @return the offending register, or null when the error is not tied to a register
     */
    public String getRegisterName() {
        return registerName;
    }
}
