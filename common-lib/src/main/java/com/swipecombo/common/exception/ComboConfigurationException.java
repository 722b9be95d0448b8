package com.swipecombo.common.exception;

/**
 * Raised when a combo engine is built from settings it cannot honour: a gapped or
 * non-monotonic level table, an unparsable threshold string, a non-positive decay window.
 *
 * <p>Thrown at construction time only. A classifier or tracker that exists is valid.
 */
public class ComboConfigurationException extends RuntimeException {
    private final String setting;

    public ComboConfigurationException(String setting, String message) {
        super("[" + setting + "] " + message);
        this.setting = setting;
    }

    public ComboConfigurationException(String setting, String message, Throwable cause) {
        super("[" + setting + "] " + message, cause);
        this.setting = setting;
    }

    public String getSetting() {
        return setting;
    }
}
