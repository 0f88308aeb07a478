package dev.twiliovoice.sdk;

/**
 * Raised when required credentials cannot be resolved while bootstrapping a {@link TwilioClient}.
 */
public final class ConfigurationException extends TwilioException {

    private static final long serialVersionUID = 1L;

    private final String variable;

    public ConfigurationException(String variable) {
        super(variable + " not set");
        this.variable = variable;
    }

    /**
     * @return name of the environment variable that was missing or blank.
     */
    public String getVariable() {
        return variable;
    }
}
