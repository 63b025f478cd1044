/* (C)2026 */
package com.ammann.imagebuilder.exception;

/**
 * Thrown when a declarative specification line does not match its expected pattern.
 *
 * <p>Raised before any container exists, so no cleanup is required.
 */
public class InvalidFormatException extends BuildException {

    private final String optionName;
    private final String spec;
    private final String imageName;

    /**
     * Constructs a new exception for a malformed specification line.
     *
     * @param optionName the configuration option the line belongs to (e.g. {@code volume_from})
     * @param spec       the raw specification text
     * @param imageName  the image whose configuration contains the line
     */
    public InvalidFormatException(String optionName, String spec, String imageName) {
        super(
                "Invalid "
                        + optionName
                        + " specification '"
                        + spec
                        + "' for image "
                        + imageName);
        this.optionName = optionName;
        this.spec = spec;
        this.imageName = imageName;
    }

    public String getOptionName() {
        return optionName;
    }

    public String getSpec() {
        return spec;
    }

    public String getImageName() {
        return imageName;
    }
}
