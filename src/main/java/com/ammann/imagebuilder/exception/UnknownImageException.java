/* (C)2026 */
package com.ammann.imagebuilder.exception;

/** Thrown when a build is requested for an image that has no configured definition. */
public class UnknownImageException extends BuildException {

    private final String imageName;

    public UnknownImageException(String imageName) {
        super("No image definition configured for: " + imageName);
        this.imageName = imageName;
    }

    public String getImageName() {
        return imageName;
    }
}
