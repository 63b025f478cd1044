package com.ammann.imagebuilder.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/** Path constants for the REST API. */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1 endpoints. */
    public static final String BASE_URL_V1 = "/api/v1";

    public static final class Builds {
        private Builds() {}

        public static final String BASE = "/builds";
    }

    public static final class Images {
        private Images() {}

        public static final String BASE = "/images";
    }
}
