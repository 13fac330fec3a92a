package com.openrangelabs.ingestor.connector;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Describes one connection parameter accepted by a connector
 */
@Value
@Builder
public class ConnectionParameter {

    String name;
    String displayName;
    String description;

    @Builder.Default
    String type = "string";

    boolean required;

    /**
     * Secret values are masked in logs and resolved from the credential store by jobs.
     */
    boolean secret;

    String defaultValue;

    /**
     * Free-form validation hint, e.g. {@code range:1-65535}.
     */
    String validation;

    @Singular
    List<String> enumValues;

    String group;

    int order;
}
