package com.openrangelabs.ingestor.connector;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Field of a discovered data structure, typed in the canonical vocabulary
 * ({@code string, integer, long, decimal, boolean, datetime, datetimeoffset, binary, uuid, json}).
 */
@Value
@Builder
@With
public class FieldInfo {

    String name;
    String dataType;
    String nativeType;

    @Builder.Default
    boolean nullable = true;

    boolean primaryKey;
    Integer maxLength;
    Integer precision;
    Integer scale;
    String description;
}
