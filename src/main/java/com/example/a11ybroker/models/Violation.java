package com.example.a11ybroker.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@JsonInclude(Include.NON_NULL)
@Value
@Builder
public class Violation {
    @NonNull String type;
    @NonNull Severity severity;
    @NonNull Long timestamp;
    String description;

    public boolean isCritical() {
        return severity == Severity.CRITICAL;
    }
}
