package com.limitbook.engine.web.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class ErrorDto {
    private String error;
    private String message;
    @Builder.Default
    private Instant timestamp = Instant.now();
}
