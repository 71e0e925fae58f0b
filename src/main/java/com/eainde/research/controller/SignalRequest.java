package com.eainde.research.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record SignalRequest(
        @JsonProperty("signal_type") String signalType,
        @JsonProperty("subject") String subject,
        @JsonProperty("payload") Map<String, Object> payload
) {
}
