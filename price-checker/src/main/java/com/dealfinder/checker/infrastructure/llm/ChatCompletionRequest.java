package com.dealfinder.checker.infrastructure.llm;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ChatCompletionRequest(
        String model,
        double temperature,
        @JsonProperty("response_format") ResponseFormat responseFormat,
        List<Message> messages) {

    public record ResponseFormat(String type) {}

    public record Message(String role, String content) {}
}
