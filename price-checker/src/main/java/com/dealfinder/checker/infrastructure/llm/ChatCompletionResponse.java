package com.dealfinder.checker.infrastructure.llm;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ChatCompletionResponse(List<Choice> choices, Usage usage) {

    public record Choice(Message message) {}

    public record Message(String content) {}

    public record Usage(
            @JsonProperty("prompt_tokens") long promptTokens,
            @JsonProperty("completion_tokens") long completionTokens) {}
}
