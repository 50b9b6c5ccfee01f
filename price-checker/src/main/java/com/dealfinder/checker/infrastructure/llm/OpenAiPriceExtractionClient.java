package com.dealfinder.checker.infrastructure.llm;

import com.dealfinder.checker.application.config.CheckerProperties;
import com.dealfinder.checker.domain.exceptions.ProviderException;
import com.dealfinder.checker.domain.extraction.ModelExtraction;
import com.dealfinder.checker.domain.extraction.PriceExtractionModel;
import com.dealfinder.checker.infrastructure.http.ProviderErrors;
import com.dealfinder.common.json.JacksonConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.ClassPathResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * OpenAI-compatible {@code POST /chat/completions} asking for a JSON object with the price. A reply
 * that cannot be read as that object counts as "no price found" rather than an error, so the
 * extractor can retry it.
 */
@Slf4j
@Component
public class OpenAiPriceExtractionClient implements PriceExtractionModel {

    static final String PROMPT_RESOURCE = "prompts/price_extraction_prompt.txt";
    private static final String PROVIDER = "llm";
    private static final String SYSTEM_PROMPT =
            "You are a product price extractor. Read shop page content and answer with valid JSON only.";
    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);

    private final RestTemplate restTemplate;
    private final CheckerProperties.Llm properties;
    private final ObjectMapper objectMapper = JacksonConfig.createObjectMapper();
    private final String promptTemplate;

    public OpenAiPriceExtractionClient(@Qualifier("llmRestTemplate") RestTemplate restTemplate, CheckerProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties.llm();
        this.promptTemplate = loadPromptTemplate();
    }

    @Override
    public ModelExtraction extract(String productName, String sourceText) {
        var request = new ChatCompletionRequest(
                properties.model(),
                0.0,
                new ChatCompletionRequest.ResponseFormat("json_object"),
                List.of(
                        new ChatCompletionRequest.Message("system", SYSTEM_PROMPT),
                        new ChatCompletionRequest.Message("user", prompt(productName, sourceText))));

        var headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (properties.apiKey() != null && !properties.apiKey().isBlank()) {
            headers.setBearerAuth(properties.apiKey());
        }

        String raw;
        try {
            raw = restTemplate.postForObject(properties.baseUrl() + "/chat/completions",
                    new HttpEntity<>(objectMapper.writeValueAsString(request), headers), String.class);
        } catch (RestClientException e) {
            throw ProviderErrors.classify(PROVIDER, e);
        }

        ChatCompletionResponse response;
        try {
            response = objectMapper.readValue(Objects.requireNonNullElse(raw, "{}"), ChatCompletionResponse.class);
        } catch (JacksonException e) {
            throw ProviderException.of(PROVIDER, "unreadable completion envelope", e);
        }

        var cost = cost(response.usage());
        if (response.choices() == null || response.choices().isEmpty() || response.choices().get(0).message() == null) {
            return ModelExtraction.empty(cost);
        }

        var content = stripCodeFence(response.choices().get(0).message().content());
        try {
            var extracted = objectMapper.readValue(content, ExtractedPrice.class);
            if (extracted == null) {
                return ModelExtraction.empty(cost);
            }
            var candidates = extracted.candidatePrices() == null
                    ? List.<BigDecimal>of()
                    : extracted.candidatePrices().stream().filter(Objects::nonNull).toList();
            return new ModelExtraction(extracted.price(), extracted.currency(), candidates, cost);
        } catch (JacksonException | IllegalArgumentException e) {
            log.debug("Model reply is not a price object: {}", e.getMessage());
            return ModelExtraction.empty(cost);
        }
    }

    private String prompt(String productName, String sourceText) {
        return promptTemplate
                .replace("{PRODUCT_NAME}", productName == null ? "" : productName)
                .replace("{SOURCES}", sourceText);
    }

    private BigDecimal cost(ChatCompletionResponse.Usage usage) {
        if (usage == null) {
            return null;
        }
        var input = properties.inputCostPer1kTokens().multiply(BigDecimal.valueOf(usage.promptTokens()));
        var output = properties.outputCostPer1kTokens().multiply(BigDecimal.valueOf(usage.completionTokens()));
        return input.add(output).divide(THOUSAND, 6, RoundingMode.HALF_UP);
    }

    static String stripCodeFence(String content) {
        if (content == null) {
            return "";
        }
        var cleaned = content.strip();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.strip();
    }

    private static String loadPromptTemplate() {
        try (var in = new ClassPathResource(PROMPT_RESOURCE).getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Missing prompt template " + PROMPT_RESOURCE, e);
        }
    }
}
