package com.raava.concierge.completion.service;

import com.raava.concierge.completion.dto.GroqApiRequest;
import com.raava.concierge.completion.dto.GroqApiResponse;
import com.raava.concierge.exception.TextCompletionException;
import com.raava.concierge.session.model.ConversationTurn;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link TextCompletionClient} backed by Groq's OpenAI-compatible chat completions endpoint.
 */
@Slf4j
@Service
public class GroqTextCompletionClient implements TextCompletionClient {

    private static final String GROQ_API_URL = "https://api.groq.com/openai/v1/chat/completions";
    private static final String DEFAULT_MODEL = "llama-3.3-70b-versatile";

    private final RestClient restClient;

    @Value("${groq.api.key:}")
    private String apiKey;

    @Value("${groq.api.model:" + DEFAULT_MODEL + "}")
    private String model;

    @Value("${groq.api.temperature:0.3}")
    private Double temperature;

    @Value("${groq.api.max-completion-tokens:512}")
    private Integer maxCompletionTokens;

    @Autowired
    public GroqTextCompletionClient(@Value("${raava.completion.timeout:15s}") Duration timeout) {
        this(RestClient.builder()
                .baseUrl(GROQ_API_URL)
                .requestFactory(requestFactory(timeout))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build());
    }

    GroqTextCompletionClient(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public String complete(String systemContext, List<ConversationTurn> turns) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new TextCompletionException("Groq API key is not configured. Set groq.api.key in application.yaml");
        }

        GroqApiRequest request = GroqApiRequest.builder()
                .messages(toMessages(systemContext, turns))
                .model(model)
                .temperature(temperature)
                .maxCompletionTokens(maxCompletionTokens)
                .topP(1.0)
                .stream(false)
                .build();

        GroqApiResponse response;
        try {
            log.debug("Calling Groq API - model: {}, turns: {}", model, turns.size());
            response = restClient.post()
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .body(request)
                    .retrieve()
                    .body(GroqApiResponse.class);
        } catch (RestClientException e) {
            log.error("Error calling Groq API - model: {}, error: {}", model, e.getMessage());
            throw new TextCompletionException("Failed to call Groq API: " + e.getMessage(), e);
        }

        if (response == null || response.getContent() == null) {
            throw new TextCompletionException("Groq API returned an empty response");
        }
        log.debug("Groq API response received - model: {}, tokens used: {}",
                response.getModel(),
                response.getUsage() != null ? response.getUsage().getTotalTokens() : "unknown");
        return response.getContent().trim();
    }

    private static List<GroqApiRequest.Message> toMessages(String systemContext, List<ConversationTurn> turns) {
        List<GroqApiRequest.Message> messages = new ArrayList<>();
        messages.add(message("system", systemContext));
        for (ConversationTurn turn : turns) {
            if (turn.getUserMessage() != null) {
                messages.add(message("user", turn.getUserMessage()));
            }
            if (turn.getReply() != null) {
                messages.add(message("assistant", turn.getReply()));
            }
        }
        return messages;
    }

    private static GroqApiRequest.Message message(String role, String content) {
        return GroqApiRequest.Message.builder()
                .role(role)
                .content(content)
                .build();
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration timeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) timeout.toMillis());
        factory.setReadTimeout((int) timeout.toMillis());
        return factory;
    }
}
