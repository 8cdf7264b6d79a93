package com.visaeligibility.config;

import java.time.Duration;

import org.springframework.ai.ollama.OllamaChatModel;
import org.springframework.ai.ollama.api.OllamaApi;
import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.ai.ollama.management.ModelManagementOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import io.micrometer.observation.ObservationRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Chat model wiring. Temperature defaults to zero and a fixed seed is sent so
 * that the same prompt yields the same completion.
 */
@Slf4j
@Configuration
public class OllamaConfig {

    @Value("${spring.ai.ollama.base-url:http://localhost:11434}")
    private String baseUrl;

    @Value("${spring.ai.ollama.chat.options.model:llama3.1}")
    private String model;

    @Value("${spring.ai.ollama.chat.options.temperature:0.0}")
    private Double temperature;

    @Value("${spring.ai.ollama.chat.options.seed:42}")
    private Integer seed;

    @Value("${spring.ai.ollama.chat.options.num-predict:1024}")
    private Integer numPredict;

    @Value("${spring.ai.ollama.chat.options.top-k:40}")
    private Integer topK;

    @Value("${spring.ai.ollama.chat.options.top-p:0.9}")
    private Double topP;

    @Value("${spring.ai.ollama.chat.options.repeat-penalty:1.1}")
    private Double repeatPenalty;

    @Value("${eligibility.llm.timeout-seconds:60}")
    private Integer timeoutSeconds;

    @Bean
    public OllamaApi ollamaApi() {
        log.info("Initializing Ollama API with base URL: {} (timeout {}s)", baseUrl, timeoutSeconds);

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofSeconds(10));
        requestFactory.setReadTimeout(Duration.ofSeconds(timeoutSeconds));

        return OllamaApi.builder()
                .baseUrl(baseUrl)
                .restClientBuilder(RestClient.builder().requestFactory(requestFactory))
                .build();
    }

    @Bean
    public OllamaOptions defaultOllamaOptions() {
        return OllamaOptions.builder()
                .model(model)
                .temperature(temperature)
                .seed(seed)
                .numPredict(numPredict)
                .topK(topK)
                .topP(topP)
                .repeatPenalty(repeatPenalty)
                .build();
    }

    @Bean
    public ModelManagementOptions modelManagementOptions() {
        return ModelManagementOptions.builder().build();
    }

    @Bean
    public OllamaChatModel ollamaChatModel(
            OllamaApi ollamaApi,
            OllamaOptions defaultOllamaOptions,
            ModelManagementOptions modelManagementOptions) {

        return OllamaChatModel.builder()
                .ollamaApi(ollamaApi)
                .defaultOptions(defaultOllamaOptions)
                .observationRegistry(ObservationRegistry.NOOP)
                .modelManagementOptions(modelManagementOptions)
                .build();
    }
}
