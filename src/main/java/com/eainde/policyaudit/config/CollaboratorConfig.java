package com.eainde.policyaudit.config;

import com.eainde.policyaudit.collaborator.CollaboratorAnswerCache;
import com.eainde.policyaudit.collaborator.LangChain4jReasoningCollaborator;
import com.eainde.policyaudit.collaborator.PolicyReasoningAgent;
import com.eainde.policyaudit.collaborator.ReasoningCollaborator;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.service.AiServices;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Reasoning collaborator over an OpenAI chat model. Only active with
 * {@code policy-audit.collaborator.enabled=true}.
 */
@Log4j2
@Configuration
@ConditionalOnProperty(prefix = "policy-audit.collaborator", name = "enabled", havingValue = "true")
public class CollaboratorConfig {

    @Value("${policy-audit.collaborator.api-key:}")
    private String apiKey;

    @Value("${policy-audit.collaborator.model-name:gpt-4o-mini}")
    private String modelName;

    @Value("${policy-audit.collaborator.temperature:0.0}")
    private double temperature;

    @Value("${policy-audit.collaborator.call-timeout:30s}")
    private Duration callTimeout;

    @Value("${policy-audit.collaborator.cache-dir:}")
    private String cacheDir;

    @Bean
    public ChatModel collaboratorChatModel() {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException(
                    "policy-audit.collaborator.enabled=true but policy-audit.collaborator.api-key is not set");
        }
        log.info("Reasoning collaborator: OpenAI model {}", modelName);
        return OpenAiChatModel.builder()
                .apiKey(apiKey)
                .modelName(modelName)
                .temperature(temperature)
                .timeout(callTimeout)
                .maxRetries(1)
                .build();
    }

    @Bean
    public PolicyReasoningAgent policyReasoningAgent(ChatModel collaboratorChatModel) {
        return AiServices.builder(PolicyReasoningAgent.class)
                .chatModel(collaboratorChatModel)
                .build();
    }

    @Bean
    public CollaboratorAnswerCache collaboratorAnswerCache() {
        if (cacheDir == null || cacheDir.isBlank()) {
            log.info("Collaborator answer cache disabled");
            return CollaboratorAnswerCache.disabled();
        }
        log.info("Collaborator answers cached in {}", cacheDir);
        return new CollaboratorAnswerCache(Path.of(cacheDir), modelName);
    }

    @Bean
    public ReasoningCollaborator reasoningCollaborator(PolicyReasoningAgent agent, ObjectMapper objectMapper,
                                                       CollaboratorAnswerCache collaboratorAnswerCache) {
        return new LangChain4jReasoningCollaborator(agent, objectMapper, collaboratorAnswerCache);
    }
}
