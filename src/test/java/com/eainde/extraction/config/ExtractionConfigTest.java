package com.eainde.extraction.config;

import com.eainde.extraction.budget.RateBudgetController;
import com.eainde.extraction.capability.ExtractionCapability;
import com.eainde.extraction.capability.RetryPolicy;
import com.eainde.extraction.pipeline.ExtractionPipelineOrchestrator;
import com.eainde.extraction.pipeline.ExtractionResult;
import com.eainde.extraction.pipeline.SourceFile;
import com.eainde.extraction.pipeline.TenderExtractionService;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExtractionConfigTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(JacksonAutoConfiguration.class))
            .withUserConfiguration(ExtractionConfig.class);

    @Nested
    @DisplayName("Default wiring")
    class DefaultWiring {

        @Test
        @DisplayName("should build every pipeline bean over an OpenAI-compatible chat model")
        void context_shouldWireWholePipeline_whenOnlyApiKeyIsSet() {
            runner.withPropertyValues("extraction.capability.api-key=test-key")
                    .run(context -> {
                        assertThat(context).hasNotFailed();
                        assertThat(context.getBean(ChatModel.class)).isInstanceOf(OpenAiChatModel.class);
                        assertThat(context).hasSingleBean(ExtractionCapability.class)
                                .hasSingleBean(ExtractionPipelineOrchestrator.class)
                                .hasSingleBean(TenderExtractionService.class);
                        assertThat(context.getBean(RetryPolicy.class).maxAttempts()).isEqualTo(5);
                        assertThat(context.getBean(RateBudgetController.class).availableRequests())
                                .isCloseTo(3000, within(1e-6));
                    });
        }

        @Test
        @DisplayName("should apply property overrides to the rate budget and retry policy")
        void context_shouldHonourOverrides_whenPropertiesSet() {
            runner.withPropertyValues(
                            "extraction.capability.api-key=test-key",
                            "extraction.rate.requests-per-minute=10",
                            "extraction.retry.max-attempts=3")
                    .run(context -> {
                        assertThat(context.getBean(RetryPolicy.class).maxAttempts()).isEqualTo(3);
                        assertThat(context.getBean(RateBudgetController.class).availableRequests())
                                .isCloseTo(10, within(1e-6));
                    });
        }
    }

    @Nested
    @DisplayName("Host-supplied chat model")
    class HostChatModel {

        @Test
        @DisplayName("should route a whole run through the supplied chat model")
        void service_shouldExtractThroughSuppliedModel_whenHostProvidesChatModel() {
            // Arrange
            ChatModel chatModel = mock(ChatModel.class);
            when(chatModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                    .aiMessage(AiMessage.from("{\"tender_meta\": {\"tender_id\": \"NIT-42\"}}"))
                    .build());

            runner.withBean(ChatModel.class, () -> chatModel)
                    .run(context -> {
                        assertThat(context).hasSingleBean(ChatModel.class);
                        TenderExtractionService service = context.getBean(TenderExtractionService.class);

                        // Act
                        ExtractionResult result = service.process(List.of(new SourceFile("nit.txt",
                                "Notice inviting tender for road resurfacing works.".getBytes(StandardCharsets.UTF_8))));

                        // Assert
                        verify(chatModel, atLeastOnce()).chat(any(ChatRequest.class));
                        assertThat(result.record().text("tender_meta.tender_id")).isEqualTo("NIT-42");
                        assertThat(result.metadata().filesProcessed()).containsExactly("nit.txt");
                    });
        }
    }
}
