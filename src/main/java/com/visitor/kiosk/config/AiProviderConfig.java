package com.visitor.kiosk.config;

import com.visitor.kiosk.provider.DisabledProviders;
import com.visitor.kiosk.provider.OcrProvider;
import com.visitor.kiosk.provider.OpenAiSettings;
import com.visitor.kiosk.provider.OpenAiSpeechToTextProvider;
import com.visitor.kiosk.provider.OpenAiTextToSpeechProvider;
import com.visitor.kiosk.provider.OpenAiVisionOcrProvider;
import com.visitor.kiosk.provider.SpeechToTextProvider;
import com.visitor.kiosk.provider.TextToSpeechProvider;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Wires the OCR / STT / TTS providers. Without an OpenAI key every provider
 * is the disabled stand-in and the endpoints serve demo payloads.
 */
@Configuration
public class AiProviderConfig {

    private static final Logger log = LoggerFactory.getLogger(AiProviderConfig.class);

    @Value("${openai.api-key:${OPENAI_API_KEY:}}")
    private String openAiApiKey;

    @Value("${openai.base-url:https://api.openai.com/v1}")
    private String baseUrl;

    @Value("${openai.model:gpt-4o-mini}")
    private String visionModel;

    @Value("${openai.stt-model:whisper-1}")
    private String sttModel;

    @Value("${openai.tts-model:tts-1}")
    private String ttsModel;

    @Value("${openai.tts-voice:alloy}")
    private String ttsVoice;

    @Value("${openai.max-retries:3}")
    private int maxRetries;

    @Value("${openai.connect-timeout:30s}")
    private Duration connectTimeout;

    @Value("${openai.read-timeout:120s}")
    private Duration readTimeout;

    @Bean
    public OpenAiSettings openAiSettings() {
        return OpenAiSettings.builder()
                .apiKey(StringUtils.trimToEmpty(openAiApiKey))
                .baseUrl(baseUrl)
                .visionModel(visionModel)
                .sttModel(sttModel)
                .ttsModel(ttsModel)
                .ttsVoice(ttsVoice)
                .maxRetries(maxRetries)
                .build();
    }

    @Bean
    public RestTemplate openAiRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .build();
    }

    @Bean
    public OcrProvider ocrProvider(RestTemplate openAiRestTemplate, OpenAiSettings settings) {
        if (!configured(settings)) {
            log.info("OPENAI_API_KEY is not set: OCR uses demo fields");
            return new DisabledProviders.Ocr();
        }
        return new OpenAiVisionOcrProvider(openAiRestTemplate, settings);
    }

    @Bean
    public SpeechToTextProvider speechToTextProvider(RestTemplate openAiRestTemplate, OpenAiSettings settings) {
        if (!configured(settings)) {
            log.info("OPENAI_API_KEY is not set: STT returns dummy transcripts");
            return new DisabledProviders.SpeechToText();
        }
        return new OpenAiSpeechToTextProvider(openAiRestTemplate, settings);
    }

    @Bean
    public TextToSpeechProvider textToSpeechProvider(RestTemplate openAiRestTemplate, OpenAiSettings settings) {
        if (!configured(settings)) {
            log.info("OPENAI_API_KEY is not set: TTS returns silent audio");
            return new DisabledProviders.TextToSpeech();
        }
        return new OpenAiTextToSpeechProvider(openAiRestTemplate, settings);
    }

    private static boolean configured(OpenAiSettings settings) {
        return StringUtils.isNotBlank(settings.getApiKey());
    }
}
