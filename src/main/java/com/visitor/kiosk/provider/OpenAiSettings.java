package com.visitor.kiosk.provider;

import lombok.Builder;
import lombok.Getter;

/**
 * Connection settings shared by the OpenAI-backed providers.
 */
@Getter
@Builder
public class OpenAiSettings {

    private final String apiKey;

    @Builder.Default
    private final String baseUrl = "https://api.openai.com/v1";

    @Builder.Default
    private final String visionModel = "gpt-4o-mini";

    @Builder.Default
    private final String sttModel = "whisper-1";

    @Builder.Default
    private final String ttsModel = "tts-1";

    @Builder.Default
    private final String ttsVoice = "alloy";

    @Builder.Default
    private final int maxRetries = 3;

    public String url(String path) {
        return baseUrl.replaceAll("/$", "") + path;
    }
}
