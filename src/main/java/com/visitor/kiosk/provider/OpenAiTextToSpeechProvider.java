package com.visitor.kiosk.provider;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Text-to-Speech through the OpenAI speech endpoint, returned as WAV.
 * The voice picks up the language from the text itself.
 */
public class OpenAiTextToSpeechProvider implements TextToSpeechProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenAiTextToSpeechProvider.class);

    private final RestTemplate restTemplate;
    private final OpenAiSettings settings;

    public OpenAiTextToSpeechProvider(RestTemplate restTemplate, OpenAiSettings settings) {
        this.restTemplate = restTemplate;
        this.settings = settings;
    }

    @Override
    public Optional<byte[]> synthesize(String text, String language) {
        if (StringUtils.isBlank(text)) {
            return Optional.empty();
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(settings.getApiKey().trim());
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_OCTET_STREAM, MediaType.ALL));

        Map<String, Object> body = new HashMap<>();
        body.put("model", settings.getTtsModel());
        body.put("voice", settings.getTtsVoice());
        body.put("input", text);
        body.put("response_format", "wav");

        try {
            ResponseEntity<byte[]> response = restTemplate.postForEntity(
                    settings.url("/audio/speech"), new HttpEntity<>(body, headers), byte[].class);
            byte[] audio = response.getBody();
            if (audio == null || audio.length == 0) {
                log.warn("TTS returned no audio for {} chars ({})", text.length(), language);
                return Optional.empty();
            }
            log.info("Synthesized {} chars ({}) -> {} bytes", text.length(), language, audio.length);
            return Optional.of(audio);
        } catch (Exception e) {
            log.warn("TTS request failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public String name() {
        return "openai-tts";
    }
}
