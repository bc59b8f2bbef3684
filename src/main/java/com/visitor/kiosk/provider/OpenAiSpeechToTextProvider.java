package com.visitor.kiosk.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

/**
 * Speech-to-Text using OpenAI Whisper. Uploads the kiosk recording as-is,
 * retrying on connection problems with a linear backoff.
 */
public class OpenAiSpeechToTextProvider implements SpeechToTextProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenAiSpeechToTextProvider.class);

    private final RestTemplate restTemplate;
    private final OpenAiSettings settings;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public OpenAiSpeechToTextProvider(RestTemplate restTemplate, OpenAiSettings settings) {
        this.restTemplate = restTemplate;
        this.settings = settings;
    }

    @Override
    public String transcribe(byte[] audio, String filename, String language) {
        if (audio == null || audio.length == 0) {
            throw new ProviderUnavailableException("Audio file is empty");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(settings.getApiKey().trim());
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);

        MultiValueMap<String, Object> form = new LinkedMultiValueMap<>();
        form.add("model", settings.getSttModel());
        form.add("response_format", "json");
        String isoLanguage = toIsoLanguage(language);
        if (isoLanguage != null) {
            form.add("language", isoLanguage);
        }
        String uploadName = StringUtils.defaultIfBlank(filename, "audio.wav");
        form.add("file", new ByteArrayResource(audio) {
            @Override
            public String getFilename() {
                return uploadName;
            }
        });

        HttpEntity<MultiValueMap<String, Object>> request = new HttpEntity<>(form, headers);
        ResponseEntity<String> response = postWithRetry(request);

        try {
            JsonNode node = objectMapper.readTree(response.getBody());
            String transcript = node.path("text").asText("").trim();
            if (transcript.isEmpty()) {
                throw new ProviderUnavailableException("Whisper returned an empty transcript");
            }
            log.info("Transcribed {} bytes ({}) -> {} chars", audio.length, isoLanguage, transcript.length());
            return transcript;
        } catch (ProviderUnavailableException e) {
            throw e;
        } catch (Exception e) {
            throw new ProviderUnavailableException("Unreadable transcription response", e);
        }
    }

    private ResponseEntity<String> postWithRetry(HttpEntity<MultiValueMap<String, Object>> request) {
        String url = settings.url("/audio/transcriptions");
        int attempts = Math.max(1, settings.getMaxRetries());
        for (int attempt = 1; ; attempt++) {
            try {
                return restTemplate.postForEntity(url, request, String.class);
            } catch (HttpClientErrorException.Unauthorized e) {
                log.error("OpenAI API returned 401 Unauthorized. Check openai.api-key (or OPENAI_API_KEY env)");
                throw new ProviderUnavailableException("Speech recognition unauthorized", e);
            } catch (ResourceAccessException e) {
                if (attempt >= attempts) {
                    log.error("STT failed after {} attempts", attempts, e);
                    throw new ProviderUnavailableException("Speech recognition unreachable", e);
                }
                long delayMs = 1000L * attempt; // 1s, 2s, 3s backoff
                log.warn("STT attempt {}/{} failed ({}), retrying in {}ms",
                        attempt, attempts, e.getMessage(), delayMs);
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new ProviderUnavailableException("Speech recognition interrupted", ie);
                }
            } catch (Exception e) {
                throw new ProviderUnavailableException("Speech recognition failed: " + e.getMessage(), e);
            }
        }
    }

    /** Whisper takes ISO-639-1 codes, so en-US becomes en. */
    static String toIsoLanguage(String language) {
        if (StringUtils.isBlank(language)) return null;
        return StringUtils.substringBefore(language.trim(), "-").toLowerCase();
    }

    @Override
    public String name() {
        return "openai-whisper";
    }
}
