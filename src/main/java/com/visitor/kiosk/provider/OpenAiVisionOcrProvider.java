package com.visitor.kiosk.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestTemplate;

import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OCR through an OpenAI vision-capable chat model: the image goes in as a
 * data URL and the model is asked for a plain line-by-line transcription.
 */
public class OpenAiVisionOcrProvider implements OcrProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenAiVisionOcrProvider.class);

    static final String INSTRUCTION =
            "Transcribe all printed text on this identity document, one line per printed line. "
                    + "Return only the text, no commentary.";

    private final RestTemplate restTemplate;
    private final OpenAiSettings settings;
    private final ObjectMapper mapper = new ObjectMapper();

    public OpenAiVisionOcrProvider(RestTemplate restTemplate, OpenAiSettings settings) {
        this.restTemplate = restTemplate;
        this.settings = settings;
    }

    @Override
    public OcrText readText(byte[] image) {
        if (image == null || image.length == 0) {
            throw new ProviderUnavailableException("Image file is empty");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(settings.getApiKey().trim());
        headers.setContentType(MediaType.APPLICATION_JSON);

        String dataUrl = "data:" + sniffImageType(image) + ";base64," + Base64.getEncoder().encodeToString(image);

        Map<String, Object> imagePart = new HashMap<>();
        imagePart.put("type", "image_url");
        imagePart.put("image_url", Map.of("url", dataUrl));

        Map<String, Object> userMessage = new HashMap<>();
        userMessage.put("role", "user");
        userMessage.put("content", List.of(Map.of("type", "text", "text", INSTRUCTION), imagePart));

        Map<String, Object> body = new HashMap<>();
        body.put("model", settings.getVisionModel());
        body.put("temperature", 0);
        body.put("messages", List.of(userMessage));

        String content;
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(
                    settings.url("/chat/completions"), new HttpEntity<>(body, headers), String.class);
            JsonNode root = mapper.readTree(response.getBody());
            content = root.path("choices").path(0).path("message").path("content").asText("");
        } catch (Exception e) {
            throw new ProviderUnavailableException("OCR request failed: " + e.getMessage(), e);
        }

        if (StringUtils.isBlank(content)) {
            throw new ProviderUnavailableException("No text found on the document");
        }
        OcrText text = new OcrText(content);
        log.info("OCR read {} lines from {} byte image", text.getLines().size(), image.length);
        return text;
    }

    // PNG and JPEG cover kiosk cameras and scanners; anything else is sent as JPEG.
    static String sniffImageType(byte[] image) {
        if (image.length >= 4 && (image[0] & 0xFF) == 0x89 && image[1] == 'P' && image[2] == 'N' && image[3] == 'G') {
            return MediaType.IMAGE_PNG_VALUE;
        }
        return MediaType.IMAGE_JPEG_VALUE;
    }

    @Override
    public String name() {
        return "openai-vision";
    }
}
