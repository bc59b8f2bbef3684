package com.visitor.kiosk.controller;

import com.visitor.kiosk.dto.TextToSpeechRequest;
import com.visitor.kiosk.service.SpeechService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Map;

@RestController
@RequestMapping("/api/speech")
@Tag(name = "speech", description = "STT/TTS APIs")
public class SpeechController {

    private static final Logger log = LoggerFactory.getLogger(SpeechController.class);

    static final MediaType AUDIO_WAV = MediaType.parseMediaType("audio/wav");

    private final SpeechService speechService;

    public SpeechController(SpeechService speechService) {
        this.speechService = speechService;
    }

    @Operation(summary = "Speech to text", description = "Accepts an audio file and returns its transcript.")
    @PostMapping(value = "/stt", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> speechToText(@RequestParam("file") MultipartFile file,
                                          @RequestParam(value = "language", defaultValue = "en-US") String language) {
        try {
            return ResponseEntity.ok(speechService.transcribe(file.getBytes(), file.getOriginalFilename(), language));
        } catch (IOException e) {
            log.error("Error reading uploaded audio", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("detail", "Error reading file"));
        }
    }

    @Operation(summary = "Text to speech", description = "Returns WAV audio, or a silent clip when TTS is unavailable.")
    @PostMapping("/tts")
    public ResponseEntity<?> textToSpeech(@RequestBody TextToSpeechRequest request) {
        if (request.getText() == null) {
            return ResponseEntity.badRequest().contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("detail", "text required"));
        }
        byte[] wav = speechService.synthesize(request.getText(), request.getLanguage());
        return ResponseEntity.ok()
                .contentType(AUDIO_WAV)
                .contentLength(wav.length)
                .body(wav);
    }
}
