package com.visitor.kiosk.service;

import com.visitor.kiosk.provider.SpeechToTextProvider;
import com.visitor.kiosk.provider.TextToSpeechProvider;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Voice input and output for the kiosk. Failures become a dummy transcript
 * or a silent clip, never an error response.
 */
@Service
public class SpeechService {

    private static final Logger log = LoggerFactory.getLogger(SpeechService.class);

    static final String DEFAULT_STT_LANGUAGE = "en-US";
    static final String DEFAULT_TTS_LANGUAGE = "en";

    /** RIFF/WAVE header for a zero-length 44.1 kHz 16-bit mono clip. */
    static final byte[] SILENT_WAV = {
            'R', 'I', 'F', 'F', 0x24, 0x00, 0x00, 0x00,
            'W', 'A', 'V', 'E', 'f', 'm', 't', ' ',
            0x10, 0x00, 0x00, 0x00, 0x01, 0x00, 0x01, 0x00,
            0x44, (byte) 0xAC, 0x00, 0x00, (byte) 0x88, 0x58, 0x01, 0x00,
            0x02, 0x00, 0x10, 0x00, 'd', 'a', 't', 'a',
            0x00, 0x00, 0x00, 0x00
    };

    private final SpeechToTextProvider sttProvider;
    private final TextToSpeechProvider ttsProvider;

    public SpeechService(SpeechToTextProvider sttProvider, TextToSpeechProvider ttsProvider) {
        this.sttProvider = sttProvider;
        this.ttsProvider = ttsProvider;
    }

    public Map<String, Object> transcribe(byte[] audio, String filename, String language) {
        String lang = StringUtils.defaultIfBlank(language, DEFAULT_STT_LANGUAGE);
        Map<String, Object> result = new LinkedHashMap<>();
        String transcript;
        try {
            transcript = sttProvider.transcribe(audio, filename, lang);
        } catch (Exception e) {
            log.warn("STT via {} failed for {}: {}", sttProvider.name(), filename, e.getMessage());
            transcript = "This is a dummy transcript of the audio (could not perform real STT: "
                    + e.getMessage() + ")";
        }
        result.put("transcript", transcript);
        result.put("language", lang);
        result.put("filename", filename);
        return result;
    }

    public byte[] synthesize(String text, String language) {
        String lang = StringUtils.defaultIfBlank(language, DEFAULT_TTS_LANGUAGE);
        try {
            return ttsProvider.synthesize(text, lang).orElseGet(() -> {
                log.info("TTS via {} produced no audio, sending silent clip", ttsProvider.name());
                return SILENT_WAV.clone();
            });
        } catch (Exception e) {
            log.warn("TTS via {} failed, sending silent clip: {}", ttsProvider.name(), e.getMessage());
            return SILENT_WAV.clone();
        }
    }
}
