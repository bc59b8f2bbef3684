package com.visitor.kiosk.provider;

import java.util.Optional;

/**
 * Stand-ins used when no AI backend is configured. They never produce
 * output, so every call ends in the demo fallback.
 */
public final class DisabledProviders {

    private DisabledProviders() {
    }

    public static final class Ocr implements OcrProvider {
        @Override
        public OcrText readText(byte[] image) {
            throw new ProviderUnavailableException("OCR provider not configured");
        }

        @Override
        public String name() {
            return "disabled";
        }
    }

    public static final class SpeechToText implements SpeechToTextProvider {
        @Override
        public String transcribe(byte[] audio, String filename, String language) {
            throw new ProviderUnavailableException("Speech recognition not configured");
        }

        @Override
        public String name() {
            return "disabled";
        }
    }

    public static final class TextToSpeech implements TextToSpeechProvider {
        @Override
        public Optional<byte[]> synthesize(String text, String language) {
            return Optional.empty();
        }

        @Override
        public String name() {
            return "disabled";
        }
    }
}
