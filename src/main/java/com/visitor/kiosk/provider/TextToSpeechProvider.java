package com.visitor.kiosk.provider;

import java.util.Optional;

public interface TextToSpeechProvider {

    /**
     * WAV audio for the text, or empty when speech could not be synthesized.
     */
    Optional<byte[]> synthesize(String text, String language);

    String name();
}
