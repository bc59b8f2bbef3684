package com.visitor.kiosk.provider;

public interface SpeechToTextProvider {

    /**
     * @param audio encoded audio file (wav, mp3, ...)
     * @param filename original upload name, used to tell the format apart
     * @param language BCP-47 tag such as {@code en-US}
     * @throws ProviderUnavailableException when no transcript could be produced
     */
    String transcribe(byte[] audio, String filename, String language);

    String name();
}
