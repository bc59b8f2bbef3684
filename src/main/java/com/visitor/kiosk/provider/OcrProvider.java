package com.visitor.kiosk.provider;

/**
 * Reads the printed text off an ID card or passport image.
 */
public interface OcrProvider {

    /**
     * @throws ProviderUnavailableException when no text could be read
     */
    OcrText readText(byte[] image);

    String name();
}
