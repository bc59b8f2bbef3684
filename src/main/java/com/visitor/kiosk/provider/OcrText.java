package com.visitor.kiosk.provider;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Raw OCR output plus its non-blank lines, trimmed.
 */
public final class OcrText {

    private final String text;
    private final List<String> lines;

    public OcrText(String text) {
        this.text = text == null ? "" : text;
        this.lines = Arrays.stream(this.text.split("\\R"))
                .map(String::trim)
                .filter(l -> !l.isEmpty())
                .collect(Collectors.toUnmodifiableList());
    }

    public String getText() {
        return text;
    }

    public List<String> getLines() {
        return lines;
    }
}
