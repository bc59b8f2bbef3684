package com.visitor.kiosk.service;

import com.visitor.kiosk.provider.OcrProvider;
import com.visitor.kiosk.provider.OcrText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * ID document OCR for the kiosk scanner. Any provider failure yields the
 * demo fields so the kiosk flow never stalls on a scan.
 */
@Service
public class OcrService {

    private static final Logger log = LoggerFactory.getLogger(OcrService.class);

    static final Map<String, Object> DEMO_FIELDS = demoFields();

    private final OcrProvider ocrProvider;

    public OcrService(OcrProvider ocrProvider) {
        this.ocrProvider = ocrProvider;
    }

    public Map<String, Object> scanIdDocument(byte[] image, String filename) {
        Map<String, Object> result = new LinkedHashMap<>();
        try {
            OcrText text = ocrProvider.readText(image);
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("ocr_text", text.getText());
            fields.put("lines", text.getLines());
            result.put("status", "success");
            result.put("ocr_fields", fields);
            result.put("filename", filename);
        } catch (Exception e) {
            log.warn("OCR via {} failed for {}, using demo fields: {}", ocrProvider.name(), filename, e.getMessage());
            result.put("status", "fallback");
            result.put("ocr_fields", DEMO_FIELDS);
            result.put("filename", filename);
            result.put("message", e.getMessage());
        }
        return result;
    }

    private static Map<String, Object> demoFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("full_name", "Demo Person");
        fields.put("id_number", "ID123456789");
        fields.put("dob", "1990-01-01");
        return Collections.unmodifiableMap(fields);
    }
}
