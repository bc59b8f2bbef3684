package com.visitor.kiosk.controller;

import com.visitor.kiosk.service.OcrService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Map;

@RestController
@RequestMapping("/api/ocr")
@Tag(name = "ocr", description = "ID OCR upload")
public class OcrController {

    private static final Logger log = LoggerFactory.getLogger(OcrController.class);

    private final OcrService ocrService;

    public OcrController(OcrService ocrService) {
        this.ocrService = ocrService;
    }

    @Operation(summary = "Upload an ID card or passport image",
            description = "Returns the OCR output, or demo fields when OCR is unavailable.")
    @PostMapping(value = "/upload-id", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<Map<String, Object>> uploadId(@RequestParam("file") MultipartFile file) {
        try {
            return ResponseEntity.ok(ocrService.scanIdDocument(file.getBytes(), file.getOriginalFilename()));
        } catch (IOException e) {
            log.error("Error reading uploaded ID image", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("detail", "Error reading file"));
        }
    }
}
