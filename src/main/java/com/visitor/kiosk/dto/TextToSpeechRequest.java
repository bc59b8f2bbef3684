package com.visitor.kiosk.dto;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class TextToSpeechRequest {

    private String text;

    private String language = "en";
}
