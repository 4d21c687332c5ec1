package com.ijawAudio.translator.gateway.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for translating typed English text.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TextTranslationRequest {

    @NotBlank(message = "text cannot be blank")
    private String text;
}
