package com.ijawAudio.translator.gateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HealthResponse {

    @JsonProperty("status")
    private String status;

    @JsonProperty("dictionaries_loaded")
    private boolean dictionariesLoaded;

    @JsonProperty("translation_count")
    private int translationCount;
}
