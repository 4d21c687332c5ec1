package com.ijawAudio.translator.gateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Response DTO exposing the loaded dictionaries.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DictionaryResponse {

    @JsonProperty("translation_dict")
    private Map<String, String> translationDict;

    @JsonProperty("audio_dict")
    private Map<String, String> audioDict;

    @JsonProperty("translation_count")
    private int translationCount;

    @JsonProperty("audio_count")
    private int audioCount;
}
