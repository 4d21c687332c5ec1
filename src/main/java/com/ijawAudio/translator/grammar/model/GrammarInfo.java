package com.ijawAudio.translator.grammar.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Size summary of the loaded grammar engine, reported at start-up and by the grammar endpoint.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GrammarInfo {

    @JsonProperty("pronouns_count")
    private int pronounsCount;

    @JsonProperty("verbs_count")
    private int verbsCount;

    @JsonProperty("nouns_count")
    private int nounsCount;

    @JsonProperty("adjectives_count")
    private int adjectivesCount;

    /**
     * Number of generation rules in the cascade.
     */
    @JsonProperty("patterns_count")
    private int patternsCount;

    @JsonProperty("total_dictionary_entries")
    private int totalDictionaryEntries;
}
