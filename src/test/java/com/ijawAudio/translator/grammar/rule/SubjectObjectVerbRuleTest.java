package com.ijawAudio.translator.grammar.rule;

import com.ijawAudio.translator.grammar.model.ParsedSlots;
import com.ijawAudio.translator.lexicon.service.Lexicon;
import com.ijawAudio.translator.lexicon.service.WordClassifier;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SubjectObjectVerbRuleTest {

    private final SubjectObjectVerbRule rule = new SubjectObjectVerbRule();

    private GenerationContext context(Lexicon lexicon, ParsedSlots slots) {
        return new GenerationContext("ignored", lexicon.snapshot(), new WordClassifier(), sentence -> slots);
    }

    @Test
    void particleVerbFollowsObject() {
        ParsedSlots slots = ParsedSlots.builder().subject("you").object("water").verb("have").build();

        assertEquals(Optional.of("Ị bení sabi"), rule.apply(context(Lexicon.load(Map.of()), slots)));
    }

    @Test
    void particleIgnoresDictionaryOverrideOfVerb() {
        ParsedSlots slots = ParsedSlots.builder().subject("she").object("yam").verb("eats").build();

        assertEquals(Optional.of("A òkù-ị̀wẹ fị"),
                rule.apply(context(Lexicon.load(Map.of("eats", "yei")), slots)));
    }

    @Test
    void regularVerbIsTranslated() {
        ParsedSlots slots = ParsedSlots.builder().subject("we").object("fish").verb("see").build();

        assertEquals(Optional.of("Wónì ìndí fịnị"), rule.apply(context(Lexicon.load(Map.of()), slots)));
    }

    @Test
    void declinesWhenAnySlotIsMissing() {
        ParsedSlots slots = ParsedSlots.builder().subject("we").verb("see").build();

        assertTrue(rule.apply(context(Lexicon.load(Map.of()), slots)).isEmpty());
    }
}
