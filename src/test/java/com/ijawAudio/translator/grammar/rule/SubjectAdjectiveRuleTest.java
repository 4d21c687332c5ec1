package com.ijawAudio.translator.grammar.rule;

import com.ijawAudio.translator.grammar.model.ParsedSlots;
import com.ijawAudio.translator.lexicon.service.Lexicon;
import com.ijawAudio.translator.lexicon.service.WordClassifier;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SubjectAdjectiveRuleTest {

    private final SubjectAdjectiveRule rule = new SubjectAdjectiveRule();
    private final Lexicon lexicon = Lexicon.load(Map.of());

    @Test
    void appendsCopulaEvenWithoutToBe() {
        ParsedSlots slots = ParsedSlots.builder().subject("they").adjective("tired").build();
        GenerationContext context = new GenerationContext("they tired", lexicon.snapshot(), new WordClassifier(), s -> slots);

        assertEquals(Optional.of("Wónì sik ye"), rule.apply(context));
    }

    @Test
    void declinesWithoutAdjective() {
        ParsedSlots slots = ParsedSlots.builder().subject("they").verb("run").build();
        GenerationContext context = new GenerationContext("they run", lexicon.snapshot(), new WordClassifier(), s -> slots);

        assertTrue(rule.apply(context).isEmpty());
    }
}
