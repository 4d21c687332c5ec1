package com.ijawAudio.translator.grammar.service;

import com.ijawAudio.translator.lexicon.service.Lexicon;
import com.ijawAudio.translator.lexicon.service.WordClassifier;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TranslationGeneratorTest {

    private static TranslationGenerator generator(Map<String, String> phrases) {
        WordClassifier classifier = new WordClassifier();
        return new TranslationGenerator(Lexicon.load(phrases), classifier, new SentenceTagger(classifier));
    }

    private final TranslationGenerator generator = generator(Map.of());

    @Test
    void subjectAdjectiveAppendsCopula() {
        assertEquals("Arí hapi ye", generator.generate("I am happy"));
        assertEquals("A fain ye", generator.generate("she is beautiful"));
    }

    @Test
    void haveUsesParticleAfterObject() {
        assertEquals("Ị bení sabi", generator.generate("you have water"));
        assertEquals("Ị bení sabi", generator.generate("you\u00A0have water"));
    }

    @Test
    void unknownNounFallsToPlainSubjectVerb() {
        assertEquals("A gha", generator.generate("she goes home"));
    }

    @Test
    void whereQuestionUsesObject() {
        assertEquals("ọ́wụ kí ye?", generator.generate("where is the river?"));
    }

    @Test
    void otherQuestions() {
        assertEquals("I bódọụ?", generator.generate("How are you"));
        assertEquals("Ị ìndí sabi?", generator.generate("do you have fish?"));
    }

    @Test
    void questionWithoutObjectFallsThroughToLaterRules() {
        assertEquals("Ị ye", generator.generate("where are you going"));
    }

    @Test
    void possessivePhrases() {
        assertEquals("owéi yè", generator.generate("my father"));
        assertEquals("yè ìwéi-wónì kírimá ye", generator.generate("my ancestors are angry"));
    }

    @Test
    void placeNounBecomesObjectWhenNoObjectPrecedesIt() {
        assertEquals("Arí maket gha", generator.generate("I go to the market"));
    }

    @Test
    void emptyInputGivesEmptyOutput() {
        assertEquals("", generator.generate(""));
        assertEquals("", generator.generate(null));
    }

    @Test
    void verbatimPhraseWinsOverRules() {
        TranslationGenerator withPhrase = generator(Map.of("i am happy", "Arí dei hapi"));

        assertEquals("Arí dei hapi", withPhrase.generate("  I am HAPPY "));
    }

    @Test
    void phraseDictionaryOverridesRoleTablesInsideTemplates() {
        TranslationGenerator withOverride = generator(Map.of("happy", "hapi-o"));

        assertEquals("Arí hapi-o ye", withOverride.generate("I am happy"));
    }

    @Test
    void arbitraryInputNeverThrows() {
        assertEquals("¿¡!!", generator.generate("¿¡!!"));
        assertEquals("你好 世界", generator.generate("你好 世界"));
        assertEquals("Lagos Abuja", generator.generate("Lagos Abuja"));
    }

    @Test
    void sameInputSameOutput() {
        assertEquals(generator.generate("we take fish to the market"), generator.generate("we take fish to the market"));
    }

    @Test
    void cascadeOrderIsFixed() {
        List<String> names = generator.rules().stream().map(rule -> rule.name()).collect(Collectors.toList());

        assertEquals(List.of("verbatim-phrase", "question", "subject-adjective", "subject-object-verb",
                "subject-verb", "possessive-phrase", "token-fallback"), names);
    }
}
