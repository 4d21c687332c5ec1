package com.ijawAudio.translator.translation.service;

import com.ijawAudio.translator.grammar.service.GrammarEngine;
import com.ijawAudio.translator.grammar.service.SentenceTagger;
import com.ijawAudio.translator.grammar.service.TranslationGenerator;
import com.ijawAudio.translator.lexicon.service.Lexicon;
import com.ijawAudio.translator.lexicon.service.WordClassifier;
import com.ijawAudio.translator.translation.model.TranslationResult;
import com.ijawAudio.translator.translation.model.TranslationStrategy;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class IjawTranslatorTest {

    private static final String CORRELATION_ID = "test-correlation";

    private final Lexicon lexicon = Lexicon.load(Map.of("hello", "Dó!", "thank you", "Nụ́ à"));
    private final IjawTranslator translator = new IjawTranslator(lexicon, engine(lexicon), 100, 30);

    private static GrammarEngine engine(Lexicon lexicon) {
        WordClassifier classifier = new WordClassifier();
        SentenceTagger tagger = new SentenceTagger(classifier);
        return new GrammarEngine(lexicon, classifier, tagger, new TranslationGenerator(lexicon, classifier, tagger));
    }

    @Test
    void exactPhraseHitComesFirst() {
        TranslationResult result = translator.translate("  Thank You ", CORRELATION_ID);

        assertEquals("Nụ́ à", result.getTranslatedText());
        assertEquals(TranslationStrategy.PHRASE_DICTIONARY, result.getStrategy());
        assertEquals("en", result.getSourceLanguage());
        assertEquals("ijw", result.getTargetLanguage());
    }

    @Test
    void grammarEngineRendersSentences() {
        TranslationResult result = translator.translate("I am happy", CORRELATION_ID);

        assertEquals("Arí hapi ye", result.getTranslatedText());
        assertEquals(TranslationStrategy.GRAMMAR, result.getStrategy());
        assertEquals("I am happy", result.getOriginalText());
    }

    @Test
    void echoedInputFallsBackToWordByWord() {
        TranslationResult punctuated = translator.translate("hello, friend!", CORRELATION_ID);
        TranslationResult unknown = translator.translate("Lagos", CORRELATION_ID);

        assertEquals("Dó! friend!", punctuated.getTranslatedText());
        assertEquals(TranslationStrategy.WORD_BY_WORD, punctuated.getStrategy());
        assertEquals("lagos", unknown.getTranslatedText());
    }

    @Test
    void blankInputTranslatesToEmpty() {
        assertEquals("", translator.translate("   ", CORRELATION_ID).getTranslatedText());
        assertEquals(TranslationStrategy.NONE, translator.translate(null, CORRELATION_ID).getStrategy());
    }

    @Test
    void engineFailureFallsBackToWordByWord() {
        GrammarEngine failing = mock(GrammarEngine.class);
        when(failing.generateTranslation(anyString())).thenThrow(new IllegalStateException("boom"));
        IjawTranslator withFailingEngine = new IjawTranslator(lexicon, failing, 100, 30);

        TranslationResult result = withFailingEngine.translate("hello water", CORRELATION_ID);

        assertEquals("Dó! water", result.getTranslatedText());
        assertEquals(TranslationStrategy.WORD_BY_WORD, result.getStrategy());
    }

    @Test
    void resultsAreCachedUntilInvalidated() {
        GrammarEngine engine = spy(engine(lexicon));
        IjawTranslator cached = new IjawTranslator(lexicon, engine, 100, 30);

        TranslationResult first = cached.translate("you have water", CORRELATION_ID);
        TranslationResult second = cached.translate("you have water ", CORRELATION_ID);

        assertSame(first, second);
        verify(engine, times(1)).generateTranslation(anyString());

        lexicon.publish(lexicon.snapshot().phraseDictionary().with("you have water", "Ị bení sabi o"));
        cached.invalidateCache();

        assertEquals("Ị bení sabi o", cached.translate("you have water", CORRELATION_ID).getTranslatedText());
    }

    @Test
    void resultComputedBeforeDictionaryChangeIsNotServedAfterIt() {
        GrammarEngine engine = mock(GrammarEngine.class);
        IjawTranslator cached = new IjawTranslator(lexicon, engine, 100, 30);
        when(engine.generateTranslation(anyString())).thenAnswer(invocation -> {
            lexicon.publish(lexicon.snapshot().phraseDictionary().with("good morning friend", "Dọ kẹ́nị"));
            cached.invalidateCache();
            return "OLD RENDERING";
        });

        assertEquals("OLD RENDERING", cached.translate("good morning friend", CORRELATION_ID).getTranslatedText());

        TranslationResult after = cached.translate("good morning friend", CORRELATION_ID);
        assertEquals("Dọ kẹ́nị", after.getTranslatedText());
        assertEquals(TranslationStrategy.PHRASE_DICTIONARY, after.getStrategy());
        verify(engine, times(1)).generateTranslation(anyString());
    }

    @Test
    void unicodeSpacesAroundInputAreIgnored() {
        TranslationResult result = translator.translate("\u00A0Thank you\u3000", CORRELATION_ID);

        assertEquals("Nụ́ à", result.getTranslatedText());
        assertEquals(TranslationStrategy.PHRASE_DICTIONARY, result.getStrategy());
        assertEquals(TranslationStrategy.NONE, translator.translate("\u00A0\u3000", CORRELATION_ID).getStrategy());
    }
}
