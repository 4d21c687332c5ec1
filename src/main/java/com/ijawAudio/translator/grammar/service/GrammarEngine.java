package com.ijawAudio.translator.grammar.service;

import com.ijawAudio.translator.grammar.model.GrammarInfo;
import com.ijawAudio.translator.grammar.model.ParsedSlots;
import com.ijawAudio.translator.lexicon.IjawWordTables;
import com.ijawAudio.translator.lexicon.model.WordRole;
import com.ijawAudio.translator.lexicon.service.Lexicon;
import com.ijawAudio.translator.lexicon.service.WordClassifier;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Grammar engine - the rule-based English to Ijaw core as seen by the service layer.
 *
 * Responsibilities:
 * - Classify single tokens
 * - Tag sentences into subject/object/verb/... slots
 * - Generate Ijaw text through the template cascade
 *
 * Stateless across calls apart from the lexicon snapshot, safe for concurrent use.
 */
@Service
@RequiredArgsConstructor
public class GrammarEngine {

    private final Lexicon lexicon;
    private final WordClassifier wordClassifier;
    private final SentenceTagger sentenceTagger;
    private final TranslationGenerator translationGenerator;

    public WordRole classify(String token) {
        return wordClassifier.classify(token);
    }

    public ParsedSlots parseSentence(String sentence) {
        return sentenceTagger.parse(sentence);
    }

    public String generateTranslation(String sentence) {
        return translationGenerator.generate(sentence);
    }

    /**
     * Translates one token through the phrase dictionary and role tables, passing unknown tokens through.
     */
    public String translateToken(String token) {
        return lexicon.snapshot().translateToken(token);
    }

    public GrammarInfo grammarInfo() {
        return GrammarInfo.builder()
                .pronounsCount(IjawWordTables.PRONOUNS.size())
                .verbsCount(IjawWordTables.VERBS.size())
                .nounsCount(IjawWordTables.NOUNS.size())
                .adjectivesCount(IjawWordTables.ADJECTIVES.size())
                .patternsCount(translationGenerator.rules().size())
                .totalDictionaryEntries(lexicon.snapshot().phraseDictionary().size())
                .build();
    }
}
