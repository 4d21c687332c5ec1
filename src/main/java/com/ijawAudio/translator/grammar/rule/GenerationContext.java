package com.ijawAudio.translator.grammar.rule;

import com.ijawAudio.translator.grammar.model.ParsedSlots;
import com.ijawAudio.translator.lexicon.service.LexiconSnapshot;
import com.ijawAudio.translator.lexicon.service.WordClassifier;
import com.ijawAudio.translator.lexicon.util.TextNormalizer;

import java.util.Objects;
import java.util.function.Function;

/**
 * Per-request input shared by the generation rules.
 *
 * Slots are computed on first access, so a verbatim dictionary hit never runs the tagger.
 */
public final class GenerationContext {

    private final String sentence;
    private final String normalized;
    private final LexiconSnapshot lexicon;
    private final WordClassifier classifier;
    private final Function<String, ParsedSlots> tagger;
    private ParsedSlots slots;

    public GenerationContext(String sentence,
                             LexiconSnapshot lexicon,
                             WordClassifier classifier,
                             Function<String, ParsedSlots> tagger) {
        this.sentence = sentence == null ? "" : sentence;
        this.normalized = TextNormalizer.normalize(this.sentence);
        this.lexicon = Objects.requireNonNull(lexicon, "lexicon");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.tagger = Objects.requireNonNull(tagger, "tagger");
    }

    /**
     * Sentence exactly as given (null replaced by empty).
     */
    public String sentence() {
        return sentence;
    }

    /**
     * Trimmed, lower-cased sentence.
     */
    public String normalized() {
        return normalized;
    }

    public LexiconSnapshot lexicon() {
        return lexicon;
    }

    public WordClassifier classifier() {
        return classifier;
    }

    public ParsedSlots slots() {
        if (slots == null) {
            slots = tagger.apply(sentence);
        }
        return slots;
    }

    /**
     * Shorthand for {@link LexiconSnapshot#translateToken(String)}.
     */
    public String translate(String token) {
        return lexicon.translateToken(token);
    }
}
