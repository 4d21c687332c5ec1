package com.ijawAudio.translator.grammar.rule;

import java.util.Optional;

/**
 * Returns the dictionary value when the whole normalized sentence is a phrase dictionary key.
 */
public class VerbatimPhraseRule implements GenerationRule {

    @Override
    public String name() {
        return "verbatim-phrase";
    }

    @Override
    public Optional<String> apply(GenerationContext context) {
        if (context.normalized().isEmpty()) {
            return Optional.empty();
        }
        return context.lexicon().lookupPhrase(context.normalized());
    }
}
