package com.ijawAudio.translator.grammar.rule;

import com.ijawAudio.translator.grammar.model.IjawParticles;
import com.ijawAudio.translator.grammar.model.ParsedSlots;

import java.util.Optional;

/**
 * "I am happy" becomes "Arí hapi ye": subject, adjective, then the copula.
 * The copula is appended whether or not the input contained a form of "to be".
 */
public class SubjectAdjectiveRule implements GenerationRule {

    @Override
    public String name() {
        return "subject-adjective";
    }

    @Override
    public Optional<String> apply(GenerationContext context) {
        ParsedSlots slots = context.slots();
        if (!slots.hasSubject() || !slots.hasAdjective()) {
            return Optional.empty();
        }
        return Optional.of(context.translate(slots.subject()) + " "
                + context.translate(slots.adjective()) + " "
                + IjawParticles.COPULA);
    }
}
