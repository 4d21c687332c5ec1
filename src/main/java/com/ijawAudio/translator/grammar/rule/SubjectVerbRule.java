package com.ijawAudio.translator.grammar.rule;

import com.ijawAudio.translator.grammar.model.IjawParticles;
import com.ijawAudio.translator.grammar.model.MotionVerbParticle;
import com.ijawAudio.translator.grammar.model.ParsedSlots;
import com.ijawAudio.translator.lexicon.ClosedWordClasses;

import java.util.Optional;

/**
 * Intransitive clause: subject and verb, optionally with a location or a time word.
 *
 * Branches in order:
 * - location set: subject, location, then the motion particle (go, come, walk) or the translated verb
 * - time set: subject, time, verb
 * - copula verb: subject followed by the copula, the English verb is dropped
 * - otherwise: subject, verb
 */
public class SubjectVerbRule implements GenerationRule {

    @Override
    public String name() {
        return "subject-verb";
    }

    @Override
    public Optional<String> apply(GenerationContext context) {
        ParsedSlots slots = context.slots();
        if (!slots.hasSubject() || !slots.hasVerb()) {
            return Optional.empty();
        }
        String subject = context.translate(slots.subject());

        if (slots.hasLocation()) {
            String verb = MotionVerbParticle.forVerb(slots.verb())
                    .map(MotionVerbParticle::particle)
                    .orElseGet(() -> context.translate(slots.verb()));
            return Optional.of(subject + " " + context.translate(slots.location()) + " " + verb);
        }
        if (slots.hasTime()) {
            return Optional.of(subject + " " + context.translate(slots.time()) + " " + context.translate(slots.verb()));
        }
        if (ClosedWordClasses.COPULAS.contains(slots.verb())) {
            return Optional.of(subject + " " + IjawParticles.COPULA);
        }
        return Optional.of(subject + " " + context.translate(slots.verb()));
    }
}
