package com.ijawAudio.translator.grammar.rule;

import com.ijawAudio.translator.grammar.model.ObjectVerbParticle;
import com.ijawAudio.translator.grammar.model.ParsedSlots;

import java.util.Optional;

/**
 * Canonical SOV clause: subject, object, verb.
 * Verbs with a fixed Ijaw particle (have, want, like, eat, build) use the particle instead of
 * the dictionary translation of the verb.
 */
public class SubjectObjectVerbRule implements GenerationRule {

    @Override
    public String name() {
        return "subject-object-verb";
    }

    @Override
    public Optional<String> apply(GenerationContext context) {
        ParsedSlots slots = context.slots();
        if (!slots.hasSubject() || !slots.hasObject() || !slots.hasVerb()) {
            return Optional.empty();
        }
        String verb = ObjectVerbParticle.forVerb(slots.verb())
                .map(ObjectVerbParticle::particle)
                .orElseGet(() -> context.translate(slots.verb()));
        return Optional.of(context.translate(slots.subject()) + " " + context.translate(slots.object()) + " " + verb);
    }
}
