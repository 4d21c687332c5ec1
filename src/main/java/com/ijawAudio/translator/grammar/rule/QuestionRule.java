package com.ijawAudio.translator.grammar.rule;

import com.ijawAudio.translator.grammar.model.IjawParticles;
import com.ijawAudio.translator.grammar.model.ParsedSlots;

import java.util.Optional;

/**
 * Question templates:
 * "how are ..." is a fixed greeting, "where ... X" asks for a location,
 * "do you have ... X" asks about possession.
 * The last two need an object; without one the rule declines.
 */
public class QuestionRule implements GenerationRule {

    @Override
    public String name() {
        return "question";
    }

    @Override
    public Optional<String> apply(GenerationContext context) {
        ParsedSlots slots = context.slots();
        if (!slots.isQuestion()) {
            return Optional.empty();
        }
        return switch (slots.questionType()) {
            case HOW_ARE -> Optional.of(IjawParticles.HOW_ARE_YOU);
            case WHERE -> slots.hasObject()
                    ? Optional.of(context.translate(slots.object()) + " " + IjawParticles.LOCATION_QUESTION_SUFFIX)
                    : Optional.empty();
            case DO_YOU_HAVE -> slots.hasObject()
                    ? Optional.of(IjawParticles.YOU + " " + context.translate(slots.object())
                            + " " + IjawParticles.HAVE_QUESTION_SUFFIX)
                    : Optional.empty();
        };
    }
}
