package com.ijawAudio.translator.grammar.rule;

import java.util.Optional;

/**
 * One template of the generation cascade.
 * A rule either renders the whole sentence or declines so the next rule is tried.
 */
public interface GenerationRule {

    /**
     * Rule name for logs.
     */
    String name();

    /**
     * @param context Sentence, slots and lexicon of the current request
     * @return Rendered Ijaw text, or empty if the rule does not match
     */
    Optional<String> apply(GenerationContext context);
}
