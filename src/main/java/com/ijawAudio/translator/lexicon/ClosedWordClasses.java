package com.ijawAudio.translator.lexicon;

import java.util.Set;

/**
 * Closed English word classes the tagger and the generation rules dispatch on.
 */
public final class ClosedWordClasses {

    /**
     * Possessive pronouns. Never tagged as subject; handled by the possessive-phrase rule.
     */
    public static final Set<String> POSSESSIVE_PRONOUNS = Set.of("my", "your", "his", "her", "our", "their");

    /**
     * Nouns that fill the location slot once the object slot is taken.
     */
    public static final Set<String> PLACE_NOUNS = Set.of("house", "market", "river", "village", "farm");

    public static final Set<String> TIME_WORDS = Set.of("now", "today", "tomorrow", "early", "late");

    /**
     * Forms of English "to be", rendered by the Ijaw copula particle.
     */
    public static final Set<String> COPULAS = Set.of("am", "is", "are");

    public static final Set<String> DETERMINERS = Set.of("the", "a", "an", "this", "that");

    public static final Set<String> PREPOSITIONS = Set.of("to", "at", "in", "on", "with", "from");

    private ClosedWordClasses() {}
}
