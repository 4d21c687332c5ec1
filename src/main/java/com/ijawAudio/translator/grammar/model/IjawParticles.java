package com.ijawAudio.translator.grammar.model;

/**
 * Fixed Ijaw particles and idioms the templates insert regardless of the input tokens.
 */
public final class IjawParticles {

    /**
     * Copula standing in for English "to be".
     */
    public static final String COPULA = "ye";

    /**
     * "Where is X?" renders as "X kí ye?".
     */
    public static final String LOCATION_QUESTION_SUFFIX = "kí ye?";

    /**
     * Second person pronoun opening "Do you have X?".
     */
    public static final String YOU = "Ị";

    public static final String HAVE_QUESTION_SUFFIX = "sabi?";

    public static final String HOW_ARE_YOU = "I bódọụ?";

    private IjawParticles() {}
}
