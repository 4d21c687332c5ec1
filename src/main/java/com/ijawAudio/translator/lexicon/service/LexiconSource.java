package com.ijawAudio.translator.lexicon.service;

import java.util.Optional;

/**
 * One layer of the ordered token lookup.
 * Layers are consulted in order by {@link LexiconSnapshot#translateToken(String)}; the first hit wins.
 */
public interface LexiconSource {

    /**
     * Short name used in logs and diagnostics.
     */
    String name();

    /**
     * Looks up an already normalized token.
     *
     * @param normalizedToken lower-cased, trimmed token
     * @return Ijaw rendering, or empty if this layer does not know the token
     */
    Optional<String> lookup(String normalizedToken);
}
