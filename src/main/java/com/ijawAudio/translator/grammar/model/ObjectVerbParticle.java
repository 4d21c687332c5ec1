package com.ijawAudio.translator.grammar.model;

import java.util.Optional;
import java.util.Set;

/**
 * Transitive verbs whose Ijaw rendering is a fixed particle placed after the object.
 */
public enum ObjectVerbParticle {
    HAVE("sabi", "have", "has"),
    WANT("wọnt", "want", "wants"),
    LIKE("laik", "like", "likes"),
    EAT("fị", "eat", "eats"),
    BUILD("bil", "build", "builds");

    private final String particle;
    private final Set<String> englishForms;

    ObjectVerbParticle(String particle, String... englishForms) {
        this.particle = particle;
        this.englishForms = Set.of(englishForms);
    }

    public String particle() {
        return particle;
    }

    /**
     * Finds the particle for an English verb surface form.
     *
     * @param verb Lower-cased English verb
     * @return Matching particle, or empty for regular verbs
     */
    public static Optional<ObjectVerbParticle> forVerb(String verb) {
        for (ObjectVerbParticle value : values()) {
            if (value.englishForms.contains(verb)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
