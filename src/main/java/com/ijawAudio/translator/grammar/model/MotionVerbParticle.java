package com.ijawAudio.translator.grammar.model;

import java.util.Optional;
import java.util.Set;

/**
 * Motion verbs whose Ijaw rendering is a directional particle placed after the location.
 */
public enum MotionVerbParticle {
    GO("gha", "go", "goes"),
    COME("bia", "come", "comes"),
    WALK("waka", "walk", "walks");

    private final String particle;
    private final Set<String> englishForms;

    MotionVerbParticle(String particle, String... englishForms) {
        this.particle = particle;
        this.englishForms = Set.of(englishForms);
    }

    public String particle() {
        return particle;
    }

    public static Optional<MotionVerbParticle> forVerb(String verb) {
        for (MotionVerbParticle value : values()) {
            if (value.englishForms.contains(verb)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
