package com.ijawAudio.translator.grammar.rule;

import com.ijawAudio.translator.grammar.model.IjawParticles;
import com.ijawAudio.translator.lexicon.ClosedWordClasses;
import com.ijawAudio.translator.lexicon.util.TextNormalizer;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Phrases opening with a possessive pronoun, e.g. "my father" becomes "owéi yè".
 *
 * The possessed noun normally comes first. The one exception is possessive, copula, adjective
 * ("my ancestors are angry"), which keeps the possessive in front: "yè ìwéi-wónì kírimá ye".
 */
public class PossessivePhraseRule implements GenerationRule {

    @Override
    public String name() {
        return "possessive-phrase";
    }

    @Override
    public Optional<String> apply(GenerationContext context) {
        List<String> words = TextNormalizer.tokenize(context.normalized());
        if (words.size() < 2 || !ClosedWordClasses.POSSESSIVE_PRONOUNS.contains(words.get(0))) {
            return Optional.empty();
        }
        String possessive = context.translate(words.get(0));
        String noun = context.translate(words.get(1));

        if (words.size() == 2) {
            return Optional.of(noun + " " + possessive);
        }
        boolean copula = ClosedWordClasses.COPULAS.contains(words.get(2));
        if (words.size() == 3 && copula) {
            return Optional.of(noun + " " + possessive + " " + IjawParticles.COPULA);
        }
        if (words.size() == 4 && copula) {
            String complement = context.translate(words.get(3));
            if (context.classifier().isAdjective(words.get(3))) {
                return Optional.of(possessive + " " + noun + " " + complement + " " + IjawParticles.COPULA);
            }
            return Optional.of(noun + " " + possessive + " " + complement + " " + IjawParticles.COPULA);
        }
        String rest = words.subList(2, words.size()).stream()
                .map(context::translate)
                .collect(Collectors.joining(" "));
        return Optional.of(noun + " " + possessive + " " + rest);
    }
}
