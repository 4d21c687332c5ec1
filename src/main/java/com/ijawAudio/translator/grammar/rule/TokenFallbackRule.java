package com.ijawAudio.translator.grammar.rule;

import com.ijawAudio.translator.lexicon.util.TextNormalizer;

import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Terminal rule: translates each whitespace-separated token of the sentence as typed and joins
 * them with single spaces. Unknown tokens pass through. Always matches.
 */
public class TokenFallbackRule implements GenerationRule {

    @Override
    public String name() {
        return "token-fallback";
    }

    @Override
    public Optional<String> apply(GenerationContext context) {
        return Optional.of(TextNormalizer.tokenize(context.sentence()).stream()
                .map(context::translate)
                .collect(Collectors.joining(" ")));
    }
}
