package com.ijawAudio.translator.lexicon.model;

import com.ijawAudio.translator.lexicon.service.LexiconSource;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Compiled-in table of English forms for a single {@link WordRole}.
 */
public final class RoleTable implements LexiconSource {

    private final WordRole role;
    private final Map<String, String> forms;

    public RoleTable(WordRole role, Map<String, String> forms) {
        this.role = Objects.requireNonNull(role, "role");
        this.forms = Map.copyOf(forms);
    }

    public WordRole role() {
        return role;
    }

    public boolean contains(String normalizedToken) {
        return forms.containsKey(normalizedToken);
    }

    public int size() {
        return forms.size();
    }

    public List<LexicalEntry> entries() {
        return forms.entrySet().stream()
                .map(e -> new LexicalEntry(e.getKey(), e.getValue(), role))
                .toList();
    }

    @Override
    public String name() {
        return role.name().toLowerCase(Locale.ROOT);
    }

    @Override
    public Optional<String> lookup(String normalizedToken) {
        return Optional.ofNullable(forms.get(normalizedToken));
    }
}
