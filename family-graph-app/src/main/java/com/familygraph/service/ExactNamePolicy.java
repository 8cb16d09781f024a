package com.familygraph.service;

import com.familygraph.model.Person;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Optional;

/**
 * Same normalized first and last name and, when both people have one, the same
 * birth date. Normalization strips accents, case and repeated whitespace.
 */
@Component
public class ExactNamePolicy implements DuplicatePolicy {

    @Override
    public Optional<String> blockingKey(Person person) {
        String first = normalize(person.firstName());
        if (first.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(first + "|" + normalize(person.lastName()));
    }

    @Override
    public Optional<String> match(Person first, Person second) {
        Optional<String> key = blockingKey(first);
        if (key.isEmpty() || !key.equals(blockingKey(second))) {
            return Optional.empty();
        }
        if (first.birthDate() != null && second.birthDate() != null) {
            if (!first.birthDate().equals(second.birthDate())) {
                return Optional.empty();
            }
            return Optional.of("Same name and birth date " + first.birthDate());
        }
        return Optional.of("Same name, birth date unknown");
    }

    static String normalize(String value) {
        if (value == null) {
            return "";
        }
        String stripped = Normalizer.normalize(value, Normalizer.Form.NFD)
            .replaceAll("\\p{M}", "");
        return stripped.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
