package com.specgate.core.validator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiles configured rule patterns. An empty pattern disables its check; an
 * invalid one is logged and also disables its check.
 */
final class Patterns {

    private static final Logger log = LoggerFactory.getLogger(Patterns.class);

    private Patterns() {}

    static Pattern compileOrNull(String regex, String name) {
        if (regex == null || regex.isEmpty()) {
            return null;
        }
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            log.warn("Invalid {} pattern '{}', skipping that check: {}", name, regex, e.getDescription());
            return null;
        }
    }
}
