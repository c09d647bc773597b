package com.raditha.cyclone.config;

/**
 * Source grammars the detector can parse. Both repositories of a run are
 * parsed with the same grammar.
 */
public enum Language {
    JAVA;

    /**
     * Resolve a configuration value, ignoring case.
     *
     * @throws ConfigurationException if the name is not a supported language
     */
    public static Language fromName(String name) {
        for (Language language : values()) {
            if (language.name().equalsIgnoreCase(name.trim())) {
                return language;
            }
        }
        throw new ConfigurationException("Unsupported language: " + name);
    }
}
