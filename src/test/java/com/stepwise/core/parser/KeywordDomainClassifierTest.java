package com.stepwise.core.parser;

import com.stepwise.core.model.DomainTag;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class KeywordDomainClassifierTest {

    private final KeywordDomainClassifier classifier = new KeywordDomainClassifier();

    @Test
    @DisplayName("single matching keyword set decides the domain")
    void singleMatch() {
        assertEquals(DomainTag.BACKEND, classifier.classify("Add REST endpoint for orders"));
        assertEquals(DomainTag.FRONTEND, classifier.classify("Render the checkout page"));
        assertEquals(DomainTag.DATABASE, classifier.classify("Write migration for invoices"));
    }

    @Test
    @DisplayName("no keyword -> GENERAL")
    void noMatch() {
        assertEquals(DomainTag.GENERAL, classifier.classify("Update the changelog"));
    }

    @Test
    @DisplayName("keywords of several domains -> GENERAL")
    void ambiguousMatch() {
        assertEquals(DomainTag.GENERAL, classifier.classify("Add api endpoint and the page that calls it"));
    }

    @Test
    @DisplayName("classification does not depend on the default locale")
    void localeIndependent() {
        Locale original = Locale.getDefault();
        try {
            Locale.setDefault(Locale.forLanguageTag("tr-TR"));
            var turkish = new KeywordDomainClassifier();
            assertEquals(DomainTag.FRONTEND, turkish.classify("Fix UI spacing"));
            assertEquals(DomainTag.DATABASE, turkish.classify("Add INDEX on invoices"));
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    @DisplayName("matches whole words only")
    void wordBoundaries() {
        // "building" must not match "ui"
        assertEquals(DomainTag.GENERAL, classifier.classify("Refresh building docs"));
    }

    @Test
    @DisplayName("keyword sets are replaceable")
    void customKeywords() {
        var custom = new KeywordDomainClassifier(Map.of(DomainTag.DATABASE, List.of("flyway")));
        assertEquals(DomainTag.DATABASE, custom.classify("Add Flyway script"));
        assertEquals(DomainTag.GENERAL, custom.classify("Add api endpoint"));
    }
}
