package com.keyphraseforge.core.merge;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Lexical helpers for the plural and containment rules. All inputs are case-folded canonical text.
 */
final class PhraseForms {

    /** Stripped forms shorter than this are not considered singulars */
    static final int MIN_STEM_LENGTH = 3;

    private PhraseForms() {
        // Utility class
    }

    /**
     * Returns the text itself plus its forms with a trailing "s" or "es" removed,
     * where the remaining text is at least {@value #MIN_STEM_LENGTH} characters.
     */
    static Set<String> pluralForms(String text) {
        Set<String> forms = new LinkedHashSet<>();
        forms.add(text);
        if (text.endsWith("es") && text.length() - 2 >= MIN_STEM_LENGTH) {
            forms.add(text.substring(0, text.length() - 2));
        }
        if (text.endsWith("s") && text.length() - 1 >= MIN_STEM_LENGTH) {
            forms.add(text.substring(0, text.length() - 1));
        }
        return forms;
    }

    static boolean pluralEquivalent(String a, String b) {
        if (a.equals(b)) {
            return true;
        }
        Set<String> formsOfB = pluralForms(b);
        for (String form : pluralForms(a)) {
            if (formsOfB.contains(form)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns whether {@code shorter} occurs in {@code longer} as a whitespace-bounded run of
     * words and {@code longer} has strictly more words. Words are compared up to plural form.
     */
    static boolean containedIn(String shorter, String longer) {
        String[] inner = shorter.split(" ");
        String[] outer = longer.split(" ");
        if (inner.length >= outer.length) {
            return false;
        }
        for (int start = 0; start + inner.length <= outer.length; start++) {
            boolean matches = true;
            for (int i = 0; i < inner.length; i++) {
                if (!pluralEquivalent(inner[i], outer[start + i])) {
                    matches = false;
                    break;
                }
            }
            if (matches) {
                return true;
            }
        }
        return false;
    }
}
