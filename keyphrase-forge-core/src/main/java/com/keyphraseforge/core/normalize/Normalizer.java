package com.keyphraseforge.core.normalize;

import com.keyphraseforge.core.config.PipelineConfig;
import com.keyphraseforge.core.config.PipelineConfig.AcronymEntry;
import com.keyphraseforge.core.config.PipelineConfig.WordCountRange;
import com.keyphraseforge.core.model.AuditReason;
import com.keyphraseforge.core.model.CandidatePhrase;
import com.keyphraseforge.core.model.NormalizedPhrase;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Canonicalizes raw candidate phrases into a comparable form.
 *
 * <p>Canonical text is produced by:
 * <ol>
 *   <li>stripping surrounding quotes and sentence punctuation left over from extraction</li>
 *   <li>collapsing whitespace runs into single spaces</li>
 *   <li>writing configured acronyms in their configured casing ("ach" becomes "ACH")</li>
 *   <li>keeping identifier-like tokens as written: tokens containing an underscore
 *       ({@code payment_id}) or mixing case ({@code FedNow}, {@code ACH-All})</li>
 *   <li>lowercasing every other token</li>
 * </ol>
 *
 * <p>The canonical form is then checked against the category's word-count range and the
 * stoplist. Normalization is idempotent and has no side effects.
 */
public class Normalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String EDGE_PUNCTUATION = "\"'`“”‘’,.;:!?";

    private final PipelineConfig config;
    private final Map<String, String> acronymCasing = new HashMap<>();
    private final Set<String> stoplist = new HashSet<>();

    public Normalizer(PipelineConfig config) {
        this.config = config;
        for (AcronymEntry entry : config.acronyms()) {
            acronymCasing.put(entry.acronym().toLowerCase(Locale.ROOT), entry.acronym());
        }
        for (String term : config.stoplist()) {
            if (term != null && !term.isBlank()) {
                stoplist.add(canonicalize(term).toLowerCase(Locale.ROOT));
            }
        }
    }

    /**
     * Normalizes a candidate phrase.
     *
     * @param candidate candidate from the extraction step
     * @return accepted phrase or rejection
     */
    public NormalizationResult normalize(CandidatePhrase candidate) {
        return normalize(candidate.text(), candidate.category(), candidate.sourceDocumentId());
    }

    /**
     * Normalizes raw text for a category, without a source document.
     *
     * @param rawText raw phrase text
     * @param category category whose word-count range applies
     * @return accepted phrase or rejection
     */
    public NormalizationResult normalize(String rawText, String category) {
        return normalize(rawText, category, "");
    }

    private NormalizationResult normalize(String rawText, String category, String documentId) {
        String canonical = canonicalize(rawText);
        WordCountRange range = config.wordCountRangeFor(category);

        int words = canonical.isEmpty() ? 0 : canonical.split(" ").length;
        if (words < range.min()) {
            return NormalizationResult.rejected(AuditReason.TOO_SHORT,
                words + " words, minimum is " + range.min());
        }
        if (words > range.max()) {
            return NormalizationResult.rejected(AuditReason.TOO_LONG,
                words + " words, maximum is " + range.max());
        }
        if (isStoplisted(canonical)) {
            return NormalizationResult.rejected(AuditReason.STOPLISTED, "generic term");
        }

        return NormalizationResult.accepted(
            new NormalizedPhrase(canonical, rawText, documentId, category));
    }

    /**
     * Produces the canonical text of a phrase without validating it.
     *
     * @param rawText raw phrase text
     * @return canonical text, possibly empty
     */
    public String canonicalize(String rawText) {
        if (rawText == null) {
            return "";
        }
        String collapsed = WHITESPACE.matcher(stripEdges(rawText)).replaceAll(" ").trim();
        if (collapsed.isEmpty()) {
            return "";
        }

        String[] tokens = collapsed.split(" ");
        StringBuilder sb = new StringBuilder(collapsed.length());
        for (int i = 0; i < tokens.length; i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append(canonicalToken(tokens[i]));
        }
        return sb.toString();
    }

    /**
     * Returns whether canonical text is a stoplisted generic term.
     *
     * @param canonicalText canonical text
     * @return true if the phrase must not be admitted
     */
    public boolean isStoplisted(String canonicalText) {
        return stoplist.contains(canonicalText.toLowerCase(Locale.ROOT));
    }

    private String canonicalToken(String token) {
        String acronym = acronymCasing.get(token.toLowerCase(Locale.ROOT));
        if (acronym != null) {
            return acronym;
        }
        if (isIdentifier(token)) {
            return token;
        }
        return token.toLowerCase(Locale.ROOT);
    }

    static boolean isIdentifier(String token) {
        if (token.indexOf('_') >= 0) {
            return true;
        }
        boolean innerUpper = false;
        boolean lower = false;
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (Character.isLowerCase(c)) {
                lower = true;
            } else if (i > 0 && Character.isUpperCase(c)) {
                innerUpper = true;
            }
        }
        return innerUpper && lower;
    }

    private static String stripEdges(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && isEdge(text.charAt(start))) {
            start++;
        }
        while (end > start && isEdge(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(start, end);
    }

    private static boolean isEdge(char c) {
        return Character.isWhitespace(c) || EDGE_PUNCTUATION.indexOf(c) >= 0;
    }
}
