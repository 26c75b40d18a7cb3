package com.tickercontext.features.oneliner;

import com.tickercontext.common.model.HeadlineRef;
import com.tickercontext.common.model.OneLiner;
import com.tickercontext.common.model.RefNumber;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Deterministic template for the one-line recommendation explanation.
 *
 * <p>Shape: {@code "<strategy phrase>. Source: <publisher> —([1][2][3])"}. Citation numbers
 * are dense over the present refs: a ref in slot 2 with slot 1 empty is {@code [1]}.
 * Output never exceeds {@link #MAX_LENGTH} characters.
 */
public final class OneLinerComposer {

    public static final int MAX_LENGTH = 180;
    public static final String ELLIPSIS = "…";
    static final int TRUNCATED_KEEP = 177;
    static final int MAX_SCANNED_SLOTS = 3;

    private static final Map<String, String> STRATEGY_PHRASES = Map.of(
        "IRON_CONDOR",  "Range-bound, IV watch",
        "DEBIT_CALL",   "Bullish, defined risk",
        "DEBIT_PUT",    "Bearish, defined risk",
        "COVERED_CALL", "Income; upside capped",
        "NO_ACTION",    "Signal unclear"
    );
    private static final String GENERIC_PHRASE = "Review setup";
    private static final String DEFAULT_PUBLISHER = "News";

    private OneLinerComposer() {}

    /**
     * @param classification recommendation class label, e.g. {@code IRON_CONDOR}
     * @param confidence     recommendation confidence; not rendered by the current template
     * @param publisher      source name for the clause; blank renders as "News"
     * @param refs           up to three ref slots, {@code null} entries mark empty slots
     */
    public static OneLiner compose(String classification, double confidence, String publisher,
                                   List<HeadlineRef> refs) {
        String source = publisher == null || publisher.isBlank() ? DEFAULT_PUBLISHER : publisher.trim();
        String base = strategyPhrase(classification) + ". Source: " + source + " —";

        List<RefNumber> numbers = numberRefs(refs);
        StringBuilder suffix = new StringBuilder();
        if (!numbers.isEmpty()) {
            suffix.append('(');
            numbers.forEach(n -> suffix.append('[').append(n.number()).append(']'));
            suffix.append(')');
        }
        return new OneLiner(truncate(base + suffix), numbers);
    }

    public static String strategyPhrase(String classification) {
        if (classification == null) return GENERIC_PHRASE;
        return STRATEGY_PHRASES.getOrDefault(classification.trim(), GENERIC_PHRASE);
    }

    static List<RefNumber> numberRefs(List<HeadlineRef> refs) {
        List<RefNumber> numbers = new ArrayList<>();
        if (refs == null) return numbers;
        int n = 1;
        for (int i = 0; i < Math.min(refs.size(), MAX_SCANNED_SLOTS); i++) {
            HeadlineRef slot = refs.get(i);
            if (slot != null && slot.hasUrl()) {
                numbers.add(new RefNumber(n++, slot.url()));
            }
        }
        return numbers;
    }

    /** Keeps the first 177 characters, drops trailing whitespace, appends one ellipsis. */
    static String truncate(String text) {
        if (text.length() <= MAX_LENGTH) return text;
        return text.substring(0, TRUNCATED_KEEP).stripTrailing() + ELLIPSIS;
    }
}
