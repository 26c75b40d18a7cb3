package com.tickercontext.features.service;

import com.tickercontext.common.model.FeaturePayload;
import com.tickercontext.common.model.HeadlineRef;
import com.tickercontext.features.model.Headline;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Pure helpers turning the primary and secondary headline lists into refs, the top
 * headline, sentiment inputs and news recency. Primary always wins over secondary.
 */
public final class HeadlineMerger {

    public static final String DEFAULT_PUBLISHER = "News";
    public static final int SENTIMENT_SOURCE_HEADLINES = 3;
    public static final int UNKNOWN_NEWS_AGE = 9999;

    private HeadlineMerger() {}

    /**
     * Walks primary then secondary, skipping items without both title and url and
     * de-duplicating by url (first occurrence wins), until {@link FeaturePayload#REF_SLOTS}
     * refs are collected. Only present refs are returned; see {@link #padSlots}.
     */
    public static List<HeadlineRef> mergeRefs(List<Headline> primary, List<Headline> secondary) {
        Set<String> seen = new HashSet<>();
        List<HeadlineRef> out = new ArrayList<>();
        for (List<Headline> source : List.of(nullSafe(primary), nullSafe(secondary))) {
            for (Headline h : source) {
                if (out.size() >= FeaturePayload.REF_SLOTS) return out;
                String title = trim(h.title());
                String url   = trim(h.url());
                if (title.isEmpty() || url.isEmpty()) continue;
                if (!seen.add(url)) continue;
                String publisher = trim(h.publisher());
                out.add(new HeadlineRef(title, publisher.isEmpty() ? DEFAULT_PUBLISHER : publisher, url));
            }
        }
        return out;
    }

    /** Pads to exactly {@link FeaturePayload#REF_SLOTS} slots with {@code null} markers. */
    public static List<HeadlineRef> padSlots(List<HeadlineRef> refs) {
        List<HeadlineRef> slots = new ArrayList<>(refs.subList(0, Math.min(refs.size(), FeaturePayload.REF_SLOTS)));
        while (slots.size() < FeaturePayload.REF_SLOTS) slots.add(null);
        return slots;
    }

    public static List<String> sources(List<HeadlineRef> refs) {
        return refs.stream().filter(Objects::nonNull).map(HeadlineRef::publisher).toList();
    }

    public static HeadlineRef topHeadline(List<Headline> primary, List<Headline> secondary) {
        Headline top = !nullSafe(primary).isEmpty() ? primary.get(0)
                     : !nullSafe(secondary).isEmpty() ? secondary.get(0)
                     : null;
        if (top == null) return null;
        return new HeadlineRef(trim(top.title()), trim(top.publisher()), trim(top.url()));
    }

    /** Titles of primary's first three items, or secondary's when primary has none. */
    public static List<String> sentimentTitles(List<Headline> primary, List<Headline> secondary) {
        List<Headline> pick = !nullSafe(primary).isEmpty() ? primary : nullSafe(secondary);
        return pick.stream()
            .limit(SENTIMENT_SOURCE_HEADLINES)
            .map(h -> trim(h.title()))
            .filter(t -> !t.isEmpty())
            .toList();
    }

    /**
     * Whole minutes since the newest timestamped headline across both sources,
     * or {@link #UNKNOWN_NEWS_AGE} when no item carries a timestamp. Not clamped.
     */
    public static int minutesSinceNews(List<Headline> primary, List<Headline> secondary, Instant now) {
        return Stream.concat(nullSafe(primary).stream(), nullSafe(secondary).stream())
            .map(Headline::publishedAt)
            .filter(Objects::nonNull)
            .max(Instant::compareTo)
            .map(latest -> (int) Math.min(Integer.MAX_VALUE, Duration.between(latest, now).toMinutes()))
            .orElse(UNKNOWN_NEWS_AGE);
    }

    private static List<Headline> nullSafe(List<Headline> list) {
        return list == null ? List.of() : list;
    }

    private static String trim(String s) {
        return s == null ? "" : s.trim();
    }
}
