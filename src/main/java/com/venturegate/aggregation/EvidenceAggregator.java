package com.venturegate.aggregation;

import com.venturegate.evidence.Dimension;
import com.venturegate.evidence.Evidence;
import com.venturegate.evidence.EvidenceCategory;
import com.venturegate.evidence.EvidenceStrength;
import com.venturegate.evidence.FitType;
import com.venturegate.evidence.Signal;
import com.venturegate.evidence.Timestamps;
import com.venturegate.evidence.ValidationState;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns normalized user evidence and automated validation states into one timeline,
 * and derives filters, summary counts and trend series from it.
 * <p>
 * Stateless; every method is safe to call concurrently.
 */
@Service
public class EvidenceAggregator {

    private static final String UNTITLED = "Untitled Evidence";
    private static final String AUTOMATED_TITLE_PREFIX = "AI Analysis: ";

    private static final DateTimeFormatter TREND_LABEL =
        DateTimeFormatter.ofPattern("MMM dd", Locale.ENGLISH).withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter MONTH_LABEL =
        DateTimeFormatter.ofPattern("MMMM yyyy", Locale.ENGLISH).withZone(ZoneOffset.UTC);

    /** Evidence with no (or an unrecognized) fit type is attributed to desirability. */
    private static final Map<FitType, Dimension> FIT_TYPE_DIMENSIONS = new EnumMap<>(Map.of(
        FitType.DESIRABILITY, Dimension.DESIRABILITY,
        FitType.FEASIBILITY, Dimension.FEASIBILITY,
        FitType.VIABILITY, Dimension.VIABILITY
    ));
    private static final Dimension DEFAULT_DIMENSION = Dimension.DESIRABILITY;

    private final Clock clock;

    public EvidenceAggregator(Clock clock) {
        this.clock = clock;
    }

    public static Dimension dimensionOf(FitType fitType) {
        return fitType == null ? DEFAULT_DIMENSION : FIT_TYPE_DIMENSIONS.getOrDefault(fitType, DEFAULT_DIMENSION);
    }

    public UserEvidenceItem transformUserEvidence(Evidence evidence) {
        return new UserEvidenceItem(
            evidence.id(),
            dimensionOf(evidence.fitType()),
            evidence.strength() != null ? evidence.strength() : EvidenceStrength.MEDIUM,
            Timestamps.orNow(evidence.createdAt(), clock),
            evidence.title() != null && !evidence.title().isEmpty() ? evidence.title() : UNTITLED,
            evidence.contradiction(),
            evidence.category() != null ? evidence.category() : EvidenceCategory.RESEARCH,
            evidence
        );
    }

    /**
     * Emits one item per dimension whose payload is present and whose signal is not the
     * dimension's neutral value, so a state yields between zero and three items.
     */
    public List<AutomatedEvidenceItem> transformAutomatedState(ValidationState state) {
        Instant timestamp = Timestamps.orNow(state.updatedAt(), clock);
        List<AutomatedEvidenceItem> items = new ArrayList<>(Dimension.values().length);
        for (Dimension dimension : Dimension.values()) {
            Signal signal = state.signal(dimension);
            Object payload = state.evidence(dimension);
            if (payload == null || signal == null || signal.isNeutral()) {
                continue;
            }
            items.add(new AutomatedEvidenceItem(
                state.id() + "-" + dimension.getValue(),
                dimension,
                signal.strength(),
                timestamp,
                AUTOMATED_TITLE_PREFIX + signal.getLabel(),
                signal,
                payload,
                state.iteration(),
                state.id()
            ));
        }
        return items;
    }

    /**
     * Concatenates both lists and stable-sorts by timestamp, most recent first.
     * The result always holds exactly {@code userItems.size() + automatedItems.size()} items.
     */
    public List<UnifiedEvidenceItem> merge(List<? extends UnifiedEvidenceItem> userItems,
                                           List<? extends UnifiedEvidenceItem> automatedItems) {
        List<UnifiedEvidenceItem> merged = new ArrayList<>(userItems.size() + automatedItems.size());
        merged.addAll(userItems);
        merged.addAll(automatedItems);
        merged.sort(Comparator.comparing(UnifiedEvidenceItem::timestamp).reversed());
        return merged;
    }

    public List<UnifiedEvidenceItem> mergeSources(List<Evidence> userEvidence, List<ValidationState> states) {
        List<UserEvidenceItem> userItems = userEvidence.stream().map(this::transformUserEvidence).toList();
        List<AutomatedEvidenceItem> automatedItems = states.stream()
            .flatMap(state -> transformAutomatedState(state).stream())
            .toList();
        return merge(userItems, automatedItems);
    }

    public List<UnifiedEvidenceItem> filter(List<UnifiedEvidenceItem> items, EvidenceFilters filters) {
        String needle = filters.search() == null || filters.search().isBlank()
            ? null
            : filters.search().toLowerCase(Locale.ROOT);
        return items.stream()
            .filter(item -> filters.dimension() == null || item.dimension() == filters.dimension())
            .filter(item -> filters.source() == null || item.source() == filters.source())
            .filter(item -> filters.strength() == null || item.strength() == filters.strength())
            .filter(item -> !filters.contradictionsOnly() || passesContradictionFilter(item))
            .filter(item -> filters.from() == null || !item.timestamp().isBefore(filters.from()))
            .filter(item -> filters.to() == null || !item.timestamp().isAfter(filters.to()))
            .filter(item -> needle == null || matchesSearch(item, needle))
            .toList();
    }

    public EvidenceSummary summarize(List<UnifiedEvidenceItem> items) {
        int[] byDimension = new int[Dimension.values().length];
        int[] byStrength = new int[EvidenceStrength.values().length];
        int user = 0;
        int ai = 0;
        int contradictions = 0;

        for (UnifiedEvidenceItem item : items) {
            byDimension[item.dimension().ordinal()]++;
            byStrength[item.strength().ordinal()]++;
            if (item.source() == EvidenceOrigin.USER) {
                user++;
            } else {
                ai++;
            }
            if (isContradiction(item)) {
                contradictions++;
            }
        }

        return new EvidenceSummary(
            items.size(),
            new EvidenceSummary.DimensionCounts(
                byDimension[Dimension.DESIRABILITY.ordinal()],
                byDimension[Dimension.FEASIBILITY.ordinal()],
                byDimension[Dimension.VIABILITY.ordinal()]),
            new EvidenceSummary.StrengthCounts(
                byStrength[EvidenceStrength.WEAK.ordinal()],
                byStrength[EvidenceStrength.MEDIUM.ordinal()],
                byStrength[EvidenceStrength.STRONG.ordinal()]),
            new EvidenceSummary.SourceCounts(user, ai),
            contradictions
        );
    }

    /**
     * One point per state, oldest first, each dimension projected through its signal's trend value.
     */
    public List<TrendPoint> trend(List<ValidationState> states) {
        List<TimedState> timed = new ArrayList<>(states.size());
        for (ValidationState state : states) {
            timed.add(new TimedState(state, Timestamps.orNow(state.updatedAt(), clock)));
        }
        timed.sort(Comparator.comparing(TimedState::timestamp));

        List<TrendPoint> points = new ArrayList<>(timed.size());
        for (TimedState entry : timed) {
            ValidationState state = entry.state();
            points.add(new TrendPoint(
                TREND_LABEL.format(entry.timestamp()),
                entry.timestamp(),
                trendValue(state.desirabilitySignal()),
                trendValue(state.feasibilitySignal()),
                trendValue(state.viabilitySignal()),
                countPayloads(state),
                state.iteration()
            ));
        }
        return points;
    }

    /** Groups items under a "MMMM yyyy" key, preserving the input order within and across groups. */
    public Map<String, List<UnifiedEvidenceItem>> groupByMonth(List<UnifiedEvidenceItem> items) {
        Map<String, List<UnifiedEvidenceItem>> groups = new LinkedHashMap<>();
        for (UnifiedEvidenceItem item : items) {
            groups.computeIfAbsent(MONTH_LABEL.format(item.timestamp()), k -> new ArrayList<>()).add(item);
        }
        return groups;
    }

    public Map<Dimension, List<UnifiedEvidenceItem>> groupByDimension(List<UnifiedEvidenceItem> items) {
        Map<Dimension, List<UnifiedEvidenceItem>> groups = new EnumMap<>(Dimension.class);
        for (Dimension dimension : Dimension.values()) {
            groups.put(dimension, new ArrayList<>());
        }
        for (UnifiedEvidenceItem item : items) {
            groups.get(item.dimension()).add(item);
        }
        groups.replaceAll((dimension, list) -> Collections.unmodifiableList(list));
        return groups;
    }

    private static boolean passesContradictionFilter(UnifiedEvidenceItem item) {
        return item.match(UserEvidenceItem::contradiction, automated -> true);
    }

    private static boolean isContradiction(UnifiedEvidenceItem item) {
        return item.match(UserEvidenceItem::contradiction, automated -> false);
    }

    private static boolean matchesSearch(UnifiedEvidenceItem item, String needle) {
        if (containsIgnoreCase(item.title(), needle)) {
            return true;
        }
        return item.match(
            user -> containsIgnoreCase(user.data().content(), needle)
                || containsIgnoreCase(user.data().summary(), needle),
            automated -> false);
    }

    private static boolean containsIgnoreCase(String haystack, String lowerNeedle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(lowerNeedle);
    }

    private static double trendValue(Signal signal) {
        return signal == null ? 0 : signal.trendValue();
    }

    private static int countPayloads(ValidationState state) {
        int count = 0;
        for (Dimension dimension : Dimension.values()) {
            if (state.evidence(dimension) != null) {
                count++;
            }
        }
        return count;
    }

    private record TimedState(ValidationState state, Instant timestamp) {}
}
