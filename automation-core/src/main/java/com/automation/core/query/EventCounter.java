package com.automation.core.query;

import com.automation.core.model.Event;
import com.automation.core.model.Resource;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Groups events for the count-by surface.
 *
 * Time countables produce contiguous buckets covering the filter's occurred
 * window, including empty ones. {@code day} buckets are whole UTC days;
 * {@code time} buckets start at {@code since} and are
 * {@code interval} units wide. Event and resource counts are ordered by
 * descending count, then by value.
 */
public final class EventCounter {

    private EventCounter() {
    }

    /**
     * @param filter a resolved filter; its occurred window bounds the buckets
     * @param events the events matching the filter
     */
    public static List<EventCount> count(EventFilter filter, List<Event> events,
                                         Countable countable, TimeUnit timeUnit, double interval) {
        Instant since = filter.occurred().since();
        Instant until = filter.occurred().until();
        return switch (countable) {
            case DAY -> countByTime(events,
                since.atZone(ZoneOffset.UTC).truncatedTo(ChronoUnit.DAYS).toInstant(), until, TimeUnit.DAY, 1.0);
            case TIME -> countByTime(events, since, until, timeUnit, interval);
            case EVENT -> countByKey(events, Event::event, Event::event);
            case RESOURCE -> countByKey(events, Event::resourceId, EventCounter::resourceLabel);
        };
    }

    private static List<EventCount> countByTime(List<Event> events, Instant since, Instant until,
                                                TimeUnit timeUnit, double interval) {
        int buckets = (int) timeUnit.validateBuckets(since, until, interval);
        Duration width = timeUnit.bucketWidth(interval);
        long[] counts = new long[buckets];
        for (Event e : events) {
            long offset = Duration.between(since, e.occurred()).toNanos();
            if (offset < 0) {
                continue;
            }
            int index = (int) Math.min(buckets - 1, offset / width.toNanos());
            counts[index]++;
        }
        List<EventCount> result = new ArrayList<>(buckets);
        for (int i = 0; i < buckets; i++) {
            Instant start = since.plus(width.multipliedBy(i));
            Instant end = start.plus(width).minusNanos(1000);
            String value = start.toString();
            result.add(new EventCount(value, value, counts[i], start, end));
        }
        return result;
    }

    private static List<EventCount> countByKey(List<Event> events, Function<Event, String> key,
                                              Function<Event, String> label) {
        Map<String, long[]> counts = new LinkedHashMap<>();
        Map<String, String> labels = new LinkedHashMap<>();
        Map<String, Instant[]> spans = new LinkedHashMap<>();
        for (Event e : events) {
            String value = key.apply(e);
            counts.computeIfAbsent(value, k -> new long[1])[0]++;
            labels.putIfAbsent(value, label.apply(e));
            Instant[] span = spans.computeIfAbsent(value, k -> new Instant[] {e.occurred(), e.occurred()});
            if (e.occurred().isBefore(span[0])) {
                span[0] = e.occurred();
            }
            if (e.occurred().isAfter(span[1])) {
                span[1] = e.occurred();
            }
        }
        List<EventCount> result = new ArrayList<>();
        counts.forEach((value, count) -> {
            Instant[] span = spans.get(value);
            result.add(new EventCount(value, labels.get(value), count[0], span[0], span[1]));
        });
        result.sort(Comparator.comparingLong(EventCount::count).reversed().thenComparing(EventCount::value));
        return result;
    }

    private static String resourceLabel(Event e) {
        String name = e.resource().get(Resource.NAME);
        return name != null ? name : e.resourceId();
    }
}
