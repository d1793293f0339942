package com.whereq.dispatch.trigger;

import com.whereq.dispatch.exception.MalformedTriggerException;
import com.whereq.dispatch.realtime.RealtimeEvent;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One rule of an {@code @event} trigger, written
 * {@code doctype[:verbs[:values[:selector]]]}.
 *
 * <ul>
 *   <li>verbs: comma separated realtime verbs, {@code ALL} or empty for any</li>
 *   <li>values: comma separated document ids, or values of the selector field;
 *   the value {@code !=} matches an update that changed the selector field</li>
 *   <li>selector: dotted path of a document field</li>
 * </ul>
 */
@Getter
public final class EventRule {

    private static final String ALL = "ALL";
    private static final String CHANGED = "!=";
    private static final Set<String> VERBS = Set.of(
        RealtimeEvent.CREATED, RealtimeEvent.UPDATED, RealtimeEvent.DELETED, RealtimeEvent.NOTIFIED);

    private final String doctype;

    /**
     * Accepted verbs, empty for any
     */
    private final Set<String> verbs;

    private final List<String> values;

    private final String selector;

    private EventRule(String doctype, Set<String> verbs, List<String> values, String selector) {
        this.doctype = doctype;
        this.verbs = verbs;
        this.values = values;
        this.selector = selector;
    }

    /**
     * Parse the space separated rules of a trigger
     *
     * @throws MalformedTriggerException if there is no rule or one does not parse
     */
    public static List<EventRule> parseAll(String arguments) {
        if (arguments == null || arguments.isBlank()) {
            throw new MalformedTriggerException("Event trigger without any rule");
        }
        List<EventRule> rules = new ArrayList<>();
        for (String rule : arguments.trim().split("\\s+")) {
            rules.add(parse(rule));
        }
        return rules;
    }

    public static EventRule parse(String rule) {
        String[] parts = rule.split(":", 4);
        String doctype = parts[0].trim();
        if (doctype.isEmpty()) {
            throw new MalformedTriggerException("Event rule without doctype: " + rule);
        }

        Set<String> verbs = new LinkedHashSet<>();
        if (parts.length > 1 && !parts[1].isBlank() && !ALL.equalsIgnoreCase(parts[1].trim())) {
            for (String verb : parts[1].split(",")) {
                String normalized = verb.trim().toUpperCase();
                if (!VERBS.contains(normalized)) {
                    throw new MalformedTriggerException("Unknown verb " + verb + " in event rule " + rule);
                }
                verbs.add(normalized);
            }
        }

        List<String> values = new ArrayList<>();
        if (parts.length > 2) {
            Arrays.stream(parts[2].split(","))
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .forEach(values::add);
        }

        String selector = parts.length > 3 && !parts[3].isBlank() ? parts[3].trim() : null;
        if (values.contains(CHANGED) && selector == null) {
            throw new MalformedTriggerException("Event rule " + rule + " uses != without a selector");
        }
        return new EventRule(doctype, Set.copyOf(verbs), List.copyOf(values), selector);
    }

    /**
     * @return true if any of the rules matches the event
     */
    public static boolean anyMatch(Collection<EventRule> rules, RealtimeEvent event) {
        for (EventRule rule : rules) {
            if (rule.matches(event)) {
                return true;
            }
        }
        return false;
    }

    public boolean matches(RealtimeEvent event) {
        if (!doctype.equals(event.getDoctype())) {
            return false;
        }
        if (!verbs.isEmpty() && !verbs.contains(event.getVerb())) {
            return false;
        }
        if (values.isEmpty()) {
            return true;
        }
        if (selector == null) {
            return values.contains(event.getDocId());
        }
        if (values.contains(CHANGED) && fieldChanged(event)) {
            return true;
        }
        if (selectorMatches(event.getDoc())) {
            return true;
        }
        // the new document may no longer match while the old one did
        return event.getOldDoc() != null && selectorMatches(event.getOldDoc());
    }

    private boolean fieldChanged(RealtimeEvent event) {
        if (event.getOldDoc() == null) {
            return false;
        }
        return !Objects.equals(lookup(event.getDoc(), selector), lookup(event.getOldDoc(), selector));
    }

    private boolean selectorMatches(Map<String, Object> doc) {
        Object field = lookup(doc, selector);
        if (field instanceof Collection<?> items) {
            for (Object item : items) {
                if (item != null && values.contains(String.valueOf(item))) {
                    return true;
                }
            }
            return false;
        }
        return field != null && values.contains(String.valueOf(field));
    }

    @SuppressWarnings("unchecked")
    static Object lookup(Map<String, Object> doc, String path) {
        Object current = doc;
        for (String key : path.split("\\.")) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<String, Object>) current).get(key);
        }
        return current;
    }

    @Override
    public String toString() {
        return doctype + ":" + (verbs.isEmpty() ? ALL : String.join(",", verbs))
            + ":" + String.join(",", values) + (selector != null ? ":" + selector : "");
    }
}
