package lm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import score.Event;
import score.EventCodec;

/**
 * The events sounding in each selected voice at one time step, in voice
 * order. This is the successor unit of the chain.
 */
public class EventGroup {

    public static final String VOICE_SEPARATOR = "&";

    public final List<Event> events;

    public EventGroup(List<Event> events) {
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("An event group needs at least one voice");
        }
        this.events = Collections.unmodifiableList(new ArrayList<Event>(events));
    }

    public static EventGroup of(Event... events) {
        List<Event> list = new ArrayList<Event>();
        Collections.addAll(list, events);
        return new EventGroup(list);
    }

    public int numVoices() {
        return events.size();
    }

    public Event get(int voice) {
        return events.get(voice);
    }

    public String encode() {
        StringBuilder buf = new StringBuilder();
        for (int v = 0; v < events.size(); v++) {
            if (v > 0) buf.append(VOICE_SEPARATOR);
            buf.append(EventCodec.encode(events.get(v)));
        }
        return buf.toString();
    }

    public static EventGroup decode(String groupStr) {
        List<Event> events = new ArrayList<Event>();
        for (String eventStr : groupStr.split(VOICE_SEPARATOR, -1)) {
            events.add(EventCodec.decode(eventStr.trim()));
        }
        return new EventGroup(events);
    }

    public boolean equals(Object other) {
        if (other instanceof EventGroup) {
            return this.events.equals(((EventGroup) other).events);
        } else {
            return false;
        }
    }

    public int hashCode() {
        return events.hashCode();
    }

    public String toString() {
        return encode();
    }

}
