package lm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An n-gram context: the last {@code order} event groups, oldest first.
 */
public class StateKey {

    public static final String STEP_SEPARATOR = "+";

    public final List<EventGroup> groups;

    public StateKey(List<EventGroup> groups) {
        if (groups == null || groups.isEmpty()) {
            throw new IllegalArgumentException("A state needs at least one time step");
        }
        this.groups = Collections.unmodifiableList(new ArrayList<EventGroup>(groups));
    }

    public int order() {
        return groups.size();
    }

    public EventGroup mostRecent() {
        return groups.get(groups.size() - 1);
    }

    /**
     * The state reached after {@code next}: drop the oldest step, append
     * the new one.
     */
    public StateKey slide(EventGroup next) {
        List<EventGroup> slid = new ArrayList<EventGroup>(groups.subList(1, groups.size()));
        slid.add(next);
        return new StateKey(slid);
    }

    public String encode() {
        StringBuilder buf = new StringBuilder();
        for (int j = 0; j < groups.size(); j++) {
            if (j > 0) buf.append(STEP_SEPARATOR);
            buf.append(groups.get(j).encode());
        }
        return buf.toString();
    }

    public static StateKey decode(String stateStr) {
        List<EventGroup> groups = new ArrayList<EventGroup>();
        for (String groupStr : stateStr.split("\\" + STEP_SEPARATOR, -1)) {
            groups.add(EventGroup.decode(groupStr));
        }
        return new StateKey(groups);
    }

    public boolean equals(Object other) {
        if (other instanceof StateKey) {
            return this.groups.equals(((StateKey) other).groups);
        } else {
            return false;
        }
    }

    public int hashCode() {
        return groups.hashCode();
    }

    public String toString() {
        return encode();
    }

}
