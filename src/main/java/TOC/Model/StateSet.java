package TOC.Model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Immutable, sorted set of state names. Two sets are equal iff their sorted member lists are equal, and
 * {@link #key()} is the canonical name used for derived automaton states. Backslash, comma and braces inside a
 * member are escaped with a backslash, so distinct sets always have distinct keys.
 */
public final class StateSet implements Iterable<String>, Comparable<StateSet> {
    private static final StateSet EMPTY = new StateSet(List.of());

    private final List<String> members;
    private final String key;

    private StateSet(List<String> sortedMembers) {
        this.members = sortedMembers;
        this.key = sortedMembers.stream().map(StateSet::escape).collect(Collectors.joining(",", "{", "}"));
    }

    private static String escape(String member) {
        StringBuilder sb = new StringBuilder(member.length());
        for (int i = 0; i < member.length(); i++) {
            char c = member.charAt(i);
            if (c == '\\' || c == ',' || c == '{' || c == '}') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    public static StateSet of(Collection<String> states) {
        if (states.isEmpty()) {
            return EMPTY;
        }
        return new StateSet(Collections.unmodifiableList(new ArrayList<>(new TreeSet<>(states))));
    }

    public static StateSet of(String... states) {
        return of(List.of(states));
    }

    public static StateSet empty() {
        return EMPTY;
    }

    public List<String> members() {
        return members;
    }

    public boolean contains(String state) {
        return Collections.binarySearch(members, state) >= 0;
    }

    public boolean containsAny(Collection<String> states) {
        for (String s : states) {
            if (contains(s)) {
                return true;
            }
        }
        return false;
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    /**
     * Lowest member in sort order; used as the block representative.
     */
    public String first() {
        return members.get(0);
    }

    public String key() {
        return key;
    }

    @Override
    public Iterator<String> iterator() {
        return members.iterator();
    }

    @Override
    public int compareTo(StateSet o) {
        return key.compareTo(o.key);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof StateSet && members.equals(((StateSet) o).members));
    }

    @Override
    public int hashCode() {
        return members.hashCode();
    }

    @Override
    public String toString() {
        return key;
    }
}
