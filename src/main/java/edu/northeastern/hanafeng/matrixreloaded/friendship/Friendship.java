package edu.northeastern.hanafeng.matrixreloaded.friendship;

/**
 * Unordered pair of distinct users, stored with the smaller id first so that
 * {@code of(a, b).equals(of(b, a))}.
 */
public record Friendship(String first, String second) implements Comparable<Friendship> {

    public Friendship {
        if (first.equals(second)) {
            throw new IllegalArgumentException("A user cannot befriend itself: " + first);
        }
        if (first.compareTo(second) > 0) {
            String swap = first;
            first = second;
            second = swap;
        }
    }

    public static Friendship of(String a, String b) {
        return new Friendship(a, b);
    }

    public boolean involves(String userId) {
        return first.equals(userId) || second.equals(userId);
    }

    @Override
    public int compareTo(Friendship other) {
        int byFirst = first.compareTo(other.first);
        return byFirst != 0 ? byFirst : second.compareTo(other.second);
    }
}
