package io.reposync.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Outcome of one reconciliation step: every repo it touched, partitioned by what happened.
 *
 * <p>The four lists are disjoint. Deleted only ever carries repos pruned at the end of a pass
 * or removed by the single-repo path.
 */
public record Diff(List<Repo> added, List<Repo> modified, List<Repo> deleted, List<Repo> unmodified) {
    private static final Comparator<Repo> BY_ID = Comparator.comparingLong(Repo::id);

    public Diff {
        added = added == null ? List.of() : List.copyOf(added);
        modified = modified == null ? List.of() : List.copyOf(modified);
        deleted = deleted == null ? List.of() : List.copyOf(deleted);
        unmodified = unmodified == null ? List.of() : List.copyOf(unmodified);
    }

    public static Diff empty() {
        return new Diff(List.of(), List.of(), List.of(), List.of());
    }

    public static Diff ofAdded(Repo repo) {
        return new Diff(List.of(repo), List.of(), List.of(), List.of());
    }

    public static Diff ofModified(Repo repo) {
        return new Diff(List.of(), List.of(repo), List.of(), List.of());
    }

    public static Diff ofUnmodified(Repo repo) {
        return new Diff(List.of(), List.of(), List.of(), List.of(repo));
    }

    public static Diff ofDeleted(List<Repo> repos) {
        return new Diff(List.of(), List.of(), repos, List.of());
    }

    public static Diff ofUnmodified(List<Repo> repos) {
        return new Diff(List.of(), List.of(), List.of(), repos);
    }

    /**
     * All repos in the diff: added, deleted, modified, then unmodified.
     */
    public List<Repo> repos() {
        List<Repo> all = new ArrayList<>(size());
        all.addAll(added);
        all.addAll(deleted);
        all.addAll(modified);
        all.addAll(unmodified);
        return all;
    }

    public int size() {
        return added.size() + deleted.size() + modified.size() + unmodified.size();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * True when the diff reports an insert, an update or a removal.
     */
    public boolean changed() {
        return !added.isEmpty() || !modified.isEmpty() || !deleted.isEmpty();
    }

    public Diff merge(Diff other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        return new Diff(
                concat(added, other.added),
                concat(modified, other.modified),
                concat(deleted, other.deleted),
                concat(unmodified, other.unmodified)
        );
    }

    public Diff sorted() {
        return new Diff(sort(added), sort(modified), sort(deleted), sort(unmodified));
    }

    private static List<Repo> concat(List<Repo> a, List<Repo> b) {
        List<Repo> out = new ArrayList<>(a.size() + b.size());
        out.addAll(a);
        out.addAll(b);
        return out;
    }

    private static List<Repo> sort(List<Repo> repos) {
        List<Repo> out = new ArrayList<>(repos);
        out.sort(BY_ID);
        return out;
    }
}
