package io.reposync.model;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

final class DiffTest {

    @Test
    void onlyInsertsUpdatesAndRemovalsCountAsChange() {
        Assertions.assertFalse(Diff.empty().changed());
        Assertions.assertTrue(Diff.empty().isEmpty());
        Assertions.assertFalse(Diff.ofUnmodified(repo(1L, "a")).changed());
        Assertions.assertTrue(Diff.ofAdded(repo(1L, "a")).changed());
        Assertions.assertTrue(Diff.ofModified(repo(1L, "a")).changed());
        Assertions.assertTrue(Diff.ofDeleted(List.of(repo(1L, "a"))).changed());
    }

    @Test
    void mergeConcatenatesAndSortOrdersById() {
        Diff merged = Diff.ofAdded(repo(3L, "c"))
                .merge(Diff.ofAdded(repo(1L, "a")))
                .merge(Diff.ofUnmodified(List.of(repo(5L, "e"), repo(4L, "d"))))
                .merge(Diff.empty());

        Assertions.assertEquals(4, merged.size());
        Assertions.assertEquals(List.of(3L, 1L), merged.added().stream().map(Repo::id).toList());
        Diff sorted = merged.sorted();
        Assertions.assertEquals(List.of(1L, 3L), sorted.added().stream().map(Repo::id).toList());
        Assertions.assertEquals(List.of(4L, 5L), sorted.unmodified().stream().map(Repo::id).toList());
    }

    @Test
    void reposListsAddedDeletedModifiedThenUnmodified() {
        Diff diff = new Diff(List.of(repo(1L, "a")), List.of(repo(2L, "b")), List.of(repo(3L, "c")), List.of(repo(4L, "d")));
        Assertions.assertEquals(List.of(1L, 3L, 2L, 4L), diff.repos().stream().map(Repo::id).toList());
    }

    @Test
    void nullListsReadAsEmpty() {
        Diff diff = new Diff(null, null, null, null);
        Assertions.assertTrue(diff.isEmpty());
        Assertions.assertEquals(List.of(), diff.added());
    }

    private static Repo repo(long id, String name) {
        return new Repo(id, name, name, "", false, false, false, 0,
                new ExternalRepoSpec(name, "github", "https://github.com"), "{}", Map.of(), 1L, 1L, 0L);
    }
}
