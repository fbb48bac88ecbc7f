package io.reposync.sync;

import io.reposync.source.SourceException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class SyncErrorsTest {

    @Test
    void fatalReasonsAreFoundThroughWrappers() {
        RuntimeException wrapped = new RuntimeException("fetching from code host GitHub", SourceException.unauthorized());
        Assertions.assertTrue(SyncErrors.isFatal(wrapped));
        Assertions.assertTrue(SyncErrors.isFatal(SourceException.forbidden()));
        Assertions.assertTrue(SyncErrors.isFatal(SourceException.accountSuspended()));
        Assertions.assertFalse(SyncErrors.isFatal(new SourceException(SourceException.Reason.RATE_LIMITED, "slow")));
        Assertions.assertFalse(SyncErrors.isFatal(SourceException.notFound("x")));
    }

    @Test
    void aggregatedErrorsAreSearchedThroughSuppressed() {
        SyncException many = SyncException.of(List.of(
                new RuntimeException("syncing repo a"),
                new RuntimeException("fetching", SourceException.forbidden())
        ));
        Assertions.assertTrue(many.getMessage().startsWith("2 errors occurred:"));
        Assertions.assertTrue(SyncErrors.isFatal(many));
        Assertions.assertEquals(2, many.errors().size());

        SyncException one = SyncException.of(List.of(SourceException.notFound("acme/api")));
        Assertions.assertEquals("not found: acme/api", one.getMessage());
        Assertions.assertTrue(SyncErrors.isNotFound(one));
        Assertions.assertTrue(SyncErrors.isGone(one));
    }

    @Test
    void notFoundIncludesRepoNotFound() {
        Assertions.assertTrue(SyncErrors.isNotFound(new RepoNotFoundException("github.com/a/b")));
        Assertions.assertTrue(SyncErrors.isGone(SourceException.unauthorized()));
        Assertions.assertFalse(SyncErrors.isGone(new SourceException(SourceException.Reason.UNAVAILABLE, "down")));
    }

    @Test
    void selfReferencingChainsTerminate() {
        RuntimeException a = new RuntimeException("a");
        RuntimeException b = new RuntimeException("b", a);
        a.addSuppressed(b);
        Assertions.assertFalse(SyncErrors.isFatal(a));
        Assertions.assertFalse(SyncErrors.anyFatal(List.of(a, b)));
        Assertions.assertTrue(SyncErrors.anyFatal(List.of(a, SourceException.forbidden())));
    }

    @Test
    void emptyErrorListIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> SyncException.of(List.of()));
    }
}
