/**
 * Runtime wiring package.
 *
 * <p>{@link io.reposync.runtime.RepoSyncRuntime} builds the store, sources, syncer and worker
 * loops for one data root and exposes the operations used by the CLI.
 */
package io.reposync.runtime;
