/**
 * reposync source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.reposync.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.reposync.cli.RepoSyncCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.reposync.sync.Syncer} reconciles stored repos with what external services report.</li>
 *   <li>{@code io.reposync.storage.Store} is the authoritative persistence layer.</li>
 * </ul>
 */
package io.reposync;
