/**
 * VoteRelay source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.voterelay.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.voterelay.cli.VoteRelayCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.voterelay.lifecycle.LifecycleManager} validates and applies delegation transitions.</li>
 *   <li>{@code io.voterelay.voting.VotingAdapter} resolves effective voters for the approval path.</li>
 *   <li>{@code io.voterelay.storage.DelegationStore} is the persistence seam.</li>
 * </ul>
 */
package io.voterelay;
