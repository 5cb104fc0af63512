/**
 * Polls GitHub repositories for new commits on their default branch and fans each new
 * commit out to the subscribers of that repository.
 * <p>
 * Entry points are {@link org.springaicommunity.github.commitwatch.CommitWatchBuilder}
 * and {@link org.springaicommunity.github.commitwatch.CommitWatchConfig}. Reference types
 * are non-null unless annotated {@code @Nullable}.
 */
@NullMarked
package org.springaicommunity.github.commitwatch;

import org.jspecify.annotations.NullMarked;
