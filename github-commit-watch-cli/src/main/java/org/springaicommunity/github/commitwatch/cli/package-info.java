/**
 * Console front end: reads slash commands from standard input and prints notifications
 * for a single local subscriber.
 */
@NullMarked
package org.springaicommunity.github.commitwatch.cli;

import org.jspecify.annotations.NullMarked;
