package org.springaicommunity.github.commitwatch.cli;

import org.springaicommunity.github.commitwatch.Notification;
import org.springaicommunity.github.commitwatch.NotificationSink;

import java.io.PrintStream;

/**
 * {@link NotificationSink} that prints every notification to a stream, prefixed with
 * the recipient.
 */
public class ConsoleTransport implements NotificationSink {

	private final PrintStream out;

	private final NotificationFormatter formatter;

	public ConsoleTransport(PrintStream out, NotificationFormatter formatter) {
		this.out = out;
		this.formatter = formatter;
	}

	@Override
	public void send(String subscriberId, Notification notification) {
		String text = formatter.format(notification);
		synchronized (out) {
			out.println("-> " + subscriberId);
			out.println(text);
			out.println();
			if (out.checkError()) {
				throw new IllegalStateException("Console output is no longer writable");
			}
		}
	}

}
