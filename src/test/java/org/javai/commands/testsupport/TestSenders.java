package org.javai.commands.testsupport;

import org.javai.commands.api.CommandSender;

/**
 * Caller identities shared by the tests.
 */
public final class TestSenders {

	public static final ConsoleSender CONSOLE = new ConsoleSender();
	public static final UserSender USER = new UserSender("alice");

	private TestSenders() {
	}

	public static final class ConsoleSender implements CommandSender {

		@Override
		public String name() {
			return "console";
		}
	}

	public static class UserSender implements CommandSender {

		private final String name;

		public UserSender(String name) {
			this.name = name;
		}

		@Override
		public String name() {
			return name;
		}
	}

	public static final class OperatorSender extends UserSender {

		public OperatorSender(String name) {
			super(name);
		}
	}
}
