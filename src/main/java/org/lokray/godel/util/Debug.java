package org.lokray.godel.util;

public class Debug {
	// ANSI escape codes for colors
	public static final String ANSI_RESET = "\u001B[0m";
	public static final String ANSI_RED = "\u001B[31m";
	public static final String ANSI_GREEN = "\u001B[32m";
	public static final String DEBUG_PROPERTY = "godel.debug";

	// Debug logs stay silent unless -Dgodel.debug=true is passed or a caller flips this flag.
	public static volatile boolean ENABLE_DEBUG = Boolean.getBoolean(DEBUG_PROPERTY);

	// Errors are printed by default; embedders that report diagnostics themselves can mute them.
	public static volatile boolean ENABLE_ERRORS = true;

	public static void logInfo(String log) {
		System.out.println(ANSI_GREEN + log + ANSI_RESET);
	}

	public static void logDebug(String log) {
		if (ENABLE_DEBUG) {
			System.out.println(log);
		}
	}

	public static void logError(String log) {
		if (ENABLE_ERRORS) {
			System.err.println(ANSI_RED + log + ANSI_RESET);
		}
	}
}
