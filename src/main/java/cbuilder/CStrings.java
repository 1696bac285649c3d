package cbuilder;

import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;

/**
 * Spelling of C string literals.
 */
public final class CStrings {

	private static final Escaper ESCAPER = Escapers.builder()
			.addEscape('"', "\\\"")
			.addEscape('\b', "\\b")
			.addEscape('\r', "\\r")
			.addEscape('\f', "\\f")
			.addEscape('\n', "\\n")
			.addEscape('\t', "\\t")
			.build();

	private CStrings() {
	}

	/**
	 * Replaces double quotes, backspace, carriage return, form feed, newline
	 * and tab by their C escape sequences. Everything else is kept as is.
	 */
	public static String escape(String str) {
		return ESCAPER.escape(str);
	}

	public static String quote(String str) {
		return '"' + escape(str) + '"';
	}
}
