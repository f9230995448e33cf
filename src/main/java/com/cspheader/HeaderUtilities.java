/*
 * Copyright 2022-2025 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.cspheader;

import com.cspheader.exception.IllegalHeaderNameException;
import com.cspheader.exception.IllegalHeaderValueException;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Header line splitting and validation shared by {@link Header} implementations.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class HeaderUtilities {
	@NonNull
	static final String CRLF = "\r\n";

	private HeaderUtilities() {
		// Non-instantiable
	}

	/**
	 * A raw header line split into its trimmed name and value.
	 */
	record HeaderLine(@NonNull String name, @NonNull String value) {
		HeaderLine {
			requireNonNull(name);
			requireNonNull(value);
		}
	}

	/**
	 * Splits {@code name: value} on the first colon.
	 * <p>
	 * A single trailing {@code CRLF} (the line terminator) is consumed. Any other CR or LF is rejected to prevent
	 * response splitting.
	 */
	@NonNull
	static HeaderLine splitHeaderLine(@NonNull String headerLine) {
		requireNonNull(headerLine);

		String line = headerLine.endsWith(CRLF) ? headerLine.substring(0, headerLine.length() - CRLF.length()) : headerLine;
		int colonIndex = line.indexOf(':');

		if (colonIndex == -1)
			throw new IllegalArgumentException(format("Header line '%s' must be of the form 'name: value'", printableString(line)));

		String name = line.substring(0, colonIndex).trim();
		String value = line.substring(colonIndex + 1);

		assertNoLineBreaks(name, line);

		return new HeaderLine(name, value.trim());
	}

	static void validateHeaderName(@NonNull String name) {
		requireNonNull(name);

		if (name.isEmpty())
			throw new IllegalHeaderNameException("Header name is blank", name);

		for (int i = 0; i < name.length(); i++) {
			char c = name.charAt(i);

			if (!isTchar(c))
				throw new IllegalHeaderNameException(format("Illegal header name '%s'. Offending character: '%s'",
						printableString(name), printableChar(c)), name);
		}
	}

	/**
	 * Rejects CR and LF anywhere in {@code value}.
	 */
	static void assertNoLineBreaks(@NonNull String headerName,
																 @NonNull String value) {
		requireNonNull(headerName);
		requireNonNull(value);

		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);

			if (c == '\r' || c == '\n')
				throw new IllegalHeaderValueException(format("Illegal value '%s' for header '%s'. Offending character: '%s' (index %d)",
						printableString(value), headerName, printableChar(c), i), headerName, value);
		}
	}

	/**
	 * RFC 9110 tchar:
	 * "!" / "#" / "$" / "%" / "&" / "'" / "*" / "+" / "-" / "." / "^" / "_" / "`" / "|" / "~" / DIGIT / ALPHA
	 */
	static boolean isTchar(char c) {
		if (c >= '0' && c <= '9') return true;
		if (c >= 'A' && c <= 'Z') return true;
		if (c >= 'a' && c <= 'z') return true;

		switch (c) {
			case '!':
			case '#':
			case '$':
			case '%':
			case '&':
			case '\'':
			case '*':
			case '+':
			case '-':
			case '.':
			case '^':
			case '_':
			case '`':
			case '|':
			case '~':
				return true;

			default:
				return false;
		}
	}

	@NonNull
	static String printableString(@NonNull String input) {
		requireNonNull(input);

		StringBuilder out = new StringBuilder(input.length() + 16);

		for (int i = 0; i < input.length(); i++)
			out.append(printableChar(input.charAt(i)));

		return out.toString();
	}

	@NonNull
	static String printableChar(char c) {
		if (c == '\r') return "\\r";
		if (c == '\n') return "\\n";
		if (c == '\t') return "\\t";
		if (c == 0) return "\\0";

		if (c < 0x20 || c == 0x7F)  // control chars
			return String.format("\\u%04X", (int) c);

		return String.valueOf(c);
	}
}
